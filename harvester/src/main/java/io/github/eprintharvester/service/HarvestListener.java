package io.github.eprintharvester.service;

import io.github.eprintharvester.model.DownloadOutcome;

/**
 * Receives the outcome of every item handed to the fetcher.
 */
@FunctionalInterface
public interface HarvestListener {

  /**
   * Listener that ignores everything.
   */
  HarvestListener NONE = (identifier, outcome) -> { };

  /**
   * On outcome.
   *
   * @param identifier the identifier
   * @param outcome the outcome
   */
  void onOutcome(String identifier, DownloadOutcome outcome);
}

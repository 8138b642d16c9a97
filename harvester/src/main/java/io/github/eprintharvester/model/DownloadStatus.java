package io.github.eprintharvester.model;

/**
 * Terminal status of one artifact fetch.
 */
public enum DownloadStatus {
  /**
   * Artifact written.
   */
  OK,

  /**
   * Artifact already present on disk.
   */
  SKIP,

  /**
   * Fetch failed; see the outcome code.
   */
  ERROR
}

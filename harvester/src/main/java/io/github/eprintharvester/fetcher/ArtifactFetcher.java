package io.github.eprintharvester.fetcher;

import io.github.eprintharvester.model.DownloadOutcome;
import java.nio.file.Path;

/**
 * Retrieves the binary artifact of one catalog item.
 */
public interface ArtifactFetcher {

  /**
   * Fetch one artifact into the destination directory. Returns exactly one outcome; transport
   * failures are reported as error outcomes, never thrown.
   *
   * @param identifier the identifier
   * @param destinationDir the destination dir, created on demand
   * @return the download outcome
   */
  DownloadOutcome fetch(String identifier, Path destinationDir);
}

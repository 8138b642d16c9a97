package io.github.eprintharvester.archive;

import org.immutables.value.Value;

/**
 * Member counts of one extraction.
 */
@Value.Immutable
public interface ExtractionResult {

  /**
   * Regular files and directories written.
   *
   * @return the count
   */
  int extracted();

  /**
   * Members skipped: outside the destination root, links, or special files.
   *
   * @return the count
   */
  int skipped();
}

package io.github.eprintharvester.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Parameters of one harvest run.
 */
@Value.Immutable
public interface HarvestRequest {

  /**
   * Output directory for artifacts.
   *
   * @return the path
   */
  Path outputDir();

  /**
   * Maximum number of artifacts to download in this run. Skipped artifacts do not count.
   *
   * @return the max items
   */
  @Value.Default
  default int maxItems() {
    return 50000;
  }

  /**
   * Lower date bound.
   *
   * @return the from date
   */
  Optional<LocalDate> fromDate();

  /**
   * Upper date bound.
   *
   * @return the until date
   */
  Optional<LocalDate> untilDate();

  /**
   * Politeness delay after every item and between pages.
   *
   * @return the duration
   */
  @Value.Default
  default Duration perItemDelay() {
    return Duration.ofMillis(2500);
  }

  /**
   * Validate.
   */
  @Value.Check
  default void check() {
    if (perItemDelay().isNegative()) {
      throw new IllegalStateException("perItemDelay must not be negative");
    }
  }
}

package io.github.eprintharvester.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Counts for one harvest run.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableHarvestSummary.class)
@JsonDeserialize(as = ImmutableHarvestSummary.class)
public interface HarvestSummary {

  /**
   * Output directory.
   */
  Path outputDir();

  /**
   * Artifacts written in this run.
   */
  long downloaded();

  /**
   * Artifacts already present.
   */
  long skipped();

  /**
   * Artifacts that ended in an error outcome.
   */
  long failed();

  /**
   * Listing pages requested.
   */
  long pages();

  /**
   * Error outcomes by code.
   */
  Map<String, Long> errorsByCode();

  /**
   * True when the walk stopped on a listing body that could not be parsed.
   */
  @Value.Default
  default boolean endedOnMalformedPage() {
    return false;
  }

  /**
   * Start time.
   */
  Instant startTime();

  /**
   * End time.
   */
  Instant endTime();
}

package io.github.eprintharvester.fetcher;

import java.time.Duration;
import java.util.Random;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Exponential backoff with jitter: {@code 2^attempt} seconds, plus or minus half a second, never
 * below one second.
 */
@Singleton
public class BackoffPolicy {

  /**
   * Lower bound of any delay, in seconds.
   */
  public static final double FLOOR_SECONDS = 1.0;

  /**
   * Maximum jitter either side of the base delay, in seconds.
   */
  public static final double JITTER_SECONDS = 0.5;

  private final Random random;

  /**
   * Instantiates a new Backoff policy.
   *
   * @param random the jitter source
   */
  @Inject
  public BackoffPolicy(final Random random) {
    this.random = random;
  }

  /**
   * Delay after the given failed attempt.
   *
   * @param attempt the 1-based attempt number
   * @return the duration
   */
  public Duration delay(final int attempt) {
    final double base = Math.pow(2, attempt);
    final double jitter = (random.nextDouble() * 2 - 1) * JITTER_SECONDS;
    final double seconds = Math.max(FLOOR_SECONDS, base + jitter);
    return Duration.ofMillis(Math.round(seconds * 1000));
  }
}

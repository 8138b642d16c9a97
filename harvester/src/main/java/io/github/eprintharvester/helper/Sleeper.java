package io.github.eprintharvester.helper;

import java.time.Duration;

/**
 * Blocking pause. Politeness delays and retry backoff go through here.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleep.
   *
   * @param duration the duration
   * @throws InterruptedException if interrupted
   */
  void sleep(Duration duration) throws InterruptedException;
}

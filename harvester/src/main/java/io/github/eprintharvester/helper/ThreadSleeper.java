package io.github.eprintharvester.helper;

import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Sleeps on the calling thread.
 */
@Singleton
public class ThreadSleeper implements Sleeper {

  /**
   * Instantiates a new Thread sleeper.
   */
  @Inject
  public ThreadSleeper() {
    // Default constructor
  }

  @Override
  public void sleep(final Duration duration) throws InterruptedException {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    Thread.sleep(duration.toMillis());
  }
}

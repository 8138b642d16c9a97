package io.github.eprintharvester.fetcher;

import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.hc.core5.http.HttpStatus;

/**
 * Which artifact responses are worth another attempt.
 */
@Singleton
public class RetryPolicy {

  /**
   * Transport attempts per artifact.
   */
  public static final int MAX_ATTEMPTS = 3;

  /**
   * Rate-limit, server-side and forbidden statuses.
   */
  public static final Set<Integer> TRANSIENT_STATUSES = Set.of(
      HttpStatus.SC_TOO_MANY_REQUESTS,
      HttpStatus.SC_INTERNAL_SERVER_ERROR,
      HttpStatus.SC_BAD_GATEWAY,
      HttpStatus.SC_SERVICE_UNAVAILABLE,
      HttpStatus.SC_GATEWAY_TIMEOUT,
      HttpStatus.SC_FORBIDDEN);

  /**
   * Instantiates a new Retry policy.
   */
  @Inject
  public RetryPolicy() {
    // Default constructor
  }

  /**
   * Max attempts.
   *
   * @return the int
   */
  public int maxAttempts() {
    return MAX_ATTEMPTS;
  }

  /**
   * Decide on an HTTP status.
   *
   * @param status the status
   * @return the retry action
   */
  public RetryAction decide(final int status) {
    if (status == HttpStatus.SC_OK) {
      return RetryAction.ACCEPT;
    }
    return TRANSIENT_STATUSES.contains(status) ? RetryAction.RETRY : RetryAction.FAIL;
  }
}

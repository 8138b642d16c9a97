package io.github.eprintharvester.fetcher;

/**
 * What to do with one observed HTTP status.
 */
public enum RetryAction {
  /**
   * Success, process the body.
   */
  ACCEPT,

  /**
   * Transient, back off and try again.
   */
  RETRY,

  /**
   * Terminal, report the status.
   */
  FAIL
}

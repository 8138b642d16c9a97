package io.github.eprintharvester.model;

/**
 * Symbolic error codes used when no HTTP status describes the failure.
 */
public final class ErrorCodes {

  /**
   * 200 response with no body.
   */
  public static final String EMPTY = "empty";

  /**
   * 200 response that turned out to be an HTML page.
   */
  public static final String CONTENT_TYPE_MISMATCH = "content-type-mismatch";

  /**
   * Unexpected local failure, e.g. the artifact could not be written.
   */
  public static final String EXCEPTION = "exception";

  /**
   * All attempts failed without any response being observed.
   */
  public static final String TIMEOUT = "timeout";

  private ErrorCodes() {
  }
}

package io.github.eprintharvester.exception;

import java.util.OptionalInt;

/**
 * A catalog listing request failed at the transport level. Listing has no retry policy, so this
 * ends the run.
 */
public class CatalogTransportException extends RuntimeException {

  private final Integer status;

  /**
   * Non-success HTTP status.
   *
   * @param message the message
   * @param status the status
   */
  public CatalogTransportException(final String message, final int status) {
    super(message);
    this.status = status;
  }

  /**
   * Network failure.
   *
   * @param message the message
   * @param cause the cause
   */
  public CatalogTransportException(final String message, final Throwable cause) {
    super(message, cause);
    this.status = null;
  }

  /**
   * HTTP status, when the server answered.
   *
   * @return the status
   */
  public OptionalInt status() {
    return status == null ? OptionalInt.empty() : OptionalInt.of(status);
  }
}

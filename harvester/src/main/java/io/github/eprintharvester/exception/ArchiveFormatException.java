package io.github.eprintharvester.exception;

import java.io.IOException;

/**
 * The file is not a (possibly compressed) tar archive.
 */
public class ArchiveFormatException extends IOException {

  /**
   * Instantiates a new Archive format exception.
   *
   * @param message the message
   * @param cause the cause
   */
  public ArchiveFormatException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

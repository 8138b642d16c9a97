package io.github.eprintharvester.exception;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writing a downloaded artifact to local storage failed. Not retried.
 */
public class ArtifactStorageException extends UncheckedIOException {

  /**
   * Instantiates a new Artifact storage exception.
   *
   * @param message the message
   * @param cause the cause
   */
  public ArtifactStorageException(final String message, final IOException cause) {
    super(message, cause);
  }
}

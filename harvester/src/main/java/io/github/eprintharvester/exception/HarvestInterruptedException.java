package io.github.eprintharvester.exception;

/**
 * The harvest thread was interrupted while waiting. The interrupt flag is restored before this is
 * thrown.
 */
public class HarvestInterruptedException extends RuntimeException {

  /**
   * Instantiates a new Harvest interrupted exception.
   *
   * @param cause the cause
   */
  public HarvestInterruptedException(final InterruptedException cause) {
    super("Harvest interrupted", cause);
  }
}

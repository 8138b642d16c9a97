package io.github.eprintharvester.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * The outcome of fetching one artifact.
 */
@Value.Immutable
public interface DownloadOutcome {

  /**
   * Ok outcome.
   *
   * @return the download outcome
   */
  static DownloadOutcome ok() {
    return ImmutableDownloadOutcome.builder().status(DownloadStatus.OK).build();
  }

  /**
   * Skip outcome.
   *
   * @return the download outcome
   */
  static DownloadOutcome skip() {
    return ImmutableDownloadOutcome.builder().status(DownloadStatus.SKIP).build();
  }

  /**
   * Error outcome with a symbolic code.
   *
   * @param code the code
   * @return the download outcome
   */
  static DownloadOutcome error(final String code) {
    return ImmutableDownloadOutcome.builder().status(DownloadStatus.ERROR).code(code).build();
  }

  /**
   * Error outcome for an HTTP status.
   *
   * @param httpStatus the http status
   * @return the download outcome
   */
  static DownloadOutcome error(final int httpStatus) {
    return error(String.valueOf(httpStatus));
  }

  /**
   * Status.
   *
   * @return the download status
   */
  DownloadStatus status();

  /**
   * Error code; present only for {@link DownloadStatus#ERROR}.
   *
   * @return the code
   */
  Optional<String> code();

  /**
   * Errors carry a code, nothing else does.
   */
  @Value.Check
  default void check() {
    if ((status() == DownloadStatus.ERROR) != code().isPresent()) {
      throw new IllegalStateException("Only error outcomes carry a code: " + status());
    }
  }

  /**
   * Log-friendly form: {@code ok}, {@code skip} or {@code err:<code>}.
   *
   * @return the string
   */
  default String describe() {
    switch (status()) {
      case OK:
        return "ok";
      case SKIP:
        return "skip";
      default:
        return "err:" + code().orElse(ErrorCodes.EXCEPTION);
    }
  }
}

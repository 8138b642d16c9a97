package io.github.eprintharvester.model;

import java.time.LocalDate;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One ListRecords request. Either an initial request carrying the set and optional date bounds, or
 * a continuation carrying only the cursor; the server remembers the initial bounds.
 */
@Value.Immutable
public interface PageRequest {

  /**
   * Initial request.
   *
   * @param setName the set name
   * @param metadataPrefix the metadata prefix
   * @param from lower date bound
   * @param until upper date bound
   * @return the page request
   */
  static PageRequest initial(final String setName,
                             final String metadataPrefix,
                             final Optional<LocalDate> from,
                             final Optional<LocalDate> until) {
    return ImmutablePageRequest.builder()
        .setName(setName)
        .metadataPrefix(metadataPrefix)
        .from(from)
        .until(until)
        .build();
  }

  /**
   * Continuation request.
   *
   * @param cursor the cursor returned by the previous page
   * @return the page request
   */
  static PageRequest continuation(final String cursor) {
    return ImmutablePageRequest.builder().cursor(cursor).build();
  }

  /**
   * Continuation cursor.
   *
   * @return the cursor
   */
  Optional<String> cursor();

  /**
   * Set name (initial requests only).
   *
   * @return the set name
   */
  Optional<String> setName();

  /**
   * Metadata prefix (initial requests only).
   *
   * @return the metadata prefix
   */
  Optional<String> metadataPrefix();

  /**
   * Lower date bound (initial requests only).
   *
   * @return the from date
   */
  Optional<LocalDate> from();

  /**
   * Upper date bound (initial requests only).
   *
   * @return the until date
   */
  Optional<LocalDate> until();

  /**
   * Is continuation boolean.
   *
   * @return the boolean
   */
  default boolean isContinuation() {
    return cursor().isPresent();
  }

  /**
   * Continuations carry nothing but the cursor; initial requests need a set and prefix.
   */
  @Value.Check
  default void check() {
    if (cursor().isPresent()) {
      if (setName().isPresent() || metadataPrefix().isPresent()
          || from().isPresent() || until().isPresent()) {
        throw new IllegalStateException("A continuation request carries only the cursor");
      }
      if (cursor().get().isBlank()) {
        throw new IllegalStateException("Cursor must not be blank");
      }
    } else if (setName().isEmpty() || metadataPrefix().isEmpty()) {
      throw new IllegalStateException("An initial request needs a set name and metadata prefix");
    }
  }
}

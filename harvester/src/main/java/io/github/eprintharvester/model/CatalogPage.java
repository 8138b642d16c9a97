package io.github.eprintharvester.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One page of catalog identifiers plus the cursor for the next page.
 */
@Value.Immutable
public interface CatalogPage {

  /**
   * Empty page returned when the listing body could not be parsed.
   *
   * @return the catalog page
   */
  static CatalogPage malformedPage() {
    return ImmutableCatalogPage.builder().malformed(true).build();
  }

  /**
   * Identifiers in catalog order, deleted records excluded.
   *
   * @return the identifiers
   */
  List<String> identifiers();

  /**
   * Cursor for the next page; empty when the catalog is exhausted.
   *
   * @return the next cursor
   */
  Optional<String> nextCursor();

  /**
   * True when the body was not a parseable listing.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean malformed() {
    return false;
  }
}

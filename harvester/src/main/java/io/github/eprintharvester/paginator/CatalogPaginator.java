package io.github.eprintharvester.paginator;

import io.github.eprintharvester.model.CatalogPage;
import io.github.eprintharvester.model.PageRequest;

/**
 * Walks a cursor-based metadata listing one page at a time.
 */
public interface CatalogPaginator {

  /**
   * Fetch one page.
   *
   * @param request initial or continuation request
   * @return the page; a malformed body yields an empty page without cursor
   * @throws io.github.eprintharvester.exception.CatalogTransportException on a non-success
   *     response or network failure
   */
  CatalogPage listPage(PageRequest request);
}

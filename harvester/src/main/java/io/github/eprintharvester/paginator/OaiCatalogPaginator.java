package io.github.eprintharvester.paginator;

import io.github.eprintharvester.exception.CatalogTransportException;
import io.github.eprintharvester.http.factory.HttpClientFactory;
import io.github.eprintharvester.model.CatalogPage;
import io.github.eprintharvester.model.Configuration;
import io.github.eprintharvester.model.PageRequest;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CatalogPaginator} for the OAI-PMH {@code ListRecords} verb.
 */
@Singleton
public class OaiCatalogPaginator implements CatalogPaginator {

  private static final Logger log = LoggerFactory.getLogger(OaiCatalogPaginator.class);

  private final CloseableHttpClient httpClient;
  private final HttpClientFactory httpClientFactory;
  private final OaiListRecordsParser parser;
  private final URI endpoint;

  /**
   * Instantiates a new Oai catalog paginator.
   *
   * @param httpClient the http client
   * @param httpClientFactory the http client factory
   * @param parser the parser
   * @param configuration the configuration
   */
  @Inject
  public OaiCatalogPaginator(final CloseableHttpClient httpClient,
                             final HttpClientFactory httpClientFactory,
                             final OaiListRecordsParser parser,
                             final Configuration configuration) {
    this.httpClient = httpClient;
    this.httpClientFactory = httpClientFactory;
    this.parser = parser;
    this.endpoint = configuration.metadataEndpoint();
  }

  @Override
  public CatalogPage listPage(final PageRequest request) {
    final URI uri = requestUri(request);
    log.debug("Listing {}", uri);

    final HttpGet get = new HttpGet(uri);
    get.setConfig(httpClientFactory.metadataRequestConfig());

    final byte[] body;
    try {
      body = httpClient.execute(get, response -> {
        final int code = response.getCode();
        if (code < 200 || code >= 300) {
          throw new CatalogTransportException("Listing request " + uri + " returned HTTP " + code,
              code);
        }
        final HttpEntity entity = response.getEntity();
        return entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
      });
    } catch (IOException e) {
      throw new CatalogTransportException("Listing request " + uri + " failed", e);
    }

    final CatalogPage page = parser.parse(body);
    log.debug("Page has {} identifiers, more pages: {}",
        page.identifiers().size(), page.nextCursor().isPresent());
    return page;
  }

  /**
   * Build the request URI. Continuations carry only the resumption token.
   *
   * @param request the request
   * @return the uri
   */
  URI requestUri(final PageRequest request) {
    try {
      final URIBuilder builder = new URIBuilder(endpoint).addParameter("verb", "ListRecords");
      if (request.isContinuation()) {
        builder.addParameter("resumptionToken", request.cursor().get());
      } else {
        builder.addParameter("metadataPrefix", request.metadataPrefix().orElseThrow());
        builder.addParameter("set", request.setName().orElseThrow());
        request.from().ifPresent(from -> builder.addParameter("from", from.toString()));
        request.until().ifPresent(until -> builder.addParameter("until", until.toString()));
      }
      return builder.build();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid metadata endpoint " + endpoint, e);
    }
  }
}

package io.github.eprintharvester.http.factory;

import io.github.eprintharvester.http.UserAgents;
import io.github.eprintharvester.http.model.HttpSettings;
import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the HTTP client used for catalog listing and artifact downloads.
 *
 * <p>Automatic retries are disabled: callers own their retry policy.
 */
@Singleton
public class HttpClientFactory {

  private static final Logger log = LoggerFactory.getLogger(HttpClientFactory.class);

  private final HttpSettings settings;

  /**
   * Instantiates a new Http client factory.
   *
   * @param settings the settings
   */
  @Inject
  public HttpClientFactory(final HttpSettings settings) {
    this.settings = settings;
  }

  /**
   * Create a client with identification headers and the connect timeout applied.
   *
   * @return the closeable http client
   */
  public CloseableHttpClient createHttpClient() {
    final String userAgent = UserAgents.userAgent(settings);
    log.info("Creating HTTP client with user agent '{}'", userAgent);

    final PoolingHttpClientConnectionManager connectionManager =
        PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(
                ConnectionConfig.custom()
                    .setConnectTimeout(timeout(settings.connectTimeout().toMillis()))
                    .build())
            .build();

    final List<Header> headers = List.of(new BasicHeader(HttpHeaders.ACCEPT, settings.accept()));

    return HttpClients.custom()
        .setConnectionManager(connectionManager)
        .setUserAgent(userAgent)
        .setDefaultHeaders(headers)
        .setDefaultRequestConfig(metadataRequestConfig())
        .disableAutomaticRetries()
        .build();
  }

  /**
   * Request config for catalog listing calls.
   *
   * @return the request config
   */
  public RequestConfig metadataRequestConfig() {
    return requestConfig(settings.metadataTimeout().toMillis());
  }

  /**
   * Request config for artifact downloads.
   *
   * @return the request config
   */
  public RequestConfig artifactRequestConfig() {
    return requestConfig(settings.artifactTimeout().toMillis());
  }

  private RequestConfig requestConfig(final long responseTimeoutMillis) {
    return RequestConfig.custom()
        .setResponseTimeout(timeout(responseTimeoutMillis))
        .build();
  }

  private static Timeout timeout(final long millis) {
    return Timeout.of(millis, TimeUnit.MILLISECONDS);
  }
}

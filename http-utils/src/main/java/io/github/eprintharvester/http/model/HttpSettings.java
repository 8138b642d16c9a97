package io.github.eprintharvester.http.model;

import java.time.Duration;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Connection and identification settings shared by every outbound request.
 */
@Value.Immutable
public interface HttpSettings {

  /**
   * The default product token sent in the User-Agent header.
   */
  String DEFAULT_PRODUCT = "eprint-harvester/1.0";

  /**
   * Accept header preferring archive payloads.
   */
  String DEFAULT_ACCEPT =
      "application/gzip, application/x-gzip, application/x-tar, "
          + "application/octet-stream;q=0.9,*/*;q=0.5";

  /**
   * Product token, e.g. {@code eprint-harvester/1.0}.
   *
   * @return the product token
   */
  @Value.Default
  default String product() {
    return DEFAULT_PRODUCT;
  }

  /**
   * Operator contact address. Only used when it looks like an email address.
   *
   * @return the contact
   */
  Optional<String> contact();

  /**
   * Accept header value.
   *
   * @return the accept header
   */
  @Value.Default
  default String accept() {
    return DEFAULT_ACCEPT;
  }

  /**
   * Connect timeout.
   *
   * @return the connect timeout
   */
  @Value.Default
  default Duration connectTimeout() {
    return Duration.ofSeconds(30);
  }

  /**
   * Response timeout for catalog listing calls.
   *
   * @return the metadata timeout
   */
  @Value.Default
  default Duration metadataTimeout() {
    return Duration.ofSeconds(60);
  }

  /**
   * Response timeout for artifact downloads. Generous, payloads can be large.
   *
   * @return the artifact timeout
   */
  @Value.Default
  default Duration artifactTimeout() {
    return Duration.ofSeconds(90);
  }
}

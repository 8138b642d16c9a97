package io.github.eprintharvester.model;

import io.github.eprintharvester.http.model.HttpSettings;
import io.github.eprintharvester.http.model.ImmutableHttpSettings;
import java.net.URI;
import org.immutables.value.Value;

/**
 * The harvester configuration.
 */
@Value.Immutable
public interface Configuration {

  /**
   * Default OAI-PMH endpoint.
   */
  URI DEFAULT_METADATA_ENDPOINT = URI.create("https://export.arxiv.org/oai2");

  /**
   * Default artifact base.
   */
  URI DEFAULT_ARTIFACT_BASE = URI.create("https://arxiv.org/e-print");

  /**
   * OAI-PMH endpoint serving ListRecords.
   *
   * @return the uri
   */
  @Value.Default
  default URI metadataEndpoint() {
    return DEFAULT_METADATA_ENDPOINT;
  }

  /**
   * Base of the artifact retrieval protocol; artifacts live at {@code {base}/{identifier}}.
   *
   * @return the uri
   */
  @Value.Default
  default URI artifactBase() {
    return DEFAULT_ARTIFACT_BASE;
  }

  /**
   * OAI set to harvest.
   *
   * @return the set name
   */
  @Value.Default
  default String setName() {
    return "math";
  }

  /**
   * OAI metadata prefix.
   *
   * @return the metadata prefix
   */
  @Value.Default
  default String metadataPrefix() {
    return "arXiv";
  }

  /**
   * Http settings.
   *
   * @return the http settings
   */
  @Value.Default
  default HttpSettings httpSettings() {
    return ImmutableHttpSettings.builder().build();
  }
}

package io.github.eprintharvester.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Component;
import io.github.eprintharvester.archive.SafeArchiveExtractor;
import io.github.eprintharvester.fetcher.ArtifactFetcher;
import io.github.eprintharvester.helper.Sleeper;
import io.github.eprintharvester.model.Configuration;
import io.github.eprintharvester.paginator.CatalogPaginator;
import io.github.eprintharvester.service.HarvestRunner;
import javax.inject.Singleton;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;

/**
 * The harvester component.
 */
@Singleton
@Component(modules = {HarvesterModule.class, ConfigurationModule.class, CommonModule.class})
public interface HarvesterComponent {

  /**
   * Instance harvester component.
   *
   * @param configuration the configuration
   * @return the harvester component
   */
  static HarvesterComponent instance(final Configuration configuration) {
    return DaggerHarvesterComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * Instance harvester component with a custom sleeper.
   *
   * @param configuration the configuration
   * @param sleeper the sleeper
   * @return the harvester component
   */
  static HarvesterComponent instance(final Configuration configuration, final Sleeper sleeper) {
    return DaggerHarvesterComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .commonModule(new CommonModule(sleeper))
        .build();
  }

  /**
   * Harvest runner.
   *
   * @return the harvest runner
   */
  HarvestRunner harvestRunner();

  /**
   * Catalog paginator.
   *
   * @return the catalog paginator
   */
  CatalogPaginator catalogPaginator();

  /**
   * Artifact fetcher.
   *
   * @return the artifact fetcher
   */
  ArtifactFetcher artifactFetcher();

  /**
   * Safe archive extractor.
   *
   * @return the safe archive extractor
   */
  SafeArchiveExtractor safeArchiveExtractor();

  /**
   * Shared HTTP client; close it when done.
   *
   * @return the closeable http client
   */
  CloseableHttpClient httpClient();

  /**
   * Object mapper.
   *
   * @return the object mapper
   */
  ObjectMapper objectMapper();
}

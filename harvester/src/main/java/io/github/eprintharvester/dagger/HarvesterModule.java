package io.github.eprintharvester.dagger;

import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import io.github.eprintharvester.fetcher.ArtifactFetcher;
import io.github.eprintharvester.fetcher.HttpArtifactFetcher;
import io.github.eprintharvester.http.factory.HttpClientFactory;
import io.github.eprintharvester.paginator.CatalogPaginator;
import io.github.eprintharvester.paginator.OaiCatalogPaginator;
import javax.inject.Singleton;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;

/**
 * The harvester module.
 */
@Module(includes = HarvesterModule.Binder.class)
public class HarvesterModule {

  /**
   * Instantiates a new Harvester module.
   */
  public HarvesterModule() {
    // Default constructor
  }

  /**
   * One pooled client shared by the paginator and the fetcher.
   *
   * @param factory the factory
   * @return the closeable http client
   */
  @Provides
  @Singleton
  public CloseableHttpClient httpClient(final HttpClientFactory factory) {
    return factory.createHttpClient();
  }

  /**
   * Interface bindings.
   */
  @Module
  interface Binder {

    /**
     * Catalog paginator.
     *
     * @param paginator the paginator
     * @return the catalog paginator
     */
    @Binds
    CatalogPaginator catalogPaginator(OaiCatalogPaginator paginator);

    /**
     * Artifact fetcher.
     *
     * @param fetcher the fetcher
     * @return the artifact fetcher
     */
    @Binds
    ArtifactFetcher artifactFetcher(HttpArtifactFetcher fetcher);
  }
}

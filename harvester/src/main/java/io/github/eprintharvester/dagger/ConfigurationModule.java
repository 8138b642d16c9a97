package io.github.eprintharvester.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.eprintharvester.http.model.HttpSettings;
import io.github.eprintharvester.model.Configuration;
import javax.inject.Singleton;

/**
 * Supplies the run configuration to the graph.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Http settings.
   *
   * @param configuration the configuration
   * @return the http settings
   */
  @Provides
  @Singleton
  public HttpSettings httpSettings(final Configuration configuration) {
    return configuration.httpSettings();
  }
}

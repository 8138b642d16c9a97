package io.github.eprintharvester.cli.dagger;

import dagger.Component;
import io.github.eprintharvester.archive.SafeArchiveExtractor;
import io.github.eprintharvester.cli.report.OutcomeReportWriterFactory;
import io.github.eprintharvester.cli.report.SummaryWriter;
import io.github.eprintharvester.dagger.CommonModule;
import io.github.eprintharvester.dagger.ConfigurationModule;
import io.github.eprintharvester.dagger.HarvesterModule;
import io.github.eprintharvester.model.Configuration;
import io.github.eprintharvester.service.HarvestRunner;
import javax.inject.Singleton;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;

/**
 * Dagger component for CLI tool.
 */
@Singleton
@Component(
    modules = {CliModule.class, HarvesterModule.class, ConfigurationModule.class,
        CommonModule.class})
public interface CliComponent {

  /**
   * Create CLI component with configuration.
   *
   * @param configuration the configuration
   * @return the CLI component
   */
  static CliComponent create(final Configuration configuration) {
    return DaggerCliComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * Harvest runner.
   *
   * @return the harvest runner
   */
  HarvestRunner harvestRunner();

  /**
   * Safe archive extractor.
   *
   * @return the safe archive extractor
   */
  SafeArchiveExtractor safeArchiveExtractor();

  /**
   * Shared HTTP client, closed by the command when it finishes.
   *
   * @return the closeable http client
   */
  CloseableHttpClient httpClient();

  /**
   * Summary writer.
   *
   * @return the summary writer
   */
  SummaryWriter summaryWriter();

  /**
   * Outcome report writer factory.
   *
   * @return the outcome report writer factory
   */
  OutcomeReportWriterFactory outcomeReportWriterFactory();
}

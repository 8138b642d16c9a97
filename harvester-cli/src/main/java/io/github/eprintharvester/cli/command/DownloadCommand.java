package io.github.eprintharvester.cli.command;

import io.github.eprintharvester.cli.dagger.CliComponent;
import io.github.eprintharvester.cli.report.OutcomeReportWriter;
import io.github.eprintharvester.http.model.ImmutableHttpSettings;
import io.github.eprintharvester.model.Configuration;
import io.github.eprintharvester.model.HarvestRequest;
import io.github.eprintharvester.model.HarvestSummary;
import io.github.eprintharvester.model.ImmutableConfiguration;
import io.github.eprintharvester.model.ImmutableHarvestRequest;
import io.github.eprintharvester.service.HarvestRunner;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Download command: walks the catalog and stores one archive per identifier.
 */
@Command(
    name = "download",
    description = "Download e-print archives for every record of an OAI-PMH set")
public class DownloadCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(DownloadCommand.class);

  @Option(
      names = {"--out", "-o"},
      description = "Output directory (default: ${DEFAULT-VALUE})",
      defaultValue = "${HARVESTER_DATA_DIR:-data}/papers")
  private Path out;

  @Option(
      names = {"--max"},
      description = "Maximum number of archives to download (default: ${DEFAULT-VALUE})",
      defaultValue = "50000")
  private int max;

  @Option(
      names = {"--from"},
      description = "Lower datestamp bound, YYYY-MM-DD (default: ${DEFAULT-VALUE})",
      defaultValue = "2010-01-01")
  private LocalDate from;

  @Option(
      names = {"--until"},
      description = "Upper datestamp bound, YYYY-MM-DD")
  private LocalDate until;

  @Option(
      names = {"--sleep"},
      description = "Seconds to wait after every item and between pages (default: ${DEFAULT-VALUE})",
      defaultValue = "2.5")
  private double sleepSeconds;

  @Option(
      names = {"--set"},
      description = "OAI set to harvest (default: ${DEFAULT-VALUE})",
      defaultValue = "math")
  private String setName;

  @Option(
      names = {"--metadata-prefix"},
      description = "OAI metadata prefix (default: ${DEFAULT-VALUE})",
      defaultValue = "arXiv")
  private String metadataPrefix;

  @Option(
      names = {"--metadata-endpoint"},
      description = "OAI-PMH endpoint (default: ${DEFAULT-VALUE})",
      defaultValue = "https://export.arxiv.org/oai2")
  private URI metadataEndpoint;

  @Option(
      names = {"--artifact-base"},
      description = "Base URL of the archives (default: ${DEFAULT-VALUE})",
      defaultValue = "https://arxiv.org/e-print")
  private URI artifactBase;

  @Option(
      names = {"--contact"},
      description = "Contact email sent in the User-Agent (default: env HARVESTER_CONTACT)",
      defaultValue = "${HARVESTER_CONTACT}")
  private String contact;

  @Option(
      names = {"--summary-file"},
      description = "Write a JSON run summary to this file")
  private Path summaryFile;

  @Option(
      names = {"--report"},
      description = "Write a CSV line per item (identifier, status, code) to this file")
  private Path reportFile;

  @Override
  public Integer call() throws Exception {
    if (max < 0) {
      log.error("--max must not be negative: {}", max);
      return 1;
    }
    if (Double.isNaN(sleepSeconds) || sleepSeconds < 0) {
      log.error("--sleep must be a non-negative number of seconds: {}", sleepSeconds);
      return 1;
    }
    if (from != null && until != null && until.isBefore(from)) {
      log.error("--until {} is before --from {}", until, from);
      return 1;
    }
    if (!isHttp(metadataEndpoint) || !isHttp(artifactBase)) {
      log.error("Endpoints must be absolute http(s) URLs: {}, {}", metadataEndpoint, artifactBase);
      return 1;
    }
    if (contact == null || !contact.contains("@")) {
      log.warn("No contact email configured. Set --contact or HARVESTER_CONTACT.");
    }

    final Configuration configuration = ImmutableConfiguration.builder()
        .metadataEndpoint(metadataEndpoint)
        .artifactBase(artifactBase)
        .setName(setName)
        .metadataPrefix(metadataPrefix)
        .httpSettings(ImmutableHttpSettings.builder()
            .contact(Optional.ofNullable(contact))
            .build())
        .build();

    final HarvestRequest request = ImmutableHarvestRequest.builder()
        .outputDir(out)
        .maxItems(max)
        .fromDate(Optional.ofNullable(from))
        .untilDate(Optional.ofNullable(until))
        .perItemDelay(Duration.ofMillis(Math.round(sleepSeconds * 1000)))
        .build();

    final CliComponent component = CliComponent.create(configuration);
    final HarvestSummary summary;
    try (CloseableHttpClient ignored = component.httpClient()) {
      summary = harvest(component.harvestRunner(), component, request);
    }

    if (summaryFile != null) {
      component.summaryWriter().write(summary, summaryFile);
    }
    return 0;
  }

  private HarvestSummary harvest(final HarvestRunner runner,
                                 final CliComponent component,
                                 final HarvestRequest request) throws Exception {
    if (reportFile == null) {
      return runner.run(request);
    }
    try (OutcomeReportWriter report = component.outcomeReportWriterFactory().open(reportFile)) {
      return runner.run(request, report);
    }
  }

  private static boolean isHttp(final URI uri) {
    return uri.isAbsolute()
        && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
        && uri.getHost() != null;
  }
}

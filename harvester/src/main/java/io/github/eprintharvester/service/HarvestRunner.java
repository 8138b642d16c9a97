package io.github.eprintharvester.service;

import io.github.eprintharvester.exception.HarvestInterruptedException;
import io.github.eprintharvester.fetcher.ArtifactFetcher;
import io.github.eprintharvester.helper.Sleeper;
import io.github.eprintharvester.model.CatalogPage;
import io.github.eprintharvester.model.Configuration;
import io.github.eprintharvester.model.DownloadOutcome;
import io.github.eprintharvester.model.HarvestRequest;
import io.github.eprintharvester.model.HarvestSummary;
import io.github.eprintharvester.model.ImmutableHarvestSummary;
import io.github.eprintharvester.model.PageRequest;
import io.github.eprintharvester.paginator.CatalogPaginator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the paginator and hands each identifier to the fetcher, one at a time.
 *
 * <p>Stops when {@code maxItems} artifacts have been downloaded, when a page comes back empty, or
 * when a page carries no cursor. Sleeps the politeness delay after every item, whatever its
 * outcome, and between pages.
 */
@Singleton
public class HarvestRunner {

  /**
   * Progress is logged every this many downloads.
   */
  public static final int PROGRESS_INTERVAL = 25;

  private static final Logger log = LoggerFactory.getLogger(HarvestRunner.class);

  private final CatalogPaginator paginator;
  private final ArtifactFetcher fetcher;
  private final Sleeper sleeper;
  private final Clock clock;
  private final Configuration configuration;

  /**
   * Instantiates a new Harvest runner.
   *
   * @param paginator the paginator
   * @param fetcher the fetcher
   * @param sleeper the sleeper
   * @param clock the clock
   * @param configuration the configuration
   */
  @Inject
  public HarvestRunner(final CatalogPaginator paginator,
                       final ArtifactFetcher fetcher,
                       final Sleeper sleeper,
                       final Clock clock,
                       final Configuration configuration) {
    this.paginator = paginator;
    this.fetcher = fetcher;
    this.sleeper = sleeper;
    this.clock = clock;
    this.configuration = configuration;
  }

  /**
   * Run a harvest.
   *
   * @param request the request
   * @return the harvest summary
   */
  public HarvestSummary run(final HarvestRequest request) {
    return run(request, HarvestListener.NONE);
  }

  /**
   * Run a harvest, reporting each outcome to the listener.
   *
   * @param request the request
   * @param listener the listener
   * @return the harvest summary
   */
  public HarvestSummary run(final HarvestRequest request, final HarvestListener listener) {
    final Instant start = clock.instant();
    log.info("Harvesting set '{}' from {} (from={}, until={}, max={})",
        configuration.setName(), configuration.metadataEndpoint(),
        request.fromDate().map(Object::toString).orElse("-"),
        request.untilDate().map(Object::toString).orElse("-"),
        request.maxItems());
    try {
      Files.createDirectories(request.outputDir());
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create " + request.outputDir(), e);
    }

    final Map<String, Long> errorsByCode = new TreeMap<>();
    Optional<String> cursor = Optional.empty();
    long total = 0;
    long skipped = 0;
    long failed = 0;
    long pages = 0;
    boolean malformed = false;

    while (total < request.maxItems()) {
      final CatalogPage page = paginator.listPage(pageRequest(cursor, request));
      pages++;
      if (page.identifiers().isEmpty()) {
        if (page.malformed()) {
          malformed = true;
          log.warn("Listing page {} could not be parsed; stopping", pages);
        }
        break;
      }

      for (final String identifier : page.identifiers()) {
        if (total >= request.maxItems()) {
          break;
        }
        final DownloadOutcome outcome = fetcher.fetch(identifier, request.outputDir());
        switch (outcome.status()) {
          case OK:
            total++;
            if (total % PROGRESS_INTERVAL == 0) {
              log.info("{} downloaded...", total);
            }
            break;
          case SKIP:
            skipped++;
            break;
          default:
            failed++;
            errorsByCode.merge(outcome.code().orElse("unknown"), 1L, Long::sum);
            break;
        }
        listener.onOutcome(identifier, outcome);
        pause(request.perItemDelay());
      }

      cursor = page.nextCursor();
      if (cursor.isEmpty()) {
        break;
      }
      pause(request.perItemDelay());
    }

    final HarvestSummary summary = ImmutableHarvestSummary.builder()
        .outputDir(request.outputDir())
        .downloaded(total)
        .skipped(skipped)
        .failed(failed)
        .pages(pages)
        .errorsByCode(errorsByCode)
        .endedOnMalformedPage(malformed)
        .startTime(start)
        .endTime(clock.instant())
        .build();
    log.info("Done. Downloaded: {}. Saved to: {}", summary.downloaded(), summary.outputDir());
    log.info("Skipped: {}, failed: {}, pages: {}", skipped, failed, pages);
    return summary;
  }

  private PageRequest pageRequest(final Optional<String> cursor, final HarvestRequest request) {
    if (cursor.isPresent()) {
      return PageRequest.continuation(cursor.get());
    }
    return PageRequest.initial(configuration.setName(), configuration.metadataPrefix(),
        request.fromDate(), request.untilDate());
  }

  private void pause(final Duration delay) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HarvestInterruptedException(e);
    }
  }
}

package io.github.eprintharvester.cli.report;

import io.github.eprintharvester.model.DownloadOutcome;
import io.github.eprintharvester.service.HarvestListener;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes one CSV record per item: identifier, status, code.
 */
public class OutcomeReportWriter implements HarvestListener, Closeable {

  private final CSVPrinter csvPrinter;

  /**
   * Constructor.
   *
   * @param csvPrinter the printer, with the header already written
   */
  public OutcomeReportWriter(final CSVPrinter csvPrinter) {
    this.csvPrinter = csvPrinter;
  }

  @Override
  public void onOutcome(final String identifier, final DownloadOutcome outcome) {
    try {
      csvPrinter.printRecord(identifier, outcome.status().name().toLowerCase(),
          outcome.code().orElse(""));
      csvPrinter.flush();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write report line for " + identifier, e);
    }
  }

  @Override
  public void close() throws IOException {
    csvPrinter.close(true);
  }
}

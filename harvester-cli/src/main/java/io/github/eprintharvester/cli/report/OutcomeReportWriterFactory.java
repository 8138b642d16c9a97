package io.github.eprintharvester.cli.report;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens outcome reports.
 */
public class OutcomeReportWriterFactory {

  /**
   * Report columns.
   */
  public static final String[] HEADER = {"identifier", "status", "code"};

  private static final Logger log = LoggerFactory.getLogger(OutcomeReportWriterFactory.class);

  private final CSVFormat csvFormat;

  /**
   * Constructor.
   *
   * @param csvFormat the csv format
   */
  public OutcomeReportWriterFactory(final CSVFormat csvFormat) {
    this.csvFormat = csvFormat;
  }

  /**
   * Open a report, replacing any existing file.
   *
   * @param reportFile the report file
   * @return the outcome report writer
   * @throws IOException if the file cannot be created
   */
  public OutcomeReportWriter open(final Path reportFile) throws IOException {
    final Path parent = reportFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    final BufferedWriter writer = Files.newBufferedWriter(reportFile, StandardCharsets.UTF_8);
    final CSVPrinter printer;
    try {
      printer = new CSVPrinter(writer, csvFormat.builder().setHeader(HEADER).build());
    } catch (IOException e) {
      writer.close();
      throw e;
    }
    log.info("Writing outcome report to {}", reportFile);
    return new OutcomeReportWriter(printer);
  }
}

package io.github.eprintharvester.cli.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.eprintharvester.model.HarvestSummary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the run summary as pretty-printed JSON.
 */
public class SummaryWriter {

  private static final Logger log = LoggerFactory.getLogger(SummaryWriter.class);

  private final ObjectMapper objectMapper;

  /**
   * Constructor.
   *
   * @param objectMapper the object mapper
   */
  public SummaryWriter(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Write the summary.
   *
   * @param summary the summary
   * @param summaryFile the summary file
   * @throws IOException if the file cannot be written
   */
  public void write(final HarvestSummary summary, final Path summaryFile) throws IOException {
    final Path parent = summaryFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(summaryFile.toFile(), summary);
    log.info("Wrote summary file: {}", summaryFile);
  }

  /**
   * Read a summary back.
   *
   * @param summaryFile the summary file
   * @return the harvest summary
   * @throws IOException if the file cannot be read
   */
  public HarvestSummary read(final Path summaryFile) throws IOException {
    return objectMapper.readValue(summaryFile.toFile(), HarvestSummary.class);
  }
}

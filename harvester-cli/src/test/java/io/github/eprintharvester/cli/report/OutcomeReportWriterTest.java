package io.github.eprintharvester.cli.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import io.github.eprintharvester.cli.dagger.CliModule;
import io.github.eprintharvester.model.DownloadOutcome;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for OutcomeReportWriter.
 */
class OutcomeReportWriterTest {

  @TempDir Path tempDir;

  private OutcomeReportWriterFactory factory;

  @BeforeEach
  void setUp() {
    factory = new OutcomeReportWriterFactory(new CliModule().csvFormat());
  }

  @Test
  void onOutcome_writesOneRecordPerItem() throws Exception {
    // Given
    final Path reportFile = tempDir.resolve("reports").resolve("run.csv");

    // When
    try (OutcomeReportWriter writer = factory.open(reportFile)) {
      writer.onOutcome("2101.00001", DownloadOutcome.ok());
      writer.onOutcome("math/0601001", DownloadOutcome.skip());
      writer.onOutcome("2101.00003", DownloadOutcome.error(404));
      writer.onOutcome("2101.00004", DownloadOutcome.error("content-type-mismatch"));
    }

    // Then
    final List<CSVRecord> records;
    try (Reader reader = Files.newBufferedReader(reportFile);
         CSVParser parser = CSVFormat.DEFAULT.builder()
             .setHeader()
             .setSkipHeaderRecord(true)
             .build()
             .parse(reader)) {
      assertThat(parser.getHeaderNames()).containsExactly("identifier", "status", "code");
      records = parser.getRecords();
    }
    assertThat(records).hasSize(4);
    assertThat(records.get(0).get("status")).isEqualTo("ok");
    assertThat(records.get(0).get("code")).isEmpty();
    assertThat(records.get(1).get("identifier")).isEqualTo("math/0601001");
    assertThat(records.get(1).get("status")).isEqualTo("skip");
    assertThat(records.get(2).get("code")).isEqualTo("404");
    assertThat(records.get(3).get("status")).isEqualTo("error");
    assertThat(records.get(3).get("code")).isEqualTo("content-type-mismatch");
  }

  @Test
  void open_replacesExistingReport() throws Exception {
    // Given
    final Path reportFile = tempDir.resolve("run.csv");
    Files.writeString(reportFile, "stale,content\n");

    // When
    try (OutcomeReportWriter writer = factory.open(reportFile)) {
      writer.onOutcome("a", DownloadOutcome.ok());
    }

    // Then
    assertThat(Files.readAllLines(reportFile)).containsExactly("identifier,status,code", "a,ok,");
  }

  @Test
  void onOutcome_writeFailure_isUnchecked() throws Exception {
    // Given
    final CSVPrinter printer = mock(CSVPrinter.class);
    doThrow(new IOException("disk full")).when(printer).printRecord(any(), any(), any());
    final OutcomeReportWriter writer = new OutcomeReportWriter(printer);

    // When / Then
    assertThatThrownBy(() -> writer.onOutcome("a", DownloadOutcome.ok()))
        .isInstanceOf(UncheckedIOException.class)
        .hasMessageContaining("a");
  }
}

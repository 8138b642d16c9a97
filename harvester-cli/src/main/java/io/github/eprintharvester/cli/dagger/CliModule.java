package io.github.eprintharvester.cli.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.eprintharvester.cli.report.OutcomeReportWriterFactory;
import io.github.eprintharvester.cli.report.SummaryWriter;
import javax.inject.Singleton;
import org.apache.commons.csv.CSVFormat;

/**
 * Dagger module providing CLI dependencies.
 */
@Module
public class CliModule {

  /**
   * Provide the report CSV format.
   *
   * @return the csv format
   */
  @Provides
  @Singleton
  public CSVFormat csvFormat() {
    return CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();
  }

  /**
   * Provide outcome report factory.
   *
   * @param csvFormat the csv format
   * @return the outcome report writer factory
   */
  @Provides
  @Singleton
  public OutcomeReportWriterFactory outcomeReportWriterFactory(final CSVFormat csvFormat) {
    return new OutcomeReportWriterFactory(csvFormat);
  }

  /**
   * Provide summary writer.
   *
   * @param objectMapper the object mapper
   * @return the summary writer
   */
  @Provides
  @Singleton
  public SummaryWriter summaryWriter(final ObjectMapper objectMapper) {
    return new SummaryWriter(objectMapper);
  }
}

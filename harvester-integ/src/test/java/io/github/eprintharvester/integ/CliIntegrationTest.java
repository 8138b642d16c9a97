package io.github.eprintharvester.integ;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.eprintharvester.cli.HarvesterCli;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

/**
 * Runs the command line tool end to end: download, then extract.
 */
class CliIntegrationTest {

  @TempDir Path tempDir;

  private OaiRepositoryServer repository;

  @BeforeEach
  void setUp() throws Exception {
    repository = new OaiRepositoryServer()
        .addPage("2101.00001", "2101.00002")
        .addPage("math/0601001", "2101.00003")
        .failArtifact("2101.00003", 404)
        .start();
  }

  @AfterEach
  void tearDown() {
    repository.close();
  }

  @Test
  void testDownloadThenExtract() throws Exception {
    Path papers = tempDir.resolve("papers");
    Path summaryFile = tempDir.resolve("summary.json");
    Path reportFile = tempDir.resolve("report.csv");

    int downloadExit = new CommandLine(new HarvesterCli()).execute(
        "download",
        "--out", papers.toString(),
        "--sleep", "0",
        "--from", "2020-01-01",
        "--until", "2021-12-31",
        "--metadata-endpoint", repository.metadataEndpoint().toString(),
        "--artifact-base", repository.artifactBase().toString(),
        "--contact", "ops@example.org",
        "--summary-file", summaryFile.toString(),
        "--report", reportFile.toString());

    assertThat(downloadExit).isZero();
    assertThat(papers.resolve("2101.00001.tar.gz")).exists();
    assertThat(papers.resolve("math_0601001.tar.gz")).exists();
    assertThat(repository.listingRequests().get(0)).contains("until=2021-12-31");

    JsonNode summary = new ObjectMapper().readTree(summaryFile.toFile());
    assertThat(summary.get("downloaded").asLong()).isEqualTo(3);
    assertThat(summary.get("failed").asLong()).isEqualTo(1);
    assertThat(summary.get("errorsByCode").get("404").asLong()).isEqualTo(1);

    assertThat(Files.readAllLines(reportFile)).containsExactly(
        "identifier,status,code",
        "2101.00001,ok,",
        "2101.00002,ok,",
        "math/0601001,ok,",
        "2101.00003,error,404");

    Path extracted = tempDir.resolve("extracted");
    int extractExit = new CommandLine(new HarvesterCli()).execute(
        "extract", "--input", papers.toString(), "--output", extracted.toString());

    assertThat(extractExit).isZero();
    assertThat(extracted.resolve("2101.00002").resolve("main.tex")).hasContent("% 2101.00002");
    assertThat(extracted.resolve("math_0601001").resolve("main.tex"))
        .hasContent("% math/0601001");
  }

  @Test
  void testInvalidOptionsExitWithOne() {
    int exit = new CommandLine(new HarvesterCli()).execute(
        "download", "--out", tempDir.toString(), "--max", "-5");

    assertThat(exit).isEqualTo(1);
    assertThat(repository.listingRequests()).isEmpty();
  }
}

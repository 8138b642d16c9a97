package io.github.eprintharvester.integ;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.eprintharvester.archive.ExtractionResult;
import io.github.eprintharvester.dagger.HarvesterComponent;
import io.github.eprintharvester.model.Configuration;
import io.github.eprintharvester.model.HarvestSummary;
import io.github.eprintharvester.model.ImmutableConfiguration;
import io.github.eprintharvester.model.ImmutableHarvestRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the harvester component against an in-process repository.
 */
class HarvestIntegrationTest {

  private static final Logger log = LoggerFactory.getLogger(HarvestIntegrationTest.class);

  @TempDir Path tempDir;

  private OaiRepositoryServer repository;
  private HarvesterComponent component;
  private final List<Duration> sleeps = new ArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    repository = new OaiRepositoryServer()
        .addPage("2101.00001", "2101.00002", "math/0601001")
        .addPage("2101.00003", "2101.00004")
        .addPage("2101.00005")
        .markDeleted("2101.00002")
        .start();
    component = HarvesterComponent.instance(configuration(), sleeps::add);
  }

  @AfterEach
  void tearDown() throws Exception {
    component.httpClient().close();
    repository.close();
  }

  private Configuration configuration() {
    return ImmutableConfiguration.builder()
        .metadataEndpoint(repository.metadataEndpoint())
        .artifactBase(repository.artifactBase())
        .build();
  }

  @Test
  void testFullWalk() throws Exception {
    Path out = tempDir.resolve("papers");

    HarvestSummary summary = component.harvestRunner().run(
        ImmutableHarvestRequest.builder().outputDir(out).perItemDelay(Duration.ZERO).build());

    log.info("Summary: {}", summary);
    assertThat(summary.downloaded()).isEqualTo(5);
    assertThat(summary.pages()).isEqualTo(3);
    assertThat(summary.failed()).isZero();
    assertThat(repository.artifactRequests())
        .containsExactly("2101.00001", "math/0601001", "2101.00003", "2101.00004", "2101.00005");
    assertThat(repository.listingRequests()).hasSize(3);
    assertThat(repository.listingRequests().get(0))
        .contains("metadataPrefix=arXiv")
        .contains("set=math")
        .doesNotContain("from=");
    assertThat(repository.listingRequests().get(1)).endsWith("resumptionToken=page-1");
    assertThat(out.resolve("math_0601001.tar.gz"))
        .hasBinaryContent(OaiRepositoryServer.archiveFor("math/0601001"));
    assertThat(out.resolve("2101.00002.tar.gz")).doesNotExist();
  }

  @Test
  void testItemCap() {
    Path out = tempDir.resolve("papers");

    HarvestSummary summary = component.harvestRunner().run(
        ImmutableHarvestRequest.builder().outputDir(out).maxItems(2).build());

    assertThat(summary.downloaded()).isEqualTo(2);
    assertThat(repository.artifactRequests()).containsExactly("2101.00001", "math/0601001");
    assertThat(repository.listingRequests()).hasSize(1);
  }

  @Test
  void testRerunSkipsExistingArtifacts() throws Exception {
    Path out = tempDir.resolve("papers");
    component.harvestRunner().run(
        ImmutableHarvestRequest.builder().outputDir(out).maxItems(2).build());

    HarvestSummary second = component.harvestRunner().run(
        ImmutableHarvestRequest.builder().outputDir(out).build());

    assertThat(second.skipped()).isEqualTo(2);
    assertThat(second.downloaded()).isEqualTo(3);
    assertThat(repository.artifactRequests()).hasSize(5);
    try (var files = Files.list(out)) {
      assertThat(files.count()).isEqualTo(5);
    }
  }

  @Test
  void testErrorsAreCountedAndWalkContinues() {
    repository.failArtifact("2101.00003", 404).disguiseArtifact("2101.00004");
    Path out = tempDir.resolve("papers");

    HarvestSummary summary = component.harvestRunner().run(
        ImmutableHarvestRequest.builder().outputDir(out).build());

    assertThat(summary.downloaded()).isEqualTo(3);
    assertThat(summary.failed()).isEqualTo(2);
    assertThat(summary.errorsByCode())
        .containsEntry("404", 1L)
        .containsEntry("content-type-mismatch", 1L);
    assertThat(out.resolve("2101.00004.tar.gz")).doesNotExist();
  }

  @Test
  void testTransientFailureIsRetriedThenReported() {
    repository.failArtifact("2101.00001", 503);
    Path out = tempDir.resolve("papers");

    HarvestSummary summary = component.harvestRunner().run(
        ImmutableHarvestRequest.builder().outputDir(out).maxItems(1).build());

    assertThat(summary.errorsByCode()).containsEntry("503", 1L);
    assertThat(repository.artifactRequests().subList(0, 3))
        .containsOnly("2101.00001");
    assertThat(summary.downloaded()).isEqualTo(1);
    assertThat(sleeps).anySatisfy(delay -> assertThat(delay).isGreaterThanOrEqualTo(
        Duration.ofSeconds(1)));
  }

  @Test
  void testDownloadedArchivesExtract() throws Exception {
    Path out = tempDir.resolve("papers");
    component.harvestRunner().run(
        ImmutableHarvestRequest.builder().outputDir(out).maxItems(2).build());

    Path extracted = tempDir.resolve("extracted").resolve("math_0601001");
    ExtractionResult result = component.safeArchiveExtractor()
        .extract(out.resolve("math_0601001.tar.gz"), extracted);

    assertThat(result.extracted()).isEqualTo(1);
    assertThat(extracted.resolve("main.tex")).hasContent("% math/0601001");
  }
}

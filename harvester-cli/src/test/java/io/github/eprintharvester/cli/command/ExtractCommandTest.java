package io.github.eprintharvester.cli.command;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ExtractCommandTest {

  @TempDir Path tempDir;

  @Test
  void call_extractsEachArchiveIntoItsOwnDirectory() throws IOException {
    // Given
    final Path input = Files.createDirectories(tempDir.resolve("papers"));
    final Path output = tempDir.resolve("extracted");
    writeArchive(input.resolve("2101.00001.tar.gz"), "main.tex", "first");
    writeArchive(input.resolve("math_0601001.tar.gz"), "paper.tex", "second");
    Files.writeString(input.resolve("notes.txt"), "ignored");

    // When
    final int exitCode = new CommandLine(new ExtractCommand())
        .execute("--input", input.toString(), "--output", output.toString());

    // Then
    assertThat(exitCode).isZero();
    assertThat(output.resolve("2101.00001").resolve("main.tex")).hasContent("first");
    assertThat(output.resolve("math_0601001").resolve("paper.tex")).hasContent("second");
    assertThat(output.resolve("notes.txt")).doesNotExist();
  }

  @Test
  void call_corruptArchive_isSkipped() throws IOException {
    // Given
    final Path input = Files.createDirectories(tempDir.resolve("papers"));
    final Path output = tempDir.resolve("extracted");
    Files.writeString(input.resolve("2101.00002.tar.gz"), "<html>rate limited</html>");
    writeArchive(input.resolve("2101.00003.tar.gz"), "ok.tex", "fine");

    // When
    final int exitCode = new CommandLine(new ExtractCommand())
        .execute("-i", input.toString(), "-o", output.toString());

    // Then
    assertThat(exitCode).isZero();
    assertThat(output.resolve("2101.00003").resolve("ok.tex")).hasContent("fine");
  }

  @Test
  void call_missingInput_returnsOne() {
    final int exitCode = new CommandLine(new ExtractCommand()).execute(
        "-i", tempDir.resolve("absent").toString(), "-o", tempDir.toString());

    assertThat(exitCode).isEqualTo(1);
  }

  private static void writeArchive(final Path archive, final String member, final String content)
      throws IOException {
    final byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    try (TarArchiveOutputStream tar = new TarArchiveOutputStream(
        new GzipCompressorOutputStream(Files.newOutputStream(archive)))) {
      final TarArchiveEntry entry = new TarArchiveEntry(member);
      entry.setSize(bytes.length);
      tar.putArchiveEntry(entry);
      tar.write(bytes);
      tar.closeArchiveEntry();
    }
  }
}

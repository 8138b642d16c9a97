package io.github.eprintharvester.cli.command;

import io.github.eprintharvester.archive.ExtractionResult;
import io.github.eprintharvester.archive.SafeArchiveExtractor;
import io.github.eprintharvester.cli.dagger.CliComponent;
import io.github.eprintharvester.exception.ArchiveFormatException;
import io.github.eprintharvester.helper.ArtifactNames;
import io.github.eprintharvester.model.ImmutableConfiguration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Extract command: unpacks every downloaded archive into its own directory.
 */
@Command(
    name = "extract",
    description = "Extract downloaded archives, one directory per archive")
public class ExtractCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

  @Option(
      names = {"--input", "-i"},
      description = "Directory holding the downloaded *.tar.gz files",
      required = true)
  private Path input;

  @Option(
      names = {"--output", "-o"},
      description = "Directory receiving one sub-directory per archive",
      required = true)
  private Path output;

  @Override
  public Integer call() throws Exception {
    if (!Files.isDirectory(input)) {
      log.error("Input is not a directory: {}", input);
      return 1;
    }

    final SafeArchiveExtractor extractor =
        CliComponent.create(ImmutableConfiguration.builder().build()).safeArchiveExtractor();

    final List<Path> archives;
    try (Stream<Path> files = Files.list(input)) {
      archives = files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(ArtifactNames.ARCHIVE_SUFFIX))
          .sorted()
          .collect(Collectors.toList());
    }
    log.info("Extracting {} archives from {} into {}", archives.size(), input, output);

    int extracted = 0;
    int failed = 0;
    for (final Path archive : archives) {
      final Path destination =
          output.resolve(ArtifactNames.baseName(archive.getFileName().toString()));
      try {
        final ExtractionResult result = extractor.extract(archive, destination);
        if (result.skipped() > 0) {
          log.warn("{}: {} members skipped", archive.getFileName(), result.skipped());
        }
        extracted++;
      } catch (ArchiveFormatException e) {
        log.warn("Not a tar archive, skipping {}: {}", archive.getFileName(), e.getMessage());
        failed++;
      } catch (IOException e) {
        log.warn("Failed to extract {}", archive.getFileName(), e);
        failed++;
      }
    }

    log.info("Extraction complete: {} extracted, {} failed", extracted, failed);
    return 0;
  }
}

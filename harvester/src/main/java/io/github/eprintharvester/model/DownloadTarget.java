package io.github.eprintharvester.model;

import io.github.eprintharvester.helper.ArtifactNames;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.immutables.value.Value;

/**
 * Where the artifact for one identifier is stored.
 */
@Value.Immutable
public interface DownloadTarget {

  /**
   * Of download target.
   *
   * @param identifier the identifier
   * @param destinationDir the destination dir
   * @return the download target
   */
  static DownloadTarget of(final String identifier, final Path destinationDir) {
    return ImmutableDownloadTarget.builder()
        .identifier(identifier)
        .destinationDir(destinationDir)
        .build();
  }

  /**
   * Identifier.
   *
   * @return the identifier
   */
  String identifier();

  /**
   * Destination dir.
   *
   * @return the path
   */
  Path destinationDir();

  /**
   * Output file.
   *
   * @return the path
   */
  @Value.Derived
  default Path path() {
    return destinationDir().resolve(ArtifactNames.fileName(identifier()));
  }

  /**
   * True when the file exists and is non-empty. A zero-byte stub does not count.
   *
   * @return the boolean
   */
  default boolean isSatisfied() {
    final Path path = path();
    if (!Files.isRegularFile(path)) {
      return false;
    }
    try {
      return Files.size(path) > 0;
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to stat " + path, e);
    }
  }
}

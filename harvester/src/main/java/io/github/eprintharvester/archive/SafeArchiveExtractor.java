package io.github.eprintharvester.archive;

import io.github.eprintharvester.exception.ArchiveFormatException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.compress.archivers.ArchiveException;
import org.apache.commons.compress.archivers.ArchiveStreamFactory;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts tar archives, compressed or not, without letting any member escape the destination.
 *
 * <p>A member whose normalized path resolves outside the destination root ({@code ../} segments,
 * absolute names) is skipped, as are links and special files.
 */
@Singleton
public class SafeArchiveExtractor {

  private static final Logger log = LoggerFactory.getLogger(SafeArchiveExtractor.class);

  /**
   * Instantiates a new Safe archive extractor.
   */
  @Inject
  public SafeArchiveExtractor() {
    // Default constructor
  }

  /**
   * Extract an archive.
   *
   * @param archive the archive
   * @param destinationDir the destination dir, created on demand
   * @return the extraction result
   * @throws ArchiveFormatException if the file is not a tar archive
   * @throws IOException if reading or writing fails
   */
  public ExtractionResult extract(final Path archive, final Path destinationDir)
      throws IOException {
    Files.createDirectories(destinationDir);
    final Path root = destinationDir.toRealPath();

    int extracted = 0;
    int skipped = 0;
    try (InputStream in = new BufferedInputStream(Files.newInputStream(archive));
         TarArchiveInputStream tar = openTar(in, archive)) {
      TarArchiveEntry entry;
      while ((entry = tar.getNextEntry()) != null) {
        final Path target = resolveInside(root, entry.getName());
        if (target == null) {
          log.warn("Skipping member '{}' of {}: outside {}", entry.getName(), archive, root);
          skipped++;
        } else if (entry.isDirectory()) {
          Files.createDirectories(target);
          extracted++;
        } else if (isRegularFile(entry)) {
          Files.createDirectories(target.getParent());
          Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
          extracted++;
        } else {
          log.debug("Skipping non-regular member '{}' of {}", entry.getName(), archive);
          skipped++;
        }
      }
    }

    log.debug("Extracted {} members of {} into {} ({} skipped)", extracted, archive, root, skipped);
    return ImmutableExtractionResult.builder().extracted(extracted).skipped(skipped).build();
  }

  /**
   * Resolve a member name under the root.
   *
   * @param root the real destination root
   * @param memberName the member name
   * @return the path, or null when it would leave the root
   */
  static Path resolveInside(final Path root, final String memberName) {
    final Path resolved;
    try {
      resolved = root.resolve(memberName).normalize();
    } catch (InvalidPathException e) {
      return null;
    }
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      return null;
    }
    return resolved;
  }

  private static boolean isRegularFile(final TarArchiveEntry entry) {
    return entry.isFile() && !entry.isSymbolicLink() && !entry.isLink()
        && !entry.isCharacterDevice() && !entry.isBlockDevice() && !entry.isFIFO();
  }

  private static TarArchiveInputStream openTar(final InputStream in, final Path archive)
      throws IOException {
    final InputStream decompressed = new BufferedInputStream(decompress(in, archive));
    try {
      final String format = ArchiveStreamFactory.detect(decompressed);
      if (!ArchiveStreamFactory.TAR.equals(format)) {
        throw new ArchiveFormatException(archive + " is a " + format + " archive, not tar", null);
      }
    } catch (ArchiveException e) {
      throw new ArchiveFormatException(archive + " is not a tar archive", e);
    }
    return new TarArchiveInputStream(decompressed);
  }

  private static InputStream decompress(final InputStream in, final Path archive)
      throws IOException {
    final String compressor;
    try {
      compressor = CompressorStreamFactory.detect(in);
    } catch (CompressorException e) {
      return in;
    }
    try {
      return new CompressorStreamFactory().createCompressorInputStream(compressor, in);
    } catch (CompressorException e) {
      throw new ArchiveFormatException("Unsupported compression " + compressor + " in " + archive,
          e);
    }
  }
}

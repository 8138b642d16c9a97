package io.github.eprintharvester.helper;

/**
 * Naming rules for identifiers and the files they are stored in.
 */
public final class ArtifactNames {

  /**
   * Suffix of stored artifacts.
   */
  public static final String ARCHIVE_SUFFIX = ".tar.gz";

  private ArtifactNames() {
  }

  /**
   * Filesystem-safe file name for an identifier. Old-style identifiers such as
   * {@code math/0601001} contain a path separator. Collisions are not detected.
   *
   * @param identifier the identifier
   * @return the file name
   */
  public static String fileName(final String identifier) {
    return identifier.replace('/', '_') + ARCHIVE_SUFFIX;
  }

  /**
   * Reduce a compound OAI identifier ({@code oai:arXiv.org:2101.00001}) to its trailing component.
   *
   * @param compound the compound identifier
   * @return the trailing component, possibly empty
   */
  public static String trailingComponent(final String compound) {
    if (compound == null) {
      return "";
    }
    final String trimmed = compound.trim();
    return trimmed.substring(trimmed.lastIndexOf(':') + 1);
  }

  /**
   * Strip the archive suffix from a stored file name.
   *
   * @param fileName the file name
   * @return the base name
   */
  public static String baseName(final String fileName) {
    if (fileName.endsWith(ARCHIVE_SUFFIX)) {
      return fileName.substring(0, fileName.length() - ARCHIVE_SUFFIX.length());
    }
    return fileName;
  }
}

package io.github.eprintharvester.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import picocli.CommandLine.IVersionProvider;

/**
 * Reports the version stamped into {@code version.properties} at build time.
 */
public class VersionProvider implements IVersionProvider {

  /**
   * Classpath resource holding the {@code version} property.
   */
  public static final String RESOURCE = "/io/github/eprintharvester/cli/version.properties";

  @Override
  public String[] getVersion() {
    return new String[] {"eprint-harvester " + version()};
  }

  /**
   * Build version.
   *
   * @return the version
   */
  public static String version() {
    try (InputStream in = VersionProvider.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing " + RESOURCE + " on the classpath");
      }
      final Properties properties = new Properties();
      properties.load(in);
      return properties.getProperty("version");
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + RESOURCE, e);
    }
  }
}

package io.github.eprintharvester.cli;

import io.github.eprintharvester.cli.command.DownloadCommand;
import io.github.eprintharvester.cli.command.ExtractCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for the e-print harvester.
 */
@Command(
    name = "eprint-harvester",
    description = "Harvest e-print archives listed by an OAI-PMH catalog",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {DownloadCommand.class, ExtractCommand.class})
public class HarvesterCli implements Runnable {

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = new CommandLine(new HarvesterCli()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, System.out);
  }
}

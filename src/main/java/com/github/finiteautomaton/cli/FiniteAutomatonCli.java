package com.github.finiteautomaton.cli;

import java.io.PrintStream;
import java.util.Arrays;

/**
 * Entry point of the finite-automaton command line. The first argument names the subcommand,
 * everything after it belongs to the subcommand.
 */
public final class FiniteAutomatonCli {
  static final int exitSuccess = 0;
  static final int exitFailure = 1;
  static final int exitUsage = 2;

  private final PrintStream out;
  private final PrintStream err;

  public FiniteAutomatonCli(final PrintStream out, final PrintStream err) {
    this.out = out;
    this.err = err;
  }

  /**
   * Returns the process exit status.
   */
  public int execute(final String[] args) {
    if (args.length == 0) {
      err.println("Error: Missing subcommand");
      printUsage(err);
      return exitUsage;
    }
    final String subcommand = args[0];
    if ("-h".equals(subcommand) || "--help".equals(subcommand)) {
      printUsage(out);
      return exitSuccess;
    }
    if (CheckStringCommand.name.equals(subcommand)) {
      return new CheckStringCommand(out, err).execute(Arrays.copyOfRange(args, 1, args.length));
    }
    err.println("Error: No such subcommand: " + subcommand);
    printUsage(err);
    return exitUsage;
  }

  private static void printUsage(final PrintStream stream) {
    stream.println("Usage: finite-automaton <subcommand> [options] [arguments]");
    stream.println();
    stream.println("Subcommands:");
    stream.println("  " + CheckStringCommand.name + "  " + CheckStringCommand.help);
  }

  public static void main(String args[]) {
    System.exit(new FiniteAutomatonCli(System.out, System.err).execute(args));
  }
}

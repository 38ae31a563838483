package com.github.finiteautomaton.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.finiteautomaton.FiniteAutomaton;
import com.github.finiteautomaton.FiniteAutomatonException;
import com.github.finiteautomaton.FiniteAutomatonParser;

/**
 * {@code checkstring [-b] <automatonFile> <string>}: checks whether the automaton stored in the
 * given JSON file accepts the given string.
 */
final class CheckStringCommand {
  private static final Logger logger =
      LogManager.getLogger(CheckStringCommand.class.getSimpleName());

  static final String name = "checkstring";
  static final String syntax = name + " [-b] <automatonFile> <string>";
  static final String help = "Checks whether the given automaton accepts the given string";

  private final PrintStream out;
  private final PrintStream err;

  CheckStringCommand(final PrintStream out, final PrintStream err) {
    this.out = out;
    this.err = err;
  }

  static Options options() {
    final Options options = new Options();
    options.addOption(Option.builder("b").longOpt("boolean")
        .desc("Only show a boolean value instead of a sentence").build());
    options.addOption(Option.builder("h").longOpt("help").desc("Show this message").build());
    return options;
  }

  int execute(final String[] args) {
    final Options options = options();
    final CommandLineParser parser = new DefaultParser();
    final CommandLine cmd;
    try {
      cmd = parser.parse(options, args);
    } catch (ParseException problem) {
      return usageError(problem.getMessage(), options);
    }
    if (cmd.hasOption("help")) {
      printHelp(out, options);
      return FiniteAutomatonCli.exitSuccess;
    }
    final List<String> arguments = cmd.getArgList();
    if (arguments.size() != 2) {
      return usageError(
          "Expected <automatonFile> and <string> but got " + arguments.size() + " argument(s)",
          options);
    }

    final String jsonString;
    try {
      jsonString = readFile(arguments.get(0));
    } catch (IOException | InvalidPathException problem) {
      return failure("Error while reading file: ", problem);
    }
    final FiniteAutomaton finiteAutomaton;
    try {
      finiteAutomaton = FiniteAutomatonParser.parse(jsonString);
    } catch (FiniteAutomatonException problem) {
      return failure("Error while parsing automaton: ", problem);
    }
    final boolean accepted;
    try {
      accepted = finiteAutomaton.checkString(arguments.get(1));
    } catch (FiniteAutomatonException problem) {
      return failure("Error while checking string: ", problem);
    }

    if (cmd.hasOption("boolean")) {
      out.println(accepted);
    } else {
      out.println("The string is " + (accepted ? "" : "not ") + "accepted by the automaton.");
    }
    return FiniteAutomatonCli.exitSuccess;
  }

  private static String readFile(final String automatonFile) throws IOException {
    final Path path = Paths.get(automatonFile);
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new IOException("File " + automatonFile + " does not exist or is not a readable file");
    }
    return Files.readString(path, StandardCharsets.UTF_8);
  }

  private int failure(final String prefix, final Exception problem) {
    logger.debug(prefix + problem.getMessage(), problem);
    err.println(prefix + problem.getMessage());
    return FiniteAutomatonCli.exitFailure;
  }

  private int usageError(final String message, final Options options) {
    err.println("Error: " + message);
    printHelp(err, options);
    return FiniteAutomatonCli.exitUsage;
  }

  static void printHelp(final PrintStream stream, final Options options) {
    final PrintWriter writer = new PrintWriter(stream);
    new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, syntax, help, options,
        HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    writer.flush();
  }
}

/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.qtree.ui;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import exm.qtree.ast.Atom;
import exm.qtree.common.Logging;
import exm.qtree.common.Settings;
import exm.qtree.common.exceptions.InvalidOptionException;
import exm.qtree.common.exceptions.QTreeFatal;
import exm.qtree.expand.BasicEnv;
import exm.qtree.ui.QTreeTool.Command;

/**
 * Command line interface to qtree.  Reads a tree in term notation from
 * a file, or stdin if no file is given, and prints the result of one
 * command.  Other options are passed through Java properties, see
 * Settings.java.
 */
public class Main {
  private static final String TO_STRING_FLAG = "s";
  private static final String VALIDATE_FLAG = "v";
  private static final String UNPIPE_FLAG = "u";
  private static final String CLASSIFY_FLAG = "c";
  private static final String PREWALK_FLAG = "p";
  private static final String POSTWALK_FLAG = "P";
  private static final String EXPAND_FLAG = "e";
  private static final String MODULE_FLAG = "m";
  private static final String FILE_FLAG = "f";
  private static final String HELP_FLAG = "h";

  public static void main(String[] args) {
    Options opts = initOptions();
    CommandLine cmd = parseArgs(opts, args);

    try {
      Settings.initQTreeProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_JAVA.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_JAVA.code());
    }

    QTreeTool tool = new QTreeTool(logger, System.out);
    try {
      if (cmd.hasOption(CLASSIFY_FLAG)) {
        tool.classify(cmd.getOptionValue(CLASSIFY_FLAG));
      } else {
        String inputName = inputName(cmd);
        String text = readInput(inputName);
        tool.run(selectCommand(cmd),
                 inputName == null ? "<stdin>" : inputName, text,
                 buildEnv(cmd));
      }
    } catch (QTreeFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();

    OptionGroup commands = new OptionGroup();
    commands.addOption(new Option(TO_STRING_FLAG, "to-string", false,
                       "Print the tree as source text (default)"));
    commands.addOption(new Option(VALIDATE_FLAG, "validate", false,
                       "Check the tree is well formed"));
    commands.addOption(new Option(UNPIPE_FLAG, "unpipe", false,
                       "Print the steps of a |> pipeline"));
    commands.addOption(new Option(CLASSIFY_FLAG, "classify", true,
                       "Classify an atom name and show its renderings"));
    commands.addOption(new Option(PREWALK_FLAG, "prewalk", false,
                       "Print every subtree, parents first"));
    commands.addOption(new Option(POSTWALK_FLAG, "postwalk", false,
                       "Print every subtree, children first"));
    commands.addOption(new Option(EXPAND_FLAG, "expand", false,
                       "Expand the root node until it stops changing"));
    opts.addOptionGroup(commands);

    opts.addOption(MODULE_FLAG, "module", true,
                   "Current module for --expand, e.g. Foo.Bar");
    opts.addOption(FILE_FLAG, "file", true,
                   "Current file for --expand");
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  private static CommandLine parseArgs(Options opts, String[] args) {
    CommandLine cmd = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      System.exit(ExitCode.SUCCESS.code());
    }

    if (cmd.getArgs().length > 1) {
      System.err.println("Expected at most one input file, but got " +
                         cmd.getArgs().length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    return cmd;
  }

  private static Command selectCommand(CommandLine cmd) {
    if (cmd.hasOption(VALIDATE_FLAG)) {
      return Command.VALIDATE;
    } else if (cmd.hasOption(UNPIPE_FLAG)) {
      return Command.UNPIPE;
    } else if (cmd.hasOption(PREWALK_FLAG)) {
      return Command.PREWALK;
    } else if (cmd.hasOption(POSTWALK_FLAG)) {
      return Command.POSTWALK;
    } else if (cmd.hasOption(EXPAND_FLAG)) {
      return Command.EXPAND;
    }
    return Command.TO_STRING;
  }

  private static BasicEnv buildEnv(CommandLine cmd) {
    BasicEnv.Builder b = BasicEnv.builder();
    if (cmd.hasOption(MODULE_FLAG)) {
      b.module(Atom.alias(cmd.getOptionValue(MODULE_FLAG)));
    }
    if (cmd.hasOption(FILE_FLAG)) {
      b.file(cmd.getOptionValue(FILE_FLAG));
    }
    return b.build();
  }

  /**
   * @return input file name, or null for stdin
   */
  private static String inputName(CommandLine cmd) {
    String[] rest = cmd.getArgs();
    return rest.length == 0 ? null : rest[0];
  }

  private static String readInput(String inputName) {
    try {
      if (inputName == null) {
        return IOUtils.toString(System.in, StandardCharsets.UTF_8);
      }
      File input = new File(inputName);
      if (!input.isFile() || !input.canRead()) {
        System.err.println("Input file \"" + input + "\" is not readable");
        throw new QTreeFatal(ExitCode.ERROR_IO.code());
      }
      return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      System.err.println("Error while reading input: " + ex.getMessage());
      throw new QTreeFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("qtree [options] [input]", opts);
    System.out.println("reads a tree in term notation, e.g. " +
                       "{:+, [line: 1], [1, 2]}");
  }
}

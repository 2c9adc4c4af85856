package com.consullo.castedit.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Command-line front end for inspecting, rendering and editing cast recordings.
 *
 * <pre>
 * castedit info demo.cast
 * castedit render demo.cast --at 3.5 --format html
 * castedit cut demo.cast --from 2 --to 8 -o clip.cast
 * castedit concat intro.cast demo.cast -o joined.cast
 * castedit play demo.cast --speed 2
 * </pre>
 */
@Command(name = "castedit",
    mixinStandardHelpOptions = true,
    version = "castedit 1.0",
    header = "Inspect, render and edit terminal session recordings",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: unreadable or invalid recording, or declined edit", "2: usage error"},
    subcommands = {
        InfoCommand.class,
        RenderCommand.class,
        CutCommand.class,
        ConcatCommand.class,
        PlayCommand.class,
        CommandLine.HelpCommand.class
    })
public class CastEditCommand implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  @Spec
  CommandSpec spec;

  public static void main(String[] args) {
    int exitCode = newCommandLine().execute(args);
    System.exit(exitCode);
  }

  /**
   * Builds the configured command line; tests use it to run subcommands in-process.
   *
   * @return command line rooted at {@code castedit}
   */
  public static CommandLine newCommandLine() {
    return new CommandLine(new CastEditCommand())
        .setCaseInsensitiveEnumValuesAllowed(true);
  }

  @Override
  public Integer call() {
    throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
  }
}

package io.lemma.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/// Main entry point for the Lemma CLI application.
///
/// Registers the subcommands:
/// - `repl` - Run a proof session over standard input and output
/// - `engines` - List the proof engines found on the class path
///
/// The process exits with the code returned by the selected subcommand.
///
/// @see ReplCommand
/// @see EnginesCommand
@Command(
        name = "lemma",
        description = "Interactive proof session driver",
        mixinStandardHelpOptions = true,
        version = "lemma 0.1.0",
        subcommands = {ReplCommand.class, EnginesCommand.class})
public class LemmaCLI implements Runnable {

    @Spec private CommandSpec spec;

    public static void main(String[] args) {
        System.exit(new CommandLine(new LemmaCLI()).execute(args));
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}

package io.lemma.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine.Option;

/// Minimal abstract base for all Lemma CLI commands.
///
/// Owns logging set-up and the {@link #call()} / {@link #execute()} contract. Logging is
/// read from the `lemma-logging.properties` class path resource, which routes every
/// record to standard error so standard output stays free for protocol responses.
/// Subclasses provide command-specific option sets and implement {@link #execute()}.
///
/// @see ReplCommand
/// @see EnginesCommand
public abstract class LemmaCommand implements Callable<Integer> {

    static final String LOGGING_RESOURCE = "/lemma-logging.properties";

    // Held strongly so the level survives; LogManager keeps only weak references.
    private static final Logger LEMMA_LOGGER = Logger.getLogger("io.lemma");

    @Option(
            names = {"-v", "--verbose"},
            description = "Log session operations to standard error")
    private boolean verbose = false;

    @Override
    public final Integer call() {
        configureLogging(verbose);
        return execute();
    }

    /// Runs the command.
    ///
    /// @return process exit code
    protected abstract int execute();

    static void configureLogging(boolean verbose) {
        try (InputStream in = LemmaCommand.class.getResourceAsStream(LOGGING_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(LemmaCommand.class.getName())
                    .log(Level.WARNING, "Failed to read " + LOGGING_RESOURCE, e);
        }
        if (verbose) {
            LEMMA_LOGGER.setLevel(Level.FINE);
        }
    }

    boolean isVerbose() {
        return verbose;
    }
}

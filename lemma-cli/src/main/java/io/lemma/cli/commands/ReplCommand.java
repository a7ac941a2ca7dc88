package io.lemma.cli.commands;

import io.lemma.core.LemmaConfig;
import io.lemma.core.engine.EngineFactory;
import io.lemma.core.engine.EngineFaultException;
import io.lemma.core.engine.ProofEngine;
import io.lemma.core.engine.SourcePosition;
import io.lemma.core.session.EngineProofSession;
import io.lemma.protocol.JsonLineCodec;
import io.lemma.protocol.OperationRegistry;
import io.lemma.protocol.ProtocolDispatcher;
import io.lemma.protocol.SessionLoop;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/// CLI command running one proof session over the line protocol.
///
/// Reads one JSON request per line from standard input and writes one JSON response per
/// line to standard output until a `commit` succeeds or the input ends.
///
/// ### Usage
/// ```bash
/// lemma repl [--engine <name>] [--budget <n>] [--config <file>] [--file <path>]
///            [--line <n>] [--column <n>] [--namespace <ns>]... [-v]
/// ```
///
/// ### Exit codes
/// - `0` - the session was committed
/// - `1` - the input ended without a commit
/// - `3` - the engine failed unrecoverably
/// - `4` - the session could not be started (configuration, engine selection)
/// - `5` - reading requests or writing responses failed mid-session
///
/// Command-line options override values read from `--config`.
@Command(name = "repl", description = "Run a proof session over stdin/stdout")
public class ReplCommand extends LemmaCommand {

    public static final int EXIT_COMMITTED = 0;
    public static final int EXIT_END_OF_INPUT = 1;
    public static final int EXIT_ENGINE_FAULT = 3;
    public static final int EXIT_STARTUP_FAILURE = 4;
    public static final int EXIT_IO_FAILURE = 5;

    private static final Logger logger = Logger.getLogger(ReplCommand.class.getName());

    @Spec private CommandSpec spec;

    @Option(
            names = {"-e", "--engine"},
            description = "Engine provider name (default: highest priority)")
    private String engine;

    @Option(
            names = {"-b", "--budget"},
            description = "Default step budget, 0 for unlimited (default: 200000)")
    private Long budget;

    @Option(
            names = {"-c", "--config"},
            description = "Properties file with lemma.* settings")
    private Path configFile;

    @Option(names = "--file", description = "Source file of the ambient context")
    private String file;

    @Option(names = "--line", description = "Source line of the ambient context (1-based)")
    private Integer line;

    @Option(names = "--column", description = "Source column of the ambient context")
    private Integer column;

    @Option(
            names = {"-n", "--namespace"},
            description = "Namespace opened for name resolution (repeatable)")
    private List<String> namespaces;

    private final InputStream in;
    private final OutputStream out;
    private final EngineFactory engineFactory;

    public ReplCommand() {
        this(System.in, System.out, null);
    }

    /// Creates the command over explicit streams.
    ///
    /// @param in request stream, not null
    /// @param out response stream, not null
    /// @param engineFactory engine factory, or null to discover providers on the class path
    public ReplCommand(InputStream in, OutputStream out, EngineFactory engineFactory) {
        this.in = in;
        this.out = out;
        this.engineFactory = engineFactory;
    }

    @Override
    protected int execute() {
        PrintWriter err = spec.commandLine().getErr();

        LemmaConfig config;
        ProofEngine proofEngine;
        try {
            config = buildConfig();
            EngineFactory factory = engineFactory != null ? engineFactory : new EngineFactory();
            proofEngine = factory.createEngine(config);
        } catch (IOException | RuntimeException e) {
            err.println("Failed to start session: " + e.getMessage());
            return EXIT_STARTUP_FAILURE;
        }

        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        try {
            EngineProofSession session = new EngineProofSession(proofEngine);
            ProtocolDispatcher dispatcher =
                    new ProtocolDispatcher(
                            session,
                            OperationRegistry.standard(config.getDefaultBudget()),
                            new JsonLineCodec());
            SessionLoop loop =
                    new SessionLoop(new BufferedReader(reader), writer, dispatcher, session);

            SessionLoop.Termination termination = loop.run();
            logger.fine("Session ended: " + termination);
            return termination == SessionLoop.Termination.COMMITTED
                    ? EXIT_COMMITTED
                    : EXIT_END_OF_INPUT;
        } catch (EngineFaultException e) {
            logger.log(Level.SEVERE, "Engine fault, terminating session", e);
            err.println("Engine fault: " + e.getMessage());
            return EXIT_ENGINE_FAULT;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Session stream failed", e);
            err.println("I/O failure: " + e.getMessage());
            return EXIT_IO_FAILURE;
        }
    }

    LemmaConfig buildConfig() throws IOException {
        LemmaConfig config;
        if (configFile != null) {
            Properties properties = new Properties();
            try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            config = LemmaConfig.fromProperties(properties);
        } else {
            config = new LemmaConfig();
        }

        if (engine != null) {
            config.setEngineName(engine);
        }
        if (budget != null) {
            config.setDefaultBudget(budget);
        }
        if (namespaces != null && !namespaces.isEmpty()) {
            config.setOpenNamespaces(namespaces);
        }
        if (file != null || line != null || column != null) {
            SourcePosition base = config.getSourcePosition();
            config.setSourcePosition(
                    new SourcePosition(
                            file != null ? file : base != null ? base.file() : null,
                            line != null ? line : base != null ? base.line() : 1,
                            column != null ? column : base != null ? base.column() : 0));
        }
        return config;
    }
}

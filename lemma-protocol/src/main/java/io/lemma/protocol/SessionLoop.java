package io.lemma.protocol;

import io.lemma.core.session.ProofSession;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads requests line by line and writes one flushed response line per request until
/// the session is committed or the input ends.
///
/// @implNote Single-threaded. The loop owns neither stream; the caller closes them.
public class SessionLoop {

    private static final Logger logger = Logger.getLogger(SessionLoop.class.getName());

    /// How the loop ended.
    public enum Termination {
        /// A successful `commit` stopped the session.
        COMMITTED,
        /// The input ended while the session was still running.
        END_OF_INPUT
    }

    private final BufferedReader input;
    private final Writer output;
    private final ProtocolDispatcher dispatcher;
    private final ProofSession session;

    public SessionLoop(
            BufferedReader input,
            Writer output,
            ProtocolDispatcher dispatcher,
            ProofSession session) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.output = Objects.requireNonNull(output, "output must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    /// Runs the loop.
    ///
    /// @return how the loop terminated, never null
    /// @throws IOException if reading or writing fails
    /// @throws io.lemma.core.engine.EngineFaultException if the engine failed
    ///     unrecoverably
    public Termination run() throws IOException {
        while (session.isRunning()) {
            String line = input.readLine();
            if (line == null) {
                logger.fine("Input ended without commit");
                return Termination.END_OF_INPUT;
            }
            output.write(dispatcher.handleLine(line));
            output.write('\n');
            output.flush();
        }
        logger.fine("Session committed");
        return Termination.COMMITTED;
    }
}

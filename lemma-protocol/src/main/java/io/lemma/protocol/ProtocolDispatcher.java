package io.lemma.protocol;

import io.lemma.core.engine.EngineFaultException;
import io.lemma.core.exception.ProofSessionException;
import io.lemma.core.session.ProofSession;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Turns one request line into exactly one response.
///
/// ### Outcomes
/// - undecodable line - `TRANSPORT_PARSE` error, no id
/// - JSON that is not a request - `INVALID_REQUEST` error, no id
/// - unknown method - `METHOD_NOT_FOUND` error with the request id
/// - handler failure - the failure's error with the request id
/// - unexpected runtime failure - `INTERNAL` error with the request id
/// - success - `result` with the request id
///
/// {@link EngineFaultException} is never converted: it leaves the engine in an unknown
/// state and propagates to the caller.
public class ProtocolDispatcher {

    private static final Logger logger = Logger.getLogger(ProtocolDispatcher.class.getName());

    private final ProofSession session;
    private final OperationRegistry registry;
    private final JsonLineCodec codec;

    public ProtocolDispatcher(
            ProofSession session, OperationRegistry registry, JsonLineCodec codec) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /// Decodes, routes and executes one request.
    ///
    /// @param line raw request line, not null
    /// @return response, never null
    /// @throws EngineFaultException if the engine failed unrecoverably
    public Response dispatch(String line) {
        Request request;
        try {
            request = codec.decode(line);
        } catch (ProofSessionException e) {
            logger.fine("Rejected request line: " + e.getMessage());
            return Response.failure(null, e);
        }

        try {
            OperationHandler handler =
                    registry.lookup(request.method())
                            .orElseThrow(
                                    () -> ProofSessionException.methodNotFound(request.method()));
            logger.fine("Dispatching " + request.method() + " " + request.params());
            Params params = new Params(request.params(), codec.getMapper());
            return Response.success(request.id(), handler.handle(session, params));
        } catch (ProofSessionException e) {
            logger.fine(request.method() + " failed: " + e.getKind() + " " + e.getMessage());
            return Response.failure(request.id(), e);
        } catch (EngineFaultException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected failure in " + request.method(), e);
            return Response.failure(
                    request.id(),
                    ProofSessionException.internal("Internal error: " + e.getMessage(), e));
        }
    }

    /// Handles one line and returns the encoded response line.
    ///
    /// @param line raw request line, not null
    /// @return encoded response without terminator, never null
    public String handleLine(String line) {
        return codec.encode(dispatch(line));
    }
}

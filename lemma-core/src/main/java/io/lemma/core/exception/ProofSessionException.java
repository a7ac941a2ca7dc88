package io.lemma.core.exception;

import java.io.Serial;
import java.util.List;
import java.util.Objects;

/// The single error type of the session driver.
///
/// Tagged with an {@link ErrorKind}; converted to the wire error schema only at the
/// protocol dispatcher boundary. Step execution failures additionally carry the list of
/// diagnostic messages the step produced.
///
/// ### Usage
/// {@snippet :
/// throw ProofSessionException.invalidParams("unknown node id 99");
/// throw ProofSessionException.stepExecution(List.of("unknown identifier 'x'"));
/// }
public class ProofSessionException extends RuntimeException {

    @Serial private static final long serialVersionUID = -5217720113264750883L;

    private final ErrorKind kind;
    private final List<String> messages;

    /// Creates an exception of the given kind.
    ///
    /// @param kind error kind, not null
    /// @param message detail message, not null
    public ProofSessionException(ErrorKind kind, String message) {
        this(kind, message, List.of(), null);
    }

    /// Creates an exception of the given kind with messages and cause.
    ///
    /// @param kind error kind, not null
    /// @param message detail message, not null
    /// @param messages diagnostic messages carried to the client, not null
    /// @param cause underlying failure, may be null
    public ProofSessionException(
            ErrorKind kind, String message, List<String> messages, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.messages = List.copyOf(messages);
    }

    /// Returns the error kind.
    ///
    /// @return kind, never null
    public ErrorKind getKind() {
        return kind;
    }

    /// Returns the diagnostic messages attached to this failure.
    ///
    /// @return immutable list, empty unless this is a step execution failure
    public List<String> getMessages() {
        return messages;
    }

    public static ProofSessionException transportParse(String detail) {
        return new ProofSessionException(ErrorKind.TRANSPORT_PARSE, detail);
    }

    public static ProofSessionException invalidRequest(String detail) {
        return new ProofSessionException(ErrorKind.INVALID_REQUEST, detail);
    }

    public static ProofSessionException methodNotFound(String method) {
        return new ProofSessionException(
                ErrorKind.METHOD_NOT_FOUND, "Unknown method: " + method);
    }

    public static ProofSessionException invalidParams(String detail) {
        return new ProofSessionException(ErrorKind.INVALID_PARAMS, detail);
    }

    /// Creates the failure for a node id outside the session's node range.
    ///
    /// @param id requested node id
    /// @param size current node count
    /// @return new exception, never null
    public static ProofSessionException unknownNode(int id, int size) {
        return invalidParams("Unknown node id " + id + " (session has " + size + " nodes)");
    }

    public static ProofSessionException stepParse(String detail, Throwable cause) {
        return new ProofSessionException(ErrorKind.STEP_PARSE, detail, List.of(), cause);
    }

    /// Creates a step execution failure carrying the step's messages.
    ///
    /// @param messages diagnostic messages, not null, not empty
    /// @return new exception, never null
    public static ProofSessionException stepExecution(List<String> messages) {
        return new ProofSessionException(
                ErrorKind.STEP_EXECUTION, String.join("\n", messages), messages, null);
    }

    public static ProofSessionException expressionParse(String detail, Throwable cause) {
        return new ProofSessionException(ErrorKind.EXPRESSION_PARSE, detail, List.of(), cause);
    }

    public static ProofSessionException elaboration(String detail, Throwable cause) {
        return new ProofSessionException(ErrorKind.ELABORATION, detail, List.of(), cause);
    }

    public static ProofSessionException internal(String detail, Throwable cause) {
        return new ProofSessionException(ErrorKind.INTERNAL, detail, List.of(), cause);
    }
}

package io.lemma.core.engine;

import java.io.Serial;

/// Unrecoverable engine-internal fault.
///
/// Raised when the engine's ambient context can no longer be trusted, e.g. a
/// snapshot from another engine instance was restored. The protocol layer does not
/// convert this into a response: it terminates the session loop.
public class EngineFaultException extends RuntimeException {

    @Serial private static final long serialVersionUID = 6049017362268409217L;

    public EngineFaultException(String message) {
        super(message);
    }

    public EngineFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}

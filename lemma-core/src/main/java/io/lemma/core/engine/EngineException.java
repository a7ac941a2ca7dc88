package io.lemma.core.engine;

import java.io.Serial;

/// Base class for recoverable failures reported by a {@link ProofEngine}.
///
/// Recoverable means the engine context is still usable: restoring any previously
/// captured snapshot returns it to a well-defined state.
///
/// @see EngineFaultException for unrecoverable failures
public abstract class EngineException extends Exception {

    @Serial private static final long serialVersionUID = 2871634460213907512L;

    protected EngineException(String message) {
        super(message);
    }

    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

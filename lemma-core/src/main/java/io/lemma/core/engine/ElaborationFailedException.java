package io.lemma.core.engine;

import java.io.Serial;

/// Thrown when a parsed expression cannot be elaborated into a well-formed term.
public class ElaborationFailedException extends EngineException {

    @Serial private static final long serialVersionUID = -1843529120743012488L;

    public ElaborationFailedException(String message) {
        super(message);
    }
}

package io.lemma.core.engine;

import java.io.Serial;

/// Thrown when step or expression text cannot be parsed.
public class EngineSyntaxException extends EngineException {

    @Serial private static final long serialVersionUID = -3308129875511940271L;

    public EngineSyntaxException(String message) {
        super(message);
    }
}

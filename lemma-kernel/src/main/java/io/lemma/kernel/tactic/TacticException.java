package io.lemma.kernel.tactic;

import java.io.Serial;

/// A tactic failed; recoverable by `first` and `repeat`.
public class TacticException extends Exception {

    @Serial private static final long serialVersionUID = 3356873201942873104L;

    public TacticException(String message) {
        super(message);
    }
}

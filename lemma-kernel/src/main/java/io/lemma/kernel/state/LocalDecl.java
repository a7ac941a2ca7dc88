package io.lemma.kernel.state;

import io.lemma.core.engine.Hypothesis;
import io.lemma.kernel.term.Term;
import java.util.Objects;

/// A hypothesis in a goal's local context.
public record LocalDecl(String name, Term type) {

    public LocalDecl {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    Hypothesis toView() {
        return new Hypothesis(name, type.pretty());
    }
}

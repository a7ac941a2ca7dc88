package io.lemma.core.engine;

import java.util.Objects;

/// A named local assumption visible inside a goal.
///
/// @param name user-facing hypothesis name, not null
/// @param type pretty-printed type of the hypothesis, not null
public record Hypothesis(String name, String type) {

    public Hypothesis {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /// Renders the hypothesis as it appears in a goal display, e.g. `h : Nat`.
    ///
    /// @return display line, never null
    public String pretty() {
        return name + " : " + type;
    }
}

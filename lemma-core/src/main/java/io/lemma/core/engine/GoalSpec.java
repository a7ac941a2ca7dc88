package io.lemma.core.engine;

import java.util.Objects;

/// One user-supplied obligation for {@link ProofEngine#buildContext}.
///
/// @param name goal name, not null
/// @param type goal type as source text, not null
public record GoalSpec(String name, String type) {

    public GoalSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}

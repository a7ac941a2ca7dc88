package io.lemma.core.engine;

import java.util.List;
import java.util.Objects;

/// A global declaration a name may refer to.
///
/// For a dotted name such as `Nat.succ.foo` the engine may resolve the prefix
/// `Nat.succ` to a declaration and report `foo` as a trailing field access.
///
/// @param name fully qualified declaration name, not null
/// @param fields remaining dotted components interpreted as field projections, not null
public record NameCandidate(String name, List<String> fields) {

    public NameCandidate {
        Objects.requireNonNull(name, "name must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
    }
}

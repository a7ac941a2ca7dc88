package io.lemma.core.engine;

import java.util.List;
import java.util.Objects;

/// Read-only, pretty-printed view of one open goal.
///
/// Goals are owned by the engine; the session only ever sees these views.
///
/// ### Rendering
/// {@link #pretty()} produces the conventional goal display:
/// ```
/// case goal
/// h : Nat
/// ⊢ Nat
/// ```
///
/// @param name goal name, may be empty for anonymous goals, not null
/// @param hypotheses local context in declaration order, not null
/// @param target pretty-printed target type, not null
public record GoalView(String name, List<Hypothesis> hypotheses, String target) {

    public GoalView {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(target, "target must not be null");
        hypotheses = hypotheses != null ? List.copyOf(hypotheses) : List.of();
    }

    /// Returns the full multi-line display of this goal.
    ///
    /// @return rendered goal, never null
    public String pretty() {
        StringBuilder sb = new StringBuilder();
        if (!name.isEmpty()) {
            sb.append("case ").append(name).append('\n');
        }
        for (Hypothesis hypothesis : hypotheses) {
            sb.append(hypothesis.pretty()).append('\n');
        }
        sb.append("⊢ ").append(target);
        return sb.toString();
    }
}

package io.lemma.kernel.state;

import io.lemma.core.engine.GoalView;
import io.lemma.kernel.term.Term;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An open proof obligation: prove `target` from `context`.
///
/// @param name goal name, empty for anonymous goals, not null
/// @param context local hypotheses, innermost last, not null
/// @param target type to inhabit, not null
public record Goal(String name, List<LocalDecl> context, Term target) {

    public Goal {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(target, "target must not be null");
        context = context != null ? List.copyOf(context) : List.of();
    }

    /// Finds the innermost hypothesis with the given name.
    ///
    /// @param hypothesisName name to look up, not null
    /// @return the hypothesis, or empty if not in scope
    public Optional<LocalDecl> lookup(String hypothesisName) {
        for (int i = context.size() - 1; i >= 0; i--) {
            if (context.get(i).name().equals(hypothesisName)) {
                return Optional.of(context.get(i));
            }
        }
        return Optional.empty();
    }

    /// Returns a goal with the same context and a new target.
    public Goal withTarget(Term newTarget) {
        return new Goal(name, context, newTarget);
    }

    /// Returns a copy renamed to `newName`.
    public Goal withName(String newName) {
        return new Goal(newName, context, target);
    }

    /// Returns a goal extended by one hypothesis, targeting `newTarget`.
    public Goal introduce(LocalDecl hypothesis, Term newTarget) {
        List<LocalDecl> extended = new ArrayList<>(context);
        extended.add(hypothesis);
        return new Goal(name, extended, newTarget);
    }

    public GoalView toView() {
        return new GoalView(
                name, context.stream().map(LocalDecl::toView).toList(), target.pretty());
    }
}

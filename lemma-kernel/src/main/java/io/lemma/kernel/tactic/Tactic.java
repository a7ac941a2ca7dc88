package io.lemma.kernel.tactic;

import io.lemma.core.engine.StepSyntax;
import io.lemma.kernel.term.Term;
import java.util.List;
import java.util.Objects;

/// Parsed tactic, the kernel's step syntax.
///
/// Every tactic except {@link Seq}, {@link First}, {@link Repeat} and {@link Skip} acts on
/// the main (first) goal.
public sealed interface Tactic extends StepSyntax
        permits Tactic.Exact,
                Tactic.Apply,
                Tactic.Intro,
                Tactic.Assumption,
                Tactic.Constructor,
                Tactic.Trivial,
                Tactic.Admit,
                Tactic.Skip,
                Tactic.Fail,
                Tactic.First,
                Tactic.Repeat,
                Tactic.Seq {

    /// Closes the main goal with a proof term of exactly the target type.
    record Exact(Term term) implements Tactic {
        public Exact {
            Objects.requireNonNull(term, "term must not be null");
        }
    }

    /// Reduces the main goal to the premises of a term whose conclusion is the target.
    record Apply(Term term) implements Tactic {
        public Apply {
            Objects.requireNonNull(term, "term must not be null");
        }
    }

    /// Introduces implication premises as hypotheses; an empty list introduces one
    /// premise under a fresh name.
    record Intro(List<String> names) implements Tactic {
        public Intro {
            names = List.copyOf(names);
        }
    }

    record Assumption() implements Tactic {}

    /// Splits a conjunction or closes `True`.
    record Constructor() implements Tactic {}

    record Trivial() implements Tactic {}

    /// Discharges the main goal without proof (`sorry` / `admit`).
    record Admit() implements Tactic {}

    record Skip() implements Tactic {}

    record Fail(String message) implements Tactic {
        public Fail {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /// Runs the first alternative that succeeds.
    record First(List<Tactic> alternatives) implements Tactic {
        public First {
            alternatives = List.copyOf(alternatives);
        }
    }

    /// Runs the body until it fails.
    record Repeat(Tactic body) implements Tactic {
        public Repeat {
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record Seq(List<Tactic> steps) implements Tactic {
        public Seq {
            steps = List.copyOf(steps);
        }
    }
}

package io.lemma.kernel.term;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// First-order syntactic unification with occurs check.
///
/// Constants only unify with themselves; metavariables may be assigned any term they do
/// not occur in. Callers reject higher-order patterns (a metavariable in function
/// position) before unifying.
public final class Unifier {

    private final Map<String, Term> assignment = new HashMap<>();

    private Unifier() {}

    /// Unifies two terms.
    ///
    /// @param lhs left term, not null
    /// @param rhs right term, not null
    /// @return every metavariable of both terms, in order of first occurrence, mapped to
    ///     its fully instantiated solution text or `null` if left unassigned; empty if the
    ///     terms do not unify
    public static Optional<Map<String, String>> unify(Term lhs, Term rhs) {
        Unifier unifier = new Unifier();
        if (!unifier.solve(lhs, rhs)) {
            return Optional.empty();
        }
        Set<String> names = new LinkedHashSet<>();
        collectMetavariables(lhs, names);
        collectMetavariables(rhs, names);

        Map<String, String> solution = new LinkedHashMap<>();
        for (String name : names) {
            Term value = unifier.assignment.get(name);
            solution.put(name, value != null ? unifier.instantiate(value).pretty() : null);
        }
        return Optional.of(solution);
    }

    /// Collects metavariable names in left-to-right order.
    public static void collectMetavariables(Term term, Set<String> names) {
        if (term instanceof Term.MVar m) {
            names.add(m.name());
        } else if (term instanceof Term.App app) {
            collectMetavariables(app.function(), names);
            collectMetavariables(app.argument(), names);
        } else if (term instanceof Term.Arrow arrow) {
            collectMetavariables(arrow.domain(), names);
            collectMetavariables(arrow.codomain(), names);
        } else if (term instanceof Term.And and) {
            collectMetavariables(and.left(), names);
            collectMetavariables(and.right(), names);
        }
    }

    private boolean solve(Term lhs, Term rhs) {
        Term a = resolve(lhs);
        Term b = resolve(rhs);
        if (a.equals(b)) {
            return true;
        }
        if (a instanceof Term.MVar m) {
            return bind(m, b);
        }
        if (b instanceof Term.MVar m) {
            return bind(m, a);
        }
        if (a instanceof Term.App x && b instanceof Term.App y) {
            return solve(x.function(), y.function()) && solve(x.argument(), y.argument());
        }
        if (a instanceof Term.Arrow x && b instanceof Term.Arrow y) {
            return solve(x.domain(), y.domain()) && solve(x.codomain(), y.codomain());
        }
        if (a instanceof Term.And x && b instanceof Term.And y) {
            return solve(x.left(), y.left()) && solve(x.right(), y.right());
        }
        return false;
    }

    private boolean bind(Term.MVar mvar, Term value) {
        if (occurs(mvar.name(), value)) {
            return false;
        }
        assignment.put(mvar.name(), value);
        return true;
    }

    private Term resolve(Term term) {
        Term current = term;
        while (current instanceof Term.MVar m && assignment.containsKey(m.name())) {
            current = assignment.get(m.name());
        }
        return current;
    }

    private boolean occurs(String name, Term term) {
        Term t = resolve(term);
        if (t instanceof Term.MVar m) {
            return m.name().equals(name);
        }
        if (t instanceof Term.App app) {
            return occurs(name, app.function()) || occurs(name, app.argument());
        }
        if (t instanceof Term.Arrow arrow) {
            return occurs(name, arrow.domain()) || occurs(name, arrow.codomain());
        }
        if (t instanceof Term.And and) {
            return occurs(name, and.left()) || occurs(name, and.right());
        }
        return false;
    }

    private Term instantiate(Term term) {
        Term t = resolve(term);
        if (t instanceof Term.App app) {
            return new Term.App(instantiate(app.function()), instantiate(app.argument()));
        }
        if (t instanceof Term.Arrow arrow) {
            return new Term.Arrow(instantiate(arrow.domain()), instantiate(arrow.codomain()));
        }
        if (t instanceof Term.And and) {
            return new Term.And(instantiate(and.left()), instantiate(and.right()));
        }
        return t;
    }
}

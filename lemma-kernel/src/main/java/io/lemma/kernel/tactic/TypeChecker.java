package io.lemma.kernel.tactic;

import io.lemma.kernel.state.Goal;
import io.lemma.kernel.state.LocalDecl;
import io.lemma.kernel.term.Environment;
import io.lemma.kernel.term.Term;
import java.util.Optional;

/// Infers the type of proof terms against a goal's local context and the environment.
final class TypeChecker {

    private static final Term NAT = new Term.Const("Nat");
    private static final Term PROP = new Term.Const("Prop");

    private final Environment environment;

    TypeChecker(Environment environment) {
        this.environment = environment;
    }

    /// Infers the type of `term` in the context of `goal`.
    ///
    /// @throws TacticException for unknown identifiers, metavariables or ill-typed
    ///     applications
    Term infer(Term term, Goal goal) throws TacticException {
        if (term instanceof Term.Const c) {
            if (c.isNumeral()) {
                return NAT;
            }
            Optional<LocalDecl> local = goal.lookup(c.name());
            if (local.isPresent()) {
                return local.get().type();
            }
            return environment
                    .typeOf(c.name())
                    .orElseThrow(
                            () -> new TacticException("unknown identifier '" + c.name() + "'"));
        }
        if (term instanceof Term.MVar m) {
            throw new TacticException("unexpected metavariable ?" + m.name() + " in proof term");
        }
        if (term instanceof Term.App app) {
            Term functionType = infer(app.function(), goal);
            if (!(functionType instanceof Term.Arrow arrow)) {
                throw new TacticException(
                        "function expected: "
                                + app.function().pretty()
                                + " has type "
                                + functionType.pretty());
            }
            Term argumentType = infer(app.argument(), goal);
            if (!argumentType.equals(arrow.domain())) {
                throw new TacticException(
                        "application type mismatch: "
                                + app.argument().pretty()
                                + " has type "
                                + argumentType.pretty()
                                + " but is expected to have type "
                                + arrow.domain().pretty());
            }
            return arrow.codomain();
        }
        return PROP;
    }
}

package io.lemma.kernel.term;

import io.lemma.core.engine.ExpressionSyntax;
import java.util.Objects;

/// First-order terms of the kernel.
///
/// Terms double as types: a goal target, a hypothesis type and the type inferred for a
/// proof term are all terms. Equality is structural.
///
/// ### Variants
/// - {@link Const} - a constant or identifier, including numerals
/// - {@link MVar} - a metavariable `?name`, only meaningful in unification
/// - {@link App} - application `f a`
/// - {@link Arrow} - implication / function type `A → B`
/// - {@link And} - conjunction `A ∧ B`
public sealed interface Term extends ExpressionSyntax
        permits Term.Const, Term.MVar, Term.App, Term.Arrow, Term.And {

    /// Renders this term with minimal parentheses.
    ///
    /// @return source-like text, never null
    default String pretty() {
        return TermPrinter.print(this);
    }

    record Const(String name) implements Term {
        public Const {
            Objects.requireNonNull(name, "name must not be null");
        }

        /// Returns whether this constant is a natural number literal.
        public boolean isNumeral() {
            return !name.isEmpty() && name.chars().allMatch(Character::isDigit);
        }
    }

    /// Metavariable; `name` excludes the leading `?`.
    record MVar(String name) implements Term {
        public MVar {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record App(Term function, Term argument) implements Term {
        public App {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(argument, "argument must not be null");
        }
    }

    record Arrow(Term domain, Term codomain) implements Term {
        public Arrow {
            Objects.requireNonNull(domain, "domain must not be null");
            Objects.requireNonNull(codomain, "codomain must not be null");
        }
    }

    record And(Term left, Term right) implements Term {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }
}

package io.lemma.kernel.term;

/// Pretty-printer for {@link Term}s.
///
/// Precedences: application (1024, left associative) binds tighter than `∧` (35, right
/// associative), which binds tighter than `→` (25, right associative).
final class TermPrinter {

    private static final int ARROW = 25;
    private static final int AND = 35;
    private static final int APP = 1024;

    private TermPrinter() {}

    static String print(Term term) {
        return print(term, 0);
    }

    private static String print(Term term, int context) {
        if (term instanceof Term.Const c) {
            return c.name();
        }
        if (term instanceof Term.MVar m) {
            return "?" + m.name();
        }
        if (term instanceof Term.App app) {
            String s = print(app.function(), APP) + " " + print(app.argument(), APP + 1);
            return parenthesize(s, context > APP);
        }
        if (term instanceof Term.And and) {
            String s = print(and.left(), AND + 1) + " ∧ " + print(and.right(), AND);
            return parenthesize(s, context > AND);
        }
        Term.Arrow arrow = (Term.Arrow) term;
        String s = print(arrow.domain(), ARROW + 1) + " → " + print(arrow.codomain(), ARROW);
        return parenthesize(s, context > ARROW);
    }

    private static String parenthesize(String s, boolean needed) {
        return needed ? "(" + s + ")" : s;
    }
}

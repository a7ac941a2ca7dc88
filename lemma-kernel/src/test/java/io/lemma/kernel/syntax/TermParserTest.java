package io.lemma.kernel.syntax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lemma.core.engine.EngineSyntaxException;
import io.lemma.kernel.term.Term;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TermParserTest {

    private static final Term P = new Term.Const("P");
    private static final Term Q = new Term.Const("Q");

    @Nested
    class Structure {

        @Test
        void shouldParseRightAssociativeArrows() throws Exception {
            Term term = TermParser.parse("P -> Q -> P");

            assertThat(term).isEqualTo(new Term.Arrow(P, new Term.Arrow(Q, P)));
        }

        @Test
        void shouldBindConjunctionTighterThanArrow() throws Exception {
            Term term = TermParser.parse("P ∧ Q → P");

            assertThat(term).isEqualTo(new Term.Arrow(new Term.And(P, Q), P));
        }

        @Test
        void shouldParseLeftAssociativeApplication() throws Exception {
            Term term = TermParser.parse("Nat.add 1 ?n");

            assertThat(term)
                    .isEqualTo(
                            new Term.App(
                                    new Term.App(new Term.Const("Nat.add"), new Term.Const("1")),
                                    new Term.MVar("n")));
        }

        @Test
        void shouldRespectParentheses() throws Exception {
            Term term = TermParser.parse("(P -> Q) -> P");

            assertThat(term).isEqualTo(new Term.Arrow(new Term.Arrow(P, Q), P));
            assertThat(term.pretty()).isEqualTo("(P → Q) → P");
        }

        @Test
        void shouldAcceptAsciiConjunction() throws Exception {
            assertThat(TermParser.parse("P /\\ Q")).isEqualTo(new Term.And(P, Q));
        }
    }

    @Nested
    class Errors {

        @Test
        void shouldRejectUnbalancedParentheses() {
            assertThatThrownBy(() -> TermParser.parse("(P -> Q"))
                    .isInstanceOf(EngineSyntaxException.class);
        }

        @Test
        void shouldRejectTrailingTokens() {
            assertThatThrownBy(() -> TermParser.parse("P )"))
                    .isInstanceOf(EngineSyntaxException.class);
        }

        @Test
        void shouldRejectEmptyExpression() {
            assertThatThrownBy(() -> TermParser.parse(""))
                    .isInstanceOf(EngineSyntaxException.class);
        }

        @Test
        void shouldReportOffsetOfUnexpectedCharacter() {
            assertThatThrownBy(() -> TermParser.parse("P # Q"))
                    .isInstanceOf(EngineSyntaxException.class)
                    .hasMessageContaining("offset 2");
        }
    }

    @Nested
    class Nesting {

        @Test
        void shouldAcceptModeratelyNestedParentheses() throws Exception {
            String text = "(".repeat(100) + "P" + ")".repeat(100);

            assertThat(TermParser.parse(text)).isEqualTo(P);
        }

        @Test
        void shouldRejectDeeplyNestedParentheses() {
            String text = "(".repeat(100_000) + "P" + ")".repeat(100_000);

            assertThatThrownBy(() -> TermParser.parse(text))
                    .isInstanceOf(EngineSyntaxException.class)
                    .hasMessageStartingWith("expression nested too deeply");
        }

        @Test
        void shouldRejectLongArrowChain() {
            String text = "P -> ".repeat(100_000) + "P";

            assertThatThrownBy(() -> TermParser.parse(text))
                    .isInstanceOf(EngineSyntaxException.class)
                    .hasMessageStartingWith("expression nested too deeply");
        }

        @Test
        void shouldRejectLongConjunctionChain() {
            String text = "P ∧ ".repeat(100_000) + "P";

            assertThatThrownBy(() -> TermParser.parse(text))
                    .isInstanceOf(EngineSyntaxException.class)
                    .hasMessageStartingWith("expression nested too deeply");
        }

        @Test
        void shouldRejectLongApplicationSpine() {
            String text = "f" + " x".repeat(100_000);

            assertThatThrownBy(() -> TermParser.parse(text))
                    .isInstanceOf(EngineSyntaxException.class)
                    .hasMessageStartingWith("expression nested too deeply");
        }

        @Test
        void shouldResetDepthBetweenSiblings() throws Exception {
            // two chains that are each within the limit
            String half = "(".repeat(200) + "P" + ")".repeat(200);

            assertThat(TermParser.parse(half + " ∧ " + half)).isEqualTo(new Term.And(P, P));
        }
    }
}

package io.lemma.kernel.term;

import static org.assertj.core.api.Assertions.assertThat;

import io.lemma.kernel.syntax.TermParser;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class UnifierTest {

    private static Optional<Map<String, String>> unify(String lhs, String rhs)
            throws Exception {
        return Unifier.unify(TermParser.parse(lhs), TermParser.parse(rhs));
    }

    @Test
    void shouldAssignMetavariablesOnBothSides() throws Exception {
        Optional<Map<String, String>> result = unify("?a → Nat", "Bool → ?b");

        assertThat(result).contains(Map.of("a", "Bool", "b", "Nat"));
    }

    @Test
    void shouldFailForDistinctConstants() throws Exception {
        assertThat(unify("x", "y")).isEmpty();
    }

    @Test
    void shouldSucceedWithEmptyAssignmentForEqualClosedTerms() throws Exception {
        assertThat(unify("Nat.succ 0", "Nat.succ 0")).contains(Map.of());
    }

    @Test
    void shouldReportUnassignedMetavariablesAsNull() throws Exception {
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("a", null);

        assertThat(unify("?a", "?a")).contains(expected);
    }

    @Test
    void shouldInstantiateChainedAssignments() throws Exception {
        Optional<Map<String, String>> result = unify("?a ∧ ?b", "?b ∧ (P → Q)");

        assertThat(result).contains(Map.of("a", "P → Q", "b", "P → Q"));
    }

    @Test
    void shouldRejectCyclicAssignment() throws Exception {
        assertThat(unify("?a", "?a → Nat")).isEmpty();
    }

    @Test
    void shouldKeepFirstOccurrenceOrder() throws Exception {
        Map<String, String> result = unify("?z → ?y", "Nat → ?x").orElseThrow();

        assertThat(result.keySet()).containsExactly("z", "y", "x");
    }
}

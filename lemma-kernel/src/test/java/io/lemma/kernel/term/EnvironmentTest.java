package io.lemma.kernel.term;

import static org.assertj.core.api.Assertions.assertThat;

import io.lemma.core.engine.NameCandidate;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnvironmentTest {

    private final Environment environment = Environment.standard();

    @Test
    void shouldDeclareStandardTypes() {
        assertThat(environment.typeOf("Nat.succ")).map(Term::pretty).contains("Nat → Nat");
        assertThat(environment.typeOf("True.intro")).map(Term::pretty).contains("True");
        assertThat(environment.typeOf("Nat.pred")).isEmpty();
    }

    @Test
    void shouldListDeclaredPrefixesLongestFirst() {
        List<NameCandidate> candidates = environment.resolve("Nat.succ.foo", List.of());

        assertThat(candidates)
                .containsExactly(
                        new NameCandidate("Nat.succ", List.of("foo")),
                        new NameCandidate("Nat", List.of("succ", "foo")));
    }

    @Test
    void shouldSearchOpenNamespaces() {
        List<NameCandidate> candidates = environment.resolve("succ", List.of("Nat", "Bool"));

        assertThat(candidates)
                .containsExactly(
                        new NameCandidate("Nat.succ", List.of()),
                        new NameCandidate("Nat", List.of("succ")),
                        new NameCandidate("Bool", List.of("succ")));
    }

    @Test
    void shouldReturnNothingForUnknownNames() {
        assertThat(environment.resolve("frobnicate", List.of())).isEmpty();
    }
}

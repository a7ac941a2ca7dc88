package io.lemma.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lemma.core.engine.GoalSpec;
import io.lemma.core.exception.ErrorKind;
import io.lemma.core.exception.ProofSessionException;
import io.lemma.protocol.json.ProtocolSerializer;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ParamsTest {

    private final ObjectMapper mapper = ProtocolSerializer.createMapper();

    private Params params(String json) throws Exception {
        return new Params((ObjectNode) mapper.readTree(json), mapper);
    }

    private static void assertInvalidParams(Throwable t, String fragment) {
        assertThat(t).isInstanceOf(ProofSessionException.class).hasMessageContaining(fragment);
        assertThat(((ProofSessionException) t).getKind()).isEqualTo(ErrorKind.INVALID_PARAMS);
    }

    @Nested
    class Integers {

        @Test
        void shouldReadInteger() throws Exception {
            assertThat(params("{\"sid\":12}").requireInt("sid")).isEqualTo(12);
        }

        @Test
        void shouldRejectMissingMember() throws Exception {
            Params params = params("{}");

            assertThatThrownBy(() -> params.requireInt("sid"))
                    .satisfies(e -> assertInvalidParams(e, "missing 'sid'"));
        }

        @Test
        void shouldRejectNonIntegralValues() throws Exception {
            Params params = params("{\"sid\":\"0\",\"x\":1.5,\"big\":99999999999}");

            assertThatThrownBy(() -> params.requireInt("sid"))
                    .satisfies(e -> assertInvalidParams(e, "'sid' must be an integer"));
            assertThatThrownBy(() -> params.requireInt("x"))
                    .satisfies(e -> assertInvalidParams(e, "'x' must be an integer"));
            assertThatThrownBy(() -> params.requireInt("big"))
                    .satisfies(e -> assertInvalidParams(e, "'big' must be an integer"));
        }
    }

    @Nested
    class OptionalLongs {

        @Test
        void shouldFallBackToDefault() throws Exception {
            assertThat(params("{}").optionalLong("budget", 200)).isEqualTo(200);
            assertThat(params("{\"budget\":null}").optionalLong("budget", 200)).isEqualTo(200);
        }

        @Test
        void shouldAcceptZeroAsUnlimited() throws Exception {
            assertThat(params("{\"budget\":0}").optionalLong("budget", 200)).isZero();
        }

        @Test
        void shouldRejectNegativeValues() throws Exception {
            Params params = params("{\"budget\":-1}");

            assertThatThrownBy(() -> params.optionalLong("budget", 200))
                    .satisfies(e -> assertInvalidParams(e, "non-negative"));
        }
    }

    @Nested
    class Lists {

        @Test
        void shouldBindGoalSpecs() throws Exception {
            Params params =
                    params("{\"goals\":[{\"name\":\"h\",\"type\":\"Nat\"},"
                            + "{\"name\":\"\",\"type\":\"P -> P\"}]}");

            assertThat(params.requireList("goals", GoalSpec.class))
                    .containsExactly(new GoalSpec("h", "Nat"), new GoalSpec("", "P -> P"));
        }

        @Test
        void shouldRejectMalformedElement() throws Exception {
            Params params = params("{\"goals\":[{\"name\":\"h\"}]}");

            assertThatThrownBy(() -> params.requireList("goals", GoalSpec.class))
                    .satisfies(e -> assertInvalidParams(e, "'goals[0]'"));
        }

        @Test
        void shouldRejectNonArray() throws Exception {
            Params params = params("{\"goals\":{}}");

            assertThatThrownBy(() -> params.requireList("goals", GoalSpec.class))
                    .satisfies(e -> assertInvalidParams(e, "must be an array"));
        }
    }
}

package io.lemma.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lemma.core.engine.GoalView;
import io.lemma.core.engine.Hypothesis;
import io.lemma.core.engine.NameCandidate;
import io.lemma.core.engine.SourcePosition;
import io.lemma.core.exception.ErrorKind;
import io.lemma.core.exception.ProofSessionException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class JsonLineCodecTest {

    private final JsonLineCodec codec = new JsonLineCodec();

    private static ErrorKind kindOf(Throwable t) {
        return ((ProofSessionException) t).getKind();
    }

    @Nested
    class Decode {

        @Test
        void shouldDecodeRequest() {
            Request request =
                    codec.decode("{\"id\":7,\"method\":\"queryState\",\"params\":{\"sid\":0}}");

            assertThat(request.id().intValue()).isEqualTo(7);
            assertThat(request.method()).isEqualTo("queryState");
            assertThat(request.params().get("sid").intValue()).isZero();
        }

        @Test
        void shouldReadMissingParamsAsEmptyObject() {
            Request request = codec.decode("{\"id\":\"a\",\"method\":\"position\"}");

            assertThat(request.params().isEmpty()).isTrue();
            assertThat(request.id().asText()).isEqualTo("a");
        }

        @Test
        void shouldIgnoreJsonRpcVersionMember() {
            Request request = codec.decode("{\"jsonrpc\":\"2.0\",\"method\":\"position\"}");

            assertThat(request.method()).isEqualTo("position");
            assertThat(request.id()).isNull();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "{not json", "{\"method\":\"x\"} trailing"})
        void shouldRejectUnparsableLines(String line) {
            assertThatThrownBy(() -> codec.decode(line))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.TRANSPORT_PARSE));
        }

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "[1,2]",
                    "42",
                    "{\"id\":1}",
                    "{\"id\":1,\"method\":5}",
                    "{\"id\":1,\"method\":\"commit\",\"params\":[0]}"
                })
        void shouldRejectNonRequests(String line) {
            assertThatThrownBy(() -> codec.decode(line))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_REQUEST));
        }
    }

    @Nested
    class Encode {

        @Test
        void shouldKeepNullResult() {
            String line = codec.encode(Response.success(codec.getMapper().valueToTree(3), null));

            assertThat(line).isEqualTo("{\"id\":3,\"result\":null}");
        }

        @Test
        void shouldEncodeStepExecutionErrorWithData() {
            Response response =
                    Response.failure(
                            codec.getMapper().valueToTree("r1"),
                            ProofSessionException.stepExecution(List.of("a", "b")));

            assertThat(codec.encode(response))
                    .isEqualTo(
                            "{\"id\":\"r1\",\"error\":{\"code\":1,\"message\":\"a\\nb\","
                                    + "\"data\":[\"a\",\"b\"]}}");
        }

        @Test
        void shouldOmitIdForUncorrelatedErrors() {
            Response response =
                    Response.failure(
                            codec.getMapper().valueToTree(9),
                            ProofSessionException.invalidRequest("bad"));

            assertThat(codec.encode(response))
                    .isEqualTo("{\"error\":{\"code\":-32600,\"message\":\"bad\"}}");
        }

        @Test
        void shouldEncodeMapResult() {
            String line =
                    codec.encode(
                            Response.success(
                                    codec.getMapper().valueToTree(1), Map.of("a", "Nat")));

            assertThat(line).isEqualTo("{\"id\":1,\"result\":{\"a\":\"Nat\"}}");
        }
    }

    @Nested
    class RoundTrip {

        static Stream<Arguments> responses() {
            Map<String, String> assignment = new LinkedHashMap<>();
            assignment.put("a", "Nat");
            assignment.put("b", null);
            List<GoalView> goals =
                    List.of(
                            new GoalView("g", List.of(new Hypothesis("h", "P")), "P ∧ Q"),
                            new GoalView("", List.of(), "Nat → \"quoted\""));
            return Stream.of(
                    Arguments.of("r-1", goals),
                    Arguments.of(42, assignment),
                    Arguments.of(9_000_000_000L, new SourcePosition("Basic.lean", 7, 0)),
                    Arguments.of(Map.of("client", "ide"), new SourcePosition(null, 1, 4)),
                    Arguments.of(
                            "names",
                            List.of(
                                    new NameCandidate("Nat.succ", List.of()),
                                    new NameCandidate("Nat", List.of("succ")))),
                    Arguments.of(1.5, 3));
        }

        @ParameterizedTest
        @MethodSource("responses")
        void shouldPreserveIdAndResult(Object id, Object result) throws Exception {
            // Given
            ObjectMapper mapper = codec.getMapper();
            JsonNode idNode = mapper.valueToTree(id);

            // When
            String line = codec.encode(Response.success(idNode, result));
            JsonNode decoded = mapper.readTree(line);

            // Then
            assertThat(line).doesNotContain("\n");
            assertThat(decoded.get("id")).isEqualTo(idNode);
            assertThat(decoded.get("result")).isEqualTo(mapper.valueToTree(result));
            assertThat(decoded.has("error")).isFalse();
        }
    }
}

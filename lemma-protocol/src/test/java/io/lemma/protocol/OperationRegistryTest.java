package io.lemma.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lemma.core.engine.GoalSpec;
import io.lemma.core.session.ProofSession;
import io.lemma.protocol.json.ProtocolSerializer;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OperationRegistryTest {

    private final ObjectMapper mapper = ProtocolSerializer.createMapper();
    private final OperationRegistry registry = OperationRegistry.standard(1234);

    @Mock private ProofSession session;

    private Object invoke(String method, String params) throws Exception {
        return registry.lookup(method)
                .orElseThrow()
                .handle(session, new Params((ObjectNode) mapper.readTree(params), mapper));
    }

    @Test
    void shouldRegisterEverySessionOperation() {
        assertThat(registry.methods())
                .containsExactly(
                        "applyStep",
                        "queryState",
                        "queryMessages",
                        "resolveName",
                        "unify",
                        "newState",
                        "giveUp",
                        "commit",
                        "position");
        assertThat(registry.lookup("frobnicate")).isEmpty();
    }

    @Test
    void shouldUseDefaultBudgetWhenAbsent() throws Exception {
        when(session.applyStep(1, "skip", 1234)).thenReturn(2);

        assertThat(invoke("applyStep", "{\"sid\":1,\"step\":\"skip\"}")).isEqualTo(2);
    }

    @Test
    void shouldPassExplicitBudget() throws Exception {
        when(session.applyStep(0, "skip", 0)).thenReturn(1);

        assertThat(invoke("applyStep", "{\"sid\":0,\"step\":\"skip\",\"budget\":0}"))
                .isEqualTo(1);
    }

    @Test
    void shouldMapMissingUnifierToNull() throws Exception {
        when(session.unify(0, "x", "y")).thenReturn(Optional.empty());

        assertThat(invoke("unify", "{\"sid\":0,\"lhs\":\"x\",\"rhs\":\"y\"}")).isNull();
    }

    @Test
    void shouldBindNewStateGoals() throws Exception {
        List<GoalSpec> goals = List.of(new GoalSpec("h", "Nat"));
        when(session.newState(goals)).thenReturn(1);

        assertThat(invoke("newState", "{\"goals\":[{\"name\":\"h\",\"type\":\"Nat\"}]}"))
                .isEqualTo(1);
    }

    @Test
    void shouldReturnNullFromCommit() throws Exception {
        assertThat(invoke("commit", "{\"sid\":2}")).isNull();

        verify(session).commit(2);
    }

    @Test
    void shouldMapMissingPositionToNull() throws Exception {
        when(session.position()).thenReturn(Optional.empty());

        assertThat(invoke("position", "{}")).isNull();
    }
}

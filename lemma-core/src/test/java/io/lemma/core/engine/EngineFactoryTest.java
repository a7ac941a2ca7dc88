package io.lemma.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.lemma.core.LemmaConfig;
import io.lemma.core.engine.spi.EngineProvider;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EngineFactory")
class EngineFactoryTest {

    private static EngineProvider provider(String name, int priority) {
        EngineProvider provider = mock(EngineProvider.class);
        when(provider.getName()).thenReturn(name);
        when(provider.getPriority()).thenReturn(priority);
        return provider;
    }

    @Nested
    @DisplayName("createEngine")
    class CreateEngine {

        @Test
        @DisplayName("selects the highest priority provider when no name is configured")
        void shouldSelectByPriority() {
            // Given
            EngineProvider low = provider("low", 0);
            EngineProvider high = provider("high", 10);
            ProofEngine engine = mock(ProofEngine.class);
            LemmaConfig config = new LemmaConfig();
            when(high.createEngine(config)).thenReturn(engine);

            // When
            ProofEngine created = new EngineFactory(List.of(low, high)).createEngine(config);

            // Then
            assertThat(created).isSameAs(engine);
            verify(low, never()).createEngine(config);
        }

        @Test
        @DisplayName("selects the configured provider regardless of priority")
        void shouldSelectByName() {
            EngineProvider low = provider("low", 0);
            EngineProvider high = provider("high", 10);
            ProofEngine engine = mock(ProofEngine.class);
            LemmaConfig config = LemmaConfig.builder().engineName("low").build();
            when(low.createEngine(config)).thenReturn(engine);

            assertThat(new EngineFactory(List.of(low, high)).createEngine(config))
                    .isSameAs(engine);
        }

        @Test
        @DisplayName("fails with the available names when the configured provider is missing")
        void shouldFailForUnknownName() {
            EngineFactory factory = new EngineFactory(List.of(provider("kernel", 0)));
            LemmaConfig config = LemmaConfig.builder().engineName("other").build();

            assertThatThrownBy(() -> factory.createEngine(config))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("other")
                    .hasMessageContaining("kernel");
        }

        @Test
        @DisplayName("fails when no providers are available")
        void shouldFailWithoutProviders() {
            assertThatThrownBy(() -> new EngineFactory(List.of()).createEngine(new LemmaConfig()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("No engine providers available");
        }
    }
}

package io.lemma.core.engine.spi;

import io.lemma.core.LemmaConfig;
import io.lemma.core.engine.ProofEngine;

/// Provider interface for pluggable proof engines.
///
/// Implementations are discovered by {@link io.lemma.core.engine.EngineFactory} through
/// `META-INF/services/io.lemma.core.engine.spi.EngineProvider`.
///
/// ### Priority System
/// When no engine name is configured, the provider with the highest
/// {@link #getPriority()} is selected.
///
/// @see io.lemma.core.engine.EngineFactory
public interface EngineProvider {

    /// Returns the provider name used for selection and logging.
    ///
    /// @return provider name (e.g., "kernel"), never null
    String getName();

    /// Creates a fresh engine whose current context is the ambient starting state.
    ///
    /// @param config session configuration, not null
    /// @return new engine instance, never null
    ProofEngine createEngine(LemmaConfig config);

    /// Returns this provider's priority; higher values are preferred.
    ///
    /// @return priority value (default: 0)
    default int getPriority() {
        return 0;
    }
}

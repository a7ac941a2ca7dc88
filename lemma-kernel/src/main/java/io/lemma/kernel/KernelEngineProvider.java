package io.lemma.kernel;

import io.lemma.core.LemmaConfig;
import io.lemma.core.engine.ProofEngine;
import io.lemma.core.engine.spi.EngineProvider;
import io.lemma.kernel.term.Environment;

/// Registers {@link KernelEngine} under the name `kernel`.
///
/// @implNote Thread-safe. Stateless; each call creates an independent engine.
public class KernelEngineProvider implements EngineProvider {

    public static final String NAME = "kernel";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ProofEngine createEngine(LemmaConfig config) {
        return new KernelEngine(Environment.standard(), config);
    }
}

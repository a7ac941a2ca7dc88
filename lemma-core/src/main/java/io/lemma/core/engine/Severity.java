package io.lemma.core.engine;

/// Severity of a {@link Diagnostic} logged by the engine.
public enum Severity {
    INFORMATION,
    WARNING,
    ERROR
}

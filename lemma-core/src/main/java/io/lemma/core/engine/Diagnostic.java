package io.lemma.core.engine;

import java.util.Objects;

/// A message accumulated in the engine's log.
///
/// @param severity message severity, not null
/// @param message rendered message text, not null
/// @param position where the message was reported, may be null
public record Diagnostic(Severity severity, String message, SourcePosition position) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic error(String message, SourcePosition position) {
        return new Diagnostic(Severity.ERROR, message, position);
    }

    public static Diagnostic warning(String message, SourcePosition position) {
        return new Diagnostic(Severity.WARNING, message, position);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}

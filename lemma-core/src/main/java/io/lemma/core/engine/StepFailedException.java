package io.lemma.core.engine;

import java.io.Serial;
import java.util.List;

/// Thrown when a parsed step fails during execution, including budget exhaustion.
///
/// The engine context may be left partially modified; callers restore the
/// pre-step snapshot before continuing.
public class StepFailedException extends EngineException {

    @Serial private static final long serialVersionUID = 7412395009211632786L;

    private final List<String> messages;

    /// Creates exception with a single message.
    ///
    /// @param message failure description, not null
    public StepFailedException(String message) {
        this(List.of(message));
    }

    /// Creates exception carrying every message the failed step produced.
    ///
    /// @param messages failure messages, not null, not empty
    public StepFailedException(List<String> messages) {
        super(String.join("\n", messages));
        this.messages = List.copyOf(messages);
    }

    /// Returns the failure messages in the order they were produced.
    ///
    /// @return immutable message list, never null
    public List<String> getMessages() {
        return messages;
    }
}

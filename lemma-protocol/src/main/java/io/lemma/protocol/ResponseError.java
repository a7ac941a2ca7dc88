package io.lemma.protocol;

import io.lemma.core.exception.ProofSessionException;
import java.util.List;
import java.util.Objects;

/// Wire form of a failed request.
///
/// @param code stable error code, see {@link io.lemma.core.exception.ErrorKind}
/// @param message human-readable message, not null
/// @param data additional data (the message list of a failed step), may be null
public record ResponseError(int code, String message, Object data) {

    public ResponseError {
        Objects.requireNonNull(message, "message must not be null");
    }

    /// Converts a session failure to its wire form.
    ///
    /// @param e failure, not null
    /// @return wire error, never null
    public static ResponseError from(ProofSessionException e) {
        List<String> messages = e.getMessages();
        String message = e.getMessage() != null ? e.getMessage() : e.getKind().getTitle();
        return new ResponseError(
                e.getKind().getCode(), message, messages.isEmpty() ? null : messages);
    }
}

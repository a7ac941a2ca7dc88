package io.lemma.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import io.lemma.core.exception.ProofSessionException;

/// A response line: exactly one of `result` or `error`.
///
/// A successful response always carries a `result` member on the wire, even when the
/// result value is `null`.
///
/// @param id echoed request id, null when the request could not be decoded
/// @param result operation result, may be null
/// @param error failure, null for successful responses
public record Response(JsonNode id, Object result, ResponseError error) {

    public Response {
        if (error != null && result != null) {
            throw new IllegalArgumentException("response cannot carry both result and error");
        }
    }

    public static Response success(JsonNode id, Object result) {
        return new Response(id, result, null);
    }

    /// Creates an error response; uncorrelated kinds never echo the id.
    ///
    /// @param id request id, may be null
    /// @param failure failure to report, not null
    /// @return error response, never null
    public static Response failure(JsonNode id, ProofSessionException failure) {
        JsonNode echoed = failure.getKind().isCorrelated() ? id : null;
        return new Response(echoed, null, ResponseError.from(failure));
    }

    public boolean isSuccess() {
        return error == null;
    }
}

package io.lemma.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/// A decoded request line.
///
/// @param id correlation id echoed in the response, may be null
/// @param method operation name, not null
/// @param params method parameters, empty when the request carried none, not null
public record Request(JsonNode id, String method, ObjectNode params) {

    public Request {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(params, "params must not be null");
    }
}

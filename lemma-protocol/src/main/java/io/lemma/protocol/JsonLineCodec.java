package io.lemma.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lemma.core.exception.ProofSessionException;
import io.lemma.protocol.json.ProtocolSerializer;
import java.util.Objects;

/// Line codec for the request/response protocol.
///
/// Every input line holds one JSON request object; every response is written as one
/// compact JSON object. A `jsonrpc` member is tolerated and ignored.
///
/// ### Request shape
/// - **id**: any JSON value, echoed back in the response (optional)
/// - **method**: string, required
/// - **params**: object, optional (read as `{}` when absent or null)
///
/// @see ProtocolDispatcher for routing
public class JsonLineCodec {

    private final ObjectMapper mapper;

    public JsonLineCodec() {
        this(ProtocolSerializer.createMapper());
    }

    public JsonLineCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Decodes one request line.
    ///
    /// @param line raw input line without terminator, not null
    /// @return decoded request, never null
    /// @throws ProofSessionException `TRANSPORT_PARSE` when the line is not JSON,
    ///     `INVALID_REQUEST` when it is JSON but not a request
    public Request decode(String line) {
        if (line.isBlank()) {
            throw ProofSessionException.transportParse("Parse error: empty line");
        }

        JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw ProofSessionException.transportParse(
                    "Parse error: " + e.getOriginalMessage());
        }

        if (root == null || !root.isObject()) {
            throw ProofSessionException.invalidRequest("Invalid request: not a JSON object");
        }

        JsonNode method = root.get("method");
        if (method == null || !method.isTextual()) {
            throw ProofSessionException.invalidRequest(
                    "Invalid request: 'method' must be a string");
        }

        JsonNode params = root.get("params");
        ObjectNode boundParams;
        if (params == null || params.isNull()) {
            boundParams = mapper.createObjectNode();
        } else if (params.isObject()) {
            boundParams = (ObjectNode) params;
        } else {
            throw ProofSessionException.invalidRequest(
                    "Invalid request: 'params' must be an object");
        }

        return new Request(root.get("id"), method.asText(), boundParams);
    }

    /// Encodes a response as a single line without terminator.
    ///
    /// @param response response to encode, not null
    /// @return compact JSON text, never null
    /// @throws IllegalStateException if the result cannot be serialized
    public String encode(Response response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode response", e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}

package io.lemma.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lemma.core.exception.ProofSessionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Typed view over the `params` object of a request.
///
/// Every accessor fails with `INVALID_PARAMS` when the member is missing or has the
/// wrong JSON type, naming the offending member.
public final class Params {

    private final ObjectNode node;
    private final ObjectMapper mapper;

    public Params(ObjectNode node, ObjectMapper mapper) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Returns a required integer member.
    ///
    /// @param name member name, not null
    /// @return integer value
    /// @throws ProofSessionException `INVALID_PARAMS` if missing, not integral or out of
    ///     the int range
    public int requireInt(String name) {
        JsonNode value = require(name);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw ProofSessionException.invalidParams(
                    "Invalid params: '" + name + "' must be an integer");
        }
        return value.intValue();
    }

    /// Returns a required string member.
    ///
    /// @param name member name, not null
    /// @return string value, never null
    /// @throws ProofSessionException `INVALID_PARAMS` if missing or not a string
    public String requireString(String name) {
        JsonNode value = require(name);
        if (!value.isTextual()) {
            throw ProofSessionException.invalidParams(
                    "Invalid params: '" + name + "' must be a string");
        }
        return value.asText();
    }

    /// Returns an optional non-negative integer member.
    ///
    /// @param name member name, not null
    /// @param defaultValue value used when the member is absent or null
    /// @return value of the member, or `defaultValue`
    /// @throws ProofSessionException `INVALID_PARAMS` if present but not a non-negative
    ///     integer
    public long optionalLong(String name, long defaultValue) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong() || value.longValue() < 0) {
            throw ProofSessionException.invalidParams(
                    "Invalid params: '" + name + "' must be a non-negative integer");
        }
        return value.longValue();
    }

    /// Returns a required array member bound element-wise to `type`.
    ///
    /// @param name member name, not null
    /// @param type element type, not null
    /// @param <T> element type
    /// @return bound elements in order, never null
    /// @throws ProofSessionException `INVALID_PARAMS` if missing, not an array, or an
    ///     element cannot be bound
    public <T> List<T> requireList(String name, Class<T> type) {
        JsonNode value = require(name);
        if (!value.isArray()) {
            throw ProofSessionException.invalidParams(
                    "Invalid params: '" + name + "' must be an array");
        }
        List<T> result = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            try {
                result.add(mapper.treeToValue(value.get(i), type));
            } catch (JsonProcessingException e) {
                throw ProofSessionException.invalidParams(
                        "Invalid params: '"
                                + name
                                + "["
                                + i
                                + "]': "
                                + e.getOriginalMessage());
            }
        }
        return result;
    }

    private JsonNode require(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            throw ProofSessionException.invalidParams(
                    "Invalid params: missing '" + name + "'");
        }
        return value;
    }
}

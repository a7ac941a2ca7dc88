package io.lemma.protocol.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.lemma.core.engine.GoalSpec;
import java.io.IOException;
import java.io.Serial;

/// Deserializes `{"name":"..","type":".."}` into a {@link GoalSpec}.
///
/// Both members are required strings; anything else is reported as an input mismatch.
///
/// @implNote Package-private. Registered by {@link LemmaJacksonModule}.
class GoalSpecDeserializer extends StdDeserializer<GoalSpec> {

    @Serial private static final long serialVersionUID = 1470328855190643262L;

    GoalSpecDeserializer() {
        super(GoalSpec.class);
    }

    @Override
    public GoalSpec deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node == null || !node.isObject()) {
            return (GoalSpec) context.handleUnexpectedToken(GoalSpec.class, parser);
        }
        return new GoalSpec(
                requireText(node, "name", parser, context),
                requireText(node, "type", parser, context));
    }

    private static String requireText(
            JsonNode node, String field, JsonParser parser, DeserializationContext context)
            throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            context.reportInputMismatch(
                    GoalSpec.class, "goal field '%s' must be a string", field);
        }
        return value.asText();
    }
}

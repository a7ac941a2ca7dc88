package io.lemma.protocol.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.lemma.core.engine.GoalView;
import io.lemma.core.engine.Hypothesis;
import java.io.IOException;
import java.io.Serial;

/// Serializes a goal as
/// `{"name":"..","hypotheses":[{"name":"..","type":".."}],"target":"..","pretty":".."}`.
///
/// @implNote Package-private. Registered by {@link LemmaJacksonModule}.
class GoalViewSerializer extends StdSerializer<GoalView> {

    @Serial private static final long serialVersionUID = -2519843311276039541L;

    GoalViewSerializer() {
        super(GoalView.class);
    }

    @Override
    public void serialize(GoalView goal, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", goal.name());
        gen.writeArrayFieldStart("hypotheses");
        for (Hypothesis hypothesis : goal.hypotheses()) {
            gen.writeStartObject();
            gen.writeStringField("name", hypothesis.name());
            gen.writeStringField("type", hypothesis.type());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeStringField("target", goal.target());
        gen.writeStringField("pretty", goal.pretty());
        gen.writeEndObject();
    }
}

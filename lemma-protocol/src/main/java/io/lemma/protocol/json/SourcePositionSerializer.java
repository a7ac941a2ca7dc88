package io.lemma.protocol.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.lemma.core.engine.SourcePosition;
import java.io.IOException;
import java.io.Serial;

/// Serializes a position as `{"file":"..","line":1,"column":0}`, omitting a null file.
///
/// @implNote Package-private. Registered by {@link LemmaJacksonModule}.
class SourcePositionSerializer extends StdSerializer<SourcePosition> {

    @Serial private static final long serialVersionUID = -603321987465510027L;

    SourcePositionSerializer() {
        super(SourcePosition.class);
    }

    @Override
    public void serialize(SourcePosition position, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (position.file() != null) {
            gen.writeStringField("file", position.file());
        }
        gen.writeNumberField("line", position.line());
        gen.writeNumberField("column", position.column());
        gen.writeEndObject();
    }
}

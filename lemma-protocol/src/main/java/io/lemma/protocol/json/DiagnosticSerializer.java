package io.lemma.protocol.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.lemma.core.engine.Diagnostic;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Serializes a diagnostic as `{"severity":"error","message":"..","position":{..}}`.
///
/// Severity is lower case; `position` is omitted when absent.
///
/// @implNote Package-private. Registered by {@link LemmaJacksonModule}.
class DiagnosticSerializer extends StdSerializer<Diagnostic> {

    @Serial private static final long serialVersionUID = 8120654932715543218L;

    DiagnosticSerializer() {
        super(Diagnostic.class);
    }

    @Override
    public void serialize(Diagnostic diagnostic, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("severity", diagnostic.severity().name().toLowerCase(Locale.ROOT));
        gen.writeStringField("message", diagnostic.message());
        if (diagnostic.position() != null) {
            provider.defaultSerializeField("position", diagnostic.position(), gen);
        }
        gen.writeEndObject();
    }
}

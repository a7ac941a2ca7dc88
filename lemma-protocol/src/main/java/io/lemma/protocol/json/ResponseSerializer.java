package io.lemma.protocol.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.lemma.protocol.Response;
import io.lemma.protocol.ResponseError;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link Response} in wire shape.
///
/// - **success**: `{"id":...,"result":...}`; `result` is written even when null
/// - **failure**: `{"id":...,"error":{"code":..,"message":"..","data":...}}`; `data` is
///   omitted when null
///
/// `id` is omitted when null.
///
/// @implNote Package-private. Registered by {@link LemmaJacksonModule}.
class ResponseSerializer extends StdSerializer<Response> {

    @Serial private static final long serialVersionUID = 5924017712804619934L;

    ResponseSerializer() {
        super(Response.class);
    }

    @Override
    public void serialize(Response response, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (response.id() != null && !response.id().isNull()) {
            provider.defaultSerializeField("id", response.id(), gen);
        }
        ResponseError error = response.error();
        if (error == null) {
            gen.writeFieldName("result");
            provider.defaultSerializeValue(response.result(), gen);
        } else {
            gen.writeObjectFieldStart("error");
            gen.writeNumberField("code", error.code());
            gen.writeStringField("message", error.message());
            if (error.data() != null) {
                provider.defaultSerializeField("data", error.data(), gen);
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}

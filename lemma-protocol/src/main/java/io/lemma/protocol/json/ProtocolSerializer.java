package io.lemma.protocol.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/// Factory for the `ObjectMapper` used on the wire.
///
/// @implNote The mapper is thread-safe once configured; create one per session.
public final class ProtocolSerializer {

    private ProtocolSerializer() {}

    /// Creates an ObjectMapper configured for the line protocol.
    ///
    /// Registers:
    /// - `LemmaJacksonModule` for protocol and engine value types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled so extra request members are ignored
    /// - `FAIL_ON_TRAILING_TOKENS` enabled so a line holds exactly one JSON value
    /// - compact output (no indentation), one response per line
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new LemmaJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }
}

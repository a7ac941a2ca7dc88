package io.lemma.protocol.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.lemma.core.engine.Diagnostic;
import io.lemma.core.engine.GoalSpec;
import io.lemma.core.engine.GoalView;
import io.lemma.core.engine.SourcePosition;
import io.lemma.protocol.Response;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the wire format of every protocol type in one
/// place.
///
/// - `Response` - `ResponseSerializer` (keeps a null `result` on the wire)
/// - `GoalView` - `GoalViewSerializer` (adds the rendered `pretty` field)
/// - `Diagnostic` - `DiagnosticSerializer` (lower-case severity)
/// - `SourcePosition` - `SourcePositionSerializer` (omits a null file)
/// - `GoalSpec` - `GoalSpecDeserializer` (strict `newState` goal objects)
///
/// `Hypothesis` and `NameCandidate` use Jackson's default record binding.
///
/// @see ProtocolSerializer for the configured mapper
public class LemmaJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = -3142086635207711903L;

    public LemmaJacksonModule() {
        super("LemmaJacksonModule");

        addSerializer(Response.class, new ResponseSerializer());
        addSerializer(GoalView.class, new GoalViewSerializer());
        addSerializer(Diagnostic.class, new DiagnosticSerializer());
        addSerializer(SourcePosition.class, new SourcePositionSerializer());
        addDeserializer(GoalSpec.class, new GoalSpecDeserializer());
    }
}

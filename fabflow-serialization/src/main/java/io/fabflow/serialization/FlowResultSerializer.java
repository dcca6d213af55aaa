package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.fabflow.core.flow.Diagnostic;
import io.fabflow.core.flow.FlowResult;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link FlowResult} as `{"process_flow":[...],"diagnostics":[...]}`.
///
/// `diagnostics` is always present, empty when every change was planned.
///
/// @implNote Package-private. Registered by {@link FabflowJacksonModule}.
class FlowResultSerializer extends StdSerializer<FlowResult> {

    @Serial private static final long serialVersionUID = 1290864471658203562L;

    FlowResultSerializer() {
        super(FlowResult.class);
    }

    @Override
    public void serialize(FlowResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        provider.defaultSerializeField("process_flow", result.flow(), gen);
        gen.writeArrayFieldStart("diagnostics");
        for (Diagnostic diagnostic : result.diagnostics()) {
            provider.defaultSerializeValue(diagnostic, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}

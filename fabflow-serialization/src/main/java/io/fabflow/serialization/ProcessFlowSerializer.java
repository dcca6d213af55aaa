package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.fabflow.core.flow.ProcessFlow;
import io.fabflow.core.flow.ProcessStep;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link ProcessFlow} as a JSON array of steps in manufacturing order.
///
/// @implNote Package-private. Registered by {@link FabflowJacksonModule}.
/// @see ProcessStepSerializer
class ProcessFlowSerializer extends StdSerializer<ProcessFlow> {

    @Serial private static final long serialVersionUID = 5517262903385149120L;

    ProcessFlowSerializer() {
        super(ProcessFlow.class);
    }

    @Override
    public void serialize(ProcessFlow flow, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        for (ProcessStep step : flow.steps()) {
            provider.defaultSerializeValue(step, gen);
        }
        gen.writeEndArray();
    }
}

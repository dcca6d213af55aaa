package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.fabflow.core.flow.ProcessStep;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link ProcessStep} to the process-flow output record.
///
/// Emitted JSON shape:
/// ```json
/// {"step_number":1,"process_type":"Deposition","tool_id":"CVD_01",
///  "recipe_parameters":{"time_s":15.2,"pressure_torr":1.8,"achieved_thickness_nm":200.0}}
/// ```
/// The originating order index is internal bookkeeping and is not written.
///
/// @implNote Package-private. Registered by {@link FabflowJacksonModule}.
class ProcessStepSerializer extends StdSerializer<ProcessStep> {

    @Serial private static final long serialVersionUID = -1934665010372811873L;

    static final String STEP_NUMBER = "step_number";
    static final String PROCESS_TYPE = "process_type";
    static final String TOOL_ID = "tool_id";
    static final String RECIPE_PARAMETERS = "recipe_parameters";

    ProcessStepSerializer() {
        super(ProcessStep.class);
    }

    @Override
    public void serialize(ProcessStep step, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField(STEP_NUMBER, step.stepNumber());
        gen.writeStringField(PROCESS_TYPE, step.processType());
        gen.writeStringField(TOOL_ID, step.toolId());
        provider.defaultSerializeField(RECIPE_PARAMETERS, step.recipeParameters(), gen);
        gen.writeEndObject();
    }
}

package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.fabflow.core.recipe.RecipeParameters;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes {@link RecipeParameters} as a flat JSON object in insertion order.
///
/// Numeric values are written as JSON numbers, symbolic values as strings:
/// `{"time_s":15.2,"pressure_torr":1.8,"achieved_thickness_nm":200.0}`.
///
/// @implNote Package-private. Registered by {@link FabflowJacksonModule}.
class RecipeParametersSerializer extends StdSerializer<RecipeParameters> {

    @Serial private static final long serialVersionUID = 7803395741184612609L;

    RecipeParametersSerializer() {
        super(RecipeParameters.class);
    }

    @Override
    public void serialize(RecipeParameters recipe, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> entry : recipe.values().entrySet()) {
            if (entry.getValue() instanceof Double number) {
                gen.writeNumberField(entry.getKey(), number);
            } else {
                gen.writeStringField(entry.getKey(), (String) entry.getValue());
            }
        }
        gen.writeEndObject();
    }
}

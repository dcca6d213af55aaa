package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.fabflow.core.change.ChangeDescriptor;
import java.io.IOException;
import java.io.Serial;
import java.util.TreeSet;

/// Serializes a {@link ChangeDescriptor} to its snake_case input shape.
///
/// Absent attributes are omitted rather than written as `null`: a missing polarity, a
/// `NaN` numeric and a null wafer size or step identifier produce no field, so the output
/// reads back to an equal descriptor. `affected_materials` is written sorted.
///
/// @implNote Package-private. Registered by {@link FabflowJacksonModule}.
/// @see ChangeDescriptorDeserializer for the inverse operation
class ChangeDescriptorSerializer extends StdSerializer<ChangeDescriptor> {

    @Serial private static final long serialVersionUID = -6120974138516437330L;

    ChangeDescriptorSerializer() {
        super(ChangeDescriptor.class);
    }

    @Override
    public void serialize(ChangeDescriptor change, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (change.polarity() != null) {
            gen.writeStringField(ChangeFields.POLARITY, change.polarity().name());
        }
        if (change.primaryMaterial() != null) {
            gen.writeStringField(ChangeFields.PRIMARY_MATERIAL, change.primaryMaterial());
        }
        gen.writeArrayFieldStart(ChangeFields.AFFECTED_MATERIALS);
        for (String material : new TreeSet<>(change.affectedMaterials())) {
            gen.writeString(material);
        }
        gen.writeEndArray();
        writeIfPresent(gen, ChangeFields.ASPECT_RATIO, change.aspectRatio());
        writeIfPresent(gen, ChangeFields.CONFORMALITY_SCORE, change.conformalityScore());
        writeIfPresent(gen, ChangeFields.TARGET_METRIC, change.targetMetric());
        if (change.waferSize() != null) {
            gen.writeNumberField(ChangeFields.WAFER_SIZE, change.waferSize().millimeters());
        }
        gen.writeNumberField(ChangeFields.ORDER_INDEX, change.orderIndex());
        if (change.isPatterning()) {
            gen.writeBooleanField(ChangeFields.PATTERNING, true);
        }
        if (change.stepIdentifier() != null) {
            gen.writeStringField(ChangeFields.STEP_ID, change.stepIdentifier());
        }

        gen.writeEndObject();
    }

    private static void writeIfPresent(JsonGenerator gen, String field, double value)
            throws IOException {
        if (!Double.isNaN(value)) {
            gen.writeNumberField(field, value);
        }
    }
}

package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.change.Polarity;
import io.fabflow.core.change.WaferSize;
import java.io.IOException;
import java.io.Serial;
import java.util.LinkedHashSet;
import java.util.Set;

/// Deserializes a {@link ChangeDescriptor} from the snake_case shape written by upstream
/// differencing.
///
/// Lenient about absence, strict about form:
/// - a missing numeric field reads as `NaN` and a missing `order_index` as `-1`, so that
///   {@link io.fabflow.core.change.ChangeDescriptorValidator} reports the descriptor instead
///   of the parser;
/// - a missing or blank `polarity` reads as null (classified as unknown downstream);
/// - an unrecognized polarity label, a non-numeric number field or a non-standard
///   `wafer_size` fail with an `IOException` naming the field.
///
/// @implNote Package-private. Registered by {@link FabflowJacksonModule}.
/// @see ChangeDescriptorSerializer for the inverse operation
class ChangeDescriptorDeserializer extends StdDeserializer<ChangeDescriptor> {

    @Serial private static final long serialVersionUID = 2871561094360528810L;

    ChangeDescriptorDeserializer() {
        super(ChangeDescriptor.class);
    }

    @Override
    public ChangeDescriptor deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        if (!root.isObject()) {
            throw new IOException(
                    "Change descriptor must be a JSON object, got " + root.getNodeType());
        }

        return ChangeDescriptor.builder()
                .polarity(readPolarity(root))
                .primaryMaterial(readText(root, ChangeFields.PRIMARY_MATERIAL))
                .affectedMaterials(readMaterials(root))
                .aspectRatio(readDouble(root, ChangeFields.ASPECT_RATIO))
                .conformalityScore(readDouble(root, ChangeFields.CONFORMALITY_SCORE))
                .targetMetric(readDouble(root, ChangeFields.TARGET_METRIC))
                .waferSize(readWaferSize(root))
                .orderIndex(readOrderIndex(root))
                .patterning(root.path(ChangeFields.PATTERNING).asBoolean(false))
                .stepIdentifier(readText(root, ChangeFields.STEP_ID))
                .build();
    }

    private static Polarity readPolarity(JsonNode root) throws IOException {
        String label = readText(root, ChangeFields.POLARITY);
        try {
            return Polarity.fromLabel(label);
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown polarity: " + label, e);
        }
    }

    private static Set<String> readMaterials(JsonNode root) throws IOException {
        JsonNode node = root.get(ChangeFields.AFFECTED_MATERIALS);
        if (isAbsent(node)) {
            return Set.of();
        }
        if (!node.isArray()) {
            throw new IOException(ChangeFields.AFFECTED_MATERIALS + " must be an array");
        }
        Set<String> materials = new LinkedHashSet<>();
        for (JsonNode material : node) {
            materials.add(material.asText());
        }
        return materials;
    }

    private static double readDouble(JsonNode root, String field) throws IOException {
        JsonNode node = root.get(field);
        if (isAbsent(node)) {
            return Double.NaN;
        }
        if (!node.isNumber()) {
            throw new IOException(field + " must be a number, got " + node);
        }
        return node.doubleValue();
    }

    private static WaferSize readWaferSize(JsonNode root) throws IOException {
        JsonNode node = root.get(ChangeFields.WAFER_SIZE);
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IOException(ChangeFields.WAFER_SIZE + " must be an integer, got " + node);
        }
        try {
            return WaferSize.ofMillimeters(node.intValue());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static int readOrderIndex(JsonNode root) throws IOException {
        JsonNode node = root.get(ChangeFields.ORDER_INDEX);
        if (isAbsent(node)) {
            return -1;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IOException(ChangeFields.ORDER_INDEX + " must be an integer, got " + node);
        }
        return node.intValue();
    }

    private static String readText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return isAbsent(node) ? null : node.asText();
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull();
    }
}

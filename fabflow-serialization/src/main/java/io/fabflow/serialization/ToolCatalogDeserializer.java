package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.fabflow.core.change.WaferSize;
import io.fabflow.core.classify.ProcessCategory;
import io.fabflow.core.optimize.SurrogateModel;
import io.fabflow.core.optimize.surrogate.DefaultSurrogateModelRegistry;
import io.fabflow.core.optimize.surrogate.KrigingSurrogateModel;
import io.fabflow.core.optimize.surrogate.SurrogateModelRegistry;
import io.fabflow.core.optimize.surrogate.TrainingSample;
import io.fabflow.core.tool.ToolRecord;
import io.fabflow.core.tool.ToolStatus;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/// Deserializes a {@link ToolCatalog}.
///
/// Expected JSON shape:
/// ```json
/// {
///   "surrogate_models": [
///     {"ref": "cvd01-oxide", "theta": [0.1, 2.0],
///      "samples": [{"x": [10.0, 1.0], "y": 150.0}, ...]}
///   ],
///   "tools": [
///     {"tool_id": "CVD_01", "status": "AVAILABLE", "wafer_size": 300,
///      "capable_categories": ["Deposition"], "incompatible_materials": ["copper"],
///      "surrogate_model_ref": "cvd01-oxide"}
///   ]
/// }
/// ```
///
/// Each model is fitted as a {@link KrigingSurrogateModel} before tools are read. A tool
/// without `surrogate_model_ref` carries no model; a reference to an undeclared model, an
/// unknown status or category, and a model that cannot be fitted all fail the whole catalog
/// with an `IOException`.
///
/// @implNote Package-private. Registered by {@link FabflowJacksonModule}.
class ToolCatalogDeserializer extends StdDeserializer<ToolCatalog> {

    @Serial private static final long serialVersionUID = -8240118517397370021L;

    ToolCatalogDeserializer() {
        super(ToolCatalog.class);
    }

    @Override
    public ToolCatalog deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        SurrogateModelRegistry registry = new DefaultSurrogateModelRegistry();
        for (JsonNode model : root.path("surrogate_models")) {
            String ref = requiredText(model, "ref", "surrogate model");
            registry.register(ref, fitModel(ref, model));
        }

        List<ToolRecord> tools = new ArrayList<>();
        for (JsonNode tool : root.path("tools")) {
            tools.add(readTool(tool, registry));
        }
        return new ToolCatalog(tools, registry);
    }

    private static SurrogateModel fitModel(String ref, JsonNode model) throws IOException {
        double[] theta = readVector(model.path("theta"), "theta of model " + ref);
        List<TrainingSample> samples = new ArrayList<>();
        for (JsonNode sample : model.path("samples")) {
            double[] x = readVector(sample.path("x"), "sample input of model " + ref);
            JsonNode y = sample.get("y");
            if (y == null || !y.isNumber()) {
                throw new IOException("Sample of model " + ref + " has no numeric 'y'");
            }
            samples.add(new TrainingSample(x, y.doubleValue()));
        }
        try {
            return KrigingSurrogateModel.fit(samples, theta);
        } catch (IllegalArgumentException e) {
            throw new IOException("Cannot fit surrogate model " + ref + ": " + e.getMessage(), e);
        }
    }

    private static ToolRecord readTool(JsonNode tool, SurrogateModelRegistry registry)
            throws IOException {
        String toolId = requiredText(tool, "tool_id", "tool");
        try {
            ToolStatus status =
                    ToolStatus.valueOf(
                            requiredText(tool, "status", toolId).trim().toUpperCase(Locale.ROOT));
            WaferSize waferSize = WaferSize.ofMillimeters(tool.path("wafer_size").asInt());

            Set<ProcessCategory> categories = EnumSet.noneOf(ProcessCategory.class);
            for (JsonNode category : tool.path("capable_categories")) {
                categories.add(ProcessCategory.fromLabel(category.asText()));
            }
            Set<String> incompatible = new LinkedHashSet<>();
            for (JsonNode material : tool.path("incompatible_materials")) {
                incompatible.add(material.asText());
            }

            SurrogateModel model = null;
            JsonNode ref = tool.get("surrogate_model_ref");
            if (ref != null && !ref.isNull()) {
                model = registry.get(ref.asText()).orElse(null);
                if (model == null) {
                    throw new IOException(
                            "Tool " + toolId + " references unknown surrogate model "
                                    + ref.asText());
                }
            }
            return new ToolRecord(toolId, status, waferSize, categories, incompatible, model);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid tool " + toolId + ": " + e.getMessage(), e);
        }
    }

    private static double[] readVector(JsonNode node, String what) throws IOException {
        if (!node.isArray() || node.isEmpty()) {
            throw new IOException("Missing or empty " + what);
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = node.get(i);
            if (!value.isNumber()) {
                throw new IOException("Non-numeric value in " + what + ": " + value);
            }
            values[i] = value.doubleValue();
        }
        return values;
    }

    private static String requiredText(JsonNode node, String field, String owner)
            throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IOException("Missing '" + field + "' in " + owner);
        }
        return value.asText();
    }
}

package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.flow.FlowResult;
import io.fabflow.core.flow.ProcessFlow;
import java.util.List;
import java.util.Map;

/// Utility class for the JSON documents fabflow reads and writes.
///
/// | Document | Method |
/// |----------|--------|
/// | change descriptors (array) | {@link #readChanges(String)}, {@link #changesToJson(List)} |
/// | layout references (object of step id to path) | {@link #readLayoutReferences(String)} |
/// | tool catalog | {@link #readToolCatalog(String)} |
/// | process flow (array of steps) | {@link #toJson(ProcessFlow)} |
/// | flow result (flow plus diagnostics) | {@link #toJson(FlowResult)} |
///
/// ### Usage
/// {@snippet :
/// List<ChangeDescriptor> changes = FlowSerializer.readChanges(changesJson);
/// ToolCatalog catalog = FlowSerializer.readToolCatalog(catalogJson);
///
/// FlowResult result = orchestrator.plan(FlowRequest.of(changes));
/// String json = FlowSerializer.toJson(result.flow());
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see FabflowJacksonModule for the registered type handlers
public final class FlowSerializer {

    private FlowSerializer() {}

    /// Serializes a process flow to a pretty-printed JSON array.
    ///
    /// @param flow the flow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ProcessFlow flow) {
        try {
            return createMapper().writeValueAsString(flow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize process flow: " + e.getMessage(), e);
        }
    }

    /// Serializes a flow result, including its diagnostics.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FlowResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize flow result: " + e.getMessage(), e);
        }
    }

    /// Serializes change descriptors to a JSON array.
    ///
    /// @param changes the descriptors, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String changesToJson(List<ChangeDescriptor> changes) {
        try {
            return createMapper().writeValueAsString(changes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize change descriptors: " + e.getMessage(), e);
        }
    }

    /// Deserializes a JSON array of change descriptors.
    ///
    /// Missing attributes are not rejected here; validate the result with
    /// {@link io.fabflow.core.change.ChangeDescriptorValidator} or let the orchestrator do it.
    ///
    /// @param json JSON array, not null
    /// @return descriptors in document order, never null
    /// @throws IllegalArgumentException if the document is not a well-formed descriptor array
    public static List<ChangeDescriptor> readChanges(String json) {
        try {
            return createMapper().readValue(json, new TypeReference<List<ChangeDescriptor>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize change descriptors: " + e.getMessage(), e);
        }
    }

    /// Deserializes a JSON object mapping lithography step identifiers to layout references.
    ///
    /// @param json JSON object such as `{"LITHO_STEP_2": "layouts/chip.gds"}`, not null
    /// @return the mapping, never null and free of null values
    /// @throws IllegalArgumentException if deserialization fails or a step maps to `null`
    public static Map<String, String> readLayoutReferences(String json) {
        Map<String, String> references;
        try {
            references =
                    createMapper().readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize layout references: " + e.getMessage(), e);
        }
        for (Map.Entry<String, String> entry : references.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException(
                        "Failed to deserialize layout references: no layout for step "
                                + entry.getKey());
            }
        }
        return references;
    }

    /// Deserializes a tool catalog, fitting its surrogate models.
    ///
    /// @param json catalog document, not null
    /// @return the catalog, never null
    /// @throws IllegalArgumentException if the document is malformed or a model cannot be fitted
    public static ToolCatalog readToolCatalog(String json) {
        try {
            return createMapper().readValue(json, ToolCatalog.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize tool catalog: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for fabflow documents.
    ///
    /// Registers:
    /// - `FabflowJacksonModule` for the descriptor, catalog and flow types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new FabflowJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}

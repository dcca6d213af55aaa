package io.fabflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.flow.Diagnostic;
import io.fabflow.core.flow.FlowResult;
import io.fabflow.core.flow.ProcessFlow;
import io.fabflow.core.flow.ProcessStep;
import io.fabflow.core.recipe.RecipeParameters;
import java.io.Serial;

/// Jackson module registering the codecs for fabflow's input and output types.
///
/// Every type is handled by a hand-written serializer or deserializer, so the core records
/// carry no Jackson annotations and JSON field names stay snake_case regardless of the Java
/// accessor names.
///
/// | Type | Direction |
/// |------|-----------|
/// | {@link ChangeDescriptor} | read and write |
/// | {@link ToolCatalog} | read |
/// | {@link ProcessStep}, {@link ProcessFlow}, {@link RecipeParameters} | write |
/// | {@link Diagnostic}, {@link FlowResult} | write |
///
/// @see FlowSerializer#createMapper()
public class FabflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4410387625230185179L;

    public FabflowJacksonModule() {
        super("FabflowJacksonModule");

        addSerializer(ChangeDescriptor.class, new ChangeDescriptorSerializer());
        addDeserializer(ChangeDescriptor.class, new ChangeDescriptorDeserializer());

        addDeserializer(ToolCatalog.class, new ToolCatalogDeserializer());

        addSerializer(RecipeParameters.class, new RecipeParametersSerializer());
        addSerializer(ProcessStep.class, new ProcessStepSerializer());
        addSerializer(ProcessFlow.class, new ProcessFlowSerializer());
        addSerializer(Diagnostic.class, new DiagnosticSerializer());
        addSerializer(FlowResult.class, new FlowResultSerializer());
    }
}

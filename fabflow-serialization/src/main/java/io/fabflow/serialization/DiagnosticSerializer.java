package io.fabflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.fabflow.core.flow.Diagnostic;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link Diagnostic} as
/// `{"order_index":3,"kind":"NO_COMPATIBLE_TOOL","message":"..."}`.
///
/// @implNote Package-private. Registered by {@link FabflowJacksonModule}.
class DiagnosticSerializer extends StdSerializer<Diagnostic> {

    @Serial private static final long serialVersionUID = -3158007224463318415L;

    DiagnosticSerializer() {
        super(Diagnostic.class);
    }

    @Override
    public void serialize(Diagnostic diagnostic, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("order_index", diagnostic.orderIndex());
        gen.writeStringField("kind", diagnostic.kind().name());
        gen.writeStringField("message", diagnostic.message());
        gen.writeEndObject();
    }
}

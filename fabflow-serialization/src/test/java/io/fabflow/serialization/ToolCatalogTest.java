package io.fabflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.fabflow.core.change.WaferSize;
import io.fabflow.core.classify.ProcessCategory;
import io.fabflow.core.tool.InMemoryKnowledgeStore;
import io.fabflow.core.tool.ToolRecord;
import io.fabflow.core.tool.ToolStatus;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ToolCatalogTest {

    private static final String CATALOG =
            """
            {
              "surrogate_models": [
                {"ref": "cvd01-oxide", "theta": [0.1, 2.0],
                 "samples": [
                   {"x": [5.0, 0.5], "y": 40.0},
                   {"x": [30.0, 3.0], "y": 180.0},
                   {"x": [17.5, 1.75], "y": 105.0}
                 ]}
              ],
              "tools": [
                {"tool_id": "CVD_01", "status": "AVAILABLE", "wafer_size": 300,
                 "capable_categories": ["Deposition"], "incompatible_materials": ["copper"],
                 "surrogate_model_ref": "cvd01-oxide"},
                {"tool_id": "LITHO_01", "status": "maintenance", "wafer_size": 300,
                 "capable_categories": ["LITHOGRAPHY"]}
              ]
            }
            """;

    @Nested
    class Reading {

        @Test
        void shouldReadToolsInFileOrder() {
            ToolCatalog catalog = FlowSerializer.readToolCatalog(CATALOG);

            assertThat(catalog.tools())
                    .extracting(ToolRecord::toolId)
                    .containsExactly("CVD_01", "LITHO_01");
        }

        @Test
        void shouldReadToolAttributes() {
            ToolRecord cvd = FlowSerializer.readToolCatalog(CATALOG).tools().get(0);

            assertThat(cvd.status()).isEqualTo(ToolStatus.AVAILABLE);
            assertThat(cvd.waferSize()).isEqualTo(WaferSize.MM_300);
            assertThat(cvd.capableCategories()).containsExactly(ProcessCategory.DEPOSITION);
            assertThat(cvd.incompatibleMaterials()).containsExactly("copper");
        }

        @Test
        void shouldAcceptCaseInsensitiveStatusAndCategoryNames() {
            ToolRecord litho = FlowSerializer.readToolCatalog(CATALOG).tools().get(1);

            assertThat(litho.status()).isEqualTo(ToolStatus.MAINTENANCE);
            assertThat(litho.capableCategories()).containsExactly(ProcessCategory.LITHOGRAPHY);
            assertThat(litho.incompatibleMaterials()).isEmpty();
            assertThat(litho.surrogateModel()).isNull();
        }

        @Test
        void shouldFitReferencedSurrogateModel() {
            ToolCatalog catalog = FlowSerializer.readToolCatalog(CATALOG);

            ToolRecord cvd = catalog.tools().get(0);
            assertThat(cvd.surrogateModel()).isNotNull();
            assertThat(cvd.surrogateModel().predict(new double[] {30.0, 3.0}))
                    .isCloseTo(180.0, within(1e-4));
            assertThat(catalog.surrogateModels().references()).containsExactly("cvd01-oxide");
        }

        @Test
        void shouldLoadIntoKnowledgeStore() {
            InMemoryKnowledgeStore store =
                    FlowSerializer.readToolCatalog(CATALOG).toKnowledgeStore();

            assertThat(store.size()).isEqualTo(2);
            assertThat(store.get("CVD_01")).isPresent();
        }

        @Test
        void shouldReadEmptyCatalog() {
            ToolCatalog catalog = FlowSerializer.readToolCatalog("{}");

            assertThat(catalog.tools()).isEmpty();
            assertThat(catalog.surrogateModels().references()).isEmpty();
        }
    }

    @Nested
    class Rejection {

        @Test
        void shouldRejectUnknownModelReference() {
            String json =
                    """
                    {"tools": [{"tool_id": "CVD_02", "status": "AVAILABLE", "wafer_size": 300,
                                "capable_categories": ["Deposition"],
                                "surrogate_model_ref": "missing"}]}
                    """;

            assertThatThrownBy(() -> FlowSerializer.readToolCatalog(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("CVD_02")
                    .hasMessageContaining("missing");
        }

        @Test
        void shouldRejectUnknownCategory() {
            String json =
                    """
                    {"tools": [{"tool_id": "IMP_01", "status": "AVAILABLE", "wafer_size": 300,
                                "capable_categories": ["Implant"]}]}
                    """;

            assertThatThrownBy(() -> FlowSerializer.readToolCatalog(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("IMP_01")
                    .hasMessageContaining("Implant");
        }

        @Test
        void shouldRejectMissingWaferSize() {
            String json =
                    """
                    {"tools": [{"tool_id": "CVD_03", "status": "AVAILABLE"}]}
                    """;

            assertThatThrownBy(() -> FlowSerializer.readToolCatalog(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("CVD_03");
        }

        @Test
        void shouldRejectModelWithMismatchedDimensions() {
            String json =
                    """
                    {"surrogate_models": [{"ref": "bad", "theta": [1.0, 1.0],
                                           "samples": [{"x": [1.0], "y": 2.0}]}]}
                    """;

            assertThatThrownBy(() -> FlowSerializer.readToolCatalog(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Cannot fit surrogate model bad");
        }

        @Test
        void shouldRejectToolWithoutId() {
            assertThatThrownBy(
                            () -> FlowSerializer.readToolCatalog(
                                    "{\"tools\": [{\"status\": \"AVAILABLE\"}]}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tool_id");
        }
    }
}

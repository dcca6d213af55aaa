package io.fabflow.core.tool;

import static io.fabflow.core.TestFixtures.lithoTool;
import static io.fabflow.core.TestFixtures.tool;
import static org.assertj.core.api.Assertions.assertThat;

import io.fabflow.core.change.WaferSize;
import io.fabflow.core.classify.ProcessCategory;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryKnowledgeStoreTest {

    @Test
    void shouldPreFilterOnCategoryAndWaferSize() {
        ToolRecord small =
                new ToolRecord(
                        "CVD_200",
                        ToolStatus.AVAILABLE,
                        WaferSize.MM_200,
                        Set.of(ProcessCategory.DEPOSITION),
                        Set.of(),
                        null);
        InMemoryKnowledgeStore store =
                new InMemoryKnowledgeStore(
                        List.of(
                                tool("CVD_01", ProcessCategory.DEPOSITION),
                                lithoTool("LITHO_01"),
                                small));

        List<ToolRecord> candidates =
                store.findCandidateTools(
                        new ToolQuery(ProcessCategory.DEPOSITION, WaferSize.MM_300, Set.of("SiO2")));

        assertThat(candidates).extracting(ToolRecord::toolId).containsExactly("CVD_01");
    }

    @Test
    void shouldLeaveStatusToTheSelector() {
        InMemoryKnowledgeStore store =
                new InMemoryKnowledgeStore(
                        List.of(
                                tool("CVD_01", ProcessCategory.DEPOSITION)
                                        .withStatus(ToolStatus.DOWN)));

        assertThat(
                        store.findCandidateTools(
                                new ToolQuery(ProcessCategory.DEPOSITION, WaferSize.MM_300, Set.of())))
                .hasSize(1);
    }

    @Test
    void shouldReplaceAndRemoveById() {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore();
        store.register(tool("CVD_01", ProcessCategory.DEPOSITION));
        store.register(tool("CVD_01", ProcessCategory.ETCH));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("CVD_01").orElseThrow().capableCategories())
                .containsExactly(ProcessCategory.ETCH);
        assertThat(store.remove("CVD_01")).isTrue();
        assertThat(store.all()).isEmpty();
    }
}

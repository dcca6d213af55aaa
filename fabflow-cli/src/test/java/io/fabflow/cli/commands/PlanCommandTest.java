package io.fabflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.fabflow.serialization.FlowSerializer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlanCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    private PlanCommand command;
    private Path layout;
    private Path maskDir;

    @BeforeEach
    void setUp() throws Exception {
        layout = write(tempDir, "device.gds", "GDSII layout");
        maskDir = tempDir.resolve("masks");

        command = new PlanCommand();
        injectField(command, "changesFile", write(tempDir, "changes.json", REFERENCE_CHANGES));
        injectField(command, "catalogFile", write(tempDir, "tools.json", REFERENCE_CATALOG));
        injectField(command, "maskDir", maskDir);
        injectField(command, "noColor", true);
        injectField(command, "layouts", layoutsFor("LITHO_STEP_2", layout));
    }

    private static Map<String, String> layoutsFor(String step, Path file) {
        Map<String, String> layouts = new LinkedHashMap<>();
        layouts.put(step, file.toString());
        return layouts;
    }

    private static JsonNode readJson(Path file) throws Exception {
        return FlowSerializer.createMapper().readTree(Files.readString(file));
    }

    @Nested
    class ReferenceScenario {

        @Test
        void shouldWriteThreeStepFlowToOutputFile() throws Exception {
            Path output = tempDir.resolve("out/flow.json");
            injectField(command, "outputFile", output);

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_OK);
            JsonNode flow = readJson(output);
            assertThat(flow).hasSize(3);
            assertThat(flow.findValuesAsText("process_type"))
                    .containsExactly("Deposition", "Lithography", "Etch");
            assertThat(flow.findValuesAsText("tool_id"))
                    .containsExactly("CVD_01", "LITHO_01", "ETCH_01");
            assertThat(flow.get(2).get("step_number").intValue()).isEqualTo(3);
        }

        @Test
        void shouldExtractMaskIntoMaskDirectory() throws Exception {
            Path output = tempDir.resolve("flow.json");
            injectField(command, "outputFile", output);

            command.run();

            String maskFile =
                    readJson(output).get(1).get("recipe_parameters").get("mask_file").asText();
            assertThat(maskFile).isEqualTo(maskDir.resolve("mask_LITHO_STEP_2.gds").toString());
            assertThat(Path.of(maskFile)).hasContent("GDSII layout");
        }

        @Test
        void shouldPrintSummaryWhenWritingToFile() throws Exception {
            injectField(command, "outputFile", tempDir.resolve("flow.json"));

            command.run();

            String output = outContent.toString();
            assertThat(output).contains("Process-Flow Planning Engine");
            assertThat(output).contains("[OK] Planned 3 steps");
            assertThat(output).contains("1. Deposition").contains("→ CVD_01");
            assertThat(output).contains("Written to:");
        }

        @Test
        void shouldWriteBareJsonToStdoutWithoutOutputFile() throws Exception {
            command.run();

            String output = outContent.toString().trim();
            assertThat(output).startsWith("[").doesNotContain("Planning Engine");
            JsonNode flow = FlowSerializer.createMapper().readTree(output);
            assertThat(flow).hasSize(3);
        }

        @Test
        void shouldIncludeDiagnosticsWhenRequested() throws Exception {
            injectField(command, "withDiagnostics", true);

            command.run();

            JsonNode result = FlowSerializer.createMapper().readTree(outContent.toString());
            assertThat(result.get("process_flow")).hasSize(3);
            assertThat(result.get("diagnostics")).isEmpty();
        }

        @Test
        void shouldApplyConfigFile() throws Exception {
            injectField(
                    command,
                    "configFile",
                    write(tempDir, "fabflow.properties", "fabflow.litho.exposure=EXPOSE_150mJ\n"));

            command.run();

            JsonNode flow = FlowSerializer.createMapper().readTree(outContent.toString());
            assertThat(flow.get(1).get("recipe_parameters").get("exposure_recipe").asText())
                    .isEqualTo("EXPOSE_150mJ");
        }

        @Test
        void shouldReadLayoutsFromJsonFile() throws Exception {
            injectField(command, "layouts", new LinkedHashMap<String, String>());
            injectField(
                    command,
                    "layoutsFile",
                    write(
                            tempDir,
                            "layouts.json",
                            "{\"LITHO_STEP_2\": " + quoted(layout.toString()) + "}"));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_OK);
            assertThat(maskDir.resolve("mask_LITHO_STEP_2.gds")).exists();
        }

        private static String quoted(String text) throws Exception {
            return FlowSerializer.createMapper().writeValueAsString(text);
        }
    }

    @Nested
    class SkippedChanges {

        @Test
        void shouldReportUnknownChangeOnStderrAndKeepNumberingDense() throws Exception {
            String changes =
                    REFERENCE_CHANGES
                            .trim()
                            .replaceFirst(
                                    "\\[",
                                    "[{\"primary_material\": \"polysilicon\", \"aspect_ratio\":"
                                            + " 1.0, \"conformality_score\": 0.5,"
                                            + " \"target_metric\": 50.0, \"wafer_size\": 300,"
                                            + " \"order_index\": 5},");
            injectField(command, "changesFile", write(tempDir, "changes.json", changes));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_OK);
            assertThat(errContent.toString())
                    .contains("[SKIP]")
                    .contains("UNKNOWN_CLASSIFICATION");
            JsonNode flow = FlowSerializer.createMapper().readTree(outContent.toString());
            assertThat(flow.findValuesAsText("step_number")).containsExactly("1", "2", "3");
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldFailWhenLayoutReferenceIsMissing() throws Exception {
            Path output = tempDir.resolve("flow.json");
            injectField(command, "layouts", new LinkedHashMap<String, String>());
            injectField(command, "outputFile", output);

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_FAILURE);
            assertThat(errContent.toString())
                    .contains("[FAIL]")
                    .contains("MISSING_LAYOUT_REFERENCE");
            assertThat(output).doesNotExist();
        }

        @Test
        void shouldFailWhenCatalogCannotBeRead() throws Exception {
            injectField(command, "catalogFile", tempDir.resolve("missing.json"));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_FAILURE);
            assertThat(errContent.toString()).contains("Cannot read input");
        }

        @Test
        void shouldFailOnMalformedChanges() throws Exception {
            injectField(command, "changesFile", write(tempDir, "changes.json", "{oops"));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_FAILURE);
            assertThat(errContent.toString()).contains("Failed to deserialize change descriptors");
        }

        @Test
        void shouldFailOnLayoutsFileWithNullEntry() throws Exception {
            Path layouts = write(tempDir, "layouts.json", "{\"LITHO_STEP_2\": null}");
            injectField(command, "layoutsFile", layouts);

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_FAILURE);
            assertThat(errContent.toString())
                    .contains("Cannot read input")
                    .contains("no layout for step LITHO_STEP_2");
        }

        @Test
        void shouldRefuseMaskOutsideMaskDirectory() throws Exception {
            String changes =
                    """
                    [{"primary_material": "photoresist", "wafer_size": 300, "order_index": 0,
                      "patterning": true, "step_id": "../escaped"}]
                    """;
            injectField(command, "changesFile", write(tempDir, "changes.json", changes));
            injectField(command, "layouts", layoutsFor("../escaped", layout));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_FAILURE);
            assertThat(errContent.toString())
                    .contains("[FAIL]")
                    .contains("escapes mask directory");
            assertThat(tempDir.resolve("escaped.gds")).doesNotExist();
            assertThat(maskDir).doesNotExist();
        }

        @Test
        void shouldSignalRetryWhenMaskServiceIsUnavailable() throws Exception {
            injectField(
                    command,
                    "layouts",
                    layoutsFor("LITHO_STEP_2", tempDir.resolve("not-there.gds")));

            command.run();

            assertThat(command.getExitCode()).isEqualTo(FabflowCommand.EXIT_UNAVAILABLE);
            assertThat(errContent.toString()).contains("MASK_SERVICE unavailable");
        }
    }
}

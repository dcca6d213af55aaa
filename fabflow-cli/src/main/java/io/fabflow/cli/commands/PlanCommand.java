package io.fabflow.cli.commands;

import io.fabflow.cli.action.DirectoryMaskExtractor;
import io.fabflow.cli.ui.AnsiStyles;
import io.fabflow.core.FabflowConfig;
import io.fabflow.core.FabflowEnvironment;
import io.fabflow.core.FabflowFactory;
import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.flow.CollaboratorUnavailableException;
import io.fabflow.core.flow.Diagnostic;
import io.fabflow.core.flow.FlowPlanningException;
import io.fabflow.core.flow.FlowRequest;
import io.fabflow.core.flow.FlowResult;
import io.fabflow.core.flow.LoggingFlowObserver;
import io.fabflow.core.flow.ProcessStep;
import io.fabflow.serialization.FlowSerializer;
import io.fabflow.serialization.ToolCatalog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;

/// CLI command planning a process flow from a file of change descriptors.
///
/// Reads the descriptors and a tool catalog, runs one planning cycle and writes the flow as
/// JSON. Skipped changes are reported on stderr; they never fail the command.
///
/// ### Usage
/// ```bash
/// fabflow plan changes.json -t tools.json -l LITHO_STEP_2=layouts/chip.gds -o flow.json
/// ```
///
/// Without `-o` the JSON goes to stdout and the banner is suppressed, so the output can be
/// piped. Layout references from `--layouts` are overridden by `-l` entries for the same step.
///
/// @see FabflowCommand for exit codes and configuration
@CommandLine.Command(name = "plan", description = "Plan a process flow from change descriptors")
class PlanCommand extends FabflowCommand {

    @CommandLine.Parameters(index = "0", description = "JSON array of change descriptors")
    private Path changesFile;

    @CommandLine.Option(
            names = {"-t", "--tools"},
            required = true,
            description = "Tool catalog JSON")
    private Path catalogFile;

    @CommandLine.Option(
            names = {"-l", "--layout"},
            description = "Layout file of a lithography step, as STEP=PATH (repeatable)")
    private Map<String, String> layouts = new LinkedHashMap<>();

    @CommandLine.Option(
            names = "--layouts",
            description = "JSON object mapping lithography steps to layout files")
    private Path layoutsFile;

    @CommandLine.Option(
            names = {"-m", "--mask-dir"},
            description = "Directory receiving extracted mask files (default: ${DEFAULT-VALUE})")
    private Path maskDir = Path.of("output");

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write the flow to this file instead of stdout")
    private Path outputFile;

    @CommandLine.Option(
            names = "--with-diagnostics",
            description = "Write {\"process_flow\":[...],\"diagnostics\":[...]} instead of"
                    + " the bare step array")
    private boolean withDiagnostics;

    @Override
    protected boolean showBanner() {
        return outputFile != null;
    }

    @Override
    protected void execute() {
        AnsiStyles styles = styles();

        FabflowConfig config;
        FlowRequest request;
        ToolCatalog catalog;
        try {
            config = loadConfig();
            List<ChangeDescriptor> changes =
                    FlowSerializer.readChanges(Files.readString(changesFile));
            request = new FlowRequest(changes, layoutReferences());
            catalog = FlowSerializer.readToolCatalog(Files.readString(catalogFile));
        } catch (IOException | IllegalArgumentException e) {
            fail(EXIT_FAILURE, "Cannot read input: " + e.getMessage());
            return;
        }

        FabflowFactory.Builder builder =
                FabflowFactory.builder()
                        .config(config)
                        .knowledgeStore(catalog.toKnowledgeStore())
                        .maskExtractor(new DirectoryMaskExtractor(maskDir))
                        .observer(new LoggingFlowObserver());

        try (FabflowEnvironment environment = builder.build()) {
            FlowResult result = environment.getOrchestrator().plan(request);
            for (Diagnostic diagnostic : result.diagnostics()) {
                System.err.println(" " + styles.warn("[SKIP]") + " " + diagnostic);
            }
            String json =
                    withDiagnostics
                            ? FlowSerializer.toJson(result)
                            : FlowSerializer.toJson(result.flow());
            if (outputFile == null) {
                System.out.println(json);
                return;
            }
            writeOutput(json);
            printSummary(result, styles);
        } catch (FlowPlanningException e) {
            fail(EXIT_FAILURE, "Planning failed (" + e.getReason() + "): " + e.getMessage());
        } catch (CollaboratorUnavailableException e) {
            fail(
                    EXIT_UNAVAILABLE,
                    e.getCollaborator() + " unavailable, retry later: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            fail(EXIT_FAILURE, "Planning failed: " + e.getMessage());
        } catch (IOException e) {
            fail(EXIT_FAILURE, "Cannot write " + outputFile + ": " + e.getMessage());
        }
    }

    private Map<String, String> layoutReferences() throws IOException {
        Map<String, String> references = new LinkedHashMap<>();
        if (layoutsFile != null) {
            references.putAll(FlowSerializer.readLayoutReferences(Files.readString(layoutsFile)));
        }
        references.putAll(layouts);
        return references;
    }

    private void writeOutput(String json) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, json + System.lineSeparator());
    }

    private void printSummary(FlowResult result, AnsiStyles styles) {
        String skipped =
                result.hasDiagnostics()
                        ? ", skipped " + result.diagnostics().size() + " changes"
                        : "";
        System.out.println(
                " " + styles.success("[OK]") + " Planned "
                        + styles.bold(result.flow().size() + " steps") + skipped);
        for (ProcessStep step : result.flow().steps()) {
            System.out.println(
                    "   " + step.stepNumber() + ". "
                            + styles.category(
                                    step.category(), AnsiStyles.padRight(step.processType(), 12))
                            + " " + styles.arrow() + " " + step.toolId());
        }
        System.out.println("   Written to: " + outputFile);
    }
}

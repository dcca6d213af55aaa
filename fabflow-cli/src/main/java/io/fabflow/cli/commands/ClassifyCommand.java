package io.fabflow.cli.commands;

import io.fabflow.cli.ui.AnsiStyles;
import io.fabflow.core.FabflowConfig;
import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.change.ChangeDescriptorValidator;
import io.fabflow.core.classify.Classification;
import io.fabflow.core.classify.ProcessClassifier;
import io.fabflow.serialization.FlowSerializer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import picocli.CommandLine;

/// CLI command checking and classifying change descriptors without planning.
///
/// For each descriptor, in order-index order, prints either its contract violations or its
/// process category and subtype under the configured thresholds. Exits with
/// {@link #EXIT_FAILURE} if any descriptor is malformed.
///
/// ### Usage
/// ```bash
/// fabflow classify changes.json [-c fabflow.properties]
/// ```
@CommandLine.Command(
        name = "classify",
        description = "Validate and classify change descriptors without planning")
class ClassifyCommand extends FabflowCommand {

    @CommandLine.Parameters(index = "0", description = "JSON array of change descriptors")
    private Path changesFile;

    @Override
    protected void execute() {
        AnsiStyles styles = styles();

        FabflowConfig config;
        List<ChangeDescriptor> changes;
        try {
            config = loadConfig();
            changes = FlowSerializer.readChanges(Files.readString(changesFile));
        } catch (IOException | IllegalArgumentException e) {
            fail(EXIT_FAILURE, "Cannot read input: " + e.getMessage());
            return;
        }

        ProcessClassifier classifier =
                ProcessClassifier.standard(config.getClassificationThresholds());
        ChangeDescriptorValidator validator = new ChangeDescriptorValidator();

        int invalid = 0;
        int unknown = 0;
        List<ChangeDescriptor> ordered =
                changes.stream()
                        .sorted(Comparator.comparingInt(ChangeDescriptor::orderIndex))
                        .toList();
        for (ChangeDescriptor change : ordered) {
            String label = "   #" + change.orderIndex() + " " + describe(change);
            List<String> violations = validator.violations(change);
            if (!violations.isEmpty()) {
                invalid++;
                System.out.println(
                        label + " " + styles.crossmark() + " "
                                + styles.error(String.join("; ", violations)));
                continue;
            }
            Classification classification = classifier.classify(change);
            if (classification.isUnknown()) {
                unknown++;
            }
            String category =
                    styles.category(classification.category(), classification.toString());
            System.out.println(label + " " + styles.arrow() + " " + category);
        }

        List<Integer> duplicates = validator.duplicateOrderIndices(changes);
        if (!duplicates.isEmpty()) {
            fail(EXIT_FAILURE, "Duplicate order indices: " + duplicates);
            return;
        }
        String summary =
                "Classified " + changes.size() + " changes, " + unknown + " unknown, " + invalid
                        + " invalid";
        if (invalid > 0) {
            fail(EXIT_FAILURE, summary);
        } else {
            System.out.println(" " + styles.success("[OK]") + " " + summary);
        }
    }

    private static String describe(ChangeDescriptor change) {
        StringBuilder text = new StringBuilder();
        text.append(change.polarity() != null ? change.polarity() : "?")
                .append(' ')
                .append(change.primaryMaterial());
        if (change.isPatterning()) {
            text.append(" [").append(change.stepIdentifier()).append(']');
        } else if (!Double.isNaN(change.aspectRatio())) {
            text.append(" ar=").append(change.aspectRatio());
        }
        return AnsiStyles.padRight(text.toString(), 32);
    }
}

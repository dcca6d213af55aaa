package io.fabflow.cli.commands;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/// Top-level `fabflow` command.
///
/// Registers the subcommands:
/// - `plan` - Plan an ordered, parameterized process flow from change descriptors
/// - `classify` - Validate and classify change descriptors without selecting tools
///
/// Invoked without a subcommand, prints usage.
///
/// @see PlanCommand
/// @see ClassifyCommand
@Command(
        name = "fabflow",
        description = "Process-flow planning engine",
        mixinStandardHelpOptions = true,
        version = "fabflow 0.1.0",
        subcommands = {PlanCommand.class, ClassifyCommand.class})
public class FabflowCLI implements Runnable {

    @Spec CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}

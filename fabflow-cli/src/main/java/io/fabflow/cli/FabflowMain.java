package io.fabflow.cli;

import io.fabflow.cli.commands.FabflowCLI;
import picocli.CommandLine;

/// Launcher for the `fabflow` command line.
public final class FabflowMain {

    private FabflowMain() {}

    public static void main(String[] args) {
        System.exit(new CommandLine(new FabflowCLI()).execute(args));
    }
}

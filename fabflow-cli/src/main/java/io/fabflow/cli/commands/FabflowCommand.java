package io.fabflow.cli.commands;

import io.fabflow.cli.ui.AnsiStyles;
import io.fabflow.core.FabflowConfig;
import io.fabflow.core.FabflowFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine.IExitCodeGenerator;
import picocli.CommandLine.Option;

/// Abstract base for all fabflow subcommands.
///
/// Owns the banner, logging setup, configuration loading and the exit code. Subclasses
/// provide their own parameters and implement {@link #execute()}, reporting failures through
/// {@link #fail(int, String)} instead of throwing.
///
/// ### Configuration Resolution
/// 1. CLI option `--config` naming a properties file with `fabflow.*` keys
/// 2. Built-in defaults of {@link FabflowConfig}
///
/// ### Exit Codes
/// | Code | Meaning |
/// |------|---------|
/// | `0`  | success |
/// | `1`  | invalid input or planning contract violation |
/// | `75` | a collaborator is unavailable; retry later |
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see PlanCommand
/// @see ClassifyCommand
public abstract class FabflowCommand implements Runnable, IExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_UNAVAILABLE = 75;

    private static final String[] BANNER = {
        "",
        "   __       _      __ _",
        "  / _| __ _| |__  / _| | _____      __",
        " | |_ / _` | '_ \\| |_| |/ _ \\ \\ /\\ / /",
        " |  _| (_| | |_) |  _| | (_) \\ V  V /",
        " |_|  \\__,_|_.__/|_| |_|\\___/ \\_/\\_/",
        "",
        " Process-Flow Planning Engine",
        ""
    };

    // Held strongly so the level set by --verbose is not lost to garbage collection.
    private static final Logger rootLogger = Logger.getLogger("io.fabflow");

    @Option(
            names = {"-v", "--verbose"},
            description = "Log planning progress, including state transitions")
    protected boolean verbose;

    @Option(names = "--no-color", description = "Disable ANSI colors")
    protected boolean noColor;

    @Option(
            names = {"-c", "--config"},
            description = "Properties file with fabflow.* settings")
    protected Path configFile;

    private int exitCode = EXIT_OK;

    @Override
    public final void run() {
        configureLogging();
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        execute();
    }

    protected abstract void execute();

    /// Returns whether the banner is printed before {@link #execute()}.
    ///
    /// @return `true` unless a subclass writes machine-readable output to stdout
    protected boolean showBanner() {
        return true;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /// Returns output styles honoring `--no-color` and the presence of a terminal.
    ///
    /// @return styles instance, never null
    protected AnsiStyles styles() {
        return AnsiStyles.of(!noColor && System.console() != null);
    }

    /// Loads the configuration named by `--config`, or the defaults.
    ///
    /// @return configuration, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if a property value is invalid
    protected FabflowConfig loadConfig() throws IOException {
        if (configFile == null) {
            return new FabflowConfig();
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(configFile)) {
            properties.load(reader);
        }
        return FabflowFactory.loadConfig(properties);
    }

    /// Reports a failure on stderr and records the exit code.
    ///
    /// @param code process exit code, non-zero
    /// @param message failure description, not null
    protected void fail(int code, String message) {
        System.err.println(" " + styles().error("[FAIL]") + " " + message);
        exitCode = code;
    }

    private void configureLogging() {
        try (InputStream config = FabflowCommand.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging configuration: " + e.getMessage());
        }
        if (verbose) {
            rootLogger.setLevel(Level.FINE);
            for (Handler handler : Logger.getLogger("").getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }
}

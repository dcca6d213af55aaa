package io.fabflow.cli.ui;

import io.fabflow.core.classify.ProcessCategory;

/// ANSI text styling for fabflow's terminal output.
///
/// All methods return styled strings; printing is the caller's responsibility. With color
/// disabled every method returns its input unchanged, so output stays grep-friendly when
/// redirected.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.success("[OK]") + " " + styles.bold("3 steps"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String MAGENTA = "\033[38;5;170m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an instance with the given color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    public String dim(String text) {
        return style(text, DIM);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors a process category label: deposition green, etch red, lithography magenta,
    /// unknown yellow.
    ///
    /// @param category the category whose color to use, not null
    /// @param text text to style, not null
    /// @return styled text, never null
    public String category(ProcessCategory category, String text) {
        String code =
                switch (category) {
                    case DEPOSITION -> GREEN;
                    case ETCH -> RED;
                    case LITHOGRAPHY -> MAGENTA;
                    case UNKNOWN -> YELLOW;
                };
        return style(text, code);
    }

    /// Right arrow for tool assignments.
    public String arrow() {
        return style("→", BLUE);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    /// Pads text on the right to a fixed width, measured before styling.
    ///
    /// @param text text to pad, not null
    /// @param width minimum width in characters
    /// @return padded text, never null
    public static String padRight(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }
}

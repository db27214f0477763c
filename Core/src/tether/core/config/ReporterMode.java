package tether.core.config;

import java.util.Locale;

/**
 * How live progress is rendered. The mode is always chosen explicitly, it is never guessed from the terminal.
 */
public enum ReporterMode {
    /**
     * Redraws the whole progress block in place using ANSI cursor control. Meant for a terminal.
     */
    INTERACTIVE,

    /**
     * Appends every new progress line exactly once. Meant for logs and CI.
     */
    APPEND_ONLY;

    /**
     * Returns the mode with the given name, such as "append-only", or null if there is none.
     */
    public static ReporterMode fromString(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ReporterMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        return null;
    }
}

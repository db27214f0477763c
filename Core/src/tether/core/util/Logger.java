package tether.core.util;

import java.io.PrintStream;

/**
 * A simple logging utility that can be either enabled or disabled globally.
 *
 * Log lines are written to the stream captured when this class is loaded (stderr) so that they never land inside the
 * live results written to stdout, nor inside the output captured from a running test case.
 */
public final class Logger {
    private static final PrintStream SINK = System.err;
    private static volatile boolean globalEnabled = true;
    private final String className;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getSimpleName());
    }

    /**
     * Globally disables all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    /**
     * Logs the specified message if logging is enabled.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (globalEnabled) {
            SINK.println("[" + Thread.currentThread().getName() + "] " + this.className + ": " + message);
        }
    }

    /**
     * Logs the specified message followed by the stack trace of the given error if logging is enabled.
     *
     * @param message The message to log.
     * @param error The error to log.
     */
    public void log(String message, Throwable error) {
        if (globalEnabled) {
            log(message);
            error.printStackTrace(SINK);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled: " + globalEnabled + " }";
    }
}

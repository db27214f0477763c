package tether.core.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A diagnostic tool the engine under test can be run with.
 *
 * Some tools wrap the engine invocation (their argv tokens become the instrumentation prefix), others are compiled into
 * the engine and only leave a marker in its output when they find something. Tools that look for data races want the
 * engine to run more than one search thread.
 */
public enum Instrumentation {
    NONE(Collections.emptyList(), null, 1),
    VALGRIND(Arrays.asList("valgrind", "--error-exitcode=" + Instrumentation.DIAGNOSTIC_EXIT_CODE, "--errors-for-leak-kinds=all", "--leak-check=full"), null, 1),
    VALGRIND_THREAD(Arrays.asList("valgrind", "--error-exitcode=" + Instrumentation.DIAGNOSTIC_EXIT_CODE, "--fair-sched=try"), null, 2),
    SANITIZER_UNDEFINED(Collections.emptyList(), "runtime error:", 1),
    SANITIZER_THREAD(Collections.emptyList(), "WARNING: ThreadSanitizer:", 2);

    /**
     * The exit code a wrapping tool reports when it found errors in the engine.
     */
    public static final int DIAGNOSTIC_EXIT_CODE = 42;

    /**
     * The number of transcript lines quoted when a diagnostic marker is found.
     */
    public static final int DIAGNOSTIC_EXCERPT_LINES = 50;

    private final List<String> prefix;
    private final String diagnosticMarker;
    private final int engineThreads;

    Instrumentation(List<String> prefix, String diagnosticMarker, int engineThreads) {
        this.prefix = prefix;
        this.diagnosticMarker = diagnosticMarker;
        this.engineThreads = engineThreads;
    }

    /**
     * Returns the argv tokens to place in front of the engine invocation.
     *
     * @return the prefix tokens.
     */
    public List<String> prefix() {
        return Collections.unmodifiableList(this.prefix);
    }

    /**
     * Returns the number of search threads the engine should be configured with under this tool.
     *
     * @return the thread count.
     */
    public int engineThreads() {
        return this.engineThreads;
    }

    /**
     * Scans the given transcript for this tool's diagnostic marker.
     *
     * Returns an empty list if the tool leaves no marker or no line carries it, otherwise up to
     * {@link #DIAGNOSTIC_EXCERPT_LINES} lines starting at the first line that carries it.
     *
     * @param transcript The transcript to scan.
     * @return the excerpt around the first diagnostic, or an empty list.
     */
    public List<String> findDiagnostic(List<String> transcript) {
        if (this.diagnosticMarker == null) {
            return Collections.emptyList();
        }

        for (int i = 0; i < transcript.size(); i++) {
            if (transcript.get(i).contains(this.diagnosticMarker)) {
                int end = Math.min(transcript.size(), i + DIAGNOSTIC_EXCERPT_LINES);
                return new ArrayList<>(transcript.subList(i, end));
            }
        }
        return Collections.emptyList();
    }

    /**
     * Returns the instrumentation matching the given command-line style name, such as "valgrind-thread".
     *
     * @param name The name.
     * @return the instrumentation or null if there is none by that name.
     */
    public static Instrumentation fromString(String name) {
        if (name == null) {
            return null;
        }
        for (Instrumentation instrumentation : values()) {
            if (instrumentation.toCommandLineName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                return instrumentation;
            }
        }
        return null;
    }

    /**
     * Returns the command-line style name of this instrumentation, such as "sanitizer-undefined".
     *
     * @return the name.
     */
    public String toCommandLineName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}

package tether.core.output;

import tether.core.exception.SetupException;
import tether.core.execution.ExecutionReport;
import tether.core.execution.FailureDetail;
import tether.core.execution.TestCase;
import tether.core.execution.util.TaskExecutor;
import tether.core.util.ObjectChecker;
import tether.core.util.Stringify;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Formats result lines and the final summary, optionally colored with ANSI escapes.
 */
public final class ResultFormatter {
    static final String CYAN = "\033[36m";
    static final String RED = "\033[31m";
    static final String GREEN = "\033[32m";
    static final String WHITE_BOLD = "\033[1m";
    static final String RESET = "\033[0m";
    private static final String CASE_INDENT = "    ";
    private static final String TRACE_INDENT = "  ";
    private static final String OUTPUT_INDENT = "      | ";
    private final boolean colors;

    private ResultFormatter(boolean colors) {
        this.colors = colors;
    }

    public static ResultFormatter colored() {
        return new ResultFormatter(true);
    }

    public static ResultFormatter plain() {
        return new ResultFormatter(false);
    }

    public String suiteHeader(String suiteName) {
        return "Test Suite: " + suiteName;
    }

    /**
     * Formats a finished case: a check mark or a cross with its duration, then for a failed case its trace, then
     * whatever the case printed.
     *
     * @param testCase The finished case.
     * @return the (possibly multi-line) result line.
     */
    public String caseResult(TestCase testCase) {
        ObjectChecker.assertNonNull(testCase);
        ExecutionReport report = testCase.getReport();
        if (report == null) {
            throw new IllegalStateException("case is not finished: " + testCase);
        }

        String duration = Stringify.nanosToMillisString(report.durationNanos);
        List<String> lines = new ArrayList<>();
        if (report.status.isSuccess()) {
            lines.add(CASE_INDENT + color(GREEN, "✓ " + testCase.identifier + " (" + duration + ")"));
        } else {
            lines.add(CASE_INDENT + color(RED, "✗ " + testCase.identifier + " (" + duration + ")"));
            lines.addAll(traceLines(report.failure));
        }

        if (!report.capturedOutput.isEmpty()) {
            for (String outputLine : report.capturedOutput.split("\\R")) {
                lines.add(OUTPUT_INDENT + outputLine);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Formats the failure of a suite lifecycle hook.
     */
    public String hookFailure(SetupException failure) {
        ObjectChecker.assertNonNull(failure);
        List<String> lines = new ArrayList<>();
        lines.add(CASE_INDENT + color(RED, "✗ " + failure.getHook() + " failed"));
        Throwable cause = (failure.getCause() == null) ? failure : failure.getCause();
        lines.addAll(traceLines(FailureDetail.fromThrowable(cause, TaskExecutor.class)));
        return String.join("\n", lines);
    }

    /**
     * Formats the summary block printed at the end of a run.
     */
    public List<String> summary(RunSummary summary) {
        ObjectChecker.assertNonNull(summary);
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add(color(WHITE_BOLD, "Test Summary"));
        lines.add("");
        lines.add("    Test Suites: " + color(GREEN, summary.suitesPassed + " passed") + ", " + color(RED, summary.suitesFailed + " failed") + ", " + summary.totalSuites() + " total");
        lines.add("    Tests:       " + color(GREEN, summary.testsPassed + " passed") + ", " + color(RED, summary.testsFailed + " failed") + ", " + summary.totalTests() + " total");
        lines.add("    Time:        " + String.format(Locale.ROOT, "%.2f", summary.elapsedSeconds()) + "s");
        lines.add("");
        return lines;
    }

    public boolean isColored() {
        return this.colors;
    }

    private List<String> traceLines(FailureDetail failure) {
        List<String> lines = new ArrayList<>();
        for (String traceLine : failure.trace) {
            for (String physicalLine : traceLine.split("\\R")) {
                lines.add(TRACE_INDENT + color(CYAN, physicalLine));
            }
        }
        return lines;
    }

    private String color(String code, String text) {
        return this.colors ? code + text + RESET : text;
    }
}

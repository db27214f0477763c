package tether.core.output;

import tether.core.exception.SetupException;
import tether.core.execution.ExecutionStatus;
import tether.core.execution.TestCase;
import tether.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The shared state of a run: the counters, every suite's result lines and every suite's cases.
 *
 * All of it is guarded by one lock that is held for a single update only, never while anything blocks on an engine.
 * The {@link ReportListener} is notified of every new line while that lock is held, so what it renders is always a
 * consistent snapshot.
 *
 * Lines are kept per suite and listed suites-first in the order the suites were registered, regardless of the order in
 * which concurrently running suites produce them.
 */
public final class RunReport {
    private final Object lock = new Object();
    private final ResultFormatter formatter;
    private final ReportListener listener;
    private final Map<String, List<String>> lines = new LinkedHashMap<>();
    private final Map<String, List<TestCase>> cases = new LinkedHashMap<>();
    private final Set<String> endedSuites = new HashSet<>();
    private int suitesPassed = 0;
    private int suitesFailed = 0;
    private int testsPassed = 0;
    private int testsFailed = 0;
    private long startNanos = 0;
    private long endNanos = 0;
    private boolean isStarted = false;
    private boolean isFinished = false;

    private RunReport(List<String> suiteNames, ResultFormatter formatter, ReportListener listener) {
        ObjectChecker.assertNonNull(suiteNames, formatter, listener);
        for (String suiteName : suiteNames) {
            this.lines.put(suiteName, new ArrayList<>());
            this.cases.put(suiteName, new ArrayList<>());
        }
        this.formatter = formatter;
        this.listener = listener;
    }

    /**
     * Constructs a new report for the given suites, in registration order.
     *
     * @param suiteNames The names of every suite of the run.
     * @param formatter The formatter of the result lines.
     * @param listener The listener notified of every new line.
     * @return the report.
     */
    public static RunReport forSuites(List<String> suiteNames, ResultFormatter formatter, ReportListener listener) {
        return new RunReport(suiteNames, formatter, listener);
    }

    /**
     * Starts the wall clock of the run.
     */
    public void start() {
        synchronized (this.lock) {
            if (this.isStarted) {
                throw new IllegalStateException("report already started.");
            }
            this.isStarted = true;
            this.startNanos = System.nanoTime();
        }
    }

    public void beginSuite(String suiteName) {
        synchronized (this.lock) {
            addLine(suiteName, this.formatter.suiteHeader(suiteName));
        }
    }

    /**
     * Registers a case that has just been marked running.
     */
    public void caseStarted(TestCase testCase) {
        ObjectChecker.assertNonNull(testCase);
        synchronized (this.lock) {
            casesOf(testCase.suiteName).add(testCase);
        }
    }

    /**
     * Counts the given finished case and adds its result line.
     */
    public void caseFinished(TestCase testCase) {
        ObjectChecker.assertNonNull(testCase);
        ExecutionStatus status = testCase.getStatus();
        if (!status.isTerminal()) {
            throw new IllegalStateException("case is not finished: " + testCase);
        }

        synchronized (this.lock) {
            if (status.isSuccess()) {
                this.testsPassed++;
            } else {
                this.testsFailed++;
            }
            addLine(testCase.suiteName, this.formatter.caseResult(testCase));
        }
    }

    public void hookFailed(String suiteName, SetupException failure) {
        ObjectChecker.assertNonNull(failure);
        synchronized (this.lock) {
            addLine(suiteName, this.formatter.hookFailure(failure));
        }
    }

    /**
     * Marks the given suite as passed or failed. A suite ends exactly once.
     */
    public void endSuite(String suiteName, boolean failed) {
        ObjectChecker.assertNonNull(suiteName);
        synchronized (this.lock) {
            linesOf(suiteName);
            if (!this.endedSuites.add(suiteName)) {
                throw new IllegalStateException("suite already ended: " + suiteName);
            }
            if (failed) {
                this.suitesFailed++;
            } else {
                this.suitesPassed++;
            }
        }
    }

    /**
     * Stops the wall clock of the run and returns its summary. Calling this again returns the same summary.
     *
     * @return the summary.
     */
    public RunSummary finish() {
        synchronized (this.lock) {
            if (!this.isFinished) {
                this.isFinished = true;
                this.endNanos = System.nanoTime();
            }
            return summary();
        }
    }

    /**
     * Returns a summary of the report as it stands.
     */
    public RunSummary summary() {
        synchronized (this.lock) {
            long elapsed = !this.isStarted ? 0 : (this.isFinished ? this.endNanos : System.nanoTime()) - this.startNanos;
            return new RunSummary(this.suitesPassed, this.suitesFailed, this.testsPassed, this.testsFailed, elapsed);
        }
    }

    /**
     * Returns true iff at least one suite has failed so far.
     */
    public boolean hasFailed() {
        synchronized (this.lock) {
            return this.suitesFailed > 0;
        }
    }

    /**
     * Returns every line of the report, suites in registration order.
     */
    public List<String> getLines() {
        synchronized (this.lock) {
            return allLines();
        }
    }

    public List<String> getLines(String suiteName) {
        synchronized (this.lock) {
            return new ArrayList<>(linesOf(suiteName));
        }
    }

    /**
     * Returns every suite's cases that have started, suites in registration order and cases in execution order.
     */
    public Map<String, List<TestCase>> getCases() {
        synchronized (this.lock) {
            Map<String, List<TestCase>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, List<TestCase>> suite : this.cases.entrySet()) {
                copy.put(suite.getKey(), Collections.unmodifiableList(new ArrayList<>(suite.getValue())));
            }
            return copy;
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + summary() + " }";
    }

    private void addLine(String suiteName, String line) {
        linesOf(suiteName).add(line);
        this.listener.lineAdded(suiteName, line, allLines());
    }

    private List<String> allLines() {
        List<String> all = new ArrayList<>();
        for (List<String> suiteLines : this.lines.values()) {
            all.addAll(suiteLines);
        }
        return all;
    }

    private List<String> linesOf(String suiteName) {
        List<String> suiteLines = this.lines.get(suiteName);
        if (suiteLines == null) {
            throw new IllegalArgumentException("unknown suite: " + suiteName);
        }
        return suiteLines;
    }

    private List<TestCase> casesOf(String suiteName) {
        List<TestCase> suiteCases = this.cases.get(suiteName);
        if (suiteCases == null) {
            throw new IllegalArgumentException("unknown suite: " + suiteName);
        }
        return suiteCases;
    }
}

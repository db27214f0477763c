package tether.core.execution;

import tether.core.util.ObjectChecker;

/**
 * The live record of one test case of a suite.
 *
 * A case starts out pending, is marked running when its worker picks it up and is finished with the report of its
 * execution. Any attempt to move it backwards or to finish it twice is refused.
 *
 * This class is thread-safe.
 */
public final class TestCase {
    public final String suiteName;
    public final String identifier;
    private ExecutionStatus status = ExecutionStatus.PENDING;
    private ExecutionReport report = null;

    private TestCase(String suiteName, String identifier) {
        ObjectChecker.assertNonNull(suiteName, identifier);
        this.suiteName = suiteName;
        this.identifier = identifier;
    }

    public static TestCase pending(String suiteName, String identifier) {
        return new TestCase(suiteName, identifier);
    }

    public synchronized void markRunning() {
        transitionTo(ExecutionStatus.RUNNING);
    }

    /**
     * Finishes this case with the given report, moving it into the report's terminal status.
     *
     * @param report The execution report.
     */
    public synchronized void finish(ExecutionReport report) {
        ObjectChecker.assertNonNull(report);
        transitionTo(report.status);
        this.report = report;
    }

    public synchronized ExecutionStatus getStatus() {
        return this.status;
    }

    /**
     * Returns the report this case finished with. This method always returns null until the case is finished.
     *
     * @return the report or null.
     */
    public synchronized ExecutionReport getReport() {
        return this.report;
    }

    @Override
    public synchronized String toString() {
        return this.getClass().getSimpleName() + " { " + this.suiteName + "." + this.identifier + ": " + this.status + " }";
    }

    private void transitionTo(ExecutionStatus next) {
        if (!this.status.canTransitionTo(next)) {
            throw new IllegalStateException(this.suiteName + "." + this.identifier + " cannot move from " + this.status + " to " + next);
        }
        this.status = next;
    }
}

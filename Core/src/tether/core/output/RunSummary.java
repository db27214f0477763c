package tether.core.output;

import java.util.Locale;

/**
 * The immutable outcome of a whole run, printed once after every suite has finished.
 */
public final class RunSummary {
    public final int suitesPassed;
    public final int suitesFailed;
    public final int testsPassed;
    public final int testsFailed;
    public final long elapsedNanos;

    RunSummary(int suitesPassed, int suitesFailed, int testsPassed, int testsFailed, long elapsedNanos) {
        this.suitesPassed = suitesPassed;
        this.suitesFailed = suitesFailed;
        this.testsPassed = testsPassed;
        this.testsFailed = testsFailed;
        this.elapsedNanos = elapsedNanos;
    }

    public int totalSuites() {
        return this.suitesPassed + this.suitesFailed;
    }

    public int totalTests() {
        return this.testsPassed + this.testsFailed;
    }

    /**
     * Returns true iff at least one suite failed.
     */
    public boolean hasFailed() {
        return this.suitesFailed > 0;
    }

    public double elapsedSeconds() {
        return this.elapsedNanos / 1_000_000_000.0;
    }

    /**
     * Returns the process exit code this run maps to: 0 iff no suite failed, 1 otherwise.
     */
    public int exitCode() {
        return hasFailed() ? 1 : 0;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suites: " + this.suitesPassed + " passed, " + this.suitesFailed + " failed"
                + ", tests: " + this.testsPassed + " passed, " + this.testsFailed + " failed"
                + ", time: " + String.format(Locale.ROOT, "%.2fs", elapsedSeconds()) + " }";
    }
}

package tether.core.exception;

import java.util.Locale;

/**
 * Thrown when an assertion did not see a matching output line before its deadline elapsed.
 *
 * This covers both a pattern that never showed up and an output stream that ended before showing it.
 */
public final class TimedOutException extends Exception {
    private final String assertion;
    private final double elapsedSeconds;
    private final long timeoutSeconds;

    public TimedOutException(String assertion, double elapsedSeconds, long timeoutSeconds) {
        super(String.format(Locale.ROOT, "%s timed out after %.2f seconds", assertion, elapsedSeconds));
        this.assertion = assertion;
        this.elapsedSeconds = elapsedSeconds;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Returns a description of the assertion that timed out.
     *
     * @return the assertion description.
     */
    public String getAssertion() {
        return this.assertion;
    }

    public double getElapsedSeconds() {
        return this.elapsedSeconds;
    }

    /**
     * Returns the deadline the assertion was given.
     *
     * @return the deadline in seconds.
     */
    public long getTimeoutSeconds() {
        return this.timeoutSeconds;
    }
}

package tether.core.execution;

/**
 * The status of a test case. A case moves forward only: pending, running, then exactly one terminal status.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    PASSED,
    FAILED,

    /**
     * An assertion of the case saw no matching line before its deadline.
     */
    TIMED_OUT;

    public boolean isTerminal() {
        return (this == PASSED) || (this == FAILED) || (this == TIMED_OUT);
    }

    public boolean isSuccess() {
        return this == PASSED;
    }

    /**
     * Returns true iff a case in this status may move to the given status.
     *
     * @param next The status to move to.
     * @return whether or not the transition is allowed.
     */
    public boolean canTransitionTo(ExecutionStatus next) {
        switch (this) {
            case PENDING:
                return next == RUNNING;
            case RUNNING:
                return next.isTerminal();
            default:
                return false;
        }
    }
}

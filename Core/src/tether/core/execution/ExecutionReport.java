package tether.core.execution;

import tether.core.util.ObjectChecker;

/**
 * A report detailing the outcome of executing one test case.
 *
 * {@link ExecutionReport#status}: the terminal status of the case.
 * {@link ExecutionReport#durationNanos}: how long the case took. A timed out case reports its assertion deadline.
 * {@link ExecutionReport#failure}: why the case failed, or null if it passed.
 * {@link ExecutionReport#capturedOutput}: what the case itself wrote to stdout and stderr.
 */
public final class ExecutionReport {
    public final ExecutionStatus status;
    public final long durationNanos;
    public final FailureDetail failure;
    public final String capturedOutput;

    private ExecutionReport(ExecutionStatus status, long durationNanos, FailureDetail failure, String capturedOutput) {
        this.status = status;
        this.durationNanos = durationNanos;
        this.failure = failure;
        this.capturedOutput = capturedOutput;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { status: " + this.status + ", duration: " + this.durationNanos + "ns"
                + ((this.failure == null) ? "" : ", failure: " + this.failure.message) + " }";
    }

    public static final class Builder {
        private ExecutionStatus status;
        private Long durationNanos;
        private FailureDetail failure;
        private String capturedOutput = "";

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder durationNanos(long duration) {
            this.durationNanos = duration;
            return this;
        }

        public Builder failure(FailureDetail failure) {
            this.failure = failure;
            return this;
        }

        public Builder capturedOutput(String output) {
            this.capturedOutput = output;
            return this;
        }

        public ExecutionReport build() {
            ObjectChecker.assertNonNull(this.status, this.durationNanos, this.capturedOutput);
            if (!this.status.isTerminal()) {
                throw new IllegalStateException("a report needs a terminal status but got: " + this.status);
            }
            if ((this.status == ExecutionStatus.PASSED) != (this.failure == null)) {
                throw new IllegalStateException("exactly the failed and timed out reports carry a failure detail.");
            }
            return new ExecutionReport(this.status, this.durationNanos, this.failure, this.capturedOutput);
        }
    }
}

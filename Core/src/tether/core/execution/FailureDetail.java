package tether.core.execution;

import tether.core.exception.TimedOutException;
import tether.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Why a test case failed: a one-line message and the trace lines shown underneath the case's result line.
 *
 * The trace covers the call site of the failure only, the frames of the harness itself are cut off.
 */
public final class FailureDetail {
    public final String message;
    public final List<String> trace;

    private FailureDetail(String message, List<String> trace) {
        this.message = message;
        this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
    }

    /**
     * Describes a timed out assertion. A timeout carries its message only.
     */
    public static FailureDetail timedOut(TimedOutException timeout) {
        ObjectChecker.assertNonNull(timeout);
        return new FailureDetail(timeout.getMessage(), Collections.singletonList(timeout.getMessage()));
    }

    /**
     * Describes the given error, keeping only the stack frames above the first frame of the given harness class.
     *
     * @param error The error.
     * @param harness The class whose frames and everything below them are cut off.
     * @return the failure detail.
     */
    public static FailureDetail fromThrowable(Throwable error, Class<?> harness) {
        ObjectChecker.assertNonNull(error, harness);
        List<String> trace = new ArrayList<>();
        trace.add(describe(error));

        for (StackTraceElement frame : error.getStackTrace()) {
            if (frame.getClassName().equals(harness.getName())) {
                break;
            }
            trace.add("    at " + frame);
        }

        Throwable cause = error.getCause();
        if ((cause != null) && (cause != error)) {
            trace.add("Caused by: " + describe(cause));
        }
        return new FailureDetail(describe(error), trace);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.message + " }";
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return (message == null) ? error.getClass().getSimpleName() : error.getClass().getSimpleName() + ": " + message;
    }
}

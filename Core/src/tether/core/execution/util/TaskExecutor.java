package tether.core.execution.util;

import tether.core.exception.SetupException;
import tether.core.exception.TimedOutException;
import tether.core.execution.ExecutionReport;
import tether.core.execution.ExecutionStatus;
import tether.core.execution.FailureDetail;
import tether.core.suite.SuiteAction;
import tether.core.suite.SuiteContext;
import tether.core.suite.TestSuite;
import tether.core.util.ObjectChecker;
import tether.core.util.ThreadLocalPrintStream;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * A stateless class that runs the cases and hooks of a suite and converts whatever they raise into a recorded outcome.
 *
 * Every failure of a case is caught here, at the case boundary. Only errors of the virtual machine itself escape.
 */
public final class TaskExecutor {

    private TaskExecutor() {}

    /**
     * Runs the given case of the given suite, surrounded by the suite's beforeEach and afterEach hooks, and returns a
     * report detailing the outcome.
     *
     * afterEach runs whenever beforeEach succeeded, even if the case body failed. The first failure of the three decides
     * the outcome: a {@link TimedOutException} makes the case timed out, anything else makes it failed.
     *
     * If {@link System#out} and {@link System#err} are {@link ThreadLocalPrintStream}s, what the case prints is captured
     * into the report.
     *
     * @param suite The suite.
     * @param identifier The case identifier.
     * @param context The context of the suite.
     * @return the report.
     */
    public static ExecutionReport executeCase(TestSuite suite, String identifier, SuiteContext context) {
        ObjectChecker.assertNonNull(suite, identifier, context);
        SuiteAction body = suite.getCase(identifier);

        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        boolean isCapturing = hijackStreams(captured);

        Throwable failure = null;
        long startTime = System.nanoTime();
        long endTime;
        try {
            suite.beforeEach.execute(context);
            try {
                body.execute(context);
            } catch (Throwable t) {
                failure = t;
            }
            try {
                suite.afterEach.execute(context);
            } catch (Throwable t) {
                if (failure == null) {
                    failure = t;
                }
            }
        } catch (Throwable t) {
            failure = t;
        } finally {
            endTime = System.nanoTime();
        }

        String output = isCapturing ? closeAndRestoreHijackedStreams(captured) : "";
        if (failure instanceof VirtualMachineError) {
            throw (VirtualMachineError) failure;
        }
        if (failure instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }

        ExecutionReport.Builder report = ExecutionReport.Builder.newBuilder().capturedOutput(output);
        if (failure == null) {
            return report.status(ExecutionStatus.PASSED).durationNanos(endTime - startTime).build();
        } else if (failure instanceof TimedOutException) {
            TimedOutException timeout = (TimedOutException) failure;
            return report.status(ExecutionStatus.TIMED_OUT)
                    .durationNanos(TimeUnit.SECONDS.toNanos(timeout.getTimeoutSeconds()))
                    .failure(FailureDetail.timedOut(timeout))
                    .build();
        } else {
            return report.status(ExecutionStatus.FAILED)
                    .durationNanos(endTime - startTime)
                    .failure(FailureDetail.fromThrowable(failure, TaskExecutor.class))
                    .build();
        }
    }

    /**
     * Runs a suite-level hook.
     *
     * @param hookName The name the hook is reported under, such as "beforeAll".
     * @param hook The hook.
     * @param context The context of the suite.
     * @throws SetupException If the hook raised.
     */
    public static void executeHook(String hookName, SuiteAction hook, SuiteContext context) throws SetupException {
        ObjectChecker.assertNonNull(hookName, hook, context);
        try {
            hook.execute(context);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new SetupException(hookName, t);
        }
    }

    /**
     * Points this thread's {@link System#out} and {@link System#err} at the given buffer. Returns false and does nothing
     * if either of them is not a {@link ThreadLocalPrintStream}.
     */
    private static boolean hijackStreams(ByteArrayOutputStream hijacker) {
        if (!(System.out instanceof ThreadLocalPrintStream) || !(System.err instanceof ThreadLocalPrintStream)) {
            return false;
        }

        PrintStream stream = new PrintStream(new BufferedOutputStream(hijacker), false, StandardCharsets.UTF_8);
        ((ThreadLocalPrintStream) System.out).setStream(stream);
        ((ThreadLocalPrintStream) System.err).setStream(stream);
        return true;
    }

    /**
     * Flushes and closes the hijacking stream, restores this thread's initial streams and returns what was captured as a
     * UTF-8 string.
     */
    private static String closeAndRestoreHijackedStreams(ByteArrayOutputStream hijacker) {
        ThreadLocalPrintStream stdout = (ThreadLocalPrintStream) System.out;
        ThreadLocalPrintStream stderr = (ThreadLocalPrintStream) System.err;
        stdout.flush();
        stderr.flush();
        String contents = new String(hijacker.toByteArray(), StandardCharsets.UTF_8);
        stdout.close();
        stdout.restoreInitialStream();
        stderr.restoreInitialStream();
        return contents;
    }
}

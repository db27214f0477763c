package tether.core.assertion;

import tether.core.engine.EngineProcess;
import tether.core.exception.EndOfStreamException;
import tether.core.exception.ProcessException;
import tether.core.exception.TimedOutException;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes the output of a running engine until a line satisfies an expectation, under a deadline.
 *
 * Every assertion reads strictly forward: the lines it consumes while looking for a match, and the matching line itself,
 * are gone for the next assertion. The scan runs on a background task so that a deadline can interrupt a read that is
 * blocked on a silent engine. A timed out scan stops before its next read, so at most the line its matcher was looking
 * at when the deadline passed is lost; the engine itself is left running.
 *
 * If the engine's output ends before a match is found the assertion keeps waiting until the deadline and then times out.
 */
public final class AssertionEngine {
    private static final Logger LOGGER = Logger.forClass(AssertionEngine.class);
    public static final long DEFAULT_TIMEOUT_SECONDS = 300;
    private static final ExecutorService SCANNERS = Executors.newCachedThreadPool(new ScannerThreadFactory());
    private final EngineProcess engine;
    private final long timeoutSeconds;

    private AssertionEngine(EngineProcess engine, long timeoutSeconds) {
        ObjectChecker.assertNonNull(engine);
        ObjectChecker.assertPositive(timeoutSeconds);
        this.engine = engine;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Constructs a new assertion engine reading from the given engine with the default deadline.
     *
     * @param engine The engine whose output is asserted on.
     * @return the assertion engine.
     */
    public static AssertionEngine forEngine(EngineProcess engine) {
        return new AssertionEngine(engine, DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Constructs a new assertion engine reading from the given engine where every assertion has the given deadline.
     *
     * @param engine The engine whose output is asserted on.
     * @param timeoutSeconds The deadline of each assertion, in seconds.
     * @return the assertion engine.
     */
    public static AssertionEngine withTimeout(EngineProcess engine, long timeoutSeconds) {
        return new AssertionEngine(engine, timeoutSeconds);
    }

    /**
     * Waits for a line equal to the expected one.
     */
    public void expectEquals(String expected) throws ProcessException, TimedOutException, InterruptedException {
        scan("expectEquals(\"" + expected + "\")", LineMatchers.exactly(expected));
    }

    /**
     * Waits for a line that as a whole matches the given glob pattern.
     *
     * @see GlobPattern
     */
    public void expectGlob(String pattern) throws ProcessException, TimedOutException, InterruptedException {
        scan("expectGlob(\"" + pattern + "\")", LineMatchers.glob(pattern));
    }

    public void expectContains(String fragment) throws ProcessException, TimedOutException, InterruptedException {
        scan("expectContains(\"" + fragment + "\")", LineMatchers.containing(fragment));
    }

    public void expectStartsWith(String prefix) throws ProcessException, TimedOutException, InterruptedException {
        scan("expectStartsWith(\"" + prefix + "\")", LineMatchers.startingWith(prefix));
    }

    /**
     * Waits for a line that satisfies the given matcher. The matcher may keep state across lines, and it may throw an
     * {@link AssertionError} to fail the assertion on the spot.
     *
     * @param description A name for the assertion, used when it times out.
     * @param matcher The matcher.
     */
    public void expectOutput(String description, LineMatcher matcher) throws ProcessException, TimedOutException, InterruptedException {
        scan(description, matcher);
    }

    /**
     * Reads lines from the engine, each stripped of surrounding whitespace, until the matcher accepts one or the
     * deadline passes.
     *
     * @param description A name for the assertion, used when it times out.
     * @param matcher The matcher.
     * @throws TimedOutException If no line matched before the deadline.
     * @throws ProcessException If the engine could not be read from.
     * @throws AssertionError If the matcher failed the assertion.
     * @throws InterruptedException If the calling thread was interrupted while waiting.
     */
    public void scan(String description, LineMatcher matcher) throws ProcessException, TimedOutException, InterruptedException {
        ObjectChecker.assertNonNull(description, matcher);

        long startTime = System.nanoTime();
        long deadline = startTime + TimeUnit.SECONDS.toNanos(this.timeoutSeconds);
        Future<Boolean> scan = SCANNERS.submit(() -> scanUntilMatch(matcher));

        try {
            if (scan.get(this.timeoutSeconds, TimeUnit.SECONDS)) {
                return;
            }
            // The output ended without a match.
            waitUntil(deadline);
            throw new TimedOutException(description, secondsSince(startTime), this.timeoutSeconds);
        } catch (TimeoutException e) {
            if (!scan.cancel(true) && completedWithMatch(scan)) {
                return;
            }
            LOGGER.log(description + " timed out, abandoning its pending read.");
            throw new TimedOutException(description, secondsSince(startTime), this.timeoutSeconds);
        } catch (InterruptedException e) {
            scan.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    public long getTimeoutSeconds() {
        return this.timeoutSeconds;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { engine: " + this.engine + ", timeout: " + this.timeoutSeconds + "s }";
    }

    /**
     * Returns true if a match was found, false if the output ended first.
     */
    private boolean scanUntilMatch(LineMatcher matcher) throws Exception {
        try {
            while (true) {
                // A cancelled scan must not consume another line.
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("scan cancelled");
                }
                if (matcher.matches(this.engine.readLine().strip())) {
                    return true;
                }
            }
        } catch (EndOfStreamException e) {
            return false;
        }
    }

    private static boolean completedWithMatch(Future<Boolean> scan) {
        if (!scan.isDone() || scan.isCancelled()) {
            return false;
        }
        try {
            return scan.get();
        } catch (CancellationException | ExecutionException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ProcessException unwrap(Throwable cause) throws InterruptedException {
        if (cause instanceof AssertionError) {
            throw (AssertionError) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        if (cause instanceof ProcessException) {
            return (ProcessException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof InterruptedException) {
            throw (InterruptedException) cause;
        }
        return new ProcessException("line matcher failed: " + cause, cause);
    }

    private static void waitUntil(long deadlineNanos) throws InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining > 0) {
            TimeUnit.NANOSECONDS.sleep(remaining);
        }
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static final class ScannerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "AssertionScanner-" + this.count.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}

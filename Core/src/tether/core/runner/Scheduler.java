package tether.core.runner;

import tether.core.lifecycle.PanicMonitor;
import tether.core.output.Reporter;
import tether.core.output.RunReport;
import tether.core.output.RunSummary;
import tether.core.suite.SuiteRegistry;
import tether.core.suite.TestSuite;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;
import tether.core.util.ThreadLocalPrintStream;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;

/**
 * Runs every registered suite concurrently, one worker thread per suite, and reports on them as they go.
 *
 * All workers are released together. While they run, {@link System#out} and {@link System#err} are replaced with
 * {@link ThreadLocalPrintStream}s so that whatever a case prints is captured with its result instead of landing in the
 * middle of the live report. The summary is always printed once every worker is done, even if a worker panicked.
 *
 * A scheduler runs once.
 */
public final class Scheduler {
    private static final Logger LOGGER = Logger.forClass(Scheduler.class);
    private final SuiteRegistry registry;
    private final Reporter reporter;
    private final PanicMonitor panicMonitor = new PanicMonitor();
    private RunReport report = null;

    private Scheduler(SuiteRegistry registry, Reporter reporter) {
        ObjectChecker.assertNonNull(registry, reporter);
        this.registry = registry;
        this.reporter = reporter;
    }

    /**
     * Constructs a new scheduler for the suites in the given registry, reporting through the given reporter.
     *
     * @param registry The suites to run.
     * @param reporter The reporter.
     * @return the scheduler.
     */
    public static Scheduler withReporter(SuiteRegistry registry, Reporter reporter) {
        return new Scheduler(registry, reporter);
    }

    /**
     * Runs every suite and returns the summary of the run, after it was printed.
     *
     * @return the summary.
     * @throws IllegalStateException If a worker panicked, or this scheduler already ran.
     * @throws InterruptedException If interrupted while waiting for the workers. The workers are interrupted too.
     */
    public RunSummary run() throws InterruptedException {
        List<TestSuite> suites = this.registry.suites();
        List<String> suiteNames = new ArrayList<>();
        for (TestSuite suite : suites) {
            suiteNames.add(suite.name);
        }

        RunReport report;
        synchronized (this) {
            if (this.report != null) {
                throw new IllegalStateException("scheduler already ran.");
            }
            this.report = RunReport.forSuites(suiteNames, this.reporter.getFormatter(), this.reporter);
            report = this.report;
        }

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(ThreadLocalPrintStream.withInitialStream(originalOut));
        System.setErr(ThreadLocalPrintStream.withInitialStream(originalErr));

        RunSummary summary;
        try {
            runWorkers(suites, report);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
            summary = report.finish();
            this.reporter.printSummary(summary);
        }

        if (this.panicMonitor.hasPanicked()) {
            Throwable panic = this.panicMonitor.getCauseOfPanic();
            throw new IllegalStateException("a suite worker panicked: " + panic, panic);
        }
        return summary;
    }

    /**
     * Returns true iff at least one suite failed. This method always returns false before the run started.
     */
    public boolean hasFailed() {
        RunReport report = getReport();
        return (report != null) && (report.hasFailed());
    }

    /**
     * Returns the report of the run, or null if the run has not started.
     */
    public synchronized RunReport getReport() {
        return this.report;
    }

    private void runWorkers(List<TestSuite> suites, RunReport report) throws InterruptedException {
        if (suites.isEmpty()) {
            report.start();
            return;
        }

        CyclicBarrier startBarrier = new CyclicBarrier(suites.size(), report::start);
        List<Thread> workers = new ArrayList<>();
        for (TestSuite suite : suites) {
            TestSuiteRunner runner = TestSuiteRunner.forSuite(suite, report, startBarrier, this.panicMonitor);
            workers.add(new Thread(runner, "TestSuiteRunner-" + suite.name));
        }

        LOGGER.log("Starting " + workers.size() + " suite workers.");
        for (Thread worker : workers) {
            worker.start();
        }

        try {
            for (Thread worker : workers) {
                worker.join();
            }
        } catch (InterruptedException e) {
            for (Thread worker : workers) {
                worker.interrupt();
            }
            throw e;
        }
        LOGGER.log("All suite workers are done.");
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.registry + " }";
    }
}

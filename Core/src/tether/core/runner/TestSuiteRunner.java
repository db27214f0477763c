package tether.core.runner;

import tether.core.exception.SetupException;
import tether.core.execution.ExecutionReport;
import tether.core.execution.TestCase;
import tether.core.execution.util.TaskExecutor;
import tether.core.lifecycle.PanicMonitor;
import tether.core.output.RunReport;
import tether.core.suite.SuiteContext;
import tether.core.suite.TestSuite;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The worker that runs one suite from start to end, recording everything into the shared {@link RunReport}.
 *
 * The worker waits on the run's start barrier, creates the suite's scratch directory, runs beforeAll, then each case in
 * declaration order, then afterAll exactly once, and finally deletes the scratch directory and ends the suite. If
 * beforeAll fails no case runs, but afterAll is still attempted. A failing case never stops the suite, unless it left
 * the worker interrupted: then the remaining cases are skipped and the suite fails.
 *
 * Anything that escapes this (a defect in the harness, not in a test) is reported to the {@link PanicMonitor}.
 */
public final class TestSuiteRunner implements Runnable {
    private static final Logger LOGGER = Logger.forClass(TestSuiteRunner.class);
    private static final String SCRATCH_DIRECTORY_PREFIX = "tether-";
    private final TestSuite suite;
    private final RunReport report;
    private final CyclicBarrier startBarrier;
    private final PanicMonitor panicMonitor;

    private TestSuiteRunner(TestSuite suite, RunReport report, CyclicBarrier startBarrier, PanicMonitor panicMonitor) {
        ObjectChecker.assertNonNull(suite, report, startBarrier, panicMonitor);
        this.suite = suite;
        this.report = report;
        this.startBarrier = startBarrier;
        this.panicMonitor = panicMonitor;
    }

    /**
     * Constructs a new worker for the given suite.
     *
     * @param suite The suite to run.
     * @param report The shared report.
     * @param startBarrier The barrier every worker of the run waits on before it starts.
     * @param panicMonitor The panic monitor.
     * @return the worker.
     */
    public static TestSuiteRunner forSuite(TestSuite suite, RunReport report, CyclicBarrier startBarrier, PanicMonitor panicMonitor) {
        return new TestSuiteRunner(suite, report, startBarrier, panicMonitor);
    }

    @Override
    public void run() {
        try {
            this.startBarrier.await();
            LOGGER.log("Running suite " + this.suite.name + " with " + this.suite.numberOfCases() + " cases.");
            runSuite();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            this.panicMonitor.panic(e);
        } catch (Throwable t) {
            this.panicMonitor.panic(t);
        } finally {
            LOGGER.log("Exiting.");
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suite: " + this.suite.name + " }";
    }

    private void runSuite() {
        this.report.beginSuite(this.suite.name);

        File scratchDirectory;
        try {
            scratchDirectory = Files.createTempDirectory(SCRATCH_DIRECTORY_PREFIX).toFile();
        } catch (IOException e) {
            this.report.hookFailed(this.suite.name, new SetupException("scratch directory", e));
            this.report.endSuite(this.suite.name, true);
            return;
        }

        SuiteContext context = SuiteContext.forSuite(this.suite.name, scratchDirectory);
        boolean failed = false;
        try {
            TaskExecutor.executeHook("beforeAll", this.suite.beforeAll, context);
            failed = runCases(context);
        } catch (SetupException e) {
            LOGGER.log("Suite " + this.suite.name + " could not be set up, running none of its cases: " + e.getMessage());
            this.report.hookFailed(this.suite.name, e);
            failed = true;
        }

        try {
            TaskExecutor.executeHook("afterAll", this.suite.afterAll, context);
        } catch (SetupException e) {
            LOGGER.log("Suite " + this.suite.name + " could not be torn down: " + e.getMessage());
            this.report.hookFailed(this.suite.name, e);
            failed = true;
        }

        deleteScratchDirectory(scratchDirectory);
        this.report.endSuite(this.suite.name, failed);
    }

    /**
     * Runs every case in declaration order until one leaves this worker interrupted. Returns true iff any case did not
     * pass or cases were skipped.
     */
    private boolean runCases(SuiteContext context) {
        boolean anyFailed = false;
        for (String identifier : this.suite.caseIdentifiers()) {
            TestCase testCase = TestCase.pending(this.suite.name, identifier);
            testCase.markRunning();
            this.report.caseStarted(testCase);

            ExecutionReport outcome = TaskExecutor.executeCase(this.suite, identifier, context);
            testCase.finish(outcome);
            this.report.caseFinished(testCase);
            LOGGER.log("Completed " + this.suite.name + "." + identifier + ": " + outcome);

            anyFailed |= !outcome.status.isSuccess();

            // Every later read would fail on the pending interrupt.
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.log("Worker of " + this.suite.name + " was interrupted during " + identifier + ", skipping its remaining cases.");
                return true;
            }
        }
        return anyFailed;
    }

    private static void deleteScratchDirectory(File directory) {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory.toPath())) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            LOGGER.log("Failed to list scratch directory " + directory + ", leaving it behind.", e);
            return;
        }

        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOGGER.log("Failed to delete " + path + ": " + e.getMessage());
            }
        }
    }
}

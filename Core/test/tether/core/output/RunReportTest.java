package tether.core.output;

import org.junit.Test;
import tether.core.exception.SetupException;
import tether.core.execution.TestCase;
import tether.core.helper.AssertHelper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RunReportTest {
    private final List<String> notifiedSuites = new ArrayList<>();
    private final RunReport report = RunReport.forSuites(Arrays.asList("TestCLI", "TestInteractive"), ResultFormatter.plain(),
            (suiteName, line, allLines) -> this.notifiedSuites.add(suiteName));

    @Test
    public void testLinesFollowRegistrationOrder() {
        this.report.start();
        this.report.beginSuite("TestInteractive");
        this.report.beginSuite("TestCLI");
        this.report.caseFinished(OutputFixtures.passed("TestInteractive", "test_uci", 1_000_000));
        this.report.caseFinished(OutputFixtures.passed("TestCLI", "test_eval", 2_000_000));

        assertThat(this.report.getLines(), contains(
                "Test Suite: TestCLI",
                "    ✓ test_eval (2.00ms)",
                "Test Suite: TestInteractive",
                "    ✓ test_uci (1.00ms)"));
        assertThat(this.notifiedSuites, contains("TestInteractive", "TestCLI", "TestInteractive", "TestCLI"));
    }

    @Test
    public void testCounters() {
        this.report.start();
        this.report.caseFinished(OutputFixtures.passed("TestCLI", "test_eval", 1));
        this.report.caseFinished(OutputFixtures.failed("TestCLI", "test_d", 1, ""));
        this.report.caseFinished(OutputFixtures.timedOut("TestCLI", "test_go", 1));
        this.report.endSuite("TestCLI", true);
        this.report.endSuite("TestInteractive", false);

        RunSummary summary = this.report.finish();
        assertEquals(1, summary.testsPassed);
        assertEquals(2, summary.testsFailed);
        assertEquals(1, summary.suitesPassed);
        assertEquals(1, summary.suitesFailed);
        assertTrue(summary.hasFailed());
        assertEquals(1, summary.exitCode());
        assertTrue(this.report.hasFailed());
    }

    @Test
    public void testAllPassedExitsZero() {
        this.report.start();
        this.report.endSuite("TestCLI", false);
        this.report.endSuite("TestInteractive", false);

        RunSummary summary = this.report.finish();
        assertFalse(summary.hasFailed());
        assertEquals(0, summary.exitCode());
        assertEquals(summary.elapsedNanos, this.report.finish().elapsedNanos);
    }

    @Test
    public void testSuiteEndsOnce() {
        this.report.endSuite("TestCLI", false);
        AssertHelper.assertThrows(IllegalStateException.class, () -> this.report.endSuite("TestCLI", true));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> this.report.endSuite("TestUnknown", true));
    }

    @Test
    public void testUnfinishedCaseRefused() {
        TestCase running = TestCase.pending("TestCLI", "test_eval");
        running.markRunning();
        AssertHelper.assertThrows(IllegalStateException.class, () -> this.report.caseFinished(running));
    }

    @Test
    public void testHookFailureLine() {
        this.report.hookFailed("TestCLI", new SetupException("afterAll", new RuntimeException("engine hung")));
        assertThat(this.report.getLines("TestCLI").get(0), startsWith("    ✗ afterAll failed"));
    }

    @Test
    public void testCasesInExecutionOrder() {
        TestCase first = OutputFixtures.passed("TestCLI", "test_b", 1);
        TestCase second = OutputFixtures.passed("TestCLI", "test_a", 1);
        this.report.caseStarted(first);
        this.report.caseStarted(second);

        Map<String, List<TestCase>> cases = this.report.getCases();
        assertThat(cases.keySet(), contains("TestCLI", "TestInteractive"));
        assertThat(cases.get("TestCLI"), contains(first, second));
        assertTrue(cases.get("TestInteractive").isEmpty());
    }
}

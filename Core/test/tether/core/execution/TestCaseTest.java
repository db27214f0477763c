package tether.core.execution;

import org.junit.Test;
import tether.core.exception.TimedOutException;
import tether.core.helper.AssertHelper;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestCaseTest {

    @Test
    public void testForwardTransitions() {
        TestCase testCase = TestCase.pending("TestCLI", "test_eval");
        assertEquals(ExecutionStatus.PENDING, testCase.getStatus());
        assertThat(testCase.getReport(), nullValue());

        testCase.markRunning();
        assertEquals(ExecutionStatus.RUNNING, testCase.getStatus());

        ExecutionReport report = passed(1_000_000);
        testCase.finish(report);
        assertEquals(ExecutionStatus.PASSED, testCase.getStatus());
        assertEquals(report, testCase.getReport());
    }

    @Test
    public void testNoBackwardOrRepeatedTransitions() {
        TestCase pending = TestCase.pending("TestCLI", "test_eval");
        AssertHelper.assertThrows(IllegalStateException.class, () -> pending.finish(passed(1)));

        TestCase finished = TestCase.pending("TestCLI", "test_d");
        finished.markRunning();
        finished.finish(passed(1));
        AssertHelper.assertThrows(IllegalStateException.class, finished::markRunning);
        AssertHelper.assertThrows(IllegalStateException.class, () -> finished.finish(passed(1)));
        assertEquals(ExecutionStatus.PASSED, finished.getStatus());
    }

    @Test
    public void testStatusTransitionTable() {
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING));
        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.PASSED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.TIMED_OUT));
        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.PENDING));
        for (ExecutionStatus next : ExecutionStatus.values()) {
            assertFalse(ExecutionStatus.FAILED.canTransitionTo(next));
            assertFalse(ExecutionStatus.TIMED_OUT.canTransitionTo(next));
        }
    }

    @Test
    public void testReportNeedsFailureIffNotPassed() {
        AssertHelper.assertThrows(IllegalStateException.class, () -> ExecutionReport.Builder.newBuilder()
                .status(ExecutionStatus.FAILED)
                .durationNanos(1)
                .build());
        AssertHelper.assertThrows(IllegalStateException.class, () -> ExecutionReport.Builder.newBuilder()
                .status(ExecutionStatus.RUNNING)
                .durationNanos(1)
                .build());
    }

    @Test
    public void testTimeoutFailureCarriesMessageOnly() {
        FailureDetail detail = FailureDetail.timedOut(new TimedOutException("expectEquals(\"readyok\")", 1.004, 1));
        assertEquals("expectEquals(\"readyok\") timed out after 1.00 seconds", detail.message);
        assertThat(detail.trace, contains(detail.message));
    }

    @Test
    public void testTraceStopsAtHarness() {
        AssertionError error = new AssertionError("expected 3");
        error.setStackTrace(new StackTraceElement[]{
                new StackTraceElement("suites.TestCLI", "lambda$define$0", "TestCLI.java", 42),
                new StackTraceElement(TestCaseTest.class.getName(), "run", "TestCaseTest.java", 7),
                new StackTraceElement("java.lang.Thread", "run", "Thread.java", 833)
        });

        FailureDetail detail = FailureDetail.fromThrowable(error, TestCaseTest.class);
        assertEquals("AssertionError: expected 3", detail.message);
        assertThat(detail.trace, contains("AssertionError: expected 3", "    at suites.TestCLI.lambda$define$0(TestCLI.java:42)"));
    }

    private static ExecutionReport passed(long durationNanos) {
        return ExecutionReport.Builder.newBuilder()
                .status(ExecutionStatus.PASSED)
                .durationNanos(durationNanos)
                .build();
    }
}

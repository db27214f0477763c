package tether.core.execution.util;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import tether.core.exception.SetupException;
import tether.core.exception.TimedOutException;
import tether.core.execution.ExecutionReport;
import tether.core.execution.ExecutionStatus;
import tether.core.helper.AssertHelper;
import tether.core.suite.SuiteAction;
import tether.core.suite.SuiteContext;
import tether.core.suite.TestSuite;
import tether.core.util.ThreadLocalPrintStream;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TaskExecutorTest {
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();
    private final List<String> calls = new ArrayList<>();
    private SuiteContext context;

    @Before
    public void createContext() {
        this.context = SuiteContext.forSuite("TestExecutor", this.folder.getRoot());
    }

    @Test
    public void testPassingCaseRunsInsideEachHooks() {
        TestSuite suite = suiteWith(context -> this.calls.add("body"));

        ExecutionReport report = TaskExecutor.executeCase(suite, "test_case", this.context);
        assertEquals(ExecutionStatus.PASSED, report.status);
        assertThat(report.failure, nullValue());
        assertThat(this.calls, contains("beforeEach", "body", "afterEach"));
    }

    @Test
    public void testAssertionFailure() {
        TestSuite suite = suiteWith(context -> {
            throw new AssertionError("bestmove missing");
        });

        ExecutionReport report = TaskExecutor.executeCase(suite, "test_case", this.context);
        assertEquals(ExecutionStatus.FAILED, report.status);
        assertEquals("AssertionError: bestmove missing", report.failure.message);
        assertThat(this.calls, contains("beforeEach", "afterEach"));
    }

    @Test
    public void testTimeoutReportsDeadlineAsDuration() {
        TestSuite suite = suiteWith(context -> {
            throw new TimedOutException("expectEquals(\"uciok\")", 3.01, 3);
        });

        ExecutionReport report = TaskExecutor.executeCase(suite, "test_case", this.context);
        assertEquals(ExecutionStatus.TIMED_OUT, report.status);
        assertEquals(TimeUnit.SECONDS.toNanos(3), report.durationNanos);
        assertThat(report.failure.message, containsString("timed out after 3.01 seconds"));
    }

    @Test
    public void testOtherFaultFailsCase() {
        TestSuite suite = suiteWith(context -> {
            throw new IllegalStateException("engine said something odd");
        });

        ExecutionReport report = TaskExecutor.executeCase(suite, "test_case", this.context);
        assertEquals(ExecutionStatus.FAILED, report.status);
        assertEquals("IllegalStateException: engine said something odd", report.failure.message);
    }

    @Test
    public void testFailingBeforeEachSkipsBodyAndAfterEach() {
        TestSuite suite = TestSuite.Builder.newBuilder("TestExecutor")
                .beforeEach(context -> {
                    throw new IllegalStateException("no engine");
                })
                .afterEach(context -> this.calls.add("afterEach"))
                .test("test_case", context -> this.calls.add("body"))
                .build();

        ExecutionReport report = TaskExecutor.executeCase(suite, "test_case", this.context);
        assertEquals(ExecutionStatus.FAILED, report.status);
        assertTrue(this.calls.isEmpty());
    }

    @Test
    public void testFailingAfterEachFailsPassingCase() {
        TestSuite suite = TestSuite.Builder.newBuilder("TestExecutor")
                .afterEach(context -> {
                    throw new AssertionError("engine left in a bad state");
                })
                .test("test_case", context -> this.calls.add("body"))
                .build();

        ExecutionReport report = TaskExecutor.executeCase(suite, "test_case", this.context);
        assertEquals(ExecutionStatus.FAILED, report.status);
        assertEquals("AssertionError: engine left in a bad state", report.failure.message);
    }

    @Test
    public void testHookFailureBecomesSetupException() {
        SetupException failure = AssertHelper.assertThrows(SetupException.class, () -> TaskExecutor.executeHook("beforeAll", context -> {
            throw new IllegalStateException("engine missing");
        }, this.context));
        assertEquals("beforeAll", failure.getHook());
        assertEquals(IllegalStateException.class, failure.getCause().getClass());
    }

    @Test
    public void testCaseOutputIsCaptured() {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(ThreadLocalPrintStream.withInitialStream(originalOut));
        System.setErr(ThreadLocalPrintStream.withInitialStream(originalErr));
        try {
            TestSuite suite = suiteWith(context -> {
                System.out.println("to stdout");
                System.err.println("to stderr");
            });

            ExecutionReport report = TaskExecutor.executeCase(suite, "test_case", this.context);
            assertThat(report.capturedOutput, containsString("to stdout"));
            assertThat(report.capturedOutput, containsString("to stderr"));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Test
    public void testNothingCapturedWithoutThreadLocalStreams() {
        ExecutionReport report = TaskExecutor.executeCase(suiteWith(context -> {}), "test_case", this.context);
        assertEquals("", report.capturedOutput);
    }

    private TestSuite suiteWith(SuiteAction body) {
        return TestSuite.Builder.newBuilder("TestExecutor")
                .beforeEach(context -> this.calls.add("beforeEach"))
                .afterEach(context -> this.calls.add("afterEach"))
                .test("test_case", body)
                .build();
    }
}

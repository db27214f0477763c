package tether.core.output;

import org.junit.Test;
import tether.core.exception.SetupException;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;

public class ResultFormatterTest {

    @Test
    public void testPlainSuccessLine() {
        String line = ResultFormatter.plain().caseResult(OutputFixtures.passed("TestCLI", "test_eval", 12_345_678));
        assertEquals("    ✓ test_eval (12.35ms)", line);
    }

    @Test
    public void testColoredSuccessLine() {
        String line = ResultFormatter.colored().caseResult(OutputFixtures.passed("TestCLI", "test_eval", 1_000_000));
        assertEquals("    " + ResultFormatter.GREEN + "✓ test_eval (1.00ms)" + ResultFormatter.RESET, line);
    }

    @Test
    public void testFailureLineWithTraceAndOutput() {
        String line = ResultFormatter.plain().caseResult(OutputFixtures.failed("TestCLI", "test_uci", 2_500_000, "engine said hi\n"));
        String[] physicalLines = line.split("\n");

        assertEquals("    ✗ test_uci (2.50ms)", physicalLines[0]);
        assertEquals("  AssertionError: expected readyok", physicalLines[1]);
        assertEquals("      | engine said hi", physicalLines[physicalLines.length - 1]);
    }

    @Test
    public void testColoredTraceIsCyan() {
        String line = ResultFormatter.colored().caseResult(OutputFixtures.failed("TestCLI", "test_uci", 1, ""));
        assertThat(line, containsString("\n  " + ResultFormatter.CYAN + "AssertionError: expected readyok" + ResultFormatter.RESET));
        assertThat(line, startsWith("    " + ResultFormatter.RED + "✗ test_uci"));
    }

    @Test
    public void testTimedOutLineShowsDeadline() {
        String line = ResultFormatter.plain().caseResult(OutputFixtures.timedOut("TestInteractive", "test_go_depth", 300));
        assertThat(line, startsWith("    ✗ test_go_depth (300000.00ms)"));
        assertThat(line, containsString("timed out after 300.00 seconds"));
    }

    @Test
    public void testHookFailure() {
        String line = ResultFormatter.plain().hookFailure(new SetupException("beforeAll", new IllegalStateException("no engine")));
        assertThat(line, startsWith("    ✗ beforeAll failed\n  IllegalStateException: no engine"));
    }

    @Test
    public void testSummary() {
        List<String> lines = ResultFormatter.plain().summary(new RunSummary(2, 1, 10, 3, 1_234_000_000L));

        assertThat(lines, hasItem("Test Summary"));
        assertThat(lines, hasItem("    Test Suites: 2 passed, 1 failed, 3 total"));
        assertThat(lines, hasItem("    Tests:       10 passed, 3 failed, 13 total"));
        assertThat(lines, hasItem("    Time:        1.23s"));
    }

    @Test
    public void testPlainSummaryHasNoEscapes() {
        for (String line : ResultFormatter.plain().summary(new RunSummary(1, 0, 1, 0, 0))) {
            assertThat(line, not(containsString("\033")));
        }
        assertThat(ResultFormatter.colored().summary(new RunSummary(1, 0, 1, 0, 0)), hasItem(ResultFormatter.WHITE_BOLD + "Test Summary" + ResultFormatter.RESET));
    }

    @Test
    public void testSuiteHeader() {
        assertEquals("Test Suite: TestCLI", ResultFormatter.plain().suiteHeader("TestCLI"));
    }
}

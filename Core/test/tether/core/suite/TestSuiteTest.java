package tether.core.suite;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import tether.core.helper.AssertHelper;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;

public class TestSuiteTest {
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testCasesKeepDeclarationOrder() {
        TestSuite suite = TestSuite.Builder.newBuilder("ordering")
                .test("test_zeta", context -> {})
                .test("test_alpha", context -> {})
                .test("test_mid", context -> {})
                .build();

        assertThat(suite.caseIdentifiers(), contains("test_zeta", "test_alpha", "test_mid"));
        assertEquals(3, suite.numberOfCases());
    }

    @Test
    public void testDuplicateCaseRejected() {
        TestSuite.Builder builder = TestSuite.Builder.newBuilder("duplicates").test("test_one", context -> {});
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> builder.test("test_one", context -> {}));
    }

    @Test
    public void testCaseNamingConvention() {
        TestSuite.Builder builder = TestSuite.Builder.newBuilder("naming");
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> builder.test("helper", context -> {}));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> builder.test("test_", context -> {}));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> builder.test("Test_upper", context -> {}));
    }

    @Test
    public void testUnsetHooksDoNothing() throws Exception {
        TestSuite suite = TestSuite.Builder.newBuilder("hooks").build();
        SuiteContext context = SuiteContext.forSuite("hooks", this.folder.getRoot());

        suite.beforeAll.execute(context);
        suite.beforeEach.execute(context);
        suite.afterEach.execute(context);
        suite.afterAll.execute(context);
        assertEquals(0, suite.numberOfCases());
    }

    @Test
    public void testUnknownCase() {
        TestSuite suite = TestSuite.Builder.newBuilder("lookup").test("test_known", context -> {}).build();
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> suite.getCase("test_unknown"));
    }

    @Test
    public void testWriteScratchFile() throws Exception {
        SuiteContext context = SuiteContext.forSuite("scratch", this.folder.getRoot());

        File file = context.writeScratchFile("bench.epd", "8/8/8/8/8/8/8/8 w - - 0 1\n");
        assertEquals(this.folder.getRoot(), file.getParentFile());
        assertEquals("8/8/8/8/8/8/8/8 w - - 0 1\n", new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));

        AssertHelper.assertThrows(IllegalArgumentException.class, () -> context.writeScratchFile("../escape.txt", "x"));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> context.writeScratchFile("..", "x"));
    }
}

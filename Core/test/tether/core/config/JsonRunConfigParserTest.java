package tether.core.config;

import org.junit.Test;
import tether.core.engine.EngineInvocation;
import tether.core.engine.Instrumentation;
import tether.core.type.Result;

import java.io.File;
import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class JsonRunConfigParserTest {
    private final JsonRunConfigParser parser = new JsonRunConfigParser();

    @Test
    public void testParseFullConfigFile() throws Exception {
        File file = new File(JsonRunConfigParserTest.class.getResource("/config/run-config.json").toURI());
        Result<RunConfig.Builder> result = this.parser.parseRunConfigFile(file);
        assertTrue(result.getError(), result.isSuccess());

        RunConfig config = result.getData().build();
        assertEquals("./stockfish", config.enginePath);
        assertEquals(Instrumentation.VALGRIND_THREAD, config.instrumentation);
        assertThat(config.prefix, contains("nice", "-n", "10"));
        assertEquals("suppressions=tsan.supp", config.environment.get("TSAN_OPTIONS"));
        assertEquals(new File("build"), config.workingDirectory);
        assertEquals(120, config.timeoutSeconds);
        assertEquals(ReporterMode.APPEND_ONLY, config.reporterMode);
        assertFalse(config.colors);
        assertEquals(2500, config.terminateGraceMillis);
        assertEquals("quit", config.shutdownCommand);
        assertEquals(new File("results.json"), config.reportFile);
    }

    @Test
    public void testEmptyObjectKeepsDefaults() {
        Result<RunConfig.Builder> result = this.parser.parseRunConfig("{}");
        assertTrue(result.isSuccess());
        assertFalse(result.getData().hasEnginePath());

        RunConfig config = result.getData().enginePath("stockfish").build();
        assertEquals(Instrumentation.NONE, config.instrumentation);
        assertEquals(300, config.timeoutSeconds);
        assertEquals(ReporterMode.INTERACTIVE, config.reporterMode);
        assertTrue(config.colors);
        assertNull(config.shutdownCommand);
        assertNull(config.reportFile);
    }

    @Test
    public void testWrongTypeNamesAttribute() {
        Result<RunConfig.Builder> result = this.parser.parseRunConfig("{\"timeout_seconds\": \"soon\"}");
        assertFalse(result.isSuccess());
        assertThat(result.getError(), startsWith("Failed to parse run config: "));
        assertThat(result.getError(), containsString("timeout_seconds"));
    }

    @Test
    public void testFractionalNumberRejected() {
        Result<RunConfig.Builder> result = this.parser.parseRunConfig("{\"terminate_grace_millis\": 1.5}");
        assertFalse(result.isSuccess());
        assertThat(result.getError(), containsString("whole Number"));
    }

    @Test
    public void testUnknownInstrumentationRejected() {
        Result<RunConfig.Builder> result = this.parser.parseRunConfig("{\"instrumentation\": \"purify\"}");
        assertFalse(result.isSuccess());
        assertThat(result.getError(), containsString("instrumentation"));
    }

    @Test
    public void testMalformedJsonRejected() {
        assertThat(this.parser.parseRunConfig("{\"engine_path\": ").getError(), containsString("malformed JSON"));
        assertThat(this.parser.parseRunConfig("[1, 2]").getError(), containsString("not a JSON object"));
    }

    @Test
    public void testMissingFileRejected() {
        Result<RunConfig.Builder> result = this.parser.parseRunConfigFile(new File("does-not-exist.json"));
        assertFalse(result.isSuccess());
        assertThat(result.getError(), containsString("cannot read"));
    }

    @Test
    public void testInstrumentationPrefixPrecedesExtraPrefix() {
        RunConfig config = RunConfig.Builder.newBuilder()
                .enginePath("./stockfish")
                .instrumentation(Instrumentation.VALGRIND)
                .prefix(Arrays.asList("taskset", "-c", "0"))
                .build();

        EngineInvocation invocation = config.baseInvocation().toBuilderWithoutArguments().argument("bench").build();
        assertThat(invocation.command(), contains("valgrind", "--error-exitcode=42", "--errors-for-leak-kinds=all", "--leak-check=full",
                "taskset", "-c", "0", "./stockfish", "bench"));
    }
}

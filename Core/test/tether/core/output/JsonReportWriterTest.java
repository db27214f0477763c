package tether.core.output;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import tether.core.execution.TestCase;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class JsonReportWriterTest {
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testWritesCountersAndCases() throws Exception {
        Map<String, List<TestCase>> cases = new LinkedHashMap<>();
        cases.put("TestCLI", Arrays.asList(
                OutputFixtures.passed("TestCLI", "test_eval", 5_000_000),
                OutputFixtures.failed("TestCLI", "test_d", 1_000_000, "")));
        cases.put("TestInteractive", Collections.singletonList(OutputFixtures.timedOut("TestInteractive", "test_go", 2)));
        RunSummary summary = new RunSummary(0, 2, 1, 2, 3_000_000_000L);

        File file = this.folder.newFile("results.json");
        JsonReportWriter.write(summary, cases, file);
        JsonObject json = JsonParser.parseString(new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8)).getAsJsonObject();

        assertEquals(2, json.get("suites_failed").getAsInt());
        assertEquals(1, json.get("tests_passed").getAsInt());
        assertEquals(1, json.get("exit_code").getAsInt());
        assertEquals(3.0, json.get("elapsed_seconds").getAsDouble(), 0.0001);

        JsonArray suites = json.getAsJsonArray("suites");
        assertEquals("TestCLI", suites.get(0).getAsJsonObject().get("name").getAsString());

        JsonArray cliCases = suites.get(0).getAsJsonObject().getAsJsonArray("cases");
        JsonObject eval = cliCases.get(0).getAsJsonObject();
        assertEquals("test_eval", eval.get("id").getAsString());
        assertEquals("PASSED", eval.get("status").getAsString());
        assertEquals(5.0, eval.get("duration_ms").getAsDouble(), 0.0001);
        assertFalse(eval.has("failure"));
        assertEquals("AssertionError: expected readyok", cliCases.get(1).getAsJsonObject().get("failure").getAsString());

        JsonObject go = suites.get(1).getAsJsonObject().getAsJsonArray("cases").get(0).getAsJsonObject();
        assertEquals("TIMED_OUT", go.get("status").getAsString());
    }
}

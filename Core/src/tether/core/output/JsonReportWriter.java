package tether.core.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import tether.core.execution.ExecutionReport;
import tether.core.execution.TestCase;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

/**
 * Writes the results of a run as a JSON document, for tools that consume results rather than read them.
 *
 * The document holds the summary counters, the elapsed time and for every suite, in registration order, each case's
 * status, duration in milliseconds and failure message.
 */
public final class JsonReportWriter {
    private static final Logger LOGGER = Logger.forClass(JsonReportWriter.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private JsonReportWriter() {}

    public static JsonObject toJson(RunSummary summary, Map<String, List<TestCase>> cases) {
        ObjectChecker.assertNonNull(summary, cases);

        JsonObject json = new JsonObject();
        json.addProperty("suites_passed", summary.suitesPassed);
        json.addProperty("suites_failed", summary.suitesFailed);
        json.addProperty("tests_passed", summary.testsPassed);
        json.addProperty("tests_failed", summary.testsFailed);
        json.addProperty("elapsed_seconds", summary.elapsedSeconds());
        json.addProperty("exit_code", summary.exitCode());

        JsonArray suites = new JsonArray();
        for (Map.Entry<String, List<TestCase>> suite : cases.entrySet()) {
            JsonObject suiteJson = new JsonObject();
            suiteJson.addProperty("name", suite.getKey());

            JsonArray caseArray = new JsonArray();
            for (TestCase testCase : suite.getValue()) {
                caseArray.add(caseToJson(testCase));
            }
            suiteJson.add("cases", caseArray);
            suites.add(suiteJson);
        }
        json.add("suites", suites);
        return json;
    }

    /**
     * Writes the results to the given file as UTF-8, replacing it if it exists.
     *
     * @param summary The run summary.
     * @param cases Every suite's cases.
     * @param file The file to write.
     */
    public static void write(RunSummary summary, Map<String, List<TestCase>> cases, File file) throws IOException {
        ObjectChecker.assertNonNull(file);
        JsonObject json = toJson(summary, cases);

        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            GSON.toJson(json, writer);
        }
        LOGGER.log("Wrote results to " + file);
    }

    private static JsonObject caseToJson(TestCase testCase) {
        JsonObject json = new JsonObject();
        json.addProperty("id", testCase.identifier);
        json.addProperty("status", testCase.getStatus().name());

        ExecutionReport report = testCase.getReport();
        if (report != null) {
            json.addProperty("duration_ms", report.durationNanos / 1_000_000.0);
            if (report.failure != null) {
                json.addProperty("failure", report.failure.message);
            }
        }
        return json;
    }
}

package tether.core.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import tether.core.engine.Instrumentation;
import tether.core.exception.ParseException;
import tether.core.type.Result;
import tether.core.util.ObjectChecker;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses a run configuration written as a JSON object.
 *
 * Every key is optional. The parse produces a {@link RunConfig.Builder} rather than a finished configuration so that
 * command-line flags can still override what the file says, and so that the engine path may be given on the command
 * line instead.
 */
public final class JsonRunConfigParser {
    private static final String ENGINE_PATH_KEY = "engine_path";
    private static final String INSTRUMENTATION_KEY = "instrumentation";
    private static final String PREFIX_KEY = "prefix";
    private static final String ENVIRONMENT_KEY = "environment";
    private static final String WORKING_DIRECTORY_KEY = "working_directory";
    private static final String TIMEOUT_KEY = "timeout_seconds";
    private static final String REPORTER_MODE_KEY = "reporter_mode";
    private static final String COLORS_KEY = "colors";
    private static final String TERMINATE_GRACE_KEY = "terminate_grace_millis";
    private static final String SHUTDOWN_COMMAND_KEY = "shutdown_command";
    private static final String REPORT_FILE_KEY = "report_file";

    public Result<RunConfig.Builder> parseRunConfig(String json) {
        ObjectChecker.assertNonNull(json);

        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                return Result.error(createParseFailureMessage("config is not a JSON object"));
            }
            return Result.successful(parseRunConfigObject(parsed.getAsJsonObject()));
        } catch (JsonParseException e) {
            return Result.error(createParseFailureMessage("malformed JSON: " + e.getMessage()));
        } catch (ParseException e) {
            return Result.error(createParseFailureMessage(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return Result.error(createParseFailureMessage("illegal value: " + e.getMessage()));
        }
    }

    /**
     * Reads the given file as UTF-8 and parses it.
     *
     * @param file The config file.
     * @return the parsed configuration or an error.
     */
    public Result<RunConfig.Builder> parseRunConfigFile(File file) {
        ObjectChecker.assertNonNull(file);

        try {
            return parseRunConfig(new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));
        } catch (IOException e) {
            return Result.error(createParseFailureMessage("cannot read " + file + ": " + e.getMessage()));
        }
    }

    private RunConfig.Builder parseRunConfigObject(JsonObject json) throws ParseException {
        RunConfig.Builder builder = RunConfig.Builder.newBuilder();

        if (json.has(ENGINE_PATH_KEY)) {
            builder.enginePath(parseAsString(json, ENGINE_PATH_KEY));
        }
        if (json.has(INSTRUMENTATION_KEY)) {
            Instrumentation instrumentation = Instrumentation.fromString(parseAsString(json, INSTRUMENTATION_KEY));
            if (instrumentation == null) {
                throw new ParseException(INSTRUMENTATION_KEY, "unknown instrumentation");
            }
            builder.instrumentation(instrumentation);
        }
        if (json.has(PREFIX_KEY)) {
            builder.prefix(parseAsStringList(json, PREFIX_KEY));
        }
        if (json.has(ENVIRONMENT_KEY)) {
            JsonObject environment = parseAsJsonObject(json, ENVIRONMENT_KEY);
            for (Map.Entry<String, JsonElement> variable : environment.entrySet()) {
                builder.environmentVariable(variable.getKey(), parseAsString(environment, variable.getKey()));
            }
        }
        if (json.has(WORKING_DIRECTORY_KEY)) {
            builder.workingDirectory(new File(parseAsString(json, WORKING_DIRECTORY_KEY)));
        }
        if (json.has(TIMEOUT_KEY)) {
            builder.timeoutSeconds(parseAsLong(json, TIMEOUT_KEY));
        }
        if (json.has(REPORTER_MODE_KEY)) {
            ReporterMode mode = ReporterMode.fromString(parseAsString(json, REPORTER_MODE_KEY));
            if (mode == null) {
                throw new ParseException(REPORTER_MODE_KEY, "expected interactive or append-only");
            }
            builder.reporterMode(mode);
        }
        if (json.has(COLORS_KEY)) {
            builder.colors(parseAsBoolean(json, COLORS_KEY));
        }
        if (json.has(TERMINATE_GRACE_KEY)) {
            builder.terminateGraceMillis(parseAsLong(json, TERMINATE_GRACE_KEY));
        }
        if (json.has(SHUTDOWN_COMMAND_KEY)) {
            builder.shutdownCommand(parseAsString(json, SHUTDOWN_COMMAND_KEY));
        }
        if (json.has(REPORT_FILE_KEY)) {
            builder.reportFile(new File(parseAsString(json, REPORT_FILE_KEY)));
        }
        return builder;
    }

    private static String createParseFailureMessage(String cause) {
        return "Failed to parse run config: " + cause;
    }

    private static boolean parseAsBoolean(JsonObject json, String attribute) throws ParseException {
        JsonElement element = json.get(attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new ParseException(attribute, "expected a Boolean");
        }
        return element.getAsBoolean();
    }

    private static long parseAsLong(JsonObject json, String attribute) throws ParseException {
        JsonElement element = json.get(attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new ParseException(attribute, "expected a Number");
        }
        try {
            return element.getAsBigDecimal().longValueExact();
        } catch (ArithmeticException e) {
            throw new ParseException(attribute, "expected a whole Number but was " + element);
        }
    }

    private static String parseAsString(JsonObject json, String attribute) throws ParseException {
        JsonElement element = json.get(attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new ParseException(attribute, "expected a String");
        }
        return element.getAsString();
    }

    private static List<String> parseAsStringList(JsonObject json, String attribute) throws ParseException {
        JsonElement element = json.get(attribute);
        if (!element.isJsonArray()) {
            throw new ParseException(attribute, "expected a JSON Array");
        }

        JsonArray array = element.getAsJsonArray();
        List<String> strings = new ArrayList<>();
        for (JsonElement token : array) {
            if (!token.isJsonPrimitive() || !token.getAsJsonPrimitive().isString()) {
                throw new ParseException(attribute, "expected every element to be a String");
            }
            strings.add(token.getAsString());
        }
        return strings;
    }

    private static JsonObject parseAsJsonObject(JsonObject json, String attribute) throws ParseException {
        JsonElement element = json.get(attribute);
        if (!element.isJsonObject()) {
            throw new ParseException(attribute, "expected a JSON Object");
        }
        return element.getAsJsonObject();
    }
}

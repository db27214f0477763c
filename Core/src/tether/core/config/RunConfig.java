package tether.core.config;

import tether.core.assertion.AssertionEngine;
import tether.core.engine.EngineInvocation;
import tether.core.engine.Instrumentation;
import tether.core.util.ObjectChecker;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The configuration of one run.
 *
 * {@link RunConfig#enginePath}: the engine executable.
 * {@link RunConfig#instrumentation}: the diagnostic tool the engine runs under.
 * {@link RunConfig#prefix}: extra argv tokens placed after the instrumentation's own prefix.
 * {@link RunConfig#environment}: extra environment variables for every engine.
 * {@link RunConfig#workingDirectory}: the directory engines run in, or null for the current one.
 * {@link RunConfig#timeoutSeconds}: the deadline of each assertion.
 * {@link RunConfig#reporterMode}: how live progress is rendered.
 * {@link RunConfig#colors}: whether ANSI colors are used.
 * {@link RunConfig#terminateGraceMillis}: how long a terminating engine is given before it is destroyed.
 * {@link RunConfig#shutdownCommand}: the command sent to an engine asked to terminate, or null.
 * {@link RunConfig#reportFile}: where the JSON results file is written, or null for none.
 */
public final class RunConfig {
    public final String enginePath;
    public final Instrumentation instrumentation;
    public final List<String> prefix;
    public final Map<String, String> environment;
    public final File workingDirectory;
    public final long timeoutSeconds;
    public final ReporterMode reporterMode;
    public final boolean colors;
    public final long terminateGraceMillis;
    public final String shutdownCommand;
    public final File reportFile;

    private RunConfig(Builder builder) {
        this.enginePath = builder.enginePath;
        this.instrumentation = builder.instrumentation;
        this.prefix = Collections.unmodifiableList(new ArrayList<>(builder.prefix));
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environment));
        this.workingDirectory = builder.workingDirectory;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.reporterMode = builder.reporterMode;
        this.colors = builder.colors;
        this.terminateGraceMillis = builder.terminateGraceMillis;
        this.shutdownCommand = builder.shutdownCommand;
        this.reportFile = builder.reportFile;
    }

    /**
     * Returns the invocation every engine of this run starts from: the instrumentation prefix followed by the extra
     * prefix, the engine path, the environment and the working directory. It has no arguments.
     *
     * @return the base invocation.
     */
    public EngineInvocation baseInvocation() {
        EngineInvocation.Builder builder = EngineInvocation.Builder.newBuilder()
                .executable(this.enginePath)
                .prefix(this.instrumentation.prefix())
                .prefix(this.prefix)
                .workingDirectory(this.workingDirectory)
                .shutdownCommand(this.shutdownCommand)
                .terminateGraceMillis(this.terminateGraceMillis);
        for (Map.Entry<String, String> variable : this.environment.entrySet()) {
            builder.environmentVariable(variable.getKey(), variable.getValue());
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { engine: " + this.enginePath
                + ", instrumentation: " + this.instrumentation
                + ", prefix: " + this.prefix
                + ", timeout: " + this.timeoutSeconds + "s"
                + ", reporter: " + this.reporterMode
                + ", colors: " + this.colors + " }";
    }

    public static final class Builder {
        private final List<String> prefix = new ArrayList<>();
        private final Map<String, String> environment = new LinkedHashMap<>();
        private String enginePath;
        private Instrumentation instrumentation = Instrumentation.NONE;
        private File workingDirectory;
        private long timeoutSeconds = AssertionEngine.DEFAULT_TIMEOUT_SECONDS;
        private ReporterMode reporterMode = ReporterMode.INTERACTIVE;
        private boolean colors = true;
        private long terminateGraceMillis = EngineInvocation.DEFAULT_TERMINATE_GRACE_MILLIS;
        private String shutdownCommand;
        private File reportFile;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder enginePath(String path) {
            this.enginePath = path;
            return this;
        }

        public Builder instrumentation(Instrumentation instrumentation) {
            ObjectChecker.assertNonNull(instrumentation);
            this.instrumentation = instrumentation;
            return this;
        }

        /**
         * Replaces the extra prefix tokens.
         */
        public Builder prefix(List<String> tokens) {
            ObjectChecker.assertNonNull(tokens);
            this.prefix.clear();
            this.prefix.addAll(tokens);
            return this;
        }

        public Builder environmentVariable(String name, String value) {
            ObjectChecker.assertNonNull(name, value);
            this.environment.put(name, value);
            return this;
        }

        public Builder workingDirectory(File directory) {
            this.workingDirectory = directory;
            return this;
        }

        public Builder timeoutSeconds(long seconds) {
            ObjectChecker.assertPositive(seconds);
            this.timeoutSeconds = seconds;
            return this;
        }

        public Builder reporterMode(ReporterMode mode) {
            ObjectChecker.assertNonNull(mode);
            this.reporterMode = mode;
            return this;
        }

        public Builder colors(boolean colors) {
            this.colors = colors;
            return this;
        }

        public Builder terminateGraceMillis(long millis) {
            ObjectChecker.assertNonNegative(millis);
            this.terminateGraceMillis = millis;
            return this;
        }

        public Builder shutdownCommand(String command) {
            this.shutdownCommand = command;
            return this;
        }

        public Builder reportFile(File file) {
            this.reportFile = file;
            return this;
        }

        public boolean hasEnginePath() {
            return (this.enginePath != null) && (!this.enginePath.isEmpty());
        }

        public RunConfig build() {
            ObjectChecker.assertNonEmpty(this.enginePath);
            return new RunConfig(this);
        }
    }
}

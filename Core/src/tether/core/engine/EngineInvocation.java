package tether.core.engine;

import tether.core.util.ObjectChecker;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to launch an engine process: the instrumentation prefix, the executable, its arguments and the
 * environment it runs in.
 *
 * The command line is always {@code prefix + [executable] + arguments}.
 */
public final class EngineInvocation {
    public static final long DEFAULT_TERMINATE_GRACE_MILLIS = 5_000;
    public final List<String> prefix;
    public final String executable;
    public final List<String> arguments;
    public final File workingDirectory;
    public final Map<String, String> environment;
    public final String shutdownCommand;
    public final long terminateGraceMillis;

    private EngineInvocation(List<String> prefix, String executable, List<String> arguments, File workingDirectory, Map<String, String> environment, String shutdownCommand, long terminateGraceMillis) {
        ObjectChecker.assertNonEmpty(executable);
        ObjectChecker.assertNonNegative(terminateGraceMillis);
        this.prefix = Collections.unmodifiableList(new ArrayList<>(prefix));
        this.executable = executable;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.workingDirectory = workingDirectory;
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        this.shutdownCommand = shutdownCommand;
        this.terminateGraceMillis = terminateGraceMillis;
    }

    /**
     * Returns the full command line.
     *
     * @return the command line.
     */
    public List<String> command() {
        List<String> command = new ArrayList<>(this.prefix);
        command.add(this.executable);
        command.addAll(this.arguments);
        return command;
    }

    /**
     * Returns a builder that starts out as a copy of this invocation but with no arguments, so the same engine can be
     * launched again with different ones.
     *
     * @return the new builder.
     */
    public Builder toBuilderWithoutArguments() {
        Builder builder = Builder.newBuilder()
                .executable(this.executable)
                .prefix(this.prefix)
                .workingDirectory(this.workingDirectory)
                .terminateGraceMillis(this.terminateGraceMillis)
                .shutdownCommand(this.shutdownCommand);
        for (Map.Entry<String, String> variable : this.environment.entrySet()) {
            builder.environmentVariable(variable.getKey(), variable.getValue());
        }
        return builder;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { command: " + String.join(" ", command())
                + ", working directory: " + this.workingDirectory
                + ", environment: " + this.environment.keySet() + " }";
    }

    public static final class Builder {
        private final List<String> prefix = new ArrayList<>();
        private final List<String> arguments = new ArrayList<>();
        private final Map<String, String> environment = new LinkedHashMap<>();
        private String executable;
        private File workingDirectory;
        private String shutdownCommand;
        private long terminateGraceMillis = DEFAULT_TERMINATE_GRACE_MILLIS;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder executable(String executable) {
            this.executable = executable;
            return this;
        }

        public Builder prefix(List<String> tokens) {
            ObjectChecker.assertNonNull(tokens);
            this.prefix.addAll(tokens);
            return this;
        }

        public Builder arguments(List<String> arguments) {
            ObjectChecker.assertNonNull(arguments);
            this.arguments.addAll(arguments);
            return this;
        }

        public Builder argument(String argument) {
            ObjectChecker.assertNonNull(argument);
            this.arguments.add(argument);
            return this;
        }

        public Builder workingDirectory(File directory) {
            this.workingDirectory = directory;
            return this;
        }

        public Builder environmentVariable(String name, String value) {
            ObjectChecker.assertNonNull(name, value);
            this.environment.put(name, value);
            return this;
        }

        /**
         * Sets the command sent to the engine when it is asked to terminate, before its input is closed. No command is
         * sent if this is never set.
         */
        public Builder shutdownCommand(String command) {
            this.shutdownCommand = command;
            return this;
        }

        public Builder terminateGraceMillis(long millis) {
            this.terminateGraceMillis = millis;
            return this;
        }

        public EngineInvocation build() {
            return new EngineInvocation(this.prefix, this.executable, this.arguments, this.workingDirectory, this.environment, this.shutdownCommand, this.terminateGraceMillis);
        }
    }
}

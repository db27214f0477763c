package tether.client.standalone;

import tether.core.config.ReporterMode;
import tether.core.config.RunConfig;
import tether.core.engine.Instrumentation;
import tether.core.type.Result;
import tether.core.util.ObjectChecker;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The parsed command line of the standalone client.
 *
 * Flags given on the command line override the same settings of a config file.
 */
public final class ClientArguments {
    public final Instrumentation instrumentation;
    public final File configFile;
    public final boolean plain;
    public final boolean noColor;
    public final Long timeoutSeconds;
    public final File reportFile;
    public final List<String> classpath;
    public final List<String> suiteClasses;
    public final String enginePath;

    private ClientArguments(Instrumentation instrumentation, File configFile, boolean plain, boolean noColor, Long timeoutSeconds, File reportFile, List<String> classpath, List<String> suiteClasses, String enginePath) {
        this.instrumentation = instrumentation;
        this.configFile = configFile;
        this.plain = plain;
        this.noColor = noColor;
        this.timeoutSeconds = timeoutSeconds;
        this.reportFile = reportFile;
        this.classpath = Collections.unmodifiableList(new ArrayList<>(classpath));
        this.suiteClasses = Collections.unmodifiableList(new ArrayList<>(suiteClasses));
        this.enginePath = enginePath;
    }

    /**
     * Parses the given command line.
     *
     * @param args The command line.
     * @return the parsed arguments, or an error describing what is wrong with them.
     */
    public static Result<ClientArguments> parse(String[] args) {
        ObjectChecker.assertNonNull((Object) args);

        Instrumentation instrumentation = null;
        File configFile = null;
        boolean plain = false;
        boolean noColor = false;
        Long timeoutSeconds = null;
        File reportFile = null;
        List<String> classpath = new ArrayList<>();
        List<String> suiteClasses = new ArrayList<>();
        String enginePath = null;

        int i = 0;
        while (i < args.length) {
            String arg = args[i];

            if (arg.startsWith("--") && (Instrumentation.fromString(arg.substring(2)) != null)) {
                if (instrumentation != null) {
                    return Result.error("only one instrumentation may be given but found --" + instrumentation.toCommandLineName() + " and " + arg);
                }
                instrumentation = Instrumentation.fromString(arg.substring(2));
            } else if (arg.equals("--plain")) {
                plain = true;
            } else if (arg.equals("--no-color")) {
                noColor = true;
            } else if (arg.equals("--config") || arg.equals("--timeout") || arg.equals("--report") || arg.equals("--classpath") || arg.equals("--suite")) {
                if (i + 1 >= args.length) {
                    return Result.error(arg + " requires a value");
                }
                String value = args[++i];

                if (arg.equals("--config")) {
                    configFile = new File(value);
                } else if (arg.equals("--report")) {
                    reportFile = new File(value);
                } else if (arg.equals("--classpath")) {
                    classpath.addAll(Arrays.asList(value.split(File.pathSeparator)));
                } else if (arg.equals("--suite")) {
                    suiteClasses.add(value);
                } else {
                    try {
                        timeoutSeconds = Long.parseLong(value);
                    } catch (NumberFormatException e) {
                        return Result.error("--timeout expects a whole number of seconds but was: " + value);
                    }
                    if (timeoutSeconds < 1) {
                        return Result.error("--timeout must be positive but was: " + value);
                    }
                }
            } else if (arg.startsWith("--")) {
                return Result.error("unknown option: " + arg);
            } else if (enginePath == null) {
                enginePath = arg;
            } else {
                return Result.error("only one engine path may be given but found " + enginePath + " and " + arg);
            }
            i++;
        }

        if (suiteClasses.isEmpty()) {
            return Result.error("at least one --suite must be given");
        }
        if ((enginePath == null) && (configFile == null)) {
            return Result.error("an engine path must be given, on the command line or in a --config file");
        }
        return Result.successful(new ClientArguments(instrumentation, configFile, plain, noColor, timeoutSeconds, reportFile, classpath, suiteClasses, enginePath));
    }

    /**
     * Applies the settings given on the command line on top of the given configuration.
     *
     * @param config The configuration to override, usually parsed from the config file.
     * @return the same builder.
     */
    public RunConfig.Builder applyTo(RunConfig.Builder config) {
        ObjectChecker.assertNonNull(config);
        if (this.enginePath != null) {
            config.enginePath(this.enginePath);
        }
        if (this.instrumentation != null) {
            config.instrumentation(this.instrumentation);
        }
        if (this.plain) {
            config.reporterMode(ReporterMode.APPEND_ONLY);
        }
        if (this.noColor) {
            config.colors(false);
        }
        if (this.timeoutSeconds != null) {
            config.timeoutSeconds(this.timeoutSeconds);
        }
        if (this.reportFile != null) {
            config.reportFile(this.reportFile);
        }
        return config;
    }

    public static String usage() {
        return StandaloneClient.class.getName()
                + " [--valgrind | --valgrind-thread | --sanitizer-undefined | --sanitizer-thread | --none]"
                + " [--config <json>] [--plain] [--no-color] [--timeout <s>] [--report <json>] [--classpath <entries>]"
                + " --suite <class> [--suite <class>...] <engine path>"
                + "\n\t--valgrind ...: the diagnostic tool the engine runs under (default: none)."
                + "\n\t--config: a JSON run configuration; command-line flags override it."
                + "\n\t--plain: append progress lines instead of redrawing them, for logs and CI."
                + "\n\t--no-color: do not use ANSI colors."
                + "\n\t--timeout: the deadline of each assertion in seconds (default: 300)."
                + "\n\t--report: also write the results to this JSON file."
                + "\n\t--classpath: where the suite classes are, entries separated by '" + File.pathSeparator + "'."
                + "\n\t--suite: the binary name of a class implementing SuiteDefinition."
                + "\n\tengine path: the engine executable.";
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { engine: " + this.enginePath + ", suites: " + this.suiteClasses
                + ", instrumentation: " + this.instrumentation + ", config: " + this.configFile + " }";
    }
}

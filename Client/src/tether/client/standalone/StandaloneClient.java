package tether.client.standalone;

import tether.core.config.JsonRunConfigParser;
import tether.core.config.RunConfig;
import tether.core.engine.EngineLauncher;
import tether.core.output.JsonReportWriter;
import tether.core.output.Reporter;
import tether.core.output.RunSummary;
import tether.core.runner.Scheduler;
import tether.core.suite.SuiteRegistry;
import tether.core.type.Result;
import tether.core.util.Logger;

import java.io.IOException;

/**
 * A single-use client that runs the given suites against an engine and then exits.
 *
 * The exit code is 0 if no suite failed and 1 otherwise, including when the command line or configuration is invalid
 * or the harness itself broke down.
 */
public final class StandaloneClient {
    private static final Logger LOGGER = Logger.forClass(StandaloneClient.class);
    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        if (!Boolean.parseBoolean(System.getProperty("enable_logger"))) {
            Logger.globalDisable();
        }
        System.exit(run(args));
    }

    /**
     * Runs the client with the given command line and returns the exit code it maps to.
     *
     * @param args The command line.
     * @return the exit code.
     */
    static int run(String[] args) {
        try {
            if (args == null) {
                System.err.println("Null arguments given.");
                System.err.println(ClientArguments.usage());
                return EXIT_FAILURE;
            }
            logArguments(args);

            Result<ClientArguments> parsedArguments = ClientArguments.parse(args);
            if (!parsedArguments.isSuccess()) {
                System.err.println(parsedArguments.getError());
                System.err.println(ClientArguments.usage());
                return EXIT_FAILURE;
            }
            ClientArguments arguments = parsedArguments.getData();

            Result<RunConfig> config = resolveConfig(arguments);
            if (!config.isSuccess()) {
                System.err.println(config.getError());
                return EXIT_FAILURE;
            }
            LOGGER.log("Resolved " + config.getData());

            RunSummary summary = runSuites(arguments, config.getData());
            return summary.exitCode();

        } catch (Throwable t) {
            System.err.println("Unexpected Error!");
            t.printStackTrace();
            return EXIT_FAILURE;
        } finally {
            LOGGER.log("Exiting.");
        }
    }

    /**
     * Reads the config file, if one was given, and applies the command-line flags on top of it.
     */
    static Result<RunConfig> resolveConfig(ClientArguments arguments) {
        RunConfig.Builder builder = RunConfig.Builder.newBuilder();

        if (arguments.configFile != null) {
            Result<RunConfig.Builder> parsed = new JsonRunConfigParser().parseRunConfigFile(arguments.configFile);
            if (!parsed.isSuccess()) {
                return parsed.propagateError();
            }
            builder = parsed.getData();
        }

        arguments.applyTo(builder);
        if (!builder.hasEnginePath()) {
            return Result.error("Invalid run configuration: no engine path was given.");
        }
        return Result.successful(builder.build());
    }

    private static RunSummary runSuites(ClientArguments arguments, RunConfig config) throws IOException, ReflectiveOperationException, InterruptedException {
        EngineLauncher launcher = EngineLauncher.forConfig(config);
        SuiteRegistry registry = SuiteRegistry.empty();

        try (SuiteLoader loader = SuiteLoader.forClasspath(arguments.classpath)) {
            for (String suiteClass : arguments.suiteClasses) {
                registry.register(loader.load(suiteClass, launcher));
            }

            Reporter reporter = Reporter.forMode(System.out, config.reporterMode, config.colors);
            Scheduler scheduler = Scheduler.withReporter(registry, reporter);
            RunSummary summary = scheduler.run();

            if (config.reportFile != null) {
                JsonReportWriter.write(summary, scheduler.getReport().getCases(), config.reportFile);
            }
            return summary;
        }
    }

    private static void logArguments(String[] args) {
        LOGGER.log("ARGS ------------------------------------------------");
        for (String a : args) {
            LOGGER.log(a);
        }
        LOGGER.log("ARGS ------------------------------------------------\n");
    }
}

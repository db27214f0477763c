package tether.core.engine;

import tether.core.assertion.AssertionEngine;
import tether.core.config.RunConfig;
import tether.core.exception.ProcessException;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.util.Arrays;
import java.util.List;

/**
 * Creates the engines of a run, all launched the same way: same executable, same instrumentation, same environment.
 * Suites only choose the arguments.
 *
 * This class is thread-safe; every suite of a run shares one launcher.
 */
public final class EngineLauncher {
    private static final Logger LOGGER = Logger.forClass(EngineLauncher.class);
    private final RunConfig config;
    private final EngineInvocation baseInvocation;

    private EngineLauncher(RunConfig config) {
        ObjectChecker.assertNonNull(config);
        this.config = config;
        this.baseInvocation = config.baseInvocation();
    }

    public static EngineLauncher forConfig(RunConfig config) {
        return new EngineLauncher(config);
    }

    /**
     * Starts a new interactive engine with the given arguments. The caller owns it and must terminate it.
     *
     * @param arguments The engine arguments.
     * @return the running engine.
     */
    public EngineProcess interactive(String... arguments) throws ProcessException {
        return EngineProcess.interactive(invocationWith(arguments));
    }

    /**
     * Runs a new engine with the given arguments to completion in batch mode.
     *
     * @param arguments The engine arguments.
     * @return the exited engine, holding its exit code and full output.
     */
    public EngineProcess batch(String... arguments) throws ProcessException, InterruptedException {
        return EngineProcess.batch(invocationWith(arguments));
    }

    /**
     * Returns an assertion engine on the given engine using this run's assertion deadline.
     */
    public AssertionEngine assertionsFor(EngineProcess engine) {
        return AssertionEngine.withTimeout(engine, this.config.timeoutSeconds);
    }

    /**
     * Fails if the given engine's transcript shows a diagnostic from this run's instrumentation.
     *
     * The failure message quotes the transcript from the first diagnostic line on, up to
     * {@link Instrumentation#DIAGNOSTIC_EXCERPT_LINES} lines.
     *
     * @param engine The engine to check, usually after it was terminated.
     * @throws AssertionError If a diagnostic was found.
     */
    public void verifyDiagnostics(EngineProcess engine) {
        ObjectChecker.assertNonNull(engine);
        List<String> excerpt = this.config.instrumentation.findDiagnostic(engine.getTranscript());
        if (!excerpt.isEmpty()) {
            LOGGER.log(this.config.instrumentation + " reported a diagnostic for " + engine);
            throw new AssertionError(this.config.instrumentation.toCommandLineName() + " reported:\n" + String.join("\n", excerpt));
        }
    }

    /**
     * Returns the number of search threads engines should be configured with under this run's instrumentation.
     */
    public int engineThreads() {
        return this.config.instrumentation.engineThreads();
    }

    public RunConfig getConfig() {
        return this.config;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.baseInvocation + " }";
    }

    private EngineInvocation invocationWith(String... arguments) {
        ObjectChecker.assertNonNull((Object) arguments);
        return this.baseInvocation.toBuilderWithoutArguments()
                .arguments(Arrays.asList(arguments))
                .build();
    }
}

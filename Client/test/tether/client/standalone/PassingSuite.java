package tether.client.standalone;

import tether.core.engine.EngineLauncher;
import tether.core.suite.SuiteDefinition;
import tether.core.suite.TestSuite;

/**
 * A suite that never starts an engine.
 */
public final class PassingSuite implements SuiteDefinition {

    @Override
    public TestSuite define(EngineLauncher launcher) {
        return TestSuite.Builder.newBuilder("TestPassing")
                .test("test_threads", context -> {
                    if (launcher.engineThreads() != 1) {
                        throw new AssertionError("expected one engine thread but was " + launcher.engineThreads());
                    }
                })
                .test("test_scratch", context -> context.writeScratchFile("options.txt", "Hash 16\n"))
                .build();
    }
}

package tether.core.engine;

import org.junit.Test;
import tether.core.assertion.AssertionEngine;
import tether.core.config.RunConfig;
import tether.core.helper.AssertHelper;
import tether.core.helper.FakeEngine;
import tether.core.helper.FakeEngines;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;

public class EngineLauncherTest {

    @Test
    public void testInteractiveEngineUsesRunSettings() throws Exception {
        EngineLauncher launcher = EngineLauncher.forConfig(FakeEngines.config().timeoutSeconds(7).build());

        try (EngineProcess engine = launcher.interactive(FakeEngines.arguments())) {
            EngineInvocation invocation = engine.getInvocation();
            assertEquals(FakeEngines.javaExecutable(), invocation.executable);
            assertEquals("quit", invocation.shutdownCommand);

            AssertionEngine assertions = launcher.assertionsFor(engine);
            assertEquals(7, assertions.getTimeoutSeconds());
            assertions.expectEquals(FakeEngine.BANNER);
            assertEquals(0, engine.terminate());
        }
    }

    @Test
    public void testVerifyDiagnosticsFailsOnMarker() throws Exception {
        EngineLauncher launcher = EngineLauncher.forConfig(FakeEngines.config().instrumentation(Instrumentation.SANITIZER_THREAD).build());

        EngineProcess engine = launcher.batch(FakeEngines.arguments("batch", "66", "info depth 1", "WARNING: ThreadSanitizer: data race", "  Read of size 8"));
        AssertionError error = AssertHelper.assertThrows(AssertionError.class, () -> launcher.verifyDiagnostics(engine));
        assertThat(error.getMessage(), startsWith("sanitizer-thread reported:"));
        assertThat(error.getMessage(), containsString("Read of size 8"));
        assertEquals(2, launcher.engineThreads());
    }

    @Test
    public void testVerifyDiagnosticsPassesCleanTranscript() throws Exception {
        EngineLauncher launcher = EngineLauncher.forConfig(FakeEngines.config().instrumentation(Instrumentation.SANITIZER_UNDEFINED).build());

        EngineProcess engine = launcher.batch(FakeEngines.arguments("batch", "0", "bestmove e2e4"));
        launcher.verifyDiagnostics(engine);
        assertEquals(1, launcher.engineThreads());
    }

    @Test
    public void testEachEngineGetsItsOwnArguments() {
        RunConfig config = FakeEngines.config().environmentVariable("TSAN_OPTIONS", "suppressions=tsan.supp").build();
        EngineInvocation first = config.baseInvocation().toBuilderWithoutArguments().argument("bench").build();
        EngineInvocation second = first.toBuilderWithoutArguments().argument("uci").build();

        assertEquals("uci", String.join(" ", second.arguments));
        assertEquals("suppressions=tsan.supp", second.environment.get("TSAN_OPTIONS"));
    }
}

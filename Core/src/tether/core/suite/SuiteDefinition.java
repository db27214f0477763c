package tether.core.suite;

import tether.core.engine.EngineLauncher;

/**
 * Implemented by a class that declares one suite. Such a class must have a public no-argument constructor so that it
 * can be loaded by name.
 */
public interface SuiteDefinition {

    /**
     * Declares the suite.
     *
     * @param launcher The run-wide factory the suite's cases and hooks create engines with.
     * @return the suite.
     */
    public TestSuite define(EngineLauncher launcher);
}

package tether.core.suite;

import tether.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The suites of a run, in registration order. Suite names are unique.
 *
 * This class is not thread-safe. Suites are registered before the run starts and only read afterwards.
 */
public final class SuiteRegistry {
    private final Map<String, TestSuite> suites = new LinkedHashMap<>();

    private SuiteRegistry() {}

    public static SuiteRegistry empty() {
        return new SuiteRegistry();
    }

    /**
     * Registers the given suite.
     *
     * @param suite The suite.
     * @return this registry.
     * @throws IllegalArgumentException If a suite of the same name is already registered.
     */
    public SuiteRegistry register(TestSuite suite) {
        ObjectChecker.assertNonNull(suite);
        if (this.suites.containsKey(suite.name)) {
            throw new IllegalArgumentException("suite registered twice: " + suite.name);
        }
        this.suites.put(suite.name, suite);
        return this;
    }

    public List<TestSuite> suites() {
        return new ArrayList<>(this.suites.values());
    }

    /**
     * Returns the identifiers of the named suite's cases in declaration order.
     *
     * @param suiteName The suite.
     * @return the case identifiers.
     */
    public List<String> caseIdentifiers(String suiteName) {
        ObjectChecker.assertNonNull(suiteName);
        TestSuite suite = this.suites.get(suiteName);
        if (suite == null) {
            throw new IllegalArgumentException("no suite registered as: " + suiteName);
        }
        return suite.caseIdentifiers();
    }

    public int size() {
        return this.suites.size();
    }

    public boolean isEmpty() {
        return this.suites.isEmpty();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suites: " + this.suites.keySet() + " }";
    }
}

package tether.core.suite;

import tether.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named, ordered collection of test cases sharing four lifecycle hooks.
 *
 * Cases run in the order they were declared. Every hook that was not set does nothing.
 */
public final class TestSuite {
    public static final String CASE_PREFIX = "test_";
    private static final SuiteAction NO_OP = context -> {};
    public final String name;
    public final SuiteAction beforeAll;
    public final SuiteAction beforeEach;
    public final SuiteAction afterEach;
    public final SuiteAction afterAll;
    private final Map<String, SuiteAction> cases;

    private TestSuite(String name, Map<String, SuiteAction> cases, SuiteAction beforeAll, SuiteAction beforeEach, SuiteAction afterEach, SuiteAction afterAll) {
        this.name = name;
        this.cases = Collections.unmodifiableMap(new LinkedHashMap<>(cases));
        this.beforeAll = beforeAll;
        this.beforeEach = beforeEach;
        this.afterEach = afterEach;
        this.afterAll = afterAll;
    }

    /**
     * Returns the identifiers of this suite's cases in declaration order.
     *
     * @return the case identifiers.
     */
    public List<String> caseIdentifiers() {
        return new ArrayList<>(this.cases.keySet());
    }

    public SuiteAction getCase(String identifier) {
        ObjectChecker.assertNonNull(identifier);
        SuiteAction action = this.cases.get(identifier);
        if (action == null) {
            throw new IllegalArgumentException("suite " + this.name + " has no case: " + identifier);
        }
        return action;
    }

    public int numberOfCases() {
        return this.cases.size();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name + ", cases: " + this.cases.keySet() + " }";
    }

    public static final class Builder {
        private final Map<String, SuiteAction> cases = new LinkedHashMap<>();
        private String name;
        private SuiteAction beforeAll = NO_OP;
        private SuiteAction beforeEach = NO_OP;
        private SuiteAction afterEach = NO_OP;
        private SuiteAction afterAll = NO_OP;

        public static Builder newBuilder(String name) {
            return new Builder().name(name);
        }

        public Builder name(String name) {
            ObjectChecker.assertNonEmpty(name);
            this.name = name;
            return this;
        }

        /**
         * Declares a case. Identifiers must start with {@link TestSuite#CASE_PREFIX} and be unique within the suite.
         */
        public Builder test(String identifier, SuiteAction action) {
            ObjectChecker.assertNonNull(identifier, action);
            if (!identifier.startsWith(CASE_PREFIX) || identifier.length() == CASE_PREFIX.length()) {
                throw new IllegalArgumentException("case identifier must look like " + CASE_PREFIX + "<name> but was: " + identifier);
            }
            if (this.cases.containsKey(identifier)) {
                throw new IllegalArgumentException("case declared twice: " + identifier);
            }
            this.cases.put(identifier, action);
            return this;
        }

        public Builder beforeAll(SuiteAction hook) {
            ObjectChecker.assertNonNull(hook);
            this.beforeAll = hook;
            return this;
        }

        public Builder beforeEach(SuiteAction hook) {
            ObjectChecker.assertNonNull(hook);
            this.beforeEach = hook;
            return this;
        }

        public Builder afterEach(SuiteAction hook) {
            ObjectChecker.assertNonNull(hook);
            this.afterEach = hook;
            return this;
        }

        public Builder afterAll(SuiteAction hook) {
            ObjectChecker.assertNonNull(hook);
            this.afterAll = hook;
            return this;
        }

        public TestSuite build() {
            ObjectChecker.assertNonNull(this.name);
            return new TestSuite(this.name, this.cases, this.beforeAll, this.beforeEach, this.afterEach, this.afterAll);
        }
    }
}

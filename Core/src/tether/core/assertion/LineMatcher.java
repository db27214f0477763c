package tether.core.assertion;

/**
 * Decides whether a line of engine output satisfies an expectation.
 *
 * A matcher is called once per line, in the order the lines were produced, until it returns true. Matchers may keep
 * state between calls. A matcher that throws an {@link AssertionError} fails the assertion immediately.
 */
@FunctionalInterface
public interface LineMatcher {

    /**
     * Returns true iff the expectation is satisfied by the given line and scanning should stop.
     *
     * @param line The line, stripped of surrounding whitespace.
     * @return whether or not the line satisfies the expectation.
     */
    public boolean matches(String line) throws Exception;
}

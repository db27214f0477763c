package tether.core.assertion;

import tether.core.util.ObjectChecker;

/**
 * The built-in line matchers.
 */
public final class LineMatchers {

    private LineMatchers() {}

    public static LineMatcher exactly(String expected) {
        ObjectChecker.assertNonNull(expected);
        return expected::equals;
    }

    /**
     * Returns a matcher that accepts a line iff the whole line matches the given shell-style glob pattern.
     *
     * @param pattern The glob pattern.
     * @return the matcher.
     * @see GlobPattern
     */
    public static LineMatcher glob(String pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        return glob::matches;
    }

    public static LineMatcher containing(String fragment) {
        ObjectChecker.assertNonNull(fragment);
        return line -> line.contains(fragment);
    }

    public static LineMatcher startingWith(String prefix) {
        ObjectChecker.assertNonNull(prefix);
        return line -> line.startsWith(prefix);
    }
}

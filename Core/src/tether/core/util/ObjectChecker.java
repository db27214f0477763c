package tether.core.util;

/**
 * Argument checks shared by every constructor and factory in the project. Each check throws the exception the JDK uses
 * for the same kind of violation.
 */
public final class ObjectChecker {

    private ObjectChecker() {}

    public static void assertNonNull(Object argument) {
        if (argument == null) {
            throw new NullPointerException("argument must be non-null.");
        }
    }

    /**
     * Checks every given argument, naming the position of the first null one.
     */
    public static void assertNonNull(Object... arguments) {
        assertNonNull((Object) arguments);
        int index = 0;
        for (Object argument : arguments) {
            if (argument == null) {
                throw new NullPointerException("argument #" + index + " must be non-null.");
            }
            index++;
        }
    }

    public static void assertPositive(long value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException("expected a positive value but got " + value);
        }
    }

    public static void assertNonNegative(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("expected a non-negative value but got " + value);
        }
    }

    /**
     * Checks that the given string is neither null nor empty.
     */
    public static void assertNonEmpty(String argument) {
        assertNonNull(argument);
        if (argument.isEmpty()) {
            throw new IllegalArgumentException("argument must be a non-empty string.");
        }
    }
}

package tether.core.exception;

/**
 * Thrown when a suite lifecycle hook raised. The remaining cases of that suite are abandoned.
 */
public final class SetupException extends Exception {
    private final String hook;

    public SetupException(String hook, Throwable cause) {
        super(hook + " failed: " + cause, cause);
        this.hook = hook;
    }

    public String getHook() {
        return this.hook;
    }
}

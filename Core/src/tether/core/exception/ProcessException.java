package tether.core.exception;

/**
 * Thrown when an engine process failed to start, or when its input or output channel is not usable.
 *
 * This is fatal to the test case that owns the process only.
 */
public class ProcessException extends Exception {

    public ProcessException(String message) {
        super(message);
    }

    public ProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}

package tether.core.exception;

/**
 * Thrown when writing to an engine process whose input channel is closed or which has already exited.
 */
public final class EngineNotRunningException extends ProcessException {

    public EngineNotRunningException(String message) {
        super(message);
    }

    public EngineNotRunningException(String message, Throwable cause) {
        super(message, cause);
    }
}

package tether.core.exception;

/**
 * Thrown when talking to an engine process that was never started.
 */
public final class EngineNotStartedException extends ProcessException {

    public EngineNotStartedException(String message) {
        super(message);
    }
}

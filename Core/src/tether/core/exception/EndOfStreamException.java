package tether.core.exception;

/**
 * Thrown when reading from an engine process whose output channel has closed and has no more lines to give.
 */
public final class EndOfStreamException extends ProcessException {

    public EndOfStreamException(String message) {
        super(message);
    }
}

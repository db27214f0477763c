package tether.core.exception;

/**
 * Thrown when parsing a configuration document and finding that one of its attributes is not structured as expected.
 */
public final class ParseException extends Exception {
    public ParseException(String attribute, String problem) {
        super(attribute + ": " + problem);
    }
}

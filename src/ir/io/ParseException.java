package ir.io;

/**
 * Serialized IR, an expression or a parameter file could not be read
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package ai.diffscope.diff;

/** The requested diff could not be produced, either because git rejected the input or the output was unparseable. */
public class DiffParseException extends Exception {
    public DiffParseException(String message) {
        super(message);
    }

    public DiffParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package autoflow;

/**
 * Unchecked exception thrown by compiler components when a session or
 * workflow cannot be processed.
 */
public class AutoflowException extends RuntimeException {

    public AutoflowException(String msg) {
        super(msg);
    }

    public AutoflowException(String msg, Throwable cause) {
        super(msg, cause);
    }
}

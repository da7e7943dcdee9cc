package decentralabs.attendance.exception;

/**
 * Thrown when session parameters are rejected at open time. Values are never clamped.
 */
public class InvalidSessionConfigException extends RuntimeException {

    private final String field;

    public InvalidSessionConfigException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

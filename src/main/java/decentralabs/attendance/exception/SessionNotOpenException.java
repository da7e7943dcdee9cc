package decentralabs.attendance.exception;

public class SessionNotOpenException extends RuntimeException {

    private final String sessionId;

    public SessionNotOpenException(String sessionId) {
        super("Session is not open");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

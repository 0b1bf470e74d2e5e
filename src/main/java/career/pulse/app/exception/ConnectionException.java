package career.pulse.app.exception;

/**
 * Base type for credential failures that abort a sync run before any mailbox access.
 */
public abstract class ConnectionException extends RuntimeException {
    private final String userId;

    protected ConnectionException(String userId, String message) {
        super(message);
        this.userId = userId;
    }

    protected ConnectionException(String userId, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * Stable code reported to API clients.
     */
    public abstract String getErrorCode();
}

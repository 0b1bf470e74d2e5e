package career.pulse.app.exception;

/**
 * The refresh token was rejected. The connection has already been disconnected
 * and its tokens cleared; the user has to authorize again.
 */
public class RefreshFailedException extends ConnectionException {
    public RefreshFailedException(String userId, Throwable cause) {
        super(userId, "Failed to refresh Gmail access token for user " + userId + ". Please reconnect your Gmail account.", cause);
    }

    @Override
    public String getErrorCode() {
        return "gmail_reauthorization_required";
    }
}

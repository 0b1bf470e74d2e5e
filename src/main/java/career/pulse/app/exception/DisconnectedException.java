package career.pulse.app.exception;

public class DisconnectedException extends ConnectionException {
    public DisconnectedException(String userId) {
        super(userId, "No active Gmail connection for user " + userId + ". Please connect your Gmail account first.");
    }

    @Override
    public String getErrorCode() {
        return "gmail_not_connected";
    }
}

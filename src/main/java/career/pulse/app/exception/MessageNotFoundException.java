package career.pulse.app.exception;

public class MessageNotFoundException extends ProviderException {
    public MessageNotFoundException(String operation, String messageId, Throwable cause) {
        super(operation, messageId, "message not found", cause);
    }
}

package career.pulse.app.exception;

/**
 * Mailbox provider failure, always carrying the operation and (when known) the message id.
 */
public class ProviderException extends RuntimeException {
    private final String operation;
    private final String messageId;

    public ProviderException(String operation, String messageId, String message, Throwable cause) {
        super(describe(operation, messageId, message), cause);
        this.operation = operation;
        this.messageId = messageId;
    }

    private static String describe(String operation, String messageId, String message) {
        String target = messageId != null ? " for message " + messageId : "";
        return "Gmail " + operation + " failed" + target + ": " + message;
    }

    public String getOperation() {
        return operation;
    }

    public String getMessageId() {
        return messageId;
    }
}

package career.pulse.app.exception;

public class SyncCancelledException extends RuntimeException {
    public SyncCancelledException(String userId) {
        super("Sync for user " + userId + " was cancelled before a credential was acquired");
    }
}

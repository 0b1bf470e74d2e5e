package career.pulse.app.model;

/**
 * Phases of one sync run. {@link #FAILED} is only reachable before any message was fetched.
 */
public enum SyncState {
    IDLE,
    TOKEN_ACQUIRED,
    FETCHING,
    CLASSIFYING_BATCH,
    PERSISTING,
    COMPLETED,
    FAILED
}

package career.pulse.app.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one sync run. Counters satisfy
 * {@code fetched >= classified + errors.size()} and {@code classified == saved + duplicatesSkipped}.
 */
@Data
public class SyncRunResult {
    private int fetched;
    private int classified;
    private int duplicatesSkipped;
    private int saved;
    private List<SyncError> errors = new ArrayList<>();
    private List<SyncedApplication> applications = new ArrayList<>();
    private boolean cancelled;

    public void recordError(String messageId, String reason) {
        errors.add(new SyncError(messageId, reason));
    }
}

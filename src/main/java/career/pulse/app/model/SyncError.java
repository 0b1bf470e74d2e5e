package career.pulse.app.model;

import lombok.Value;

@Value
public class SyncError {
    String messageId;
    String reason;
}

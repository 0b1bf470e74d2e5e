package career.pulse.app.classifier;

import career.pulse.app.entity.ApplicationStatus;
import lombok.Value;

/**
 * Resolved status and whether it came from an explicit keyword rather than the default.
 */
@Value
public class StatusMatch {
    ApplicationStatus status;
    boolean explicit;
}

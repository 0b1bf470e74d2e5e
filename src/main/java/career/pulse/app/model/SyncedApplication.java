package career.pulse.app.model;

import career.pulse.app.entity.ApplicationStatus;
import lombok.Value;

@Value
public class SyncedApplication {
    String company;
    String role;
    ApplicationStatus status;
    double confidence;
}

package career.pulse.app.model;

import career.pulse.app.entity.ApplicationStatus;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Structured job application event extracted from a single message.
 */
@Value
@Builder
public class ParsedApplication {
    @NonNull String company;
    @NonNull String role;
    @NonNull ApplicationStatus status;
    @NonNull String dateApplied;
    String location;
    double confidence;
    @NonNull String emailId;

    public DuplicateKey duplicateKey() {
        return DuplicateKey.of(company, role, dateApplied);
    }
}

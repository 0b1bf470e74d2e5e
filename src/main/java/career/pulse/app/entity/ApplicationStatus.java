package career.pulse.app.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of a tracked job application.
 */
public enum ApplicationStatus {
    APPLIED("applied"),
    INTERVIEW("interview"),
    OFFER("offer"),
    REJECTED("rejected");

    private final String value;

    ApplicationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Case-insensitive lookup, so both {@code "interview"} and {@code "Interview"} are accepted.
     */
    public static Optional<ApplicationStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ApplicationStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

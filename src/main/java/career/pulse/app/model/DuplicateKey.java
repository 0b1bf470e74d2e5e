package career.pulse.app.model;

import lombok.Value;

import java.util.Locale;

/**
 * Normalized (company, role, dateApplied) identity used for exact-match deduplication.
 */
@Value
public class DuplicateKey {
    String company;
    String role;
    String dateApplied;

    public static DuplicateKey of(String company, String role, String dateApplied) {
        return new DuplicateKey(normalize(company), normalize(role), normalize(dateApplied));
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}

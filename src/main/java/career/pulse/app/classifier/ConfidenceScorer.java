package career.pulse.app.classifier;

import org.springframework.stereotype.Component;

/**
 * Additive confidence model. Each extracted field contributes a fixed weight in
 * hundredths; the weights sum to exactly 100 so the score stays within [0, 1].
 */
@Component
public class ConfidenceScorer {
    static final int COMPANY_WEIGHT = 25;
    static final int ROLE_WEIGHT = 25;
    static final int DATE_WEIGHT = 15;
    static final int LOCATION_WEIGHT = 10;
    static final int STATUS_WEIGHT = 25;

    public double score(boolean company, boolean role, boolean date, boolean location, boolean explicitStatus) {
        int total = 0;
        if (company) {
            total += COMPANY_WEIGHT;
        }
        if (role) {
            total += ROLE_WEIGHT;
        }
        if (date) {
            total += DATE_WEIGHT;
        }
        if (location) {
            total += LOCATION_WEIGHT;
        }
        if (explicitStatus) {
            total += STATUS_WEIGHT;
        }
        return total / 100.0;
    }
}

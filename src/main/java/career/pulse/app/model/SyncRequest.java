package career.pulse.app.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Body of POST /api/email/sync. Every field is optional.
 */
@Data
public class SyncRequest {
    private String query;

    /** Gmail date filter, YYYY/MM/DD. */
    @Pattern(regexp = "\\d{4}/\\d{1,2}/\\d{1,2}", message = "afterDate must be YYYY/MM/DD")
    private String afterDate;

    @Min(1)
    @Max(500)
    private Integer maxResults;

    public SyncOptions toOptions() {
        return SyncOptions.builder()
                .query(query)
                .afterDate(afterDate)
                .maxResults(maxResults)
                .build();
    }
}

package career.pulse.app.model;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Body of POST and PUT /api/applications. On update only the fields present are changed.
 */
@Data
public class ApplicationForm {
    @Size(max = 255)
    private String company;

    @Size(max = 255)
    private String role;

    @Size(max = 255)
    private String location;

    /** YYYY-MM-DD. */
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "dateApplied must be YYYY-MM-DD")
    private String dateApplied;

    /** applied, interview, offer or rejected, any case. */
    private String status;

    @Size(max = 255)
    private String source;

    @Size(max = 255)
    private String remotePolicy;

    private String notes;

    public boolean hasRequiredFields() {
        return !isBlank(company) && !isBlank(role) && !isBlank(dateApplied) && !isBlank(status);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

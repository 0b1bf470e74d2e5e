package career.pulse.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fields returned by the optional LLM extractor. Any field may be null.
 */
@Value
@Builder
public class LlmExtraction {
    Boolean jobEmail;
    String company;
    String jobTitle;
    String location;
    String status;
}

package career.pulse.app.service;

import career.pulse.app.model.LlmExtraction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Prompt and response handling shared by the LLM extractors.
 */
@Slf4j
final class LlmResponseParser {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final int MAX_BODY_CHARS = 3000;

    private LlmResponseParser() {}

    static String buildPrompt(String from, String subject, String body) {
        String content = body == null ? "" : body;
        return String.format(
                "Extract job application details from this email. Respond with ONLY a JSON object with the keys "
                        + "\"isJobEmail\" (boolean), \"company\", \"jobTitle\", \"location\" and \"status\" "
                        + "(one of applied, interview, offer, rejected). Use null for anything not stated.\n\n"
                        + "From: %s\nSubject: %s\n\n%s",
                from == null ? "" : from,
                subject == null ? "" : subject,
                content.length() > MAX_BODY_CHARS ? content.substring(0, MAX_BODY_CHARS) + "..." : content);
    }

    /**
     * Reads the first JSON object in the model output; markdown fences and prose around it are ignored.
     */
    static Optional<LlmExtraction> parse(String output) {
        if (output == null) {
            return Optional.empty();
        }
        int start = output.indexOf('{');
        int end = output.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.debug("LLM output contained no JSON object");
            return Optional.empty();
        }
        try {
            JsonNode json = OBJECT_MAPPER.readTree(output.substring(start, end + 1));
            LlmExtraction extraction = LlmExtraction.builder()
                    .jobEmail(json.hasNonNull("isJobEmail") ? json.get("isJobEmail").asBoolean() : null)
                    .company(text(json, "company"))
                    .jobTitle(text(json, "jobTitle"))
                    .location(text(json, "location"))
                    .status(text(json, "status"))
                    .build();
            if (Boolean.FALSE.equals(extraction.getJobEmail())) {
                return Optional.empty();
            }
            return Optional.of(extraction);
        } catch (Exception e) {
            log.debug("Could not parse LLM output: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode json, String field) {
        if (!json.hasNonNull(field)) {
            return null;
        }
        String value = json.get(field).asText().trim();
        return value.isEmpty() || "null".equalsIgnoreCase(value) ? null : value;
    }
}

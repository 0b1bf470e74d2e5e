package career.pulse.app.service;

import career.pulse.app.model.LlmExtraction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Google Gemini extractor over the REST generateContent endpoint.
 */
@Slf4j
public class GeminiExtractionService implements LlmExtractionService {
    private static final String GEMINI_API_URL =
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-pro:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public GeminiExtractionService(String apiKey) {
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
        this.apiKey = apiKey;

        if (apiKey == null || apiKey.isEmpty()) {
            log.warn("Gemini API key not configured. Set careerpulse.ai.gemini-api-key to enable extraction.");
        }
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isEmpty();
    }

    @Override
    public Optional<LlmExtraction> extract(String from, String subject, String body) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return LlmResponseParser.parse(callGeminiAPI(LlmResponseParser.buildPrompt(from, subject, body)));
        } catch (Exception e) {
            handleError(e, "application extraction");
            return Optional.empty();
        }
    }

    private String callGeminiAPI(String prompt) throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> requestBody = new HashMap<>();
        Map<String, Object> contents = new HashMap<>();
        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        contents.put("parts", List.of(part));
        requestBody.put("contents", List.of(contents));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("maxOutputTokens", 200);
        generationConfig.put("temperature", 0.0f);
        requestBody.put("generationConfig", generationConfig);

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);
        ResponseEntity<String> response = restTemplate.postForEntity(GEMINI_API_URL + "?key=" + apiKey, request, String.class);

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new IllegalStateException("Gemini API error: " + response.getStatusCode());
        }
        JsonNode parts = objectMapper.readTree(response.getBody()).path("candidates").path(0).path("content").path("parts");
        if (parts.isArray() && parts.size() > 0) {
            return parts.get(0).path("text").asText();
        }
        throw new IllegalStateException("Unexpected Gemini API response format");
    }

    private void handleError(Exception e, String operation) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";

        // quota errors arrive as 429 or 403 with a quota message
        if (errorMessage.contains("quota")
                || errorMessage.contains("exceeded")
                || errorMessage.contains("rate limit")
                || errorMessage.contains("429")
                || errorMessage.contains("resource exhausted")) {
            throw new QuotaException("Gemini quota/rate limit exceeded during " + operation, e);
        }
        // the request URL carries the API key, so transport messages are not logged
        log.warn("Gemini {} failed: {}", operation, e.getClass().getSimpleName());
    }
}

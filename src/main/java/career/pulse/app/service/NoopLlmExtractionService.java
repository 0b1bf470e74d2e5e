package career.pulse.app.service;

import career.pulse.app.model.LlmExtraction;

import java.util.Optional;

/**
 * Used when no LLM provider is configured.
 */
public class NoopLlmExtractionService implements LlmExtractionService {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public Optional<LlmExtraction> extract(String from, String subject, String body) {
        return Optional.empty();
    }
}

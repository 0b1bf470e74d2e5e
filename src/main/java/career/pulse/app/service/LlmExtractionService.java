package career.pulse.app.service;

import career.pulse.app.model.LlmExtraction;

import java.util.Optional;

/**
 * Optional secondary extractor backed by a language model.
 * Implementations must not throw for content problems; provider limits surface as {@link QuotaException}.
 */
public interface LlmExtractionService {
    /**
     * Custom exception for AI service quota/rate limit errors.
     */
    class QuotaException extends RuntimeException {
        public QuotaException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * @return false when no provider is configured; callers then skip extraction entirely
     */
    boolean isEnabled();

    /**
     * Extract application fields from an email.
     * @param from sender header
     * @param subject normalized subject
     * @param body normalized plain-text body
     * @return extracted fields, or empty when the model produced nothing usable
     * @throws QuotaException if the provider quota is exceeded
     */
    Optional<LlmExtraction> extract(String from, String subject, String body);
}

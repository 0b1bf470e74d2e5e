package career.pulse.app.classifier;

import career.pulse.app.entity.ApplicationStatus;
import career.pulse.app.model.LlmExtraction;
import career.pulse.app.model.ParsedApplication;
import career.pulse.app.model.RawMessage;
import career.pulse.app.service.LlmExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Turns a fetched message into a {@link ParsedApplication}, or {@code null} when the
 * message is not about a job application.
 * <p>
 * Never throws: undecodable or unrecognised content degrades to fallback values
 * and a low confidence score.
 */
@Slf4j
@Component
public class EmailClassifier {
    static final String UNKNOWN_COMPANY = "Unknown";
    static final String UNKNOWN_ROLE = "Unknown Position";

    private final ContentNormalizer normalizer;
    private final JobRelevanceFilter relevanceFilter;
    private final StatusDetector statusDetector;
    private final ConfidenceScorer confidenceScorer;
    private final LlmExtractionService llmExtractionService;
    private final Clock clock;

    private final ExtractorChain companyChain;
    private final ExtractorChain roleChain;
    private final ExtractorChain locationChain;

    public EmailClassifier(ContentNormalizer normalizer, JobRelevanceFilter relevanceFilter,
                           StatusDetector statusDetector, ConfidenceScorer confidenceScorer,
                           LlmExtractionService llmExtractionService, Clock clock) {
        this.normalizer = normalizer;
        this.relevanceFilter = relevanceFilter;
        this.statusDetector = statusDetector;
        this.confidenceScorer = confidenceScorer;
        this.llmExtractionService = llmExtractionService;
        this.clock = clock;

        ExtractorChain company = FieldExtractors.companyChain();
        ExtractorChain role = FieldExtractors.roleChain();
        ExtractorChain location = FieldExtractors.locationChain();
        if (llmExtractionService.isEnabled()) {
            company = company.then(FieldExtractors.llmField(LlmExtraction::getCompany, FieldExtractors::cleanCompany));
            role = role.then(FieldExtractors.llmField(LlmExtraction::getJobTitle, FieldExtractors::cleanRole));
            location = location.then(FieldExtractors.llmField(LlmExtraction::getLocation, FieldExtractors::cleanLocation));
        }
        this.companyChain = company;
        this.roleChain = role;
        this.locationChain = location;
    }

    public ParsedApplication classify(RawMessage message) {
        if (message == null || message.getMessageId() == null) {
            return null;
        }
        String subject = normalize(message.getSubject(), message.getMessageId());
        String body = normalize(message.getBody(), message.getMessageId());
        if (!relevanceFilter.isJobRelated(subject, body)) {
            return null;
        }

        try {
            return extract(message, subject, body);
        } catch (RuntimeException | StackOverflowError e) {
            // regex backtracking on pathological input can exhaust the stack
            log.warn("Classification degraded to fallback for message {}: {}", message.getMessageId(), e.toString());
            return fallback(message);
        }
    }

    private String normalize(String content, String messageId) {
        try {
            return normalizer.normalize(content);
        } catch (RuntimeException e) {
            log.warn("Could not normalize content of message {}, using raw text: {}", messageId, e.getMessage());
            return content == null ? "" : content;
        }
    }

    private ParsedApplication extract(RawMessage message, String subject, String body) {
        StatusMatch status = statusDetector.detect(subject + "\n" + body);
        ClassificationContext context = new ClassificationContext(message, subject, body,
                () -> askLlm(message.getMessageId(), message.getFrom(), subject, body));

        Optional<String> company = companyChain.firstMatch(context);
        Optional<String> role = roleChain.firstMatch(context);
        Optional<String> location = locationChain.firstMatch(context);
        Optional<String> receivedDate = receivedDate(message);

        double confidence = confidenceScorer.score(company.isPresent(), role.isPresent(),
                receivedDate.isPresent(), location.isPresent(), status.isExplicit());

        ParsedApplication parsed = ParsedApplication.builder()
                .company(company.orElse(UNKNOWN_COMPANY))
                .role(role.orElse(UNKNOWN_ROLE))
                .status(status.getStatus())
                .dateApplied(receivedDate.orElseGet(this::today))
                .location(location.orElse(null))
                .confidence(confidence)
                .emailId(message.getMessageId())
                .build();
        log.debug("Classified message {} as {} at {} ({}), confidence {}", message.getMessageId(),
                parsed.getRole(), parsed.getCompany(), parsed.getStatus(), confidence);
        return parsed;
    }

    private ParsedApplication fallback(RawMessage message) {
        return ParsedApplication.builder()
                .company(UNKNOWN_COMPANY)
                .role(UNKNOWN_ROLE)
                .status(ApplicationStatus.APPLIED)
                .dateApplied(today())
                .confidence(0.0)
                .emailId(message.getMessageId())
                .build();
    }

    private Optional<LlmExtraction> askLlm(String messageId, String from, String subject, String body) {
        try {
            return llmExtractionService.extract(from, subject, body);
        } catch (LlmExtractionService.QuotaException e) {
            log.warn("LLM quota exceeded, skipping extraction for message {}", messageId);
        } catch (RuntimeException e) {
            log.warn("LLM extraction failed for message {}: {}", messageId, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Receipt date as a UTC calendar day, empty when missing or outside four-digit years.
     */
    private Optional<String> receivedDate(RawMessage message) {
        if (message.getReceivedAt() == null) {
            return Optional.empty();
        }
        LocalDate date = message.getReceivedAt().atZone(ZoneOffset.UTC).toLocalDate();
        if (date.getYear() < 1900 || date.getYear() > 9999) {
            return Optional.empty();
        }
        return Optional.of(date.format(DateTimeFormatter.ISO_LOCAL_DATE));
    }

    private String today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}

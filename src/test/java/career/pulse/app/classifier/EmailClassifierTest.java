package career.pulse.app.classifier;

import career.pulse.app.entity.ApplicationStatus;
import career.pulse.app.model.LlmExtraction;
import career.pulse.app.model.ParsedApplication;
import career.pulse.app.model.RawMessage;
import career.pulse.app.service.LlmExtractionService;
import career.pulse.app.service.NoopLlmExtractionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailClassifierTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private LlmExtractionService llmExtractionService;

    private EmailClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = newClassifier(new NoopLlmExtractionService());
    }

    private static EmailClassifier newClassifier(LlmExtractionService llm) {
        return new EmailClassifier(new ContentNormalizer(), new JobRelevanceFilter(), new StatusDetector(),
                new ConfidenceScorer(), llm, CLOCK);
    }

    private static RawMessage message(String id, String from, String subject, String body, Instant receivedAt) {
        return RawMessage.builder()
                .messageId(id)
                .from(from)
                .subject(subject)
                .body(body)
                .receivedAt(receivedAt)
                .build();
    }

    @Test
    void classify_WithApplicationReceivedEmail_ShouldExtractAllFields() {
        // Given
        RawMessage message = message("msg-1", "jobs@acme.com", "Application Received: Backend Engineer",
                "Thank you for applying to our team.", Instant.parse("2024-06-01T10:00:00Z"));

        // When
        ParsedApplication parsed = classifier.classify(message);

        // Then
        assertNotNull(parsed);
        assertEquals("acme", parsed.getCompany());
        assertEquals("Backend Engineer", parsed.getRole());
        assertEquals(ApplicationStatus.APPLIED, parsed.getStatus());
        assertEquals("2024-06-01", parsed.getDateApplied());
        assertNull(parsed.getLocation());
        assertEquals("msg-1", parsed.getEmailId());
        assertEquals(0.9, parsed.getConfidence(), 1e-9);
    }

    @Test
    void classify_WithNonJobEmail_ShouldReturnNull() {
        RawMessage message = message("msg-2", "news@shop.example.com", "Your weekly deals",
                "Save 20% on garden furniture this weekend.", Instant.parse("2024-06-01T10:00:00Z"));

        assertNull(classifier.classify(message));
    }

    @Test
    void classify_WithNullMessageOrId_ShouldReturnNull() {
        assertNull(classifier.classify(null));
        assertNull(classifier.classify(message(null, "jobs@acme.com", "Application received", "", null)));
    }

    @Test
    void classify_WithHtmlInterviewInvitation_ShouldUseBodyForCompanyAndLocation() {
        // Given
        String html = "<html><body><p>We would like to invite you to an <b>interview</b> for the Data Scientist "
                + "position at Globex.</p><p>Location: Remote (US)</p></body></html>";
        RawMessage message = message("msg-3", "no-reply@greenhouse.io", "Interview Invitation - Data Scientist",
                html, Instant.parse("2024-06-10T23:30:00Z"));

        // When
        ParsedApplication parsed = classifier.classify(message);

        // Then
        assertNotNull(parsed);
        assertEquals("Globex", parsed.getCompany());
        assertEquals("Data Scientist", parsed.getRole());
        assertEquals(ApplicationStatus.INTERVIEW, parsed.getStatus());
        assertEquals("Remote (US)", parsed.getLocation());
        assertEquals("2024-06-10", parsed.getDateApplied());
        assertEquals(1.0, parsed.getConfidence(), 1e-9);
    }

    @Test
    void classify_WithRejectionAfterInterview_ShouldReportRejected() {
        RawMessage message = message("msg-4", "talent@initech.com", "Update on your application",
                "Thank you for your time at the interview. Unfortunately we will not be moving forward.",
                Instant.parse("2024-06-01T10:00:00Z"));

        ParsedApplication parsed = classifier.classify(message);

        assertNotNull(parsed);
        assertEquals(ApplicationStatus.REJECTED, parsed.getStatus());
        assertEquals("initech", parsed.getCompany());
    }

    @Test
    void classify_WithUnicodeNames_ShouldKeepThemIntact() {
        RawMessage message = message("msg-5", "recruiter.personal@gmail.com",
                "Application for Ingénieur Logiciel at Zürich Analytics", "Thanks for applying.",
                Instant.parse("2024-06-01T10:00:00Z"));

        ParsedApplication parsed = classifier.classify(message);

        assertNotNull(parsed);
        assertEquals("Zürich Analytics", parsed.getCompany());
        assertEquals("Ingénieur Logiciel", parsed.getRole());
    }

    @Test
    void classify_WithNothingExtractable_ShouldUseFallbacksAndZeroConfidence() {
        // Given
        RawMessage message = message("msg-6", "", "Your application", "", null);

        // When
        ParsedApplication parsed = classifier.classify(message);

        // Then
        assertNotNull(parsed);
        assertEquals(EmailClassifier.UNKNOWN_COMPANY, parsed.getCompany());
        assertEquals(EmailClassifier.UNKNOWN_ROLE, parsed.getRole());
        assertEquals(ApplicationStatus.APPLIED, parsed.getStatus());
        assertEquals("2024-06-15", parsed.getDateApplied());
        assertNull(parsed.getLocation());
        assertEquals(0.0, parsed.getConfidence(), 1e-9);
    }

    @Test
    void classify_WithDateOutsideFourDigitYears_ShouldFallBackToToday() {
        Instant farFuture = LocalDate.of(12000, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
        RawMessage message = message("msg-7", "jobs@acme.com", "Application Received: Backend Engineer",
                "Thank you for applying.", farFuture);

        ParsedApplication parsed = classifier.classify(message);

        assertNotNull(parsed);
        assertEquals("2024-06-15", parsed.getDateApplied());
        assertEquals(0.75, parsed.getConfidence(), 1e-9);
    }

    @Test
    void classify_WithSameFieldsFoundByDifferentStrategies_ShouldScoreTheSame() {
        Instant receivedAt = Instant.parse("2024-06-01T10:00:00Z");
        ParsedApplication fromDomain = classifier.classify(message("a", "jobs@acme.com",
                "Application Received: Backend Engineer", "Thanks.", receivedAt));
        ParsedApplication fromBody = classifier.classify(message("b", "someone@gmail.com",
                "Application Received: Backend Engineer", "Thank you for your interest in Acme.", receivedAt));

        assertNotNull(fromDomain);
        assertNotNull(fromBody);
        assertEquals("Acme", fromBody.getCompany());
        assertEquals(fromDomain.getConfidence(), fromBody.getConfidence(), 1e-9);
    }

    @Test
    void classify_WithHeuristicGaps_ShouldAskLlmOnce() {
        // Given
        when(llmExtractionService.isEnabled()).thenReturn(true);
        when(llmExtractionService.extract(any(), any(), any())).thenReturn(Optional.of(LlmExtraction.builder()
                .jobEmail(true)
                .company("Initech")
                .jobTitle("QA Lead")
                .location("Austin, TX")
                .build()));
        EmailClassifier withLlm = newClassifier(llmExtractionService);

        // When
        ParsedApplication parsed = withLlm.classify(message("msg-8", "", "Your application",
                "We have your details on file.", null));

        // Then
        assertNotNull(parsed);
        assertEquals("Initech", parsed.getCompany());
        assertEquals("QA Lead", parsed.getRole());
        assertEquals("Austin, TX", parsed.getLocation());
        assertEquals(0.6, parsed.getConfidence(), 1e-9);
        verify(llmExtractionService, times(1)).extract(any(), any(), any());
    }

    @Test
    void classify_WithHeuristicsComplete_ShouldNotAskLlm() {
        when(llmExtractionService.isEnabled()).thenReturn(true);
        EmailClassifier withLlm = newClassifier(llmExtractionService);

        RawMessage message = message("msg-9", "no-reply@greenhouse.io", "Interview Invitation - Data Scientist",
                "Interview for the Data Scientist position at Globex.\nLocation: Berlin", null);
        ParsedApplication parsed = withLlm.classify(message);

        assertNotNull(parsed);
        assertEquals("Berlin", parsed.getLocation());
        verify(llmExtractionService, never()).extract(any(), any(), any());
    }

    @Test
    void classify_WhenLlmQuotaExceeded_ShouldStillReturnHeuristicResult() {
        // Given
        when(llmExtractionService.isEnabled()).thenReturn(true);
        when(llmExtractionService.extract(any(), any(), any()))
                .thenThrow(new LlmExtractionService.QuotaException("quota", null));
        EmailClassifier withLlm = newClassifier(llmExtractionService);

        // When
        ParsedApplication parsed = withLlm.classify(message("msg-10", "jobs@acme.com", "Your application",
                "Thanks for applying.", null));

        // Then
        assertNotNull(parsed);
        assertEquals("acme", parsed.getCompany());
        assertEquals(EmailClassifier.UNKNOWN_ROLE, parsed.getRole());
    }

    @Test
    void classify_WithLongCapitalisedBody_ShouldReturnResultWithoutError() {
        // Given
        String body = "Thanks for your application. The team is based in " + "Abc ".repeat(20000);
        RawMessage message = message("msg-11", "jobs@acme.com", "Your application", body,
                Instant.parse("2024-06-01T10:00:00Z"));

        // When
        ParsedApplication parsed = assertDoesNotThrow(() -> classifier.classify(message));

        // Then
        assertNotNull(parsed);
        assertEquals("acme", parsed.getCompany());
        assertEquals("Abc Abc Abc Abc", parsed.getLocation());
    }

    @Test
    void classify_AcrossVariedMessages_ShouldAlwaysProduceValidDateAndConfidence() {
        List<RawMessage> messages = List.of(
                message("p1", "jobs@acme.com", "Application Received: Backend Engineer", "Thanks for applying", null),
                message("p2", "<b>odd</b>", "<i>Offer</i>", "<div>Congratulations &amp; welcome</div>", Instant.EPOCH),
                message("p3", null, null, "We'd like to schedule a phone screen", Instant.parse("2030-12-31T23:59:59Z")),
                message("p4", "hr@globex.co.uk", "Re: your job application", "Location: Paris, France", null),
                message("p5", "x@y.z", "Position", "\u0000� application ‮", Instant.MIN),
                message("p6", "jobs@acme.com", "Interview | Staff Engineer", "Unfortunately...", Instant.MAX));

        for (RawMessage message : messages) {
            ParsedApplication parsed = classifier.classify(message);
            assertNotNull(parsed, "expected a result for " + message.getMessageId());
            assertTrue(parsed.getDateApplied().matches("\\d{4}-\\d{2}-\\d{2}"), parsed.getDateApplied());
            assertTrue(parsed.getConfidence() >= 0.0 && parsed.getConfidence() <= 1.0);
            assertNotNull(parsed.getStatus());
        }
    }
}

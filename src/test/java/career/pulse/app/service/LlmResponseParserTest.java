package career.pulse.app.service;

import career.pulse.app.model.LlmExtraction;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LlmResponseParserTest {

    @Test
    void parse_WithFencedJson_ShouldReadFields() {
        // Given
        String output = "```json\n{\"isJobEmail\": true, \"company\": \"Acme\", \"jobTitle\": \"Backend Engineer\","
                + " \"location\": null, \"status\": \"applied\"}\n```";

        // When
        Optional<LlmExtraction> extraction = LlmResponseParser.parse(output);

        // Then
        assertTrue(extraction.isPresent());
        assertEquals("Acme", extraction.get().getCompany());
        assertEquals("Backend Engineer", extraction.get().getJobTitle());
        assertNull(extraction.get().getLocation());
        assertEquals("applied", extraction.get().getStatus());
    }

    @Test
    void parse_WithNonJobEmail_ShouldReturnEmpty() {
        assertTrue(LlmResponseParser.parse("{\"isJobEmail\": false, \"company\": \"Acme\"}").isEmpty());
    }

    @Test
    void parse_WithLiteralNullStrings_ShouldTreatThemAsMissing() {
        Optional<LlmExtraction> extraction = LlmResponseParser.parse("{\"company\": \"null\", \"jobTitle\": \"  \"}");

        assertTrue(extraction.isPresent());
        assertNull(extraction.get().getCompany());
        assertNull(extraction.get().getJobTitle());
    }

    @Test
    void parse_WithGarbage_ShouldReturnEmpty() {
        assertTrue(LlmResponseParser.parse(null).isEmpty());
        assertTrue(LlmResponseParser.parse("I cannot help with that").isEmpty());
        assertTrue(LlmResponseParser.parse("{not json}").isEmpty());
    }

    @Test
    void buildPrompt_ShouldTruncateLongBodies() {
        String prompt = LlmResponseParser.buildPrompt("jobs@acme.com", "Application received", "x".repeat(5000));

        assertTrue(prompt.contains("From: jobs@acme.com"));
        assertTrue(prompt.contains("Subject: Application received"));
        assertTrue(prompt.endsWith("x".repeat(3000) + "..."));
        assertFalse(prompt.contains("x".repeat(3001)));
    }
}

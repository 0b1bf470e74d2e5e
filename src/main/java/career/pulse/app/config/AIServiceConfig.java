package career.pulse.app.config;

import career.pulse.app.service.GeminiExtractionService;
import career.pulse.app.service.LlmExtractionService;
import career.pulse.app.service.NoopLlmExtractionService;
import career.pulse.app.service.OpenAiExtractionService;
import com.theokanning.openai.service.OpenAiService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Selects the LLM secondary extractor.
 * Set careerpulse.ai.provider=openai or careerpulse.ai.provider=gemini; anything else disables it.
 */
@Configuration
public class AIServiceConfig {

    @Bean
    @ConditionalOnProperty(name = "careerpulse.ai.provider", havingValue = "gemini")
    public LlmExtractionService geminiExtractionService(CareerPulseProperties properties) {
        return new GeminiExtractionService(properties.getAi().getGeminiApiKey());
    }

    @Bean
    @ConditionalOnProperty(name = "careerpulse.ai.provider", havingValue = "openai")
    public LlmExtractionService openAiExtractionService(CareerPulseProperties properties) {
        OpenAiService openAiService = new OpenAiService(properties.getAi().getOpenaiApiKey(),
                Duration.ofSeconds(properties.getSync().getCallTimeoutSeconds()));
        return new OpenAiExtractionService(openAiService, properties.getAi().getOpenaiModel());
    }

    @Bean
    @ConditionalOnProperty(name = "careerpulse.ai.provider", havingValue = "none", matchIfMissing = true)
    public LlmExtractionService noopExtractionService() {
        return new NoopLlmExtractionService();
    }
}

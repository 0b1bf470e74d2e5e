package career.pulse.app.service;

import career.pulse.app.model.LlmExtraction;
import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * OpenAI-backed extractor, created by {@link career.pulse.app.config.AIServiceConfig}
 * when {@code careerpulse.ai.provider=openai}.
 */
@Slf4j
public class OpenAiExtractionService implements LlmExtractionService {
    private final OpenAiService openAiService;
    private final String model;

    public OpenAiExtractionService(OpenAiService openAiService, String model) {
        this.openAiService = openAiService;
        this.model = model;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Optional<LlmExtraction> extract(String from, String subject, String body) {
        try {
            ChatMessage message = new ChatMessage("user", LlmResponseParser.buildPrompt(from, subject, body));
            ChatCompletionRequest request = ChatCompletionRequest.builder()
                    .model(model)
                    .messages(List.of(message))
                    .maxTokens(200)
                    .temperature(0.0)
                    .build();

            String output = openAiService.createChatCompletion(request)
                    .getChoices().get(0).getMessage().getContent();
            return LlmResponseParser.parse(output);
        } catch (Exception e) {
            handleOpenAIError(e, "application extraction");
            return Optional.empty();
        }
    }

    private void handleOpenAIError(Exception e, String operation) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";

        if (e instanceof OpenAiHttpException
                || errorMessage.contains("quota")
                || errorMessage.contains("exceeded")
                || errorMessage.contains("rate limit")
                || (e.getCause() != null && e.getCause().getMessage() != null
                && e.getCause().getMessage().toLowerCase(Locale.ROOT).contains("429"))) {
            throw new QuotaException("OpenAI quota/rate limit exceeded during " + operation + ": " + e.getMessage(), e);
        }
        log.warn("OpenAI {} failed: {}", operation, e.getMessage());
    }
}

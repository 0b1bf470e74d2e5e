package career.pulse.app.classifier;

import career.pulse.app.model.LlmExtraction;
import career.pulse.app.model.RawMessage;
import lombok.Getter;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-message input shared by all extractors. The LLM result is computed at most once.
 */
@Getter
public class ClassificationContext {
    private final RawMessage message;
    private final String subject;
    private final String body;
    private final Supplier<Optional<LlmExtraction>> llmSupplier;
    private Optional<LlmExtraction> llmResult;

    public ClassificationContext(RawMessage message, String subject, String body,
                                 Supplier<Optional<LlmExtraction>> llmSupplier) {
        this.message = message;
        this.subject = subject;
        this.body = body;
        this.llmSupplier = llmSupplier;
    }

    public String getFrom() {
        return message.getFrom() == null ? "" : message.getFrom();
    }

    public Optional<LlmExtraction> llm() {
        if (llmResult == null) {
            llmResult = llmSupplier.get();
        }
        return llmResult;
    }
}

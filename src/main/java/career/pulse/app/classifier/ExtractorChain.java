package career.pulse.app.classifier;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of strategies for one field; the first non-empty result wins.
 * A strategy that throws is treated as having found nothing.
 */
@Slf4j
public class ExtractorChain {
    private final String field;
    private final List<FieldExtractor> extractors;

    public ExtractorChain(String field, List<FieldExtractor> extractors) {
        this.field = field;
        this.extractors = List.copyOf(extractors);
    }

    public ExtractorChain then(FieldExtractor extractor) {
        List<FieldExtractor> extended = new ArrayList<>(extractors);
        extended.add(extractor);
        return new ExtractorChain(field, extended);
    }

    public Optional<String> firstMatch(ClassificationContext context) {
        for (FieldExtractor extractor : extractors) {
            try {
                Optional<String> value = extractor.extract(context);
                if (value.isPresent() && !value.get().isBlank()) {
                    return Optional.of(value.get().trim());
                }
            } catch (RuntimeException e) {
                log.warn("{} extractor failed for message {}: {}", field,
                        context.getMessage().getMessageId(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}

package career.pulse.app.classifier;

import java.util.Optional;

/**
 * One extraction strategy for a single field. Returns empty when it finds nothing.
 */
@FunctionalInterface
public interface FieldExtractor {
    Optional<String> extract(ClassificationContext context);
}

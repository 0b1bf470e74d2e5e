package career.pulse.app.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A mail item as fetched from the provider. Transient; never persisted.
 */
@Value
@Builder
public class RawMessage {
    String messageId;
    String from;
    String subject;
    String body;
    Instant receivedAt;
}

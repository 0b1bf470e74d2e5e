package career.pulse.app.service;

import career.pulse.app.model.RawMessage;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Locale;

/**
 * Converts a Gmail API {@link Message} into a {@link RawMessage}. Plain text parts are
 * preferred; HTML is used only when the message has no plain text part.
 */
@Slf4j
@Component
public class GmailMessageMapper {

    public RawMessage toRawMessage(Message message) {
        String from = "";
        String subject = "";
        String date = null;
        String body = "";

        MessagePart payload = message.getPayload();
        if (payload != null) {
            if (payload.getHeaders() != null) {
                for (MessagePartHeader header : payload.getHeaders()) {
                    if (header.getName() == null) {
                        continue;
                    }
                    String value = header.getValue() != null ? header.getValue() : "";
                    switch (header.getName().toLowerCase(Locale.ROOT)) {
                        case "from":
                            from = value;
                            break;
                        case "subject":
                            subject = value;
                            break;
                        case "date":
                            date = value;
                            break;
                        default:
                            break;
                    }
                }
            }

            BodyExtractionResult bodyResult = extractBodyFromParts(payload);
            if (bodyResult.plainTextContent != null && !bodyResult.plainTextContent.isBlank()) {
                body = bodyResult.plainTextContent;
            } else if (bodyResult.htmlContent != null) {
                body = bodyResult.htmlContent;
            }
        }

        return RawMessage.builder()
                .messageId(message.getId())
                .from(from)
                .subject(subject)
                .body(body)
                .receivedAt(resolveReceivedAt(message.getInternalDate(), date))
                .build();
    }

    /**
     * Provider receipt time first, then the Date header. Null when neither is usable.
     */
    Instant resolveReceivedAt(Long internalDate, String dateHeader) {
        if (internalDate != null && internalDate > 0) {
            return Instant.ofEpochMilli(internalDate);
        }
        if (dateHeader == null || dateHeader.isBlank()) {
            return null;
        }
        // drop trailing comments such as "(UTC)"
        String cleaned = dateHeader.replaceAll("\\s*\\([^)]*\\)\\s*$", "").trim();
        try {
            return ZonedDateTime.parse(cleaned, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Date header '{}'", dateHeader);
            return null;
        }
    }

    private static class BodyExtractionResult {
        String htmlContent = null;
        String plainTextContent = null;
    }

    private BodyExtractionResult extractBodyFromParts(MessagePart part) {
        BodyExtractionResult result = new BodyExtractionResult();

        if (part.getBody() != null && part.getBody().getData() != null) {
            String mimeType = part.getMimeType();
            if ("text/plain".equals(mimeType) || "text/html".equals(mimeType)) {
                String decoded = decode(part.getBody().getData(), mimeType);
                if (decoded != null) {
                    if ("text/html".equals(mimeType)) {
                        result.htmlContent = decoded;
                    } else {
                        result.plainTextContent = decoded;
                    }
                }
            }
        }

        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                BodyExtractionResult subResult = extractBodyFromParts(subPart);
                if (subResult.htmlContent != null && !subResult.htmlContent.isEmpty()) {
                    result.htmlContent = (result.htmlContent != null ? result.htmlContent + "\n" : "") + subResult.htmlContent;
                }
                if (subResult.plainTextContent != null && !subResult.plainTextContent.isEmpty()) {
                    result.plainTextContent = (result.plainTextContent != null ? result.plainTextContent + "\n" : "") + subResult.plainTextContent;
                }
            }
        }

        return result;
    }

    /**
     * Gmail bodies are URL-safe base64; some senders produce unpadded or standard
     * alphabet data, so a padded standard decode is tried second.
     */
    private String decode(String data, String mimeType) {
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            try {
                String padded = data;
                int remainder = padded.length() % 4;
                if (remainder > 0) {
                    padded += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return null;
            }
        }
    }
}

package career.pulse.app.service;

import career.pulse.app.config.CareerPulseProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Signs the OAuth {@code state} parameter so a Gmail callback can only connect the
 * mailbox to the user who started the flow.
 * <p>
 * Format: {@code base64url(userId:issuedAt:nonce).base64url(HMAC-SHA256)}.
 */
@Component
public class OAuthStateSigner {
    static final Duration MAX_AGE = Duration.ofMinutes(10);
    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] secret;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public OAuthStateSigner(CareerPulseProperties properties, Clock clock) {
        this.secret = properties.getSecurity().getSigningSecret().getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    public String sign(String userId) {
        byte[] nonce = new byte[12];
        random.nextBytes(nonce);
        String payload = userId + ":" + Instant.now(clock).getEpochSecond() + ":"
                + Base64.getUrlEncoder().withoutPadding().encodeToString(nonce);
        String encodedPayload = encode(payload.getBytes(StandardCharsets.UTF_8));
        return encodedPayload + "." + encode(hmac(encodedPayload));
    }

    /**
     * @return the user id carried by a valid, unexpired state; empty otherwise
     */
    public Optional<String> verify(String state) {
        if (state == null) {
            return Optional.empty();
        }
        int dot = state.indexOf('.');
        if (dot <= 0 || dot == state.length() - 1) {
            return Optional.empty();
        }
        String encodedPayload = state.substring(0, dot);
        byte[] signature;
        String payload;
        try {
            signature = Base64.getUrlDecoder().decode(state.substring(dot + 1));
            payload = new String(Base64.getUrlDecoder().decode(encodedPayload), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (!MessageDigest.isEqual(hmac(encodedPayload), signature)) {
            return Optional.empty();
        }

        // user ids may contain ':'; the last two fields are fixed
        int nonceSep = payload.lastIndexOf(':');
        int issuedSep = nonceSep > 0 ? payload.lastIndexOf(':', nonceSep - 1) : -1;
        if (issuedSep <= 0) {
            return Optional.empty();
        }
        long issuedAt;
        try {
            issuedAt = Long.parseLong(payload.substring(issuedSep + 1, nonceSep));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        if (Instant.ofEpochSecond(issuedAt).plus(MAX_AGE).isBefore(now)) {
            return Optional.empty();
        }
        return Optional.of(payload.substring(0, issuedSep));
    }

    private byte[] hmac(String data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    private static String encode(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}

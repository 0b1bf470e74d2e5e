package career.pulse.app.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Token endpoint response. The refresh token is null when the provider did not rotate it.
 */
@Value
@Builder
public class TokenGrant {
    @ToString.Exclude
    String accessToken;
    @ToString.Exclude
    String refreshToken;
    Instant expiresAt;
    String scope;
}

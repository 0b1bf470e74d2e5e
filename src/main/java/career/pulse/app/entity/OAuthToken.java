package career.pulse.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

@Embeddable
@Data
public class OAuthToken {
    @ToString.Exclude
    @Column(length = 4000)
    private String accessToken;

    @ToString.Exclude
    @Column(length = 4000)
    private String refreshToken;

    private Instant expiresAt;

    private String scopes;

    public boolean isEmpty() {
        return accessToken == null && refreshToken == null;
    }
}

package career.pulse.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Stored Gmail credential for one user. Token fields are only mutated by
 * {@link career.pulse.app.service.TokenLifecycleManager}.
 */
@Entity
@Table(name = "email_connections",
        uniqueConstraints = @UniqueConstraint(name = "uk_email_connections_user", columnNames = "user_id"))
@Getter
@Setter
@ToString
public class OAuthConnection {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    private String email;

    @Embedded
    private OAuthToken token = new OAuthToken();

    private boolean connected;

    private Instant updatedAt;
}

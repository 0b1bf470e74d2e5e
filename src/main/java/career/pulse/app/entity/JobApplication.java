package career.pulse.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "applications", indexes = {
        @Index(name = "idx_applications_user", columnList = "user_id"),
        @Index(name = "idx_applications_email", columnList = "email_id")
})
@Data
public class JobApplication {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private String company;

    @Column(nullable = false)
    private String role;

    private String location;

    @Column(nullable = false, length = 10)
    private String dateApplied;

    private String lastUpdate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApplicationStatus status;

    private String source;

    private String remotePolicy;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "email_id")
    private String emailId;

    private double confidenceScore;

    private Instant createdAt;
}

package career.pulse.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * One status transition of a tracked application, written whenever a user edit changes the status.
 */
@Entity
@Table(name = "status_history", indexes = @Index(name = "idx_status_history_application", columnList = "application_id"))
@Data
public class StatusChange {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "application_id", nullable = false)
    private String applicationId;

    @Enumerated(EnumType.STRING)
    private ApplicationStatus oldStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApplicationStatus newStatus;

    @Column(nullable = false)
    private Instant changedAt;
}

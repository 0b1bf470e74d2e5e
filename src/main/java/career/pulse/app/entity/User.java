package career.pulse.app.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString
public class User {
    @Id
    private String id; // OAuth subject

    private String primaryEmail;

    private String name;

    private Instant createdAt;
}

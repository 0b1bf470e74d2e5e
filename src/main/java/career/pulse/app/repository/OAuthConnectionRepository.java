package career.pulse.app.repository;

import career.pulse.app.entity.OAuthConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OAuthConnectionRepository extends JpaRepository<OAuthConnection, String> {
    Optional<OAuthConnection> findByUserId(String userId);
    List<OAuthConnection> findByConnectedTrue();
}

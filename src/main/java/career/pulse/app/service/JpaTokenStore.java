package career.pulse.app.service;

import career.pulse.app.entity.OAuthConnection;
import career.pulse.app.repository.OAuthConnectionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class JpaTokenStore implements TokenStore {
    private final OAuthConnectionRepository connectionRepository;

    public JpaTokenStore(OAuthConnectionRepository connectionRepository) {
        this.connectionRepository = connectionRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OAuthConnection> findByUserId(String userId) {
        return connectionRepository.findByUserId(userId);
    }

    @Override
    @Transactional
    public OAuthConnection save(OAuthConnection connection) {
        return connectionRepository.save(connection);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OAuthConnection> findActive() {
        return connectionRepository.findByConnectedTrue();
    }
}

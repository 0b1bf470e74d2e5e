package career.pulse.app.service;

import career.pulse.app.entity.OAuthConnection;

import java.util.List;
import java.util.Optional;

/**
 * Per-user keyed store of OAuth connections. The store is the source of truth;
 * nothing is cached in front of it.
 */
public interface TokenStore {
    Optional<OAuthConnection> findByUserId(String userId);

    OAuthConnection save(OAuthConnection connection);

    /**
     * @return every connection currently flagged as connected
     */
    List<OAuthConnection> findActive();
}

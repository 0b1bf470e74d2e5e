package career.pulse.app.service;

import career.pulse.app.config.CareerPulseProperties;
import career.pulse.app.entity.OAuthConnection;
import career.pulse.app.entity.OAuthToken;
import career.pulse.app.exception.DisconnectedException;
import career.pulse.app.exception.OAuthExchangeException;
import career.pulse.app.exception.RefreshFailedException;
import career.pulse.app.model.ConnectionStatus;
import career.pulse.app.model.TokenGrant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the token fields of every {@link OAuthConnection}: decides whether a stored
 * credential is usable, refreshes it, or disconnects it.
 * <p>
 * Refreshes are serialized per user so two concurrent callers never both spend the
 * same refresh token.
 */
@Slf4j
@Service
public class TokenLifecycleManager {
    static final String RECONNECT_MESSAGE = "Token expired, please reconnect";

    private final TokenStore tokenStore;
    private final GoogleOAuthClient oauthClient;
    private final Clock clock;
    private final long safetyMarginSeconds;
    private final UserLocks userLocks = new UserLocks();

    public TokenLifecycleManager(TokenStore tokenStore, GoogleOAuthClient oauthClient,
                                 CareerPulseProperties properties, Clock clock) {
        this.tokenStore = tokenStore;
        this.oauthClient = oauthClient;
        this.clock = clock;
        this.safetyMarginSeconds = properties.getSync().getTokenSafetyMarginSeconds();
    }

    /**
     * Returns an access token that stays valid for at least the safety margin,
     * refreshing the stored credential when needed.
     *
     * @throws DisconnectedException  if the user has no active connection
     * @throws RefreshFailedException if the refresh grant failed; the connection is disconnected
     */
    public String acquireValidAccessToken(String userId) {
        OAuthConnection connection = requireActiveConnection(userId);
        if (isUsable(connection.getToken())) {
            return connection.getToken().getAccessToken();
        }

        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            // another caller may have refreshed while we waited
            connection = requireActiveConnection(userId);
            if (isUsable(connection.getToken())) {
                return connection.getToken().getAccessToken();
            }
            return refresh(connection);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the refresh grant even when the current access token is still valid.
     */
    public String forceRefresh(String userId) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            return refresh(requireActiveConnection(userId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a freshly authorized connection, replacing any previous one for the user.
     */
    public OAuthConnection connect(String userId, String email, TokenGrant grant) {
        if (grant.getAccessToken() == null || grant.getRefreshToken() == null) {
            throw new OAuthExchangeException("Token response is incomplete: access and refresh tokens are both required");
        }

        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            OAuthConnection connection = tokenStore.findByUserId(userId).orElseGet(() -> {
                OAuthConnection created = new OAuthConnection();
                created.setUserId(userId);
                return created;
            });

            OAuthToken token = new OAuthToken();
            token.setAccessToken(grant.getAccessToken());
            token.setRefreshToken(grant.getRefreshToken());
            token.setExpiresAt(grant.getExpiresAt());
            token.setScopes(grant.getScope());

            connection.setEmail(email);
            connection.setToken(token);
            connection.setConnected(true);
            connection.setUpdatedAt(Instant.now(clock));

            OAuthConnection saved = tokenStore.save(connection);
            log.info("Gmail connected for user {} ({}), token expires at {}", userId, email, grant.getExpiresAt());
            return saved;
        } finally {
            lock.unlock();
        }
    }

    public void disconnect(String userId) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            tokenStore.findByUserId(userId).ifPresent(connection -> {
                invalidate(connection);
                log.info("Gmail disconnected for user {} ({})", userId, connection.getEmail());
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * Connection state as reported to the client. An expired token is refreshed
     * on the way; a failed refresh disconnects and is reported with an error.
     */
    public ConnectionStatus checkStatus(String userId) {
        try {
            acquireValidAccessToken(userId);
        } catch (DisconnectedException e) {
            return ConnectionStatus.disconnected(null);
        } catch (RefreshFailedException e) {
            return ConnectionStatus.disconnected(RECONNECT_MESSAGE);
        }
        return tokenStore.findByUserId(userId)
                .map(connection -> ConnectionStatus.connected(connection.getEmail()))
                .orElseGet(() -> ConnectionStatus.disconnected(null));
    }

    private String refresh(OAuthConnection connection) {
        String userId = connection.getUserId();
        OAuthToken token = connection.getToken();
        log.info("Refreshing Gmail access token for user {} ({})", userId, connection.getEmail());

        TokenGrant grant;
        try {
            grant = oauthClient.refresh(token.getRefreshToken());
        } catch (RuntimeException e) {
            invalidate(connection);
            log.warn("Token refresh failed for user {} ({}), connection disconnected: {}",
                    userId, connection.getEmail(), e.getMessage());
            throw new RefreshFailedException(userId, e);
        }

        token.setAccessToken(grant.getAccessToken());
        token.setExpiresAt(grant.getExpiresAt());
        if (grant.getRefreshToken() != null) {
            token.setRefreshToken(grant.getRefreshToken());
        }
        connection.setUpdatedAt(Instant.now(clock));
        tokenStore.save(connection);
        log.info("Token refreshed for user {} ({}), expires at {}", userId, connection.getEmail(), grant.getExpiresAt());
        return grant.getAccessToken();
    }

    private void invalidate(OAuthConnection connection) {
        OAuthToken token = connection.getToken() != null ? connection.getToken() : new OAuthToken();
        token.setAccessToken(null);
        token.setRefreshToken(null);
        token.setExpiresAt(null);
        connection.setToken(token);
        connection.setConnected(false);
        connection.setUpdatedAt(Instant.now(clock));
        tokenStore.save(connection);
    }

    private OAuthConnection requireActiveConnection(String userId) {
        OAuthConnection connection = tokenStore.findByUserId(userId)
                .orElseThrow(() -> new DisconnectedException(userId));
        if (!connection.isConnected() || connection.getToken() == null || connection.getToken().isEmpty()) {
            throw new DisconnectedException(userId);
        }
        return connection;
    }

    private boolean isUsable(OAuthToken token) {
        if (token.getAccessToken() == null || token.getExpiresAt() == null) {
            return false;
        }
        return token.getExpiresAt().isAfter(Instant.now(clock).plusSeconds(safetyMarginSeconds));
    }

    private ReentrantLock lockFor(String userId) {
        return userLocks.forUser(userId);
    }
}

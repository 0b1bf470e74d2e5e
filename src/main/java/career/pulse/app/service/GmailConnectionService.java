package career.pulse.app.service;

import career.pulse.app.exception.OAuthExchangeException;
import career.pulse.app.model.MailboxProfile;
import career.pulse.app.model.TokenGrant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Gmail connect flow: consent URL, callback handling and profile lookup for a connected mailbox.
 */
@Slf4j
@Service
public class GmailConnectionService {
    private final GoogleOAuthClient oauthClient;
    private final OAuthStateSigner stateSigner;
    private final TokenLifecycleManager tokenManager;
    private final MailboxFetcher mailboxFetcher;

    public GmailConnectionService(GoogleOAuthClient oauthClient, OAuthStateSigner stateSigner,
                                  TokenLifecycleManager tokenManager, MailboxFetcher mailboxFetcher) {
        this.oauthClient = oauthClient;
        this.stateSigner = stateSigner;
        this.tokenManager = tokenManager;
        this.mailboxFetcher = mailboxFetcher;
    }

    public String authorizationUrl(String userId) {
        return oauthClient.buildAuthorizationUrl(stateSigner.sign(userId));
    }

    /**
     * Exchanges the authorization code and stores the connection for the user named by {@code state}.
     *
     * @return the connected mailbox address
     * @throws OAuthExchangeException if the state is invalid, the exchange fails or the
     *                                response lacks an access or refresh token
     */
    public String completeAuthorization(String code, String state) {
        String userId = stateSigner.verify(state)
                .orElseThrow(() -> new OAuthExchangeException("Invalid or expired authorization state"));

        TokenGrant grant = oauthClient.exchangeCode(code);
        if (grant.getAccessToken() == null || grant.getRefreshToken() == null) {
            log.warn("Token exchange for user {} returned no refresh token", userId);
            throw new OAuthExchangeException("Failed to obtain tokens");
        }

        MailboxProfile profile = mailboxFetcher.getProfile(grant.getAccessToken());
        tokenManager.connect(userId, profile.getEmail(), grant);
        return profile.getEmail();
    }

    /**
     * @throws career.pulse.app.exception.ConnectionException if the user has no usable connection
     */
    public MailboxProfile profile(String userId) {
        return mailboxFetcher.getProfile(tokenManager.acquireValidAccessToken(userId));
    }
}

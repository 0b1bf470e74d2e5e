package career.pulse.app.service;

import career.pulse.app.entity.OAuthConnection;
import career.pulse.app.exception.ConnectionException;
import career.pulse.app.model.SyncOptions;
import career.pulse.app.model.SyncRunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Background sync for every user with an active Gmail connection.
 * Enabled with {@code careerpulse.sync.scheduled-enabled=true}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "careerpulse.sync.scheduled-enabled", havingValue = "true")
public class ScheduledSyncRunner {
    private final TokenStore tokenStore;
    private final SyncOrchestrator syncOrchestrator;

    public ScheduledSyncRunner(TokenStore tokenStore, SyncOrchestrator syncOrchestrator) {
        this.tokenStore = tokenStore;
        this.syncOrchestrator = syncOrchestrator;
    }

    @Scheduled(fixedDelayString = "${careerpulse.sync.scheduled-interval-ms:300000}",
            initialDelayString = "${careerpulse.sync.scheduled-interval-ms:300000}")
    public void syncAllConnectedUsers() {
        List<OAuthConnection> connections = tokenStore.findActive();
        log.info("Scheduled sync started for {} connected users", connections.size());
        int succeeded = 0;
        for (OAuthConnection connection : connections) {
            String userId = connection.getUserId();
            try {
                SyncRunResult result = syncOrchestrator.runSync(userId, SyncOptions.defaults());
                log.info("Scheduled sync for user {} saved {} applications", userId, result.getSaved());
                succeeded++;
            } catch (ConnectionException e) {
                log.warn("Skipping scheduled sync for user {}: {}", userId, e.getErrorCode());
            } catch (Exception e) {
                log.error("Scheduled sync failed for user {}: {}", userId, e.getMessage(), e);
            }
        }
        log.info("Scheduled sync ended, {}/{} users synced", succeeded, connections.size());
    }
}

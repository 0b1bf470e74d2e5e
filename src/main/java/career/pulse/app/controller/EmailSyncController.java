package career.pulse.app.controller;

import career.pulse.app.entity.OAuthConnection;
import career.pulse.app.exception.ConnectionException;
import career.pulse.app.exception.ProviderException;
import career.pulse.app.exception.SyncCancelledException;
import career.pulse.app.model.MailboxProfile;
import career.pulse.app.model.SyncRequest;
import career.pulse.app.model.SyncRunResult;
import career.pulse.app.service.ApplicationRecorder;
import career.pulse.app.service.GmailConnectionService;
import career.pulse.app.service.SyncOrchestrator;
import career.pulse.app.service.TokenStore;
import career.pulse.app.service.UserService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mailbox sync and profile endpoints. Sync item failures come back as 200 with
 * the {@code errors} list populated; only credential and listing failures fail the request.
 */
@Slf4j
@RestController
@RequestMapping("/api/email")
public class EmailSyncController {
    private final SyncOrchestrator syncOrchestrator;
    private final GmailConnectionService connectionService;
    private final ApplicationRecorder applicationRecorder;
    private final TokenStore tokenStore;
    private final UserService userService;

    public EmailSyncController(
            SyncOrchestrator syncOrchestrator,
            GmailConnectionService connectionService,
            ApplicationRecorder applicationRecorder,
            TokenStore tokenStore,
            UserService userService) {
        this.syncOrchestrator = syncOrchestrator;
        this.connectionService = connectionService;
        this.applicationRecorder = applicationRecorder;
        this.tokenStore = tokenStore;
        this.userService = userService;
    }

    @PostMapping("/sync")
    public ResponseEntity<?> sync(@Valid @RequestBody(required = false) SyncRequest request,
                                  Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        SyncRequest effective = request != null ? request : new SyncRequest();
        try {
            SyncRunResult result = syncOrchestrator.runSync(userId, effective.toOptions());
            return ResponseEntity.ok(result);
        } catch (ConnectionException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(error(e.getErrorCode(), "Please connect your Gmail account first"));
        } catch (ProviderException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error("gmail_unavailable", e.getMessage()));
        } catch (SyncCancelledException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(error("sync_cancelled", e.getMessage()));
        } catch (Exception e) {
            log.error("Email sync failed for user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error("sync_failed", e.getMessage()));
        }
    }

    @GetMapping("/profile")
    public ResponseEntity<?> profile(Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        try {
            MailboxProfile profile = connectionService.profile(userId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("email", profile.getEmail());
            body.put("messagesTotal", profile.getMessagesTotal());
            body.put("threadsTotal", profile.getThreadsTotal());
            body.put("applicationsTracked", applicationRecorder.countByUser(userId));
            return ResponseEntity.ok(body);
        } catch (ConnectionException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error(e.getErrorCode(), "Gmail not connected"));
        } catch (Exception e) {
            log.error("Failed to fetch Gmail profile for user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(error("profile_failed", e.getMessage()));
        }
    }

    /**
     * Connection state and time of the last token change, without contacting Google.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        Optional<OAuthConnection> connection = tokenStore.findByUserId(userId).filter(OAuthConnection::isConnected);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connected", connection.isPresent());
        connection.ifPresent(c -> body.put("email", c.getEmail()));
        body.put("updatedAt", connection.map(OAuthConnection::getUpdatedAt).orElse(null));
        return ResponseEntity.ok(body);
    }

    private static Map<String, String> error(String code, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message != null ? message : "");
        return body;
    }
}

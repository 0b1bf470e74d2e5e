package career.pulse.app.controller;

import career.pulse.app.exception.DisconnectedException;
import career.pulse.app.exception.OAuthExchangeException;
import career.pulse.app.exception.RefreshFailedException;
import career.pulse.app.model.ConnectionStatus;
import career.pulse.app.service.GmailConnectionService;
import career.pulse.app.service.TokenLifecycleManager;
import career.pulse.app.service.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/auth")
public class GmailAuthController {
    private final GmailConnectionService connectionService;
    private final TokenLifecycleManager tokenManager;
    private final UserService userService;

    public GmailAuthController(
            GmailConnectionService connectionService,
            TokenLifecycleManager tokenManager,
            UserService userService) {
        this.connectionService = connectionService;
        this.tokenManager = tokenManager;
        this.userService = userService;
    }

    @GetMapping("/gmail")
    public ResponseEntity<Map<String, String>> authorizationUrl(Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        return ResponseEntity.ok(Map.of("authUrl", connectionService.authorizationUrl(userId)));
    }

    /**
     * Google redirects the browser here after consent; the response is a small HTML page.
     */
    @GetMapping(value = "/gmail/callback", produces = MediaType.TEXT_HTML_VALUE)
    public ResponseEntity<String> callback(@RequestParam(value = "code", required = false) String code,
                                           @RequestParam(value = "state", required = false) String state,
                                           @RequestParam(value = "error", required = false) String error) {
        if (code == null || code.isBlank()) {
            String reason = error != null ? "Authorization was not granted: " + error : "Missing authorization code";
            return ResponseEntity.badRequest().body(failurePage(reason));
        }
        try {
            String email = connectionService.completeAuthorization(code, state);
            return ResponseEntity.ok(successPage(email));
        } catch (OAuthExchangeException e) {
            log.warn("Gmail authorization rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(failurePage(e.getMessage()));
        } catch (Exception e) {
            log.error("OAuth callback error: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(failurePage(e.getMessage()));
        }
    }

    @GetMapping("/status")
    public ResponseEntity<?> status(Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        try {
            ConnectionStatus status = tokenManager.checkStatus(userId);
            return ResponseEntity.ok(status);
        } catch (Exception e) {
            log.error("Error checking connection status for user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to check connection status"));
        }
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, Object>> disconnect(Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        try {
            tokenManager.disconnect(userId);
            return ResponseEntity.ok(result("Email disconnected successfully"));
        } catch (Exception e) {
            log.error("Error disconnecting Gmail for user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to disconnect email"));
        }
    }

    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh(Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        try {
            tokenManager.forceRefresh(userId);
            return ResponseEntity.ok(result("Token refreshed successfully"));
        } catch (DisconnectedException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "No active connection found"));
        } catch (RefreshFailedException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", e.getErrorCode()));
        } catch (Exception e) {
            log.error("Error refreshing token for user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to refresh token"));
        }
    }

    private static Map<String, Object> result(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", message);
        return body;
    }

    private static String successPage(String email) {
        return "<html><body>"
                + "<h1>Gmail Connected Successfully!</h1>"
                + "<p>" + HtmlUtils.htmlEscape(email != null ? email : "") + " is now linked to CareerPulse.</p>"
                + "<p>You can now close this window and return to CareerPulse.</p>"
                + "<script>setTimeout(function () { window.close(); }, 2000);</script>"
                + "</body></html>";
    }

    private static String failurePage(String reason) {
        return "<html><body>"
                + "<h1>Connection Failed</h1>"
                + "<p>Error: " + HtmlUtils.htmlEscape(reason != null ? reason : "unknown error") + "</p>"
                + "<p>Please try again.</p>"
                + "</body></html>";
    }
}

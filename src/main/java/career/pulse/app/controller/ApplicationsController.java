package career.pulse.app.controller;

import career.pulse.app.entity.ApplicationStatus;
import career.pulse.app.entity.JobApplication;
import career.pulse.app.entity.StatusChange;
import career.pulse.app.model.ApplicationForm;
import career.pulse.app.service.ApplicationService;
import career.pulse.app.service.UserService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracked applications of the signed-in user. Records owned by someone else answer 404.
 */
@Slf4j
@RestController
@RequestMapping("/api/applications")
public class ApplicationsController {
    private final ApplicationService applicationService;
    private final UserService userService;

    public ApplicationsController(ApplicationService applicationService, UserService userService) {
        this.applicationService = applicationService;
        this.userService = userService;
    }

    @GetMapping
    public ResponseEntity<?> list(Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        try {
            List<JobApplication> applications = applicationService.list(userId);
            return ResponseEntity.ok(applications);
        } catch (Exception e) {
            log.error("Failed to list applications for user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(error("fetch_failed", "Failed to fetch applications"));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id, Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        try {
            Optional<JobApplication> application = applicationService.get(userId, id);
            return application.<ResponseEntity<?>>map(ResponseEntity::ok).orElseGet(ApplicationsController::notFound);
        } catch (Exception e) {
            log.error("Failed to fetch application {} for user {}: {}", id, userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(error("fetch_failed", "Failed to fetch application"));
        }
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<?> history(@PathVariable String id, Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        try {
            Optional<List<StatusChange>> history = applicationService.history(userId, id);
            return history.<ResponseEntity<?>>map(ResponseEntity::ok).orElseGet(ApplicationsController::notFound);
        } catch (Exception e) {
            log.error("Failed to fetch status history of {} for user {}: {}", id, userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(error("fetch_failed", "Failed to fetch status history"));
        }
    }

    @PostMapping
    public ResponseEntity<?> create(@Valid @RequestBody ApplicationForm form, Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        if (!form.hasRequiredFields()) {
            return ResponseEntity.badRequest()
                    .body(error("missing_fields", "company, role, dateApplied and status are required"));
        }
        Optional<ApplicationStatus> status = ApplicationStatus.parse(form.getStatus());
        if (status.isEmpty()) {
            return invalidStatus();
        }
        try {
            JobApplication created = applicationService.create(userId, form, status.get());
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (Exception e) {
            log.error("Failed to create application for user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(error("create_failed", "Failed to create application"));
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable String id, @Valid @RequestBody ApplicationForm form,
                                    Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        ApplicationStatus status = null;
        if (form.getStatus() != null) {
            Optional<ApplicationStatus> parsed = ApplicationStatus.parse(form.getStatus());
            if (parsed.isEmpty()) {
                return invalidStatus();
            }
            status = parsed.get();
        }
        try {
            Optional<JobApplication> updated = applicationService.update(userId, id, form, status);
            return updated.<ResponseEntity<?>>map(ResponseEntity::ok).orElseGet(ApplicationsController::notFound);
        } catch (Exception e) {
            log.error("Failed to update application {} for user {}: {}", id, userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(error("update_failed", "Failed to update application"));
        }
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<?> updateStatus(@PathVariable String id, @RequestBody Map<String, String> body,
                                          Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        String requested = body.get("status");
        if (requested == null || requested.isBlank()) {
            return ResponseEntity.badRequest().body(error("missing_fields", "Status is required"));
        }
        Optional<ApplicationStatus> status = ApplicationStatus.parse(requested);
        if (status.isEmpty()) {
            return invalidStatus();
        }
        try {
            Optional<JobApplication> updated = applicationService.updateStatus(userId, id, status.get());
            return updated.<ResponseEntity<?>>map(ResponseEntity::ok).orElseGet(ApplicationsController::notFound);
        } catch (Exception e) {
            log.error("Failed to update status of {} for user {}: {}", id, userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(error("update_failed", "Failed to update application status"));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable String id, Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        try {
            if (!applicationService.delete(userId, id)) {
                return notFound();
            }
            return ResponseEntity.noContent().build();
        } catch (Exception e) {
            log.error("Failed to delete application {} for user {}: {}", id, userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(error("delete_failed", "Failed to delete application"));
        }
    }

    private static ResponseEntity<?> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", "Application not found"));
    }

    private static ResponseEntity<?> invalidStatus() {
        return ResponseEntity.badRequest()
                .body(error("invalid_status", "Status must be one of applied, interview, offer, rejected"));
    }

    private static Map<String, String> error(String code, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message != null ? message : "");
        return body;
    }
}

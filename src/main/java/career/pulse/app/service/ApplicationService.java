package career.pulse.app.service;

import career.pulse.app.entity.ApplicationStatus;
import career.pulse.app.entity.JobApplication;
import career.pulse.app.entity.StatusChange;
import career.pulse.app.model.ApplicationForm;
import career.pulse.app.repository.JobApplicationRepository;
import career.pulse.app.repository.StatusChangeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * User-facing reads and edits of tracked applications. Every lookup is scoped to
 * the owning user, so another user's record behaves as if it did not exist.
 */
@Slf4j
@Service
public class ApplicationService {
    static final String SOURCE_MANUAL = "Manual";

    private final JobApplicationRepository applicationRepository;
    private final StatusChangeRepository statusChangeRepository;
    private final Clock clock;

    public ApplicationService(JobApplicationRepository applicationRepository,
                              StatusChangeRepository statusChangeRepository,
                              Clock clock) {
        this.applicationRepository = applicationRepository;
        this.statusChangeRepository = statusChangeRepository;
        this.clock = clock;
    }

    /** Newest application first. */
    @Transactional(readOnly = true)
    public List<JobApplication> list(String userId) {
        return applicationRepository.findByUserIdOrderByDateAppliedDesc(userId);
    }

    @Transactional(readOnly = true)
    public Optional<JobApplication> get(String userId, String id) {
        return applicationRepository.findByIdAndUserId(id, userId);
    }

    /**
     * Status transitions, most recent first; empty when the application is not the user's.
     */
    @Transactional(readOnly = true)
    public Optional<List<StatusChange>> history(String userId, String id) {
        return applicationRepository.findByIdAndUserId(id, userId)
                .map(application -> statusChangeRepository.findByApplicationIdOrderByChangedAtDesc(application.getId()));
    }

    /**
     * @param status already validated by the caller
     */
    @Transactional
    public JobApplication create(String userId, ApplicationForm form, ApplicationStatus status) {
        JobApplication application = new JobApplication();
        application.setUserId(userId);
        application.setCompany(form.getCompany().trim());
        application.setRole(form.getRole().trim());
        application.setLocation(form.getLocation());
        application.setDateApplied(form.getDateApplied());
        application.setLastUpdate(today());
        application.setStatus(status);
        application.setSource(form.getSource() != null ? form.getSource() : SOURCE_MANUAL);
        application.setRemotePolicy(form.getRemotePolicy());
        application.setNotes(form.getNotes());
        application.setConfidenceScore(0.0);
        application.setCreatedAt(Instant.now(clock));
        JobApplication saved = applicationRepository.save(application);
        log.info("Created application {} for user {}: {} at {}", saved.getId(), userId, saved.getRole(), saved.getCompany());
        return saved;
    }

    /**
     * Applies the non-null fields of the form. A status change is written to the history.
     *
     * @param status new status, or {@code null} to leave it unchanged
     */
    @Transactional
    public Optional<JobApplication> update(String userId, String id, ApplicationForm form, ApplicationStatus status) {
        return applicationRepository.findByIdAndUserId(id, userId).map(application -> {
            if (form.getCompany() != null) {
                application.setCompany(form.getCompany().trim());
            }
            if (form.getRole() != null) {
                application.setRole(form.getRole().trim());
            }
            if (form.getLocation() != null) {
                application.setLocation(form.getLocation());
            }
            if (form.getDateApplied() != null) {
                application.setDateApplied(form.getDateApplied());
            }
            if (form.getSource() != null) {
                application.setSource(form.getSource());
            }
            if (form.getRemotePolicy() != null) {
                application.setRemotePolicy(form.getRemotePolicy());
            }
            if (form.getNotes() != null) {
                application.setNotes(form.getNotes());
            }
            if (status != null) {
                changeStatus(application, status);
            }
            application.setLastUpdate(today());
            return applicationRepository.save(application);
        });
    }

    @Transactional
    public Optional<JobApplication> updateStatus(String userId, String id, ApplicationStatus status) {
        return applicationRepository.findByIdAndUserId(id, userId).map(application -> {
            changeStatus(application, status);
            application.setLastUpdate(today());
            return applicationRepository.save(application);
        });
    }

    /**
     * @return false when there was nothing of the user's to delete
     */
    @Transactional
    public boolean delete(String userId, String id) {
        Optional<JobApplication> application = applicationRepository.findByIdAndUserId(id, userId);
        if (application.isEmpty()) {
            return false;
        }
        statusChangeRepository.deleteByApplicationId(id);
        applicationRepository.delete(application.get());
        log.info("Deleted application {} for user {}", id, userId);
        return true;
    }

    private void changeStatus(JobApplication application, ApplicationStatus status) {
        ApplicationStatus previous = application.getStatus();
        if (previous == status) {
            return;
        }
        StatusChange change = new StatusChange();
        change.setApplicationId(application.getId());
        change.setOldStatus(previous);
        change.setNewStatus(status);
        change.setChangedAt(Instant.now(clock));
        statusChangeRepository.save(change);
        application.setStatus(status);
        log.debug("Application {} moved from {} to {}", application.getId(), previous, status);
    }

    private String today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}

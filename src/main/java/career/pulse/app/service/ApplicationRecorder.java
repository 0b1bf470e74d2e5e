package career.pulse.app.service;

import career.pulse.app.entity.JobApplication;
import career.pulse.app.model.ParsedApplication;
import career.pulse.app.repository.JobApplicationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Persists classified applications, one transaction per record so a failing
 * write never rolls back earlier ones.
 */
@Service
public class ApplicationRecorder {
    static final String SOURCE_EMAIL = "Email";

    private final JobApplicationRepository applicationRepository;
    private final Clock clock;

    public ApplicationRecorder(JobApplicationRepository applicationRepository, Clock clock) {
        this.applicationRepository = applicationRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<JobApplication> findByUser(String userId) {
        return applicationRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public long countByUser(String userId) {
        return applicationRepository.countByUserId(userId);
    }

    @Transactional
    public JobApplication record(String userId, ParsedApplication parsed, String subject) {
        JobApplication application = new JobApplication();
        application.setUserId(userId);
        application.setCompany(parsed.getCompany());
        application.setRole(parsed.getRole());
        application.setLocation(parsed.getLocation());
        application.setDateApplied(parsed.getDateApplied());
        application.setLastUpdate(parsed.getDateApplied());
        application.setStatus(parsed.getStatus());
        application.setSource(SOURCE_EMAIL);
        application.setRemotePolicy(isRemote(parsed.getLocation()) ? "Remote" : null);
        application.setNotes("Extracted from email: \"" + (subject != null ? subject : "") + "\"");
        application.setEmailId(parsed.getEmailId());
        application.setConfidenceScore(parsed.getConfidence());
        application.setCreatedAt(Instant.now(clock));
        return applicationRepository.save(application);
    }

    private boolean isRemote(String location) {
        return location != null && location.toLowerCase(Locale.ROOT).contains("remote");
    }
}

package career.pulse.app.service;

import career.pulse.app.entity.ApplicationStatus;
import career.pulse.app.entity.JobApplication;
import career.pulse.app.model.DuplicateKey;
import career.pulse.app.model.ParsedApplication;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Exact-match duplicate detection on (company, role, dateApplied) plus status.
 * Near matches, such as the same company and role on another day, are distinct applications.
 */
@Component
public class DuplicateDetector {

    public boolean isDuplicate(ParsedApplication candidate, KnownApplications existing) {
        return existing.contains(candidate.duplicateKey(), candidate.getStatus());
    }

    /**
     * Snapshot of a user's stored applications, extended as a run saves new ones.
     * Not thread-safe; callers serialize access per user.
     */
    public static class KnownApplications {
        private final Set<Entry> entries = new HashSet<>();
        private final Set<String> emailIds = new HashSet<>();

        public static KnownApplications of(Collection<JobApplication> stored) {
            KnownApplications known = new KnownApplications();
            for (JobApplication application : stored) {
                known.entries.add(new Entry(
                        DuplicateKey.of(application.getCompany(), application.getRole(), application.getDateApplied()),
                        application.getStatus()));
                if (application.getEmailId() != null) {
                    known.emailIds.add(application.getEmailId());
                }
            }
            return known;
        }

        public void add(ParsedApplication application) {
            entries.add(new Entry(application.duplicateKey(), application.getStatus()));
            emailIds.add(application.getEmailId());
        }

        /**
         * Whether a record was already extracted from this message.
         */
        public boolean containsEmail(String emailId) {
            return emailIds.contains(emailId);
        }

        boolean contains(DuplicateKey key, ApplicationStatus status) {
            return entries.contains(new Entry(key, status));
        }

        public int size() {
            return entries.size();
        }

        @Value
        private static class Entry {
            DuplicateKey key;
            ApplicationStatus status;
        }
    }
}

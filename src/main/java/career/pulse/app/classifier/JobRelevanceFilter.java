package career.pulse.app.classifier;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A message is job-related iff its normalized subject and body contain at least
 * one job-context term. Terms match at a word start, so "recruit" also covers
 * "recruiter" and "recruiting".
 */
@Component
public class JobRelevanceFilter {
    static final List<String> JOB_VOCABULARY = List.of(
            "application", "apply", "applied", "applying", "interview", "offer", "position", "role",
            "job", "career", "hiring", "recruit", "candidate", "rejection", "rejected",
            "thanks for applying", "phone screen", "next steps");

    private static final Pattern JOB_TERMS = Pattern.compile(
            "(?iu)\\b(?:" + JOB_VOCABULARY.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")");

    public boolean isJobRelated(String normalizedSubject, String normalizedBody) {
        String text = (normalizedSubject == null ? "" : normalizedSubject) + "\n"
                + (normalizedBody == null ? "" : normalizedBody);
        return JOB_TERMS.matcher(text).find();
    }
}

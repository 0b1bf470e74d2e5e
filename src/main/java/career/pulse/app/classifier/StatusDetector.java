package career.pulse.app.classifier;

import career.pulse.app.entity.ApplicationStatus;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves the application status from keyword groups evaluated in fixed priority
 * order: rejected, offer, interview, applied. The first group with a hit wins;
 * with no hit the status defaults to applied.
 */
@Component
public class StatusDetector {
    private static final Map<ApplicationStatus, Pattern> GROUPS_BY_PRIORITY = new LinkedHashMap<>();

    static {
        GROUPS_BY_PRIORITY.put(ApplicationStatus.REJECTED, group(List.of(
                "unfortunately", "not moving forward", "not to move forward", "move forward with other candidates",
                "pursue other candidates", "not been selected", "not selected", "regret to inform",
                "rejected", "rejection", "will not be proceeding", "no longer under consideration",
                "position has been filled")));
        GROUPS_BY_PRIORITY.put(ApplicationStatus.OFFER, group(List.of(
                "offer letter", "pleased to offer", "happy to offer", "job offer", "extend an offer",
                "extend you an offer", "offer of employment", "congratulations")));
        GROUPS_BY_PRIORITY.put(ApplicationStatus.INTERVIEW, group(List.of(
                "interview", "phone screen", "schedule a call", "schedule a time", "video call",
                "meet with", "next steps", "your availability", "coding challenge", "assessment")));
        GROUPS_BY_PRIORITY.put(ApplicationStatus.APPLIED, group(List.of(
                "application received", "received your application", "thank you for applying",
                "thanks for applying", "application submitted", "application has been submitted",
                "successfully applied", "applied")));
    }

    private static Pattern group(List<String> phrases) {
        return Pattern.compile("(?iu)\\b(?:" + phrases.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")");
    }

    public StatusMatch detect(String normalizedText) {
        String text = normalizedText == null ? "" : normalizedText;
        for (Map.Entry<ApplicationStatus, Pattern> group : GROUPS_BY_PRIORITY.entrySet()) {
            if (group.getValue().matcher(text).find()) {
                return new StatusMatch(group.getKey(), true);
            }
        }
        return new StatusMatch(ApplicationStatus.APPLIED, false);
    }
}

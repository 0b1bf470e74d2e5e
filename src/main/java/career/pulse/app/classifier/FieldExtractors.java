package career.pulse.app.classifier;

import career.pulse.app.model.LlmExtraction;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic extraction strategies. Chains are declared in evaluation order; new
 * strategies are appended without touching the classifier.
 */
public final class FieldExtractors {

    private FieldExtractors() {}

    private static final String CAP_WORD = "\\p{Lu}[\\p{L}\\d&'\\-]*";
    private static final String CAP_PHRASE = CAP_WORD + "(?:\\s+" + CAP_WORD + "){0,3}";

    private static final Pattern EMAIL_ADDRESS = Pattern.compile("[\\w.+\\-]+@([A-Za-z0-9\\-]+(?:\\.[A-Za-z0-9\\-]+)+)");

    /** Mailbox and applicant-tracking hosts that say nothing about the employer. */
    private static final Set<String> NON_EMPLOYER_DOMAINS = Set.of(
            "gmail.com", "googlemail.com", "yahoo.com", "outlook.com", "hotmail.com", "live.com", "icloud.com",
            "aol.com", "proton.me", "protonmail.com",
            "greenhouse.io", "greenhouse-mail.io", "lever.co", "myworkday.com", "myworkdayjobs.com", "workday.com",
            "smartrecruiters.com", "icims.com", "ashbyhq.com", "jobvite.com", "linkedin.com", "indeed.com",
            "indeedemail.com", "taleo.net", "successfactors.com", "bamboohr.com", "breezy.hr", "recruitee.com",
            "workablemail.com", "workable.com", "ziprecruiter.com", "glassdoor.com", "hire.lever.co");

    private static final Set<String> SECOND_LEVEL_SUFFIXES = Set.of("co", "com", "org", "net", "ac", "gov", "edu");

    private static final Set<String> NOT_A_COMPANY = Set.of(
            "the", "our", "your", "us", "we", "you", "a", "an", "this", "that", "it", "unknown", "team", "hi", "dear");

    private static final List<Pattern> COMPANY_PATTERNS = List.of(
            Pattern.compile("(?i:thank you for your interest in|thanks for your interest in|your interest in)\\s+(" + CAP_PHRASE + ")"),
            Pattern.compile("(?i:applying|application|applied)\\s+(?i:to|at|with)\\s+(" + CAP_PHRASE + ")"),
            Pattern.compile("\\b(?i:at)\\s+(" + CAP_PHRASE + ")"),
            Pattern.compile("(" + CAP_PHRASE + ")\\s+(?i:recruiting|talent acquisition|hiring|careers)\\s+(?i:team)"));

    private static final String ROLE_WORD = "\\p{Lu}[\\p{L}\\d/&+#.()\\-]*";
    private static final String ROLE_PHRASE = ROLE_WORD + "(?:\\s+(?:(?:of|and|&)\\s+)?" + ROLE_WORD + "){0,6}";

    private static final List<Pattern> ROLE_SUBJECT_PATTERNS = List.of(
            Pattern.compile("(?i)(?:application(?:\\s+(?:received|submitted|confirmation|update))?|applied|"
                    + "interview(?:\\s+(?:invitation|request|invite))?|offer)\\s*[:\\-–|]\\s*(.+)"),
            Pattern.compile("(?i)(?:application for|applying for|applied for)\\s+(?:the\\s+)?(.+?)(?:\\s+(?:at|with)\\s+|\\s*[!.,;|]|$)"),
            Pattern.compile("\\b(?i:for|as|in)\\s+(?:(?i:the|our|a|an)\\s+)?(" + ROLE_PHRASE + ")\\s+(?i:position|role|opening|job)\\b"));

    private static final List<Pattern> ROLE_BODY_PATTERNS = List.of(
            Pattern.compile("(?im)^\\s*(?:position|role|job title|job)\\s*:\\s*([^\\n]+)$"),
            Pattern.compile("(?i)(?:application for|applying for|applied for)\\s+(?:the\\s+)?([^\\n]+?)(?:\\s+(?:at|with)\\s+|\\s*[!.,;|]|$)"),
            Pattern.compile("\\b(?i:for|as|in)\\s+(?:(?i:the|our|a|an)\\s+)?(" + ROLE_PHRASE + ")\\s+(?i:position|role|opening)\\b"));

    private static final Pattern ROLE_TAIL = Pattern.compile("(?i)\\s+(?:at|with|@)\\s+.*$|\\s+[\\-–|]\\s+.*$");

    private static final String PLACE = CAP_WORD + "(?:\\s+" + CAP_WORD + "){0,3}";
    private static final List<Pattern> LOCATION_PATTERNS = List.of(
            Pattern.compile("(?im)^\\s*(?:location|office location|work location)\\s*:\\s*([^\\n|;]+)$"),
            Pattern.compile("(?i:based in|located in|office in|position in)\\s+(" + PLACE + "(?:,\\s*" + PLACE + ")?)"));
    private static final Pattern REMOTE = Pattern.compile(
            "\\((?i:remote)\\)|\\b(?i:fully remote)\\b|\\b(?i:remote)\\s+(?i:position|role|opportunity|job|work)\\b");

    public static ExtractorChain companyChain() {
        return new ExtractorChain("company", List.of(
                FieldExtractors::companyFromSenderDomain,
                context -> firstGroup(COMPANY_PATTERNS, context.getSubject(), FieldExtractors::cleanCompany),
                context -> firstGroup(COMPANY_PATTERNS, context.getBody(), FieldExtractors::cleanCompany)));
    }

    public static ExtractorChain roleChain() {
        return new ExtractorChain("role", List.of(
                context -> firstGroup(ROLE_SUBJECT_PATTERNS, context.getSubject(), FieldExtractors::cleanRole),
                context -> firstGroup(ROLE_BODY_PATTERNS, context.getBody(), FieldExtractors::cleanRole)));
    }

    public static ExtractorChain locationChain() {
        return new ExtractorChain("location", List.of(
                context -> firstGroup(LOCATION_PATTERNS, context.getBody(), FieldExtractors::cleanLocation),
                context -> REMOTE.matcher(context.getBody()).find() ? Optional.of("Remote") : Optional.empty()));
    }

    public static FieldExtractor llmField(Function<LlmExtraction, String> field, Function<String, Optional<String>> cleaner) {
        return context -> context.llm().map(field).flatMap(cleaner);
    }

    static Optional<String> companyFromSenderDomain(ClassificationContext context) {
        Matcher matcher = EMAIL_ADDRESS.matcher(context.getFrom());
        if (!matcher.find()) {
            return Optional.empty();
        }
        String domain = matcher.group(1).toLowerCase(Locale.ROOT);
        for (String excluded : NON_EMPLOYER_DOMAINS) {
            if (domain.equals(excluded) || domain.endsWith("." + excluded)) {
                return Optional.empty();
            }
        }

        String[] labels = domain.split("\\.");
        int end = labels.length - 1; // drop the TLD
        if (end >= 2 && SECOND_LEVEL_SUFFIXES.contains(labels[end - 1]) && labels[end].length() == 2) {
            end--; // acme.co.uk
        }
        if (end < 1) {
            return Optional.empty();
        }
        return Optional.of(labels[end - 1]).filter(label -> label.length() > 1);
    }

    private static Optional<String> firstGroup(List<Pattern> patterns, String text,
                                               Function<String, Optional<String>> cleaner) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Optional<String> cleaned = cleaner.apply(matcher.group(1));
                if (cleaned.isPresent()) {
                    return cleaned;
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<String> cleanCompany(String raw) {
        String value = stripPunctuation(raw);
        if (value.length() < 2 || value.length() > 60) {
            return Optional.empty();
        }
        String firstWord = value.split("\\s+")[0].toLowerCase(Locale.ROOT);
        if (NOT_A_COMPANY.contains(value.toLowerCase(Locale.ROOT)) || NOT_A_COMPANY.contains(firstWord)) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public static Optional<String> cleanRole(String raw) {
        String value = ROLE_TAIL.matcher(raw == null ? "" : raw.trim()).replaceAll("");
        value = stripPunctuation(stripPunctuation(value)
                .replaceFirst("(?i)^(?:the|a|an|our)\\s+", "")
                .replaceFirst("(?i)\\s+(?:position|role|opening|job)$", ""));
        if (value.length() < 2 || value.length() > 80) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public static Optional<String> cleanLocation(String raw) {
        String value = stripPunctuation(raw);
        if (value.length() < 2 || value.length() > 60) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private static String stripPunctuation(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim()
                .replaceAll("^[\\s\"'“”‘’]+", "")
                .replaceAll("[\\s\"'“”‘’.,;:!?]+$", "")
                .trim();
    }
}

package career.pulse.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * CareerPulse configuration. Google credentials, the store location and the
 * signing secret are required; startup fails without them.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "careerpulse")
public class CareerPulseProperties {

    @Valid
    private Google google = new Google();
    @Valid
    private Store store = new Store();
    @Valid
    private Security security = new Security();
    @Valid
    private Sync sync = new Sync();
    private Ai ai = new Ai();

    @Data
    public static class Google {
        @NotBlank
        private String clientId;
        @NotBlank
        private String clientSecret;
        @NotBlank
        private String redirectUri;
        private String authorizationUri = "https://accounts.google.com/o/oauth2/v2/auth";
        private String tokenUri = "https://oauth2.googleapis.com/token";
        private List<String> scopes = new ArrayList<>(List.of(
                "https://www.googleapis.com/auth/gmail.readonly",
                "https://www.googleapis.com/auth/userinfo.email"));
    }

    @Data
    public static class Store {
        /** H2 file path, jdbc: URL or postgres:// URL. */
        @NotBlank
        private String location;
    }

    @Data
    public static class Security {
        /** HMAC secret for the OAuth state parameter. */
        @NotBlank
        private String signingSecret;
    }

    @Data
    public static class Sync {
        private String defaultQuery = "(application OR apply OR applied OR interview OR offer OR rejected OR rejection"
                + " OR position OR role OR job OR career OR hiring OR recruit OR candidate OR \"thank you for\""
                + " OR \"thanks for applying\" OR congratulations OR schedule OR \"phone screen\" OR \"video call\""
                + " OR \"next steps\") in:inbox";
        @Min(1)
        private int defaultMaxResults = 100;
        @Min(0)
        private int defaultLookbackDays = 30;
        @Min(0)
        private long tokenSafetyMarginSeconds = 60;
        @Min(1)
        private int fetchConcurrency = 4;
        @Min(1)
        private int fetchAttempts = 3;
        @Min(0)
        private long fetchBackoffMs = 500;
        @Min(1)
        private int callTimeoutSeconds = 20;
        private boolean scheduledEnabled = false;
        private long scheduledIntervalMs = 300000;
    }

    @Data
    public static class Ai {
        /** none, openai or gemini. */
        private String provider = "none";
        private String openaiApiKey;
        private String openaiModel = "gpt-3.5-turbo";
        private String geminiApiKey;
    }
}

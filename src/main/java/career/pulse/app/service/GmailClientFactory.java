package career.pulse.app.service;

import career.pulse.app.config.CareerPulseProperties;
import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.GeneralSecurityException;

/**
 * Builds Gmail clients bound to a bearer access token. Every request carries
 * connect and read timeouts.
 */
@Component
public class GmailClientFactory {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "CareerPulse";

    private final HttpTransport httpTransport;
    private final int timeoutMs;

    @Autowired
    public GmailClientFactory(CareerPulseProperties properties) throws GeneralSecurityException, IOException {
        this(GoogleNetHttpTransport.newTrustedTransport(), properties.getSync().getCallTimeoutSeconds());
    }

    public GmailClientFactory(HttpTransport httpTransport, int timeoutSeconds) {
        this.httpTransport = httpTransport;
        this.timeoutMs = timeoutSeconds * 1000;
    }

    public Gmail create(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(httpTransport)
                .setJsonFactory(JSON_FACTORY)
                .build();
        credential.setAccessToken(accessToken);

        HttpRequestInitializer initializer = request -> {
            credential.initialize(request);
            request.setConnectTimeout(timeoutMs);
            request.setReadTimeout(timeoutMs);
        };

        return new Gmail.Builder(httpTransport, JSON_FACTORY, initializer)
                .setApplicationName(APPLICATION_NAME)
                .build();
    }
}

package career.pulse.app.service;

import career.pulse.app.config.CareerPulseProperties;
import career.pulse.app.exception.OAuthExchangeException;
import career.pulse.app.model.TokenGrant;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;

/**
 * Talks to Google's OAuth 2.0 endpoints: builds the Gmail consent URL, exchanges
 * authorization codes and runs the refresh grant.
 */
@Slf4j
@Service
public class GoogleOAuthClient {
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final CareerPulseProperties.Google google;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GoogleOAuthClient(CareerPulseProperties properties, Clock clock) {
        this.google = properties.getGoogle();
        this.clock = clock;
        this.objectMapper = new ObjectMapper();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = properties.getSync().getCallTimeoutSeconds() * 1000;
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        this.restTemplate = new RestTemplate(requestFactory);
    }

    /**
     * Consent URL for read-only Gmail access. access_type=offline and prompt=consent
     * make Google return a refresh token even when the user authorized before.
     */
    public String buildAuthorizationUrl(String state) {
        return UriComponentsBuilder.fromHttpUrl(google.getAuthorizationUri())
                .queryParam("client_id", google.getClientId())
                .queryParam("redirect_uri", google.getRedirectUri())
                .queryParam("response_type", "code")
                .queryParam("scope", String.join(" ", google.getScopes()))
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .queryParam("state", state)
                .encode()
                .build()
                .toUriString();
    }

    public TokenGrant exchangeCode(String code) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("code", code);
        body.add("client_id", google.getClientId());
        body.add("client_secret", google.getClientSecret());
        body.add("redirect_uri", google.getRedirectUri());
        body.add("grant_type", "authorization_code");
        return postToTokenEndpoint(body, "authorization code exchange");
    }

    public TokenGrant refresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isEmpty()) {
            throw new OAuthExchangeException("No refresh token available");
        }
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", google.getClientId());
        body.add("client_secret", google.getClientSecret());
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");
        return postToTokenEndpoint(body, "token refresh");
    }

    private TokenGrant postToTokenEndpoint(MultiValueMap<String, String> body, String operation) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        HttpEntity<MultiValueMap<String, String>> request = new HttpEntity<>(body, headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(google.getTokenUri(), request, String.class);
        } catch (RestClientException e) {
            throw new OAuthExchangeException("Google " + operation + " failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new OAuthExchangeException("Google " + operation + " failed. Status: " + response.getStatusCode());
        }

        try {
            JsonNode json = objectMapper.readTree(response.getBody());
            if (!json.hasNonNull("access_token")) {
                // never echo the body: it may carry token material
                throw new OAuthExchangeException("Google " + operation + " response missing access_token");
            }
            long expiresIn = json.hasNonNull("expires_in")
                    ? json.get("expires_in").asLong()
                    : DEFAULT_EXPIRES_IN_SECONDS;
            Instant expiresAt = Instant.now(clock).plusSeconds(expiresIn);

            return TokenGrant.builder()
                    .accessToken(json.get("access_token").asText())
                    .refreshToken(json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null)
                    .expiresAt(expiresAt)
                    .scope(json.hasNonNull("scope") ? json.get("scope").asText() : null)
                    .build();
        } catch (OAuthExchangeException e) {
            throw e;
        } catch (Exception e) {
            throw new OAuthExchangeException("Could not read Google " + operation + " response: " + e.getMessage(), e);
        }
    }
}

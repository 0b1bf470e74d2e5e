package career.pulse.app.service;

import career.pulse.app.config.CareerPulseProperties;
import career.pulse.app.exception.OAuthExchangeException;
import career.pulse.app.model.TokenGrant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GoogleOAuthClientTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private RestTemplate restTemplate;

    private GoogleOAuthClient oauthClient;

    @BeforeEach
    void setUp() {
        CareerPulseProperties properties = new CareerPulseProperties();
        properties.getGoogle().setClientId("test_client_id");
        properties.getGoogle().setClientSecret("test_client_secret");
        properties.getGoogle().setRedirectUri("http://localhost:8080/api/auth/gmail/callback");
        oauthClient = new GoogleOAuthClient(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        // Inject mock using reflection to override the constructor-created RestTemplate
        ReflectionTestUtils.setField(oauthClient, "restTemplate", restTemplate);
    }

    @Test
    void buildAuthorizationUrl_ShouldRequestOfflineAccessAndCarryState() {
        // When
        String url = oauthClient.buildAuthorizationUrl("signed-state");

        // Then
        assertTrue(url.startsWith("https://accounts.google.com/o/oauth2/v2/auth?"));
        assertTrue(url.contains("client_id=test_client_id"));
        assertTrue(url.contains("access_type=offline"));
        assertTrue(url.contains("prompt=consent"));
        assertTrue(url.contains("state=signed-state"));
        assertTrue(url.contains("gmail.readonly"));
        assertTrue(url.contains("redirect_uri=http%3A%2F%2Flocalhost%3A8080%2Fapi%2Fauth%2Fgmail%2Fcallback")
                || url.contains("redirect_uri=http://localhost:8080/api/auth/gmail/callback"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void exchangeCode_WithFullResponse_ShouldReturnGrant() {
        // Given
        String body = "{\"access_token\":\"ya29.access\",\"refresh_token\":\"1//refresh\",\"expires_in\":3599,"
                + "\"scope\":\"https://www.googleapis.com/auth/gmail.readonly\",\"token_type\":\"Bearer\"}";
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                .thenReturn(new ResponseEntity<>(body, HttpStatus.OK));

        // When
        TokenGrant grant = oauthClient.exchangeCode("auth-code");

        // Then
        assertEquals("ya29.access", grant.getAccessToken());
        assertEquals("1//refresh", grant.getRefreshToken());
        assertEquals(NOW.plusSeconds(3599), grant.getExpiresAt());

        ArgumentCaptor<HttpEntity<MultiValueMap<String, String>>> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForEntity(eq("https://oauth2.googleapis.com/token"), captor.capture(), eq(String.class));
        MultiValueMap<String, String> form = captor.getValue().getBody();
        assertEquals("authorization_code", form.getFirst("grant_type"));
        assertEquals("auth-code", form.getFirst("code"));
    }

    @Test
    void refresh_WithoutExpiresIn_ShouldDefaultToOneHour() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                .thenReturn(new ResponseEntity<>("{\"access_token\":\"new_access_token\"}", HttpStatus.OK));

        // When
        TokenGrant grant = oauthClient.refresh("refresh_token_123");

        // Then
        assertEquals("new_access_token", grant.getAccessToken());
        assertNull(grant.getRefreshToken());
        assertEquals(NOW.plusSeconds(3600), grant.getExpiresAt());
    }

    @Test
    void refresh_WithMissingRefreshToken_ShouldThrowWithoutCallingGoogle() {
        // When & Then
        assertThrows(OAuthExchangeException.class, () -> oauthClient.refresh(null));
        verify(restTemplate, never()).postForEntity(anyString(), any(), any(Class.class));
    }

    @Test
    void refresh_WhenGoogleRejects_ShouldThrowOAuthExchangeException() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                .thenThrow(new HttpClientErrorException(HttpStatus.BAD_REQUEST, "invalid_grant"));

        // When & Then
        assertThrows(OAuthExchangeException.class, () -> oauthClient.refresh("revoked"));
    }

    @Test
    void refresh_WithResponseMissingAccessToken_ShouldNotEchoBody() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                .thenReturn(new ResponseEntity<>("{\"refresh_token\":\"secret-value\"}", HttpStatus.OK));

        // When
        OAuthExchangeException exception = assertThrows(OAuthExchangeException.class,
                () -> oauthClient.refresh("refresh_token_123"));

        // Then
        assertFalse(exception.getMessage().contains("secret-value"));
    }
}

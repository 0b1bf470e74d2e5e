package career.pulse.app.service;

import career.pulse.app.config.CareerPulseProperties;
import career.pulse.app.exception.MessageNotFoundException;
import career.pulse.app.exception.ProviderException;
import career.pulse.app.model.MailboxProfile;
import career.pulse.app.model.RawMessage;
import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class GmailMailboxFetcherTest {

    private CareerPulseProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CareerPulseProperties();
        properties.getSync().setFetchAttempts(3);
        properties.getSync().setFetchBackoffMs(0);
    }

    @Test
    void listCandidateIds_WithProviderReportingMoreThanMax_ShouldReturnExactlyMax() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> json(200, listBody(0, 50, null)));
        GmailMailboxFetcher fetcher = fetcher(transport);

        // When
        List<String> ids = fetcher.listCandidateIds("token", "in:inbox", null, 5);

        // Then
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), ids);
        assertEquals(1, transport.urls.size());
        assertTrue(transport.urls.get(0).contains("maxResults=5"));
    }

    @Test
    void listCandidateIds_WithAfterDate_ShouldAddDateFilterToQuery() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> json(200, listBody(0, 1, null)));
        GmailMailboxFetcher fetcher = fetcher(transport);

        // When
        fetcher.listCandidateIds("token", "subject:application", "2024/01/15", 10);

        // Then
        String url = URLDecoder.decode(transport.urls.get(0), StandardCharsets.UTF_8);
        assertTrue(url.contains("q=subject:application after:2024/01/15"), url);
    }

    @Test
    void listCandidateIds_ShouldFollowPagesUntilCapReached() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> url.contains("pageToken=page2")
                ? json(200, listBody(3, 3, "page3"))
                : json(200, listBody(0, 3, "page2")));
        GmailMailboxFetcher fetcher = fetcher(transport);

        // When
        List<String> ids = fetcher.listCandidateIds("token", "in:inbox", null, 5);

        // Then
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), ids);
        assertEquals(2, transport.urls.size());
    }

    @Test
    void listCandidateIds_WithEmptyMailbox_ShouldReturnEmptyList() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> json(200, "{\"resultSizeEstimate\":0}"));

        // When
        List<String> ids = fetcher(transport).listCandidateIds("token", "in:inbox", "2024/01/01", 100);

        // Then
        assertTrue(ids.isEmpty());
    }

    @Test
    void fetchFull_ShouldMapHeadersBodyAndReceiptTime() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> json(200, messageBody("m1")));

        // When
        RawMessage message = fetcher(transport).fetchFull("token", "m1");

        // Then
        assertEquals("m1", message.getMessageId());
        assertEquals("Acme Careers <jobs@acme.com>", message.getFrom());
        assertEquals("Application Received: Backend Engineer", message.getSubject());
        assertEquals("Thank you for applying to Acme!", message.getBody());
        assertEquals(Instant.ofEpochMilli(1714564800000L), message.getReceivedAt());
    }

    @Test
    void fetchFull_WithUnknownMessage_ShouldThrowMessageNotFoundWithContext() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> error(404, "Requested entity was not found."));

        // When
        MessageNotFoundException exception = assertThrows(MessageNotFoundException.class,
                () -> fetcher(transport).fetchFull("token", "gone-1"));

        // Then
        assertEquals("get", exception.getOperation());
        assertEquals("gone-1", exception.getMessageId());
        assertTrue(exception.getMessage().contains("gone-1"));
        assertEquals(1, transport.urls.size());
    }

    @Test
    void fetchFull_WithRateLimit_ShouldBackOffAndRetry() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        ScriptedTransport transport = new ScriptedTransport(url -> calls.incrementAndGet() == 1
                ? error(429, "Rate Limit Exceeded")
                : json(200, messageBody("m1")));

        // When
        RawMessage message = fetcher(transport).fetchFull("token", "m1");

        // Then
        assertEquals("m1", message.getMessageId());
        assertEquals(2, transport.urls.size());
    }

    @Test
    void fetchFull_WhenRetriesExhausted_ShouldThrowProviderExceptionWithContext() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> error(503, "Backend Error"));

        // When
        ProviderException exception = assertThrows(ProviderException.class,
                () -> fetcher(transport).fetchFull("token", "m7"));

        // Then
        assertEquals("get", exception.getOperation());
        assertEquals("m7", exception.getMessageId());
        assertTrue(exception.getMessage().contains("503"));
        assertEquals(3, transport.urls.size());
    }

    @Test
    void fetchFull_WithForbidden_ShouldNotRetry() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> error(403, "Insufficient Permission"));

        // When & Then
        assertThrows(ProviderException.class, () -> fetcher(transport).fetchFull("token", "m1"));
        assertEquals(1, transport.urls.size());
    }

    @Test
    void fetchFull_WithReadTimeout_ShouldFailWithoutRetrying() {
        // Given
        FailingTransport transport = new FailingTransport(Integer.MAX_VALUE,
                () -> new SocketTimeoutException("Read timed out"), url -> json(200, messageBody("m1")));

        // When
        ProviderException exception = assertThrows(ProviderException.class,
                () -> fetcher(transport).fetchFull("token", "m3"));

        // Then
        assertEquals("m3", exception.getMessageId());
        assertTrue(exception.getMessage().contains("timed out"));
        assertEquals(1, transport.urls.size());
    }

    @Test
    void fetchFull_WithConnectionReset_ShouldRetry() {
        // Given
        FailingTransport transport = new FailingTransport(1,
                () -> new IOException("Connection reset"), url -> json(200, messageBody("m1")));

        // When
        RawMessage message = fetcher(transport).fetchFull("token", "m1");

        // Then
        assertEquals("m1", message.getMessageId());
        assertEquals(2, transport.urls.size());
    }

    @Test
    void getProfile_ShouldReturnAddressAndCounts() {
        // Given
        ScriptedTransport transport = new ScriptedTransport(url -> json(200,
                "{\"emailAddress\":\"me@example.com\",\"messagesTotal\":1200,\"threadsTotal\":800,\"historyId\":\"1\"}"));

        // When
        MailboxProfile profile = fetcher(transport).getProfile("token");

        // Then
        assertEquals("me@example.com", profile.getEmail());
        assertEquals(1200, profile.getMessagesTotal());
        assertEquals(800, profile.getThreadsTotal());
        assertTrue(transport.urls.get(0).contains("/users/me/profile"));
    }

    @Test
    void buildQuery_WithoutQuery_ShouldUseDateFilterOnly() {
        assertEquals("after:2024/03/01", GmailMailboxFetcher.buildQuery(null, "2024/03/01"));
        assertEquals("in:inbox", GmailMailboxFetcher.buildQuery("  in:inbox ", null));
    }

    private GmailMailboxFetcher fetcher(MockHttpTransport transport) {
        return new GmailMailboxFetcher(new GmailClientFactory(transport, 5), new GmailMessageMapper(), properties);
    }

    private static String listBody(int from, int count, String nextPageToken) {
        StringBuilder body = new StringBuilder("{\"messages\":[");
        for (int i = from; i < from + count; i++) {
            if (i > from) {
                body.append(',');
            }
            body.append("{\"id\":\"m").append(i).append("\",\"threadId\":\"t").append(i).append("\"}");
        }
        body.append("],\"resultSizeEstimate\":50");
        if (nextPageToken != null) {
            body.append(",\"nextPageToken\":\"").append(nextPageToken).append('"');
        }
        return body.append('}').toString();
    }

    private static String messageBody(String id) {
        String data = Base64.getUrlEncoder().encodeToString("Thank you for applying to Acme!".getBytes(StandardCharsets.UTF_8));
        return "{\"id\":\"" + id + "\",\"threadId\":\"t1\",\"internalDate\":\"1714564800000\","
                + "\"payload\":{\"mimeType\":\"text/plain\",\"headers\":["
                + "{\"name\":\"From\",\"value\":\"Acme Careers <jobs@acme.com>\"},"
                + "{\"name\":\"Subject\",\"value\":\"Application Received: Backend Engineer\"}],"
                + "\"body\":{\"size\":31,\"data\":\"" + data + "\"}}}";
    }

    private static MockLowLevelHttpResponse json(int status, String content) {
        return new MockLowLevelHttpResponse()
                .setStatusCode(status)
                .setContentType("application/json; charset=UTF-8")
                .setContent(content);
    }

    private static MockLowLevelHttpResponse error(int status, String message) {
        return json(status, "{\"error\":{\"code\":" + status + ",\"message\":\"" + message + "\",\"errors\":[]}}");
    }

    /**
     * Answers every request through a function of its URL and records the URLs seen.
     */
    private static class ScriptedTransport extends MockHttpTransport {
        final List<String> urls = new ArrayList<>();
        private final Function<String, MockLowLevelHttpResponse> responder;

        ScriptedTransport(Function<String, MockLowLevelHttpResponse> responder) {
            this.responder = responder;
        }

        @Override
        public LowLevelHttpRequest buildRequest(String method, String url) {
            synchronized (urls) {
                urls.add(url);
            }
            return new MockLowLevelHttpRequest(url) {
                @Override
                public LowLevelHttpResponse execute() {
                    return responder.apply(url);
                }
            };
        }
    }

    /**
     * Throws an I/O error for the first {@code failures} requests, then answers like {@link ScriptedTransport}.
     */
    private static class FailingTransport extends ScriptedTransport {
        private final int failures;
        private final Supplier<IOException> error;

        FailingTransport(int failures, Supplier<IOException> error, Function<String, MockLowLevelHttpResponse> responder) {
            super(responder);
            this.failures = failures;
            this.error = error;
        }

        @Override
        public LowLevelHttpRequest buildRequest(String method, String url) {
            LowLevelHttpRequest delegate = super.buildRequest(method, url);
            boolean fail;
            synchronized (urls) {
                fail = urls.size() <= failures;
            }
            return new MockLowLevelHttpRequest(url) {
                @Override
                public LowLevelHttpResponse execute() throws IOException {
                    if (fail) {
                        throw error.get();
                    }
                    return delegate.execute();
                }
            };
        }
    }
}

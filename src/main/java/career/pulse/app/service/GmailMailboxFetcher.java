package career.pulse.app.service;

import career.pulse.app.config.CareerPulseProperties;
import career.pulse.app.exception.MessageNotFoundException;
import career.pulse.app.exception.ProviderException;
import career.pulse.app.model.MailboxProfile;
import career.pulse.app.model.RawMessage;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.Profile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Gmail-backed {@link MailboxFetcher}. Rate limiting (429), server errors and
 * connection failures are retried with exponential backoff up to the configured
 * attempt count; timeouts and everything else surface immediately as a
 * {@link ProviderException}.
 */
@Slf4j
@Service
public class GmailMailboxFetcher implements MailboxFetcher {
    private static final String USER_ME = "me";
    private static final long MAX_PAGE_SIZE = 500L;
    private static final Set<Integer> RETRYABLE_STATUS = Set.of(429, 500, 502, 503, 504);

    private final GmailClientFactory clientFactory;
    private final GmailMessageMapper messageMapper;
    private final int maxAttempts;
    private final long backoffMs;

    public GmailMailboxFetcher(GmailClientFactory clientFactory, GmailMessageMapper messageMapper,
                               CareerPulseProperties properties) {
        this.clientFactory = clientFactory;
        this.messageMapper = messageMapper;
        this.maxAttempts = properties.getSync().getFetchAttempts();
        this.backoffMs = properties.getSync().getFetchBackoffMs();
    }

    @Override
    public List<String> listCandidateIds(String accessToken, String query, String afterDate, int maxResults) {
        List<String> ids = new ArrayList<>();
        if (maxResults <= 0) {
            return ids;
        }

        String searchQuery = buildQuery(query, afterDate);
        Gmail service = clientFactory.create(accessToken);
        String pageToken = null;
        do {
            final String currentPage = pageToken;
            final long pageSize = Math.min(maxResults - ids.size(), MAX_PAGE_SIZE);
            ListMessagesResponse response = execute("list", null, () -> service.users().messages().list(USER_ME)
                    .setQ(searchQuery)
                    .setMaxResults(pageSize)
                    .setPageToken(currentPage)
                    .execute());

            if (response.getMessages() != null) {
                for (Message messageRef : response.getMessages()) {
                    if (ids.size() >= maxResults) {
                        break;
                    }
                    ids.add(messageRef.getId());
                }
            }
            pageToken = response.getNextPageToken();
        } while (pageToken != null && ids.size() < maxResults);

        log.debug("Listed {} candidate ids for query '{}'", ids.size(), searchQuery);
        return ids;
    }

    @Override
    public RawMessage fetchFull(String accessToken, String messageId) {
        Gmail service = clientFactory.create(accessToken);
        Message message = execute("get", messageId, () -> service.users().messages().get(USER_ME, messageId)
                .setFormat("full")
                .execute());
        try {
            return messageMapper.toRawMessage(message);
        } catch (RuntimeException e) {
            throw new ProviderException("decode", messageId, e.getMessage(), e);
        }
    }

    @Override
    public MailboxProfile getProfile(String accessToken) {
        Gmail service = clientFactory.create(accessToken);
        Profile profile = execute("getProfile", null, () -> service.users().getProfile(USER_ME).execute());
        return new MailboxProfile(profile.getEmailAddress(), profile.getMessagesTotal(), profile.getThreadsTotal());
    }

    static String buildQuery(String query, String afterDate) {
        String searchQuery = query != null ? query.trim() : "";
        if (afterDate != null && !afterDate.isBlank()) {
            searchQuery = (searchQuery.isEmpty() ? "" : searchQuery + " ") + "after:" + afterDate;
        }
        return searchQuery;
    }

    @FunctionalInterface
    interface GmailCall<T> {
        T execute() throws IOException;
    }

    private <T> T execute(String operation, String messageId, GmailCall<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.execute();
            } catch (GoogleJsonResponseException e) {
                int status = e.getStatusCode();
                if (status == 404) {
                    throw new MessageNotFoundException(operation, messageId, e);
                }
                if (!RETRYABLE_STATUS.contains(status) || attempt >= maxAttempts) {
                    throw new ProviderException(operation, messageId, "HTTP " + status + " " + e.getStatusMessage(), e);
                }
                log.warn("Gmail {} returned {} (attempt {}/{}), backing off", operation, status, attempt, maxAttempts);
            } catch (SocketTimeoutException e) {
                // a read timeout already used the full call budget
                throw new ProviderException(operation, messageId, "timed out: " + e.getMessage(), e);
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    throw new ProviderException(operation, messageId, e.getMessage(), e);
                }
                log.warn("Gmail {} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
            }
            backOff(operation, messageId, attempt);
        }
    }

    private void backOff(String operation, String messageId, int attempt) {
        long delay = backoffMs * (1L << (attempt - 1));
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(operation, messageId, "interrupted while backing off", e);
        }
    }
}

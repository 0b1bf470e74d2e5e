package career.pulse.app.service;

import career.pulse.app.exception.MessageNotFoundException;
import career.pulse.app.exception.ProviderException;
import career.pulse.app.model.MailboxProfile;
import career.pulse.app.model.RawMessage;

import java.util.List;

/**
 * Mailbox provider operations used by a sync run.
 * Implementations narrow only by provider-side query and caller limits; they never filter by content.
 */
public interface MailboxFetcher {
    /**
     * List message ids matching a search query.
     * @param accessToken OAuth access token
     * @param query provider search query
     * @param afterDate optional date filter, appended to the query verbatim as {@code after:<afterDate>}
     * @param maxResults hard cap on the number of ids returned
     * @return ids in provider order, never more than {@code maxResults}
     * @throws ProviderException if the provider call fails after retries
     */
    List<String> listCandidateIds(String accessToken, String query, String afterDate, int maxResults);

    /**
     * Fetch a full message.
     * @throws MessageNotFoundException if the provider has no such message
     * @throws ProviderException for any other failure, with operation and id context
     */
    RawMessage fetchFull(String accessToken, String messageId);

    /**
     * Identity and counters of the connected mailbox.
     * @throws ProviderException if the provider call fails after retries
     */
    MailboxProfile getProfile(String accessToken);
}

package career.pulse.app.service;

import career.pulse.app.classifier.EmailClassifier;
import career.pulse.app.config.CareerPulseProperties;
import career.pulse.app.exception.ConnectionException;
import career.pulse.app.exception.SyncCancelledException;
import career.pulse.app.model.ParsedApplication;
import career.pulse.app.model.RawMessage;
import career.pulse.app.model.SyncOptions;
import career.pulse.app.model.SyncRunResult;
import career.pulse.app.model.SyncState;
import career.pulse.app.model.SyncedApplication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one sync for a user: credential, candidate list, full fetch, classification,
 * duplicate check and persistence.
 * <p>
 * Credential and list failures abort the run. Anything that goes wrong with a single
 * message is recorded in the result and the run moves on to the next one.
 */
@Slf4j
@Service
public class SyncOrchestrator {
    private static final DateTimeFormatter QUERY_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final TokenLifecycleManager tokenManager;
    private final MailboxFetcher mailboxFetcher;
    private final EmailClassifier emailClassifier;
    private final DuplicateDetector duplicateDetector;
    private final ApplicationRecorder applicationRecorder;
    private final Executor fetchExecutor;
    private final Executor classificationExecutor;
    private final CareerPulseProperties.Sync syncProperties;
    private final Clock clock;
    private final UserLocks persistLocks = new UserLocks();

    public SyncOrchestrator(TokenLifecycleManager tokenManager,
                            MailboxFetcher mailboxFetcher,
                            EmailClassifier emailClassifier,
                            DuplicateDetector duplicateDetector,
                            ApplicationRecorder applicationRecorder,
                            @Qualifier("mailFetchExecutor") Executor fetchExecutor,
                            @Qualifier("classificationExecutor") Executor classificationExecutor,
                            CareerPulseProperties properties,
                            Clock clock) {
        this.tokenManager = tokenManager;
        this.mailboxFetcher = mailboxFetcher;
        this.emailClassifier = emailClassifier;
        this.duplicateDetector = duplicateDetector;
        this.applicationRecorder = applicationRecorder;
        this.fetchExecutor = fetchExecutor;
        this.classificationExecutor = classificationExecutor;
        this.syncProperties = properties.getSync();
        this.clock = clock;
    }

    /**
     * @throws career.pulse.app.exception.DisconnectedException  if the user has no active Gmail connection
     * @throws career.pulse.app.exception.RefreshFailedException if the stored credential could not be refreshed
     * @throws career.pulse.app.exception.ProviderException      if the candidate list could not be fetched
     * @throws SyncCancelledException                             if cancelled before any message was fetched
     */
    public SyncRunResult runSync(String userId, SyncOptions options) {
        SyncOptions effective = options != null ? options : SyncOptions.defaults();
        String query = effective.getQuery() != null && !effective.getQuery().isBlank()
                ? effective.getQuery()
                : syncProperties.getDefaultQuery();
        String afterDate = effective.getAfterDate() != null && !effective.getAfterDate().isBlank()
                ? effective.getAfterDate()
                : LocalDate.now(clock).minusDays(syncProperties.getDefaultLookbackDays()).format(QUERY_DATE);
        int maxResults = effective.getMaxResults() != null
                ? effective.getMaxResults()
                : syncProperties.getDefaultMaxResults();

        log.info("Sync started for user {} (after {}, max {})", userId, afterDate, maxResults);
        SyncState state = SyncState.IDLE;
        String accessToken;
        List<String> candidateIds;
        try {
            checkNotCancelled(userId, effective);
            accessToken = tokenManager.acquireValidAccessToken(userId);
            state = transition(userId, state, SyncState.TOKEN_ACQUIRED);

            checkNotCancelled(userId, effective);
            state = transition(userId, state, SyncState.FETCHING);
            candidateIds = mailboxFetcher.listCandidateIds(accessToken, query, afterDate, maxResults);
        } catch (ConnectionException | SyncCancelledException e) {
            transition(userId, state, SyncState.FAILED);
            log.warn("Sync aborted for user {}: {}", userId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            transition(userId, state, SyncState.FAILED);
            log.error("Sync aborted for user {}, could not list messages: {}", userId, e.getMessage(), e);
            throw e;
        }

        SyncRunResult result = new SyncRunResult();
        result.setFetched(candidateIds.size());
        if (candidateIds.isEmpty()) {
            transition(userId, state, SyncState.COMPLETED);
            log.info("Sync completed for user {}: no candidate messages", userId);
            return result;
        }

        state = transition(userId, state, SyncState.CLASSIFYING_BATCH);
        List<ItemOutcome> outcomes = fetchAndClassify(userId, accessToken, candidateIds, effective, result);

        state = transition(userId, state, SyncState.PERSISTING);
        persist(userId, outcomes, effective, result);

        transition(userId, state, SyncState.COMPLETED);
        log.info("Sync completed for user {}: fetched={}, classified={}, saved={}, duplicates={}, errors={}{}",
                userId, result.getFetched(), result.getClassified(), result.getSaved(),
                result.getDuplicatesSkipped(), result.getErrors().size(), result.isCancelled() ? " (cancelled)" : "");
        return result;
    }

    /**
     * Fetches full messages with bounded concurrency and classifies them in parallel.
     * Outcomes keep the candidate order; failed items are recorded and left out.
     */
    private List<ItemOutcome> fetchAndClassify(String userId, String accessToken, List<String> candidateIds,
                                               SyncOptions options, SyncRunResult result) {
        List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>(candidateIds.size());
        for (String messageId : candidateIds) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> mailboxFetcher.fetchFull(accessToken, messageId), fetchExecutor)
                    .thenApplyAsync(message -> new ItemOutcome(message, emailClassifier.classify(message)),
                            classificationExecutor));
        }

        List<ItemOutcome> outcomes = new ArrayList<>(candidateIds.size());
        long timeoutMillis = itemTimeoutMillis(syncProperties);
        for (int i = 0; i < futures.size(); i++) {
            String messageId = candidateIds.get(i);
            CompletableFuture<ItemOutcome> future = futures.get(i);
            if (options.isCancellationRequested()) {
                futures.subList(i, futures.size()).forEach(pending -> pending.cancel(true));
                result.setCancelled(true);
                log.info("Sync for user {} cancelled while fetching, {} messages not processed",
                        userId, futures.size() - i);
                break;
            }
            try {
                outcomes.add(future.get(timeoutMillis, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Timed out fetching message {} for user {}", messageId, userId);
                result.recordError(messageId, "Timed out after " + timeoutMillis + "ms");
            } catch (ExecutionException | CancellationException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                log.error("Failed to fetch message {} for user {}: {}", messageId, userId, cause.getMessage(), cause);
                result.recordError(messageId, describe(cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(pending -> pending.cancel(true));
                result.setCancelled(true);
                log.warn("Sync for user {} interrupted while fetching", userId);
                break;
            }
        }
        return outcomes;
    }

    /**
     * Duplicate check and save, serialized per user so two messages about the same
     * application cannot both pass the check.
     */
    private void persist(String userId, List<ItemOutcome> outcomes, SyncOptions options, SyncRunResult result) {
        ReentrantLock lock = persistLocks.forUser(userId);
        lock.lock();
        try {
            DuplicateDetector.KnownApplications known =
                    DuplicateDetector.KnownApplications.of(applicationRecorder.findByUser(userId));

            for (ItemOutcome outcome : outcomes) {
                if (result.isCancelled() || options.isCancellationRequested()) {
                    // already-saved records stay; the rest of the batch is skipped
                    result.setCancelled(true);
                    log.info("Sync for user {} cancelled during persistence after {} saves", userId, result.getSaved());
                    break;
                }
                ParsedApplication parsed = outcome.parsed;
                if (parsed == null) {
                    continue;
                }
                try {
                    if (known.containsEmail(parsed.getEmailId()) || duplicateDetector.isDuplicate(parsed, known)) {
                        log.debug("Skipping duplicate from message {}: {} at {}", parsed.getEmailId(),
                                parsed.getRole(), parsed.getCompany());
                        result.setDuplicatesSkipped(result.getDuplicatesSkipped() + 1);
                    } else {
                        applicationRecorder.record(userId, parsed, outcome.message.getSubject());
                        known.add(parsed);
                        result.setSaved(result.getSaved() + 1);
                        result.getApplications().add(new SyncedApplication(
                                parsed.getCompany(), parsed.getRole(), parsed.getStatus(), parsed.getConfidence()));
                    }
                    result.setClassified(result.getClassified() + 1);
                } catch (RuntimeException e) {
                    log.error("Failed to save application from message {} for user {}: {}",
                            parsed.getEmailId(), userId, e.getMessage(), e);
                    result.recordError(parsed.getEmailId(), describe(e));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * How long to wait for one message: every fetch attempt may use the full call
     * timeout, plus the backoff between attempts.
     */
    static long itemTimeoutMillis(CareerPulseProperties.Sync sync) {
        int attempts = Math.max(1, sync.getFetchAttempts());
        long perAttempt = TimeUnit.SECONDS.toMillis(sync.getCallTimeoutSeconds());
        long backoff = Math.max(0L, sync.getFetchBackoffMs()) * ((1L << (attempts - 1)) - 1);
        return perAttempt * attempts + backoff;
    }

    private void checkNotCancelled(String userId, SyncOptions options) {
        if (options.isCancellationRequested()) {
            throw new SyncCancelledException(userId);
        }
    }

    private SyncState transition(String userId, SyncState from, SyncState to) {
        log.debug("Sync for user {}: {} -> {}", userId, from, to);
        return to;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static class ItemOutcome {
        final RawMessage message;
        final ParsedApplication parsed;

        ItemOutcome(RawMessage message, ParsedApplication parsed) {
            this.message = message;
            this.parsed = parsed;
        }
    }
}

package com.chatintel.group.service;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.exception.NotAGroupException;
import com.chatintel.group.model.Group;
import com.chatintel.group.model.GroupSnapshot;
import com.chatintel.group.model.RawMessage;
import com.chatintel.group.model.ScrapeResult;
import com.chatintel.group.model.ScrapeStatus;
import com.chatintel.group.model.StoredMessage;
import com.chatintel.group.source.ChatSource;
import com.chatintel.group.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the scrape cycle for one group:
 * fetch chat, build identity map, upsert group, open run, fetch and store
 * messages, close run.
 *
 * Failures before the run is opened leave no audit record. Once it is open the
 * run is closed on every path, including unexpected errors, by the finally block
 * in {@link #processRun}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GroupScrapeService {

    private final ChatSource chatSource;
    private final IdentityResolver identityResolver;
    private final MessageNormalizer normalizer;
    private final MessageStore messageStore;
    private final GroupScraperProperties properties;

    /**
     * Scrape one group. Never throws; every failure is reported in the result.
     */
    public ScrapeResult scrapeGroup(String groupId) {
        log.info("Starting scrape for group: {}", groupId);

        GroupSnapshot snapshot;
        IdentityMap identities;
        long runId;
        try {
            snapshot = chatSource.fetchGroup(groupId);
            if (!snapshot.isGroup()) {
                throw new NotAGroupException(groupId);
            }
            identities = identityResolver.build(snapshot);

            // group row first, the run references it
            messageStore.upsertGroup(Group.from(snapshot));
            runId = messageStore.startRun(groupId);
        } catch (Exception e) {
            log.error("Scrape of group {} failed before the run started: {}", groupId, e.getMessage(), e);
            return ScrapeResult.failure(groupId, describe(e));
        }

        return processRun(runId, groupId, snapshot, identities);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ScrapeResult processRun(long runId, String groupId, GroupSnapshot snapshot, IdentityMap identities) {
        RunTally tally = new RunTally();
        boolean closed = false;
        String failure = "scrape aborted";

        try {
            List<RawMessage> messages = chatSource.fetchRecentMessages(groupId, properties.getScraper().getMessageLimit());
            log.info("Fetched {} messages from {}", messages.size(), snapshot.getName());

            for (RawMessage raw : messages) {
                processMessage(raw, groupId, identities, tally);
            }

            messageStore.endRun(runId, tally.processed, tally.inserted, ScrapeStatus.COMPLETED, null);
            closed = true;

            log.info("Scrape completed for {}. Processed {} messages ({} new, {} skipped)",
                    snapshot.getName(), tally.processed, tally.inserted, tally.skipped);
            return ScrapeResult.success(groupId, snapshot.getName(), tally.processed, tally.inserted);

        } catch (Exception e) {
            failure = describe(e);
            log.error("Error scraping group {} (run {}): {}", groupId, runId, failure, e);
            return ScrapeResult.failure(groupId, failure);

        } finally {
            if (!closed) {
                closeAsFailed(runId, tally, failure);
            }
        }
    }

    /**
     * One message, isolated from its siblings: any failure is logged and the
     * message skipped. Losing the database connection is not a message problem
     * and fails the run instead.
     */
    private void processMessage(RawMessage raw, String groupId, IdentityMap identities, RunTally tally) {
        try {
            StoredMessage message = normalizer.normalize(raw, groupId, identities);
            boolean inserted = messageStore.insertMessage(message).isPresent();
            tally.processed++;
            if (inserted) {
                tally.inserted++;
            }
        } catch (DataAccessResourceFailureException e) {
            throw e;
        } catch (Exception e) {
            tally.skipped++;
            log.error("Error processing message {}: {}", raw == null ? null : raw.getId(), e.getMessage(), e);
        }
    }

    private void closeAsFailed(long runId, RunTally tally, String failure) {
        try {
            messageStore.endRun(runId, tally.processed, tally.inserted, ScrapeStatus.FAILED, failure);
        } catch (Exception e) {
            // startup's failAbandonedRuns() closes it if the store stays unreachable
            log.error("Could not close scrape run {} as failed: {}", runId, e.getMessage(), e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static final class RunTally {
        int processed;
        int inserted;
        int skipped;
    }
}

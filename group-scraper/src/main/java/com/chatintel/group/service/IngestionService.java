package com.chatintel.group.service;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.model.ScrapeResult;
import com.chatintel.group.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for every scrape, scheduled or manual.
 *
 * All scrapes take the same lock, so exactly one ingestion path writes messages
 * at any time. Groups of one pass are scraped one after another with a pause in
 * between to keep request volume towards the source flat.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private final GroupScrapeService groupScrapeService;
    private final MessageStore messageStore;
    private final GroupScraperProperties properties;
    private final Clock clock;

    private final ReentrantLock ingestionLock = new ReentrantLock();

    public ScrapeResult scrapeGroup(String groupId) {
        ingestionLock.lock();
        try {
            return groupScrapeService.scrapeGroup(groupId);
        } finally {
            ingestionLock.unlock();
        }
    }

    /** Scrape every monitored group, waiting for a running pass to finish first. */
    public List<ScrapeResult> scrapeAllConfiguredGroups() {
        ingestionLock.lock();
        try {
            return scrapeSequentially(properties.getSource().getMonitoredGroups());
        } finally {
            ingestionLock.unlock();
        }
    }

    /**
     * Scheduler variant of {@link #scrapeAllConfiguredGroups()}: returns empty
     * instead of waiting when another scrape still holds the lock.
     */
    public Optional<List<ScrapeResult>> tryScrapeAllConfiguredGroups() {
        if (!ingestionLock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.of(scrapeSequentially(properties.getSource().getMonitoredGroups()));
        } finally {
            ingestionLock.unlock();
        }
    }

    public boolean isScrapeRunning() {
        return ingestionLock.isLocked();
    }

    /**
     * Delete messages older than the retention window.
     *
     * @return number of deleted messages, 0 when retention is unbounded
     */
    public int cleanupExpiredMessages() {
        int days = properties.getRetention().getDays();
        if (days <= 0) {
            log.debug("Message retention is unbounded, nothing to clean up");
            return 0;
        }
        long cutoff = clock.instant().minus(Duration.ofDays(days)).getEpochSecond();
        log.info("Cleaning up messages older than {} days", days);
        int deleted = messageStore.deleteMessagesOlderThan(cutoff);
        log.info("Deleted {} old messages", deleted);
        return deleted;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<ScrapeResult> scrapeSequentially(List<String> groupIds) {
        if (groupIds.isEmpty()) {
            log.warn("No monitored groups configured");
            return List.of();
        }

        List<ScrapeResult> results = new ArrayList<>();
        for (int i = 0; i < groupIds.size(); i++) {
            if (i > 0) {
                pause(properties.getScraper().getGroupDelay());
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Interrupted, {} group(s) left unscraped this pass", groupIds.size() - i);
                    break;
                }
            }
            results.add(groupScrapeService.scrapeGroup(groupIds.get(i)));
        }
        return results;
    }

    private void pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}

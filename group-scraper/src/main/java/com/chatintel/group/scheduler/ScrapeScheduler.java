package com.chatintel.group.scheduler;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.model.ScrapeResult;
import com.chatintel.group.service.IngestionService;
import com.chatintel.group.source.ConnectionState;
import com.chatintel.group.source.SourceStateListener;
import com.chatintel.group.store.MessageStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Owns the two recurring jobs: ingestion of all monitored groups and retention
 * cleanup.
 *
 * Both are cron triggers in the configured timezone, armed when the chat source
 * first reports READY (or explicitly via {@link #startAll()}). Arming and
 * disarming are idempotent. A tick never throws, so one bad tick cannot stop the
 * schedule.
 *
 * Default schedule: ingestion every 5 minutes, cleanup daily at 02:00.
 * Override with CRON_SCHEDULE / group-scraper.scheduling.* properties. Classic
 * five-field expressions (minute first) are accepted and run at second 0.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler implements SourceStateListener {

    private final IngestionService ingestionService;
    private final MessageStore messageStore;
    private final TaskScheduler taskScheduler;
    private final GroupScraperProperties properties;

    private ScheduledFuture<?> ingestionJob;
    private ScheduledFuture<?> cleanupJob;
    private volatile ConnectionState sourceState = ConnectionState.INITIALIZING;

    /**
     * On application startup:
     *  1. Reject cron expressions that cannot be armed
     *  2. Always ensure the database schema exists
     *  3. Close runs a crashed predecessor left in progress
     */
    @PostConstruct
    public void onStartup() {
        GroupScraperProperties.Scheduling scheduling = properties.getScheduling();
        validate("scrape-cron", scheduling.getScrapeCron());
        validate("cleanup-cron", scheduling.getCleanupCron());
        ZoneId zone = zone();

        messageStore.ensureSchema();
        messageStore.failAbandonedRuns();
        log.info("Scraper ready. Monitoring {} group(s); jobs arm in {} once the chat source is ready",
                properties.getSource().getMonitoredGroups().size(), zone);
    }

    @PreDestroy
    public void onShutdown() {
        stopAll();
    }

    @Override
    public void onStateChange(ConnectionState previous, ConnectionState current) {
        sourceState = current;
        if (current == ConnectionState.READY && properties.getScheduling().isAutoStart()) {
            startAll();
        }
    }

    // ── Arming ───────────────────────────────────────────────────────────────

    /** Arms each job on its own, so a job that fails to arm leaves the other running. */
    public synchronized void startAll() {
        try {
            startIngestion();
        } catch (RuntimeException e) {
            log.error("Could not arm message scraper job: {}", e.getMessage(), e);
        }
        try {
            startCleanup();
        } catch (RuntimeException e) {
            log.error("Could not arm cleanup job: {}", e.getMessage(), e);
        }
    }

    public synchronized void stopAll() {
        stopIngestion();
        stopCleanup();
    }

    public synchronized void startIngestion() {
        if (isArmed(ingestionJob)) return;
        String cron = toSpringCron(properties.getScheduling().getScrapeCron());
        log.info("Setting up message scraper job: {} ({})", cron, zone());
        ingestionJob = taskScheduler.schedule(this::ingestionTick, new CronTrigger(cron, zone()));
    }

    public synchronized void startCleanup() {
        if (isArmed(cleanupJob)) return;
        if (!cleanupEnabled()) {
            log.info("Message retention is set to forever, skipping cleanup job");
            return;
        }
        String cron = toSpringCron(properties.getScheduling().getCleanupCron());
        log.info("Setting up cleanup job: {} ({})", cron, zone());
        cleanupJob = taskScheduler.schedule(this::cleanupTick, new CronTrigger(cron, zone()));
    }

    public synchronized void stopIngestion() {
        if (isArmed(ingestionJob)) {
            ingestionJob.cancel(false);
            log.info("Message scraper job stopped");
        }
        ingestionJob = null;
    }

    public synchronized void stopCleanup() {
        if (isArmed(cleanupJob)) {
            cleanupJob.cancel(false);
            log.info("Cleanup job stopped");
        }
        cleanupJob = null;
    }

    public synchronized SchedulerStatus getStatus() {
        GroupScraperProperties.Scheduling scheduling = properties.getScheduling();
        return new SchedulerStatus(
                new SchedulerStatus.JobStatus(toSpringCron(scheduling.getScrapeCron()), isArmed(ingestionJob), true),
                new SchedulerStatus.JobStatus(toSpringCron(scheduling.getCleanupCron()), isArmed(cleanupJob), cleanupEnabled()),
                scheduling.getTimezone());
    }

    // ── Ticks ────────────────────────────────────────────────────────────────

    void ingestionTick() {
        if (sourceState != ConnectionState.READY) {
            log.warn("Chat source is {}, skipping scheduled scrape", sourceState);
            return;
        }
        log.info("Scheduled scrape triggered");
        try {
            Optional<List<ScrapeResult>> results = ingestionService.tryScrapeAllConfiguredGroups();
            if (results.isEmpty()) {
                log.warn("Previous scrape still running, skipping this tick");
                return;
            }
            log.info("Scrape completed: {}", results.get().stream()
                    .map(ScrapeResult::summary)
                    .collect(Collectors.joining(", ")));
        } catch (Exception e) {
            log.error("Scheduled scrape failed: {}", e.getMessage(), e);
        }
    }

    void cleanupTick() {
        log.info("Scheduled cleanup triggered");
        try {
            int deleted = ingestionService.cleanupExpiredMessages();
            log.info("Cleanup completed: {} messages deleted", deleted);
        } catch (Exception e) {
            log.error("Scheduled cleanup failed: {}", e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean cleanupEnabled() {
        return properties.getRetention().getDays() > 0;
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getScheduling().getTimezone());
    }

    /** Five-field expressions get a leading seconds field; anything else is passed through. */
    static String toSpringCron(String expression) {
        if (expression == null) return null;
        String trimmed = expression.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    private static void validate(String name, String expression) {
        try {
            CronExpression.parse(toSpringCron(expression));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "Invalid group-scraper.scheduling." + name + " '" + expression + "': " + e.getMessage(), e);
        }
    }

    private static boolean isArmed(ScheduledFuture<?> job) {
        return job != null && !job.isCancelled() && !job.isDone();
    }
}

package com.chatintel.group.service;

import com.chatintel.group.model.ScrapeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs manually requested scrapes in the background. Callers get a future and can
 * answer "accepted" right away; completion is logged either way.
 */
@Component
@Slf4j
public class ScrapeTaskQueue {

    private final IngestionService ingestionService;
    private final Executor scrapeExecutor;

    public ScrapeTaskQueue(IngestionService ingestionService,
                           @Qualifier("scrapeExecutor") Executor scrapeExecutor) {
        this.ingestionService = ingestionService;
        this.scrapeExecutor = scrapeExecutor;
    }

    /**
     * @throws java.util.concurrent.RejectedExecutionException when the queue is full
     */
    public CompletableFuture<ScrapeResult> submitGroup(String groupId) {
        return CompletableFuture
                .supplyAsync(() -> ingestionService.scrapeGroup(groupId), scrapeExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Manual scrape failed for {}: {}", groupId, error.getMessage(), error);
                    } else {
                        log.info("Manual scrape completed: {}", result.summary());
                    }
                });
    }

    public CompletableFuture<List<ScrapeResult>> submitAll() {
        return CompletableFuture
                .supplyAsync(ingestionService::scrapeAllConfiguredGroups, scrapeExecutor)
                .whenComplete((results, error) -> {
                    if (error != null) {
                        log.error("Manual scrape of all groups failed: {}", error.getMessage(), error);
                    } else {
                        log.info("Manual scrape all completed: {}", results.stream()
                                .map(ScrapeResult::summary)
                                .collect(Collectors.joining(", ")));
                    }
                });
    }
}

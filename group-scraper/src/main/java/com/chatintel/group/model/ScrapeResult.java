package com.chatintel.group.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one group scrape as reported to callers. Failures are carried here,
 * never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScrapeResult(
        boolean success,
        String groupId,
        String groupName,
        Integer messagesProcessed,
        Integer messagesInserted,
        String error) {

    public static ScrapeResult success(String groupId, String groupName, int processed, int inserted) {
        return new ScrapeResult(true, groupId, groupName, processed, inserted, null);
    }

    public static ScrapeResult failure(String groupId, String error) {
        return new ScrapeResult(false, groupId, null, null, null, error);
    }

    public String summary() {
        return success
                ? String.format("%s: %d messages (%d new)", groupName, messagesProcessed, messagesInserted)
                : String.format("%s: FAILED - %s", groupId, error);
    }
}

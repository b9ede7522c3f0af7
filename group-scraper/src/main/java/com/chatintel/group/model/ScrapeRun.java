package com.chatintel.group.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Audit record for one scrape of one group. Stored in the scrape_history table.
 * Opened before the first message is written and closed exactly once.
 */
@Data
@Builder
public class ScrapeRun {

    private Long id;
    private String groupId;
    private int messagesScraped;    // processed, duplicates included
    private int messagesInserted;   // newly persisted only
    private OffsetDateTime startedAt;
    private OffsetDateTime endedAt; // null while in progress
    private ScrapeStatus status;
    private String errorMessage;    // null on success
}

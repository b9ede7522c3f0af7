package com.chatintel.group.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GroupStatistics {

    private long totalMessages;
    private long mediaMessages;
    private long uniqueSenders;
    /** Epoch seconds, null when the group has no messages */
    private Long firstMessageTimestamp;
    private Long lastMessageTimestamp;
}

package com.chatintel.group.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * A monitored chat group. Upserted on every scrape, never deleted by the pipeline.
 */
@Data
@Builder
public class Group {

    /** Source-assigned id, e.g. 120363041234567890@g.us */
    private String id;
    private String name;
    private int participantCount;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static Group from(GroupSnapshot snapshot) {
        return Group.builder()
                .id(snapshot.getId())
                .name(snapshot.getName())
                .participantCount(snapshot.getParticipants() == null ? 0 : snapshot.getParticipants().size())
                .build();
    }
}

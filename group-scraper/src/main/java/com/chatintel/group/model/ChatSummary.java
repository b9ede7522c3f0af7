package com.chatintel.group.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the bridge's chat list. Used to discover group ids for
 * MONITORED_GROUPS.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatSummary {

    private String id;
    private String name;
    @JsonProperty("isGroup")
    private boolean group;
    private int unreadCount;
    /** Epoch seconds of the last activity */
    private Long timestamp;
}

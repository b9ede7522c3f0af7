package com.chatintel.group.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw DTO for one message as returned by the bridge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawMessage {

    private String id;
    private String body;
    private String type;

    @JsonProperty("timestamp")
    private long timestampEpochSeconds;

    @JsonProperty("from")
    private String fromId;

    @JsonProperty("author")
    private String authorId;

    private boolean fromMe;
    private boolean hasMedia;

    @JsonProperty("ack")
    private int ackState;

    /** Sender contact if the bridge attached it; resolved on demand otherwise */
    private ContactInfo contact;
}

package com.chatintel.group.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for a chat as returned by the bridge.
 * Kept separate from {@link Group} to isolate bridge coupling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroupSnapshot {

    private String id;
    private String name;
    /** False for one-to-one chats */
    @JsonProperty("isGroup")
    private boolean group;

    @Builder.Default
    private List<Participant> participants = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Participant {
        private String id;
        /** Phone number the bridge already knows for this participant, if any */
        private String phoneNumber;
    }
}

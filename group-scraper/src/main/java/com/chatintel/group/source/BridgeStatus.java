package com.chatintel.group.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of the bridge's status endpoint. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BridgeStatus {

    /** Lower-case connection state, e.g. "ready" */
    private String state;
}

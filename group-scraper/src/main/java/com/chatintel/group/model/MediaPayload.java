package com.chatintel.group.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MediaPayload {

    /** e.g. image/jpeg, audio/ogg; codecs=opus */
    private String mimeType;

    /** Base64 on the wire, decoded by Jackson */
    private byte[] data;
}

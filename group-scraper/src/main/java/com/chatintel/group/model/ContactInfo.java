package com.chatintel.group.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContactInfo {

    /** The contact's own serialized id; may be the linked (opaque) id of a phone participant */
    private String id;
    private String number;
    /** Display name the user set for themselves */
    private String pushname;
    /** Name saved in the address book of the scraping account */
    private String name;
}

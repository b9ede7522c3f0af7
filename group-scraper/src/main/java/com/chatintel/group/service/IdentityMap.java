package com.chatintel.group.service;

import java.util.Map;
import java.util.Optional;

/**
 * Participant identifier to phone digits, built for a single scrape.
 *
 * Both phone-bearing ids (94772147755@c.us) and the opaque linked ids the source
 * uses as message authors (162474452119805@lid) are keys. Values are bare digits.
 * Never cached across scrapes: the source may reassign linked ids between sessions.
 */
public record IdentityMap(Map<String, String> entries) {

    public IdentityMap {
        entries = Map.copyOf(entries);
    }

    public static IdentityMap empty() {
        return new IdentityMap(Map.of());
    }

    public Optional<String> phoneFor(String rawId) {
        return rawId == null ? Optional.empty() : Optional.ofNullable(entries.get(rawId));
    }

    public int size() {
        return entries.size();
    }
}

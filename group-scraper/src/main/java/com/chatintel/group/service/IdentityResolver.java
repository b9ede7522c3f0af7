package com.chatintel.group.service;

import com.chatintel.group.exception.ChatSourceException;
import com.chatintel.group.model.ContactInfo;
import com.chatintel.group.model.GroupSnapshot;
import com.chatintel.group.source.ChatIds;
import com.chatintel.group.source.ChatSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the {@link IdentityMap} for one group snapshot.
 *
 * Never fails: a participant whose phone cannot be determined is left out and
 * the message normalizer falls back to weaker signals for its messages.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IdentityResolver {

    private final ChatSource chatSource;

    public IdentityMap build(GroupSnapshot snapshot) {
        Map<String, String> entries = new HashMap<>();
        List<GroupSnapshot.Participant> participants = snapshot.getParticipants();
        if (participants == null || participants.isEmpty()) {
            log.info("Group {} has no participant list, identity map is empty", snapshot.getId());
            return IdentityMap.empty();
        }

        int degraded = 0;
        for (GroupSnapshot.Participant participant : participants) {
            try {
                if (!resolveParticipant(participant, entries)) {
                    degraded++;
                }
            } catch (Exception e) {
                degraded++;
                log.warn("Skipping participant {} of {}: {}", participant.getId(), snapshot.getId(), e.getMessage());
            }
        }

        log.info("Built participant map with {} entries for {} ({} participants degraded)",
                entries.size(), snapshot.getId(), degraded);
        return new IdentityMap(entries);
    }

    /** @return false when the participant could only be mapped partially or not at all */
    private boolean resolveParticipant(GroupSnapshot.Participant participant, Map<String, String> entries) {
        String participantId = participant.getId();
        if (participantId == null || participantId.isBlank()) {
            return false;
        }

        Optional<String> knownPhone = ChatIds.digitsOf(participant.getPhoneNumber())
                .or(() -> ChatIds.phoneOf(participantId));

        if (knownPhone.isPresent()) {
            String phone = knownPhone.get();
            entries.put(participantId, phone);
            if (!ChatIds.isPhoneBearing(participantId)) {
                return true;
            }
            // Messages are often authored under the linked id, learn it too
            try {
                ContactInfo contact = chatSource.resolveContact(participantId);
                if (contact.getId() != null && !contact.getId().equals(participantId)) {
                    entries.put(contact.getId(), phone);
                }
                return true;
            } catch (ChatSourceException e) {
                log.debug("No linked id for {}: {}", participantId, e.getMessage());
                return false;
            }
        }

        try {
            ContactInfo contact = chatSource.resolveContact(participantId);
            Optional<String> phone = ChatIds.digitsOf(contact.getNumber())
                    .or(() -> ChatIds.phoneOf(contact.getId()));
            phone.ifPresent(p -> entries.put(participantId, p));
            return phone.isPresent();
        } catch (ChatSourceException e) {
            log.warn("Could not resolve participant {}: {}", participantId, e.getMessage());
            return false;
        }
    }
}

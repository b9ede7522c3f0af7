package com.chatintel.group.service;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.exception.ChatSourceException;
import com.chatintel.group.model.ContactInfo;
import com.chatintel.group.model.RawMessage;
import com.chatintel.group.model.StoredMessage;
import com.chatintel.group.source.ChatIds;
import com.chatintel.group.source.ChatSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Maps raw bridge messages to the normalised {@link StoredMessage} model.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MessageNormalizer {

    private final ChatSource chatSource;
    private final MediaDownloader mediaDownloader;
    private final GroupScraperProperties properties;
    private final Clock clock;

    /**
     * Convert one raw message to a database-ready record.
     *
     * @param raw        Raw DTO from the bridge
     * @param groupId    The group this message was scraped from
     * @param identities Participant map of the current scrape
     */
    public StoredMessage normalize(RawMessage raw, String groupId, IdentityMap identities) {
        ContactInfo contact = contactOf(raw);

        StoredMessage message = StoredMessage.builder()
                .id(raw.getId())
                .groupId(groupId)
                .body(raw.getBody())
                .type(raw.getType())
                .timestamp(raw.getTimestampEpochSeconds())
                .timestampFormatted(OffsetDateTime.ofInstant(
                        Instant.ofEpochSecond(raw.getTimestampEpochSeconds()), ZoneOffset.UTC))
                .fromNumber(raw.getFromId())
                .fromName(displayName(raw, contact))
                .authorRawId(raw.getAuthorId())
                .authorPhone(resolveAuthorPhone(raw.getAuthorId(), contact, identities).orElse(null))
                .fromMe(raw.isFromMe())
                .hasMedia(raw.isHasMedia())
                .ackState(raw.getAckState())
                .scrapedAt(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC))
                .build();

        if (raw.isHasMedia() && properties.getScraper().isScrapeMedia()) {
            message.setMediaPath(captureMedia(raw.getId()));
        }
        return message;
    }

    /**
     * Canonical sender, first hit wins:
     * identity map, contact number, contact id (phone-bearing or mapped),
     * phone-bearing author id, phone-shaped author local part.
     */
    Optional<String> resolveAuthorPhone(String authorId, ContactInfo contact, IdentityMap identities) {
        Optional<String> phone = identities.phoneFor(authorId).flatMap(ChatIds::canonicalPhone);
        if (phone.isPresent()) return phone;

        if (contact != null) {
            phone = ChatIds.canonicalPhone(contact.getNumber());
            if (phone.isPresent()) return phone;

            String contactId = contact.getId();
            phone = ChatIds.isPhoneBearing(contactId)
                    ? ChatIds.phoneOf(contactId).flatMap(ChatIds::canonicalPhone)
                    : identities.phoneFor(contactId).flatMap(ChatIds::canonicalPhone);
            if (phone.isPresent()) return phone;
        }

        phone = ChatIds.phoneOf(authorId).flatMap(ChatIds::canonicalPhone);
        if (phone.isPresent()) return phone;

        String localPart = ChatIds.localPart(authorId);
        if (ChatIds.looksLikePhone(localPart)) {
            return Optional.of("+" + localPart);
        }

        if (authorId != null) {
            log.debug("Sender of author {} is unresolved", authorId);
        }
        return Optional.empty();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private ContactInfo contactOf(RawMessage raw) {
        if (raw.getContact() != null) {
            return raw.getContact();
        }
        String senderId = raw.getAuthorId() != null ? raw.getAuthorId() : raw.getFromId();
        if (senderId == null) {
            return null;
        }
        try {
            return chatSource.resolveContact(senderId);
        } catch (ChatSourceException e) {
            log.debug("No contact for sender {} of message {}: {}", senderId, raw.getId(), e.getMessage());
            return null;
        }
    }

    private String displayName(RawMessage raw, ContactInfo contact) {
        if (contact != null) {
            if (notBlank(contact.getPushname())) return contact.getPushname();
            if (notBlank(contact.getName())) return contact.getName();
        }
        return raw.getFromId();
    }

    private String captureMedia(String messageId) {
        try {
            return mediaDownloader.download(messageId)
                    .map(Path::toString)
                    .orElse(null);
        } catch (Exception e) {
            log.error("Failed to download media for message {}: {}", messageId, e.getMessage(), e);
            return null;
        }
    }

    private static boolean notBlank(String val) {
        return val != null && !val.isBlank();
    }
}

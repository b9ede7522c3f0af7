package com.chatintel.group.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Normalised message record ready for database ingestion.
 *
 * Written once per message id; later inserts of the same id are ignored. Only
 * retention cleanup ever removes a row, nothing updates one in place.
 */
@Data
@Builder(toBuilder = true)
public class StoredMessage {

    // ── Source identifiers ──────────────────────────────────────────────────
    /** Serialized message id, globally unique across groups */
    private String id;

    private String groupId;

    // ── Content ─────────────────────────────────────────────────────────────
    /** Null for media-only or system messages */
    private String body;

    /** chat, image, video, ptt, document, sticker, revoked, ... */
    private String type;

    // ── Time ────────────────────────────────────────────────────────────────
    /** Epoch seconds as assigned by the source */
    private long timestamp;

    private OffsetDateTime timestampFormatted;

    // ── Sender ──────────────────────────────────────────────────────────────
    /** Raw "from" of the message; for group messages this is the group id */
    private String fromNumber;

    private String fromName;

    /** Raw author identifier, either phone-bearing (@c.us) or opaque (@lid) */
    private String authorRawId;

    /** Canonical sender as +digits, null when unresolvable */
    private String authorPhone;

    private boolean fromMe;

    // ── Media ───────────────────────────────────────────────────────────────
    private boolean hasMedia;

    /** Where the payload was written, null when not captured */
    private String mediaPath;

    // ── Metadata ────────────────────────────────────────────────────────────
    private int ackState;

    private OffsetDateTime scrapedAt;
}

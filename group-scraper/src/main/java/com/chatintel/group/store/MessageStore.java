package com.chatintel.group.store;

import com.chatintel.group.model.Group;
import com.chatintel.group.model.GroupStatistics;
import com.chatintel.group.model.ScrapeRun;
import com.chatintel.group.model.ScrapeStatus;
import com.chatintel.group.model.StoredMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Sole owner of the chat_groups, messages and scrape_history tables.
 *
 * SQL sticks to the subset PostgreSQL and H2 (PostgreSQL mode) share. Every call
 * borrows a pooled connection through JdbcTemplate and hands it back on return or
 * throw; failures surface as Spring's DataAccessException.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MessageStore {

    static final String ABANDONED_RUN_MESSAGE = "abandoned: process restarted";

    private static final int SEARCH_LIMIT = 100;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public void ensureSchema() {
        log.info("Ensuring database schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS chat_groups
            (
                id                  VARCHAR(255) PRIMARY KEY,
                name                VARCHAR(1024) NOT NULL,
                participant_count   INTEGER,
                created_at          TIMESTAMP WITH TIME ZONE NOT NULL,
                updated_at          TIMESTAMP WITH TIME ZONE NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS messages
            (
                id                  VARCHAR(255) PRIMARY KEY,
                group_id            VARCHAR(255) NOT NULL REFERENCES chat_groups (id),
                message_body        VARCHAR,
                message_type        VARCHAR(64),
                message_timestamp   BIGINT NOT NULL,
                timestamp_formatted TIMESTAMP WITH TIME ZONE,
                from_number         VARCHAR(255),
                from_name           VARCHAR(1024),
                author              VARCHAR(255),
                author_phone        VARCHAR(32),
                is_from_me          BOOLEAN DEFAULT FALSE,
                has_media           BOOLEAN DEFAULT FALSE,
                media_path          VARCHAR(1024),
                ack                 INTEGER,
                scraped_at          TIMESTAMP WITH TIME ZONE NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scrape_history
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                group_id            VARCHAR(255) NOT NULL REFERENCES chat_groups (id),
                messages_scraped    INTEGER DEFAULT 0 NOT NULL,
                messages_inserted   INTEGER DEFAULT 0 NOT NULL,
                started_at          TIMESTAMP WITH TIME ZONE NOT NULL,
                ended_at            TIMESTAMP WITH TIME ZONE,
                status              VARCHAR(16) NOT NULL,
                error_message       VARCHAR
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_messages_group_id ON messages (group_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_messages_timestamp ON messages (message_timestamp)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_scrape_history_group_id ON scrape_history (group_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_scrape_history_started_at ON scrape_history (started_at)");

        log.info("Database schema ready.");
    }

    // ── Groups ───────────────────────────────────────────────────────────────

    /**
     * Insert or update keyed on id. Concurrent upserts of one id end with the
     * last writer's name and participant count.
     */
    @Transactional
    public Group upsertGroup(Group group) {
        OffsetDateTime now = now();
        int updated = updateGroup(group, now);
        if (updated == 0) {
            int inserted = jdbcTemplate.update("""
                INSERT INTO chat_groups (id, name, participant_count, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT DO NOTHING
                """,
                    group.getId(), group.getName(), group.getParticipantCount(), now, now);
            if (inserted == 0) {
                // lost an insert race, the row exists now
                updateGroup(group, now);
            }
        }
        return getGroup(group.getId())
                .orElseThrow(() -> new IllegalStateException("Group vanished during upsert: " + group.getId()));
    }

    private int updateGroup(Group group, OffsetDateTime now) {
        return jdbcTemplate.update(
                "UPDATE chat_groups SET name = ?, participant_count = ?, updated_at = ? WHERE id = ?",
                group.getName(), group.getParticipantCount(), now, group.getId());
    }

    public Optional<Group> getGroup(String groupId) {
        return jdbcTemplate.query("SELECT * FROM chat_groups WHERE id = ?", GROUP_MAPPER, groupId)
                .stream()
                .findFirst();
    }

    public List<Group> getAllGroups() {
        return jdbcTemplate.query("SELECT * FROM chat_groups ORDER BY updated_at DESC", GROUP_MAPPER);
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    /**
     * Insert-or-ignore on the message id. This is the only deduplication step in
     * the pipeline.
     *
     * @return the message when a new row was written, empty when the id already existed
     */
    public Optional<StoredMessage> insertMessage(StoredMessage m) {
        int rows = jdbcTemplate.update("""
            INSERT INTO messages
            (id, group_id, message_body, message_type, message_timestamp, timestamp_formatted,
             from_number, from_name, author, author_phone, is_from_me, has_media,
             media_path, ack, scraped_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """,
                m.getId(), m.getGroupId(), m.getBody(), m.getType(), m.getTimestamp(), m.getTimestampFormatted(),
                m.getFromNumber(), m.getFromName(), m.getAuthorRawId(), m.getAuthorPhone(), m.isFromMe(),
                m.isHasMedia(), m.getMediaPath(), m.getAckState(), m.getScrapedAt());
        return rows == 1 ? Optional.of(m) : Optional.empty();
    }

    public List<StoredMessage> getMessagesByGroup(String groupId, int limit, int offset) {
        return jdbcTemplate.query("""
            SELECT * FROM messages
            WHERE group_id = ?
            ORDER BY message_timestamp DESC
            LIMIT ? OFFSET ?
            """, MESSAGE_MAPPER, groupId, limit, offset);
    }

    /** Both bounds are epoch seconds and inclusive. */
    public List<StoredMessage> getMessagesByDateRange(String groupId, long startEpochSeconds, long endEpochSeconds) {
        return jdbcTemplate.query("""
            SELECT * FROM messages
            WHERE group_id = ? AND message_timestamp >= ? AND message_timestamp <= ?
            ORDER BY message_timestamp DESC
            """, MESSAGE_MAPPER, groupId, startEpochSeconds, endEpochSeconds);
    }

    public long countMessages(String groupId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM messages WHERE group_id = ?", Long.class, groupId);
        return count == null ? 0 : count;
    }

    public List<StoredMessage> searchMessages(String groupId, String term) {
        return jdbcTemplate.query("""
            SELECT * FROM messages
            WHERE group_id = ? AND LOWER(message_body) LIKE ? ESCAPE '\\'
            ORDER BY message_timestamp DESC
            LIMIT ?
            """, MESSAGE_MAPPER, groupId, "%" + escapeLike(term.toLowerCase(Locale.ROOT)) + "%", SEARCH_LIMIT);
    }

    /** The term matches literally: LIKE wildcards in it are escaped. */
    private static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    /** Oldest first, grouped by group when no group is given. */
    public List<StoredMessage> findMessagesForExport(String groupId) {
        if (groupId != null) {
            return jdbcTemplate.query(
                    "SELECT * FROM messages WHERE group_id = ? ORDER BY message_timestamp ASC",
                    MESSAGE_MAPPER, groupId);
        }
        return jdbcTemplate.query(
                "SELECT * FROM messages ORDER BY group_id, message_timestamp ASC", MESSAGE_MAPPER);
    }

    public GroupStatistics getGroupStatistics(String groupId) {
        return jdbcTemplate.queryForObject("""
            SELECT
                COUNT(*)                                        AS total_messages,
                COALESCE(SUM(CASE WHEN has_media THEN 1 ELSE 0 END), 0) AS media_messages,
                MIN(message_timestamp)                          AS first_ts,
                MAX(message_timestamp)                          AS last_ts,
                COUNT(DISTINCT author_phone)                    AS unique_senders
            FROM messages
            WHERE group_id = ?
            """, (rs, i) -> GroupStatistics.builder()
                        .totalMessages(rs.getLong("total_messages"))
                        .mediaMessages(rs.getLong("media_messages"))
                        .firstMessageTimestamp(nullableLong(rs, "first_ts"))
                        .lastMessageTimestamp(nullableLong(rs, "last_ts"))
                        .uniqueSenders(rs.getLong("unique_senders"))
                        .build(),
                groupId);
    }

    /**
     * Retention cleanup.
     *
     * @param cutoffEpochSeconds messages strictly older than this are removed
     * @return number of deleted messages
     */
    public int deleteMessagesOlderThan(long cutoffEpochSeconds) {
        return jdbcTemplate.update("DELETE FROM messages WHERE message_timestamp < ?", cutoffEpochSeconds);
    }

    // ── Scrape history ───────────────────────────────────────────────────────

    /** Opens an in_progress run. Must precede any message write of that scrape. */
    public long startRun(String groupId) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        OffsetDateTime startedAt = now();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO scrape_history (group_id, started_at, status) VALUES (?, ?, ?)",
                    new String[]{"id"});
            ps.setString(1, groupId);
            ps.setObject(2, startedAt);
            ps.setString(3, ScrapeStatus.IN_PROGRESS.dbValue());
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for scrape run of " + groupId);
        }
        return key.longValue();
    }

    /**
     * Closes a run. Only an in_progress run can be closed, so a second close of
     * the same run fails instead of rewriting the audit record.
     */
    public void endRun(long runId, int messagesScraped, int messagesInserted, ScrapeStatus status, String errorMessage) {
        if (status == ScrapeStatus.IN_PROGRESS) {
            throw new IllegalArgumentException("A run cannot be closed as in_progress");
        }
        int rows = jdbcTemplate.update("""
            UPDATE scrape_history
            SET ended_at = ?, messages_scraped = ?, messages_inserted = ?, status = ?, error_message = ?
            WHERE id = ? AND status = ?
            """,
                now(), messagesScraped, messagesInserted, status.dbValue(), errorMessage,
                runId, ScrapeStatus.IN_PROGRESS.dbValue());
        if (rows == 0) {
            throw new IllegalStateException("Scrape run " + runId + " is unknown or already closed");
        }
    }

    public Optional<ScrapeRun> getRun(long runId) {
        return jdbcTemplate.query("SELECT * FROM scrape_history WHERE id = ?", RUN_MAPPER, runId)
                .stream()
                .findFirst();
    }

    public List<ScrapeRun> getScrapeHistory(String groupId, int limit) {
        return jdbcTemplate.query("""
            SELECT * FROM scrape_history
            WHERE group_id = ?
            ORDER BY started_at DESC, id DESC
            LIMIT ?
            """, RUN_MAPPER, groupId, limit);
    }

    public Optional<ScrapeRun> getLatestRun(String groupId) {
        return getScrapeHistory(groupId, 1).stream().findFirst();
    }

    /**
     * Closes runs a previous process left open when it died mid-scrape.
     * Only safe before this process starts scraping.
     */
    public int failAbandonedRuns() {
        int rows = jdbcTemplate.update("""
            UPDATE scrape_history
            SET ended_at = ?, status = ?, error_message = ?
            WHERE status = ?
            """,
                now(), ScrapeStatus.FAILED.dbValue(), ABANDONED_RUN_MESSAGE, ScrapeStatus.IN_PROGRESS.dbValue());
        if (rows > 0) {
            log.warn("Closed {} scrape run(s) left in progress by a previous process", rows);
        }
        return rows;
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static final RowMapper<Group> GROUP_MAPPER = (rs, i) -> Group.builder()
            .id(rs.getString("id"))
            .name(rs.getString("name"))
            .participantCount(rs.getInt("participant_count"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
            .build();

    private static final RowMapper<StoredMessage> MESSAGE_MAPPER = (rs, i) -> StoredMessage.builder()
            .id(rs.getString("id"))
            .groupId(rs.getString("group_id"))
            .body(rs.getString("message_body"))
            .type(rs.getString("message_type"))
            .timestamp(rs.getLong("message_timestamp"))
            .timestampFormatted(rs.getObject("timestamp_formatted", OffsetDateTime.class))
            .fromNumber(rs.getString("from_number"))
            .fromName(rs.getString("from_name"))
            .authorRawId(rs.getString("author"))
            .authorPhone(rs.getString("author_phone"))
            .fromMe(rs.getBoolean("is_from_me"))
            .hasMedia(rs.getBoolean("has_media"))
            .mediaPath(rs.getString("media_path"))
            .ackState(rs.getInt("ack"))
            .scrapedAt(rs.getObject("scraped_at", OffsetDateTime.class))
            .build();

    private static final RowMapper<ScrapeRun> RUN_MAPPER = (rs, i) -> ScrapeRun.builder()
            .id(rs.getLong("id"))
            .groupId(rs.getString("group_id"))
            .messagesScraped(rs.getInt("messages_scraped"))
            .messagesInserted(rs.getInt("messages_inserted"))
            .startedAt(rs.getObject("started_at", OffsetDateTime.class))
            .endedAt(rs.getObject("ended_at", OffsetDateTime.class))
            .status(ScrapeStatus.fromDbValue(rs.getString("status")))
            .errorMessage(rs.getString("error_message"))
            .build();
}

package com.chatintel.group.output;

import com.chatintel.group.model.StoredMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes exported messages as one pretty-printed JSON document:
 * {@code {"metadata": {...}, "messages": [...]}} with snake_case message fields.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void write(List<StoredMessage> messages, Map<String, String> groupNames, String groupId, Path outputPath) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("exportDate", Instant.now(clock).toString());
        metadata.put("totalMessages", messages.size());
        metadata.put("groupId", groupId != null ? groupId : "all");

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("metadata", metadata);
        document.put("messages", messages.stream().map(m -> toRow(m, groupNames.get(m.getGroupId()))).toList());

        try {
            objectMapper.writer()
                    .with(SerializationFeature.INDENT_OUTPUT)
                    .writeValue(outputPath.toFile(), document);
            log.info("Written {} messages to JSON: {}", messages.size(), outputPath);
        } catch (IOException e) {
            log.error("Failed to write JSON file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("JSON export failed", e);
        }
    }

    private Map<String, Object> toRow(StoredMessage m, String groupName) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", m.getId());
        row.put("group_id", m.getGroupId());
        row.put("group_name", groupName);
        row.put("message_body", m.getBody());
        row.put("message_type", m.getType());
        row.put("author", m.getAuthorRawId());
        row.put("author_phone", m.getAuthorPhone());
        row.put("from_number", m.getFromNumber());
        row.put("from_name", m.getFromName());
        row.put("timestamp", m.getTimestamp());
        row.put("timestamp_formatted", m.getTimestampFormatted() != null ? m.getTimestampFormatted().toString() : null);
        row.put("is_from_me", m.isFromMe());
        row.put("has_media", m.isHasMedia());
        row.put("media_path", m.getMediaPath());
        row.put("ack", m.getAckState());
        row.put("scraped_at", m.getScrapedAt() != null ? m.getScrapedAt().toString() : null);
        return row;
    }
}

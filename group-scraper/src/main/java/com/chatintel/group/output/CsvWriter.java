package com.chatintel.group.output;

import com.chatintel.group.model.StoredMessage;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes exported messages as CSV with a header row, one message per line,
 * e.g. ./exports/messages_120363041234567890_2024-05-01T10-00-00Z.csv
 *
 * These CSVs load straight into a spreadsheet or back into PostgreSQL via
 *   COPY messages_import FROM '/exports/....csv' WITH (FORMAT csv, HEADER true)
 */
@Component
@Slf4j
public class CsvWriter {

    private static final String[] HEADERS = {
            "id", "group_id", "group_name",
            "message_body", "message_type",
            "author", "author_phone", "from_number", "from_name",
            "timestamp", "timestamp_formatted",
            "is_from_me", "has_media", "media_path",
            "ack", "scraped_at"
    };

    public void write(List<StoredMessage> messages, Map<String, String> groupNames, Path outputPath) {
        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (StoredMessage m : messages) {
                writer.writeNext(toRow(m, groupNames.get(m.getGroupId())));
            }

            log.info("Written {} messages to CSV: {}", messages.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV export failed", e);
        }
    }

    private String[] toRow(StoredMessage m, String groupName) {
        return new String[]{
                str(m.getId()),
                str(m.getGroupId()),
                str(groupName),
                str(m.getBody()),
                str(m.getType()),
                str(m.getAuthorRawId()),
                str(m.getAuthorPhone()),
                str(m.getFromNumber()),
                str(m.getFromName()),
                str(m.getTimestamp()),
                str(m.getTimestampFormatted()),
                str(m.isFromMe()),
                str(m.isHasMedia()),
                str(m.getMediaPath()),
                str(m.getAckState()),
                str(m.getScrapedAt())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}

package com.chatintel.group.output;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.config.GroupScraperProperties.Export.ExportFormat;
import com.chatintel.group.model.Group;
import com.chatintel.group.model.StoredMessage;
import com.chatintel.group.source.ChatIds;
import com.chatintel.group.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Exports stored messages to a file in the requested format (JSON or CSV).
 *
 * Default output path: {exportDir}/messages_{group}_{timestamp}.{ext}, or
 * all_messages_{timestamp}.{ext} when exporting every group. An explicit output
 * file is resolved against the export directory and must stay inside it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ExportRouter {

    private final MessageStore messageStore;
    private final JsonWriter jsonWriter;
    private final CsvWriter csvWriter;
    private final GroupScraperProperties properties;
    private final Clock clock;

    /**
     * @param groupId    group to export, null for all groups
     * @param format     null for the configured default
     * @param outputFile explicit target file relative to the export directory, null for the default path
     * @throws IllegalArgumentException when {@code outputFile} points outside the export directory
     */
    public ExportResult export(String groupId, ExportFormat format, String outputFile) {
        ExportFormat mode = format != null ? format : properties.getExport().getDefaultFormat();
        Path requested = outputFile != null ? resolveInsideExportDir(outputFile) : null;

        List<StoredMessage> messages = messageStore.findMessagesForExport(groupId);
        if (messages.isEmpty()) {
            log.warn("No messages found to export");
            return new ExportResult(true, "No messages found", 0, null);
        }

        Path outputPath = requested != null ? requested : defaultPath(groupId, mode);
        ensureDirectory(outputPath.toAbsolutePath().getParent());
        log.info("Starting export of {} messages to: {}", messages.size(), outputPath);

        Map<String, String> groupNames = messageStore.getAllGroups().stream()
                .collect(Collectors.toMap(Group::getId, Group::getName, (a, b) -> a));

        switch (mode) {
            case JSON -> jsonWriter.write(messages, groupNames, groupId, outputPath);
            case CSV -> csvWriter.write(messages, groupNames, outputPath);
        }

        return new ExportResult(true, "Export completed successfully", messages.size(), outputPath.toString());
    }

    private Path defaultPath(String groupId, ExportFormat mode) {
        String timestamp = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString().replace(':', '-');
        String extension = mode.name().toLowerCase(Locale.ROOT);
        String filename = groupId != null
                ? String.format("messages_%s_%s.%s", ChatIds.localPart(groupId), timestamp, extension)
                : String.format("all_messages_%s.%s", timestamp, extension);
        return Paths.get(properties.getExport().getOutputDir()).resolve(filename);
    }

    private Path resolveInsideExportDir(String outputFile) {
        Path exportDir = Paths.get(properties.getExport().getOutputDir()).toAbsolutePath().normalize();
        Path target;
        try {
            target = exportDir.resolve(outputFile).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid outputFile: " + outputFile, e);
        }
        if (!target.startsWith(exportDir) || target.equals(exportDir)) {
            throw new IllegalArgumentException("outputFile must be a file inside the export directory " + exportDir);
        }
        return target;
    }

    private void ensureDirectory(Path dir) {
        if (dir == null) return;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create export directory: " + dir, e);
        }
    }
}

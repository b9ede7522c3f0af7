package com.chatintel.group.service;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.model.MediaPayload;
import com.chatintel.group.source.ChatSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;

/**
 * Writes message media to {@code <mediaPath>/<message id>.<subtype>}, e.g.
 * ./data/media/false_120363041234567890@g.us_3EB0C767D26A1D6A.jpeg
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MediaDownloader {

    private final ChatSource chatSource;
    private final GroupScraperProperties properties;

    /**
     * @return the written file, empty when the source has no payload for the message
     * @throws IOException when the payload cannot be written
     */
    public Optional<Path> download(String messageId) throws IOException {
        Optional<MediaPayload> media = chatSource.downloadMedia(messageId);
        if (media.isEmpty()) {
            log.debug("No media payload for message {}", messageId);
            return Optional.empty();
        }

        Path mediaDir = Paths.get(properties.getScraper().getMediaPath());
        Files.createDirectories(mediaDir);

        String filename = safeFilename(messageId) + "." + extensionOf(media.get().getMimeType());
        Path target = mediaDir.resolve(filename);
        Files.write(target, media.get().getData());

        log.info("Media saved: {}", filename);
        return Optional.of(target);
    }

    static String extensionOf(String mimeType) {
        if (mimeType == null || !mimeType.contains("/")) return "bin";
        String subtype = mimeType.substring(mimeType.indexOf('/') + 1);
        int params = subtype.indexOf(';');
        if (params >= 0) subtype = subtype.substring(0, params);
        subtype = subtype.trim().toLowerCase(Locale.ROOT);
        return subtype.matches("[a-z0-9.+-]+") ? subtype : "bin";
    }

    static String safeFilename(String messageId) {
        return messageId.replaceAll("[^A-Za-z0-9@._-]", "_");
    }
}

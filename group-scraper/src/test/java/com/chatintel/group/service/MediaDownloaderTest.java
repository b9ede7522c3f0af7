package com.chatintel.group.service;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.model.MediaPayload;
import com.chatintel.group.source.ChatSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MediaDownloaderTest {

    @TempDir
    Path tempDir;

    private final ChatSource chatSource = mock(ChatSource.class);
    private final GroupScraperProperties properties = new GroupScraperProperties();

    @Test
    void writesPayloadNamedAfterMessageAndSubtype() throws Exception {
        properties.getScraper().setMediaPath(tempDir.resolve("media").toString());
        String messageId = "false_120363041234567890@g.us_3EB0C767D26A1D6A";
        when(chatSource.downloadMedia(messageId)).thenReturn(Optional.of(
                new MediaPayload("image/jpeg", "jpeg-bytes".getBytes(StandardCharsets.UTF_8))));

        Optional<Path> written = new MediaDownloader(chatSource, properties).download(messageId);

        assertThat(written).contains(tempDir.resolve("media").resolve(messageId + ".jpeg"));
        assertThat(Files.readString(written.get())).isEqualTo("jpeg-bytes");
    }

    @Test
    void noPayloadWritesNothing() throws Exception {
        properties.getScraper().setMediaPath(tempDir.resolve("media").toString());
        when(chatSource.downloadMedia("m1")).thenReturn(Optional.empty());

        assertThat(new MediaDownloader(chatSource, properties).download("m1")).isEmpty();
        assertThat(Files.exists(tempDir.resolve("media"))).isFalse();
    }

    @Test
    void extensionComesFromMimeSubtype() {
        assertThat(MediaDownloader.extensionOf("audio/ogg; codecs=opus")).isEqualTo("ogg");
        assertThat(MediaDownloader.extensionOf("application/pdf")).isEqualTo("pdf");
        assertThat(MediaDownloader.extensionOf(null)).isEqualTo("bin");
        assertThat(MediaDownloader.extensionOf("garbage")).isEqualTo("bin");
    }

    @Test
    void unsafeCharactersAreReplaced() {
        assertThat(MediaDownloader.safeFilename("../etc/passwd")).isEqualTo(".._etc_passwd");
    }
}

package com.chatintel.group.service;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.exception.ChatSourceException;
import com.chatintel.group.model.GroupSnapshot;
import com.chatintel.group.model.RawMessage;
import com.chatintel.group.model.ScrapeResult;
import com.chatintel.group.model.ScrapeStatus;
import com.chatintel.group.model.StoredMessage;
import com.chatintel.group.source.ChatSource;
import com.chatintel.group.store.MessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GroupScrapeServiceTest {

    private static final String GROUP = "120363041234567890@g.us";
    private static final long RUN_ID = 7L;

    private final ChatSource chatSource = mock(ChatSource.class);
    private final IdentityResolver identityResolver = mock(IdentityResolver.class);
    private final MessageNormalizer normalizer = mock(MessageNormalizer.class);
    private final MessageStore messageStore = mock(MessageStore.class);
    private final GroupScraperProperties properties = new GroupScraperProperties();

    private final GroupScrapeService service =
            new GroupScrapeService(chatSource, identityResolver, normalizer, messageStore, properties);

    @BeforeEach
    void setUp() {
        when(chatSource.fetchGroup(GROUP)).thenReturn(GroupSnapshot.builder()
                .id(GROUP)
                .name("Colombo Rentals")
                .group(true)
                .participants(List.of(new GroupSnapshot.Participant("94772147755@c.us", null)))
                .build());
        when(identityResolver.build(any())).thenReturn(IdentityMap.empty());
        when(messageStore.startRun(GROUP)).thenReturn(RUN_ID);
        when(normalizer.normalize(any(), eq(GROUP), any())).thenAnswer(inv -> {
            RawMessage raw = inv.getArgument(0);
            return StoredMessage.builder().id(raw.getId()).groupId(GROUP).build();
        });
        when(messageStore.insertMessage(any())).thenAnswer(inv -> Optional.of(inv.getArgument(0)));
    }

    @Test
    void completedRunCountsDuplicatesAsProcessed() {
        when(chatSource.fetchRecentMessages(GROUP, 100)).thenReturn(messages(3));
        doReturn(Optional.empty()).when(messageStore).insertMessage(argThat(m -> m != null && m.getId().equals("m2")));

        ScrapeResult result = service.scrapeGroup(GROUP);

        assertThat(result.success()).isTrue();
        assertThat(result.groupName()).isEqualTo("Colombo Rentals");
        assertThat(result.messagesProcessed()).isEqualTo(3);
        assertThat(result.messagesInserted()).isEqualTo(2);
        verify(messageStore).endRun(RUN_ID, 3, 2, ScrapeStatus.COMPLETED, null);
    }

    @Test
    void groupIsUpsertedAndRunOpenedBeforeAnyMessageWrite() {
        when(chatSource.fetchRecentMessages(GROUP, 100)).thenReturn(messages(1));

        service.scrapeGroup(GROUP);

        InOrder order = inOrder(messageStore);
        order.verify(messageStore).upsertGroup(argThat(g -> g.getId().equals(GROUP) && g.getParticipantCount() == 1));
        order.verify(messageStore).startRun(GROUP);
        order.verify(messageStore).insertMessage(any());
        order.verify(messageStore).endRun(eq(RUN_ID), anyInt(), anyInt(), eq(ScrapeStatus.COMPLETED), isNull());
    }

    @Test
    void oneBadMessageIsSkippedAndTheRunStillCompletes() {
        when(chatSource.fetchRecentMessages(GROUP, 100)).thenReturn(messages(5));
        doThrow(new IllegalStateException("malformed message"))
                .when(normalizer).normalize(argThat(m -> m != null && m.getId().equals("m3")), eq(GROUP), any());

        ScrapeResult result = service.scrapeGroup(GROUP);

        assertThat(result.success()).isTrue();
        assertThat(result.messagesProcessed()).isEqualTo(4);
        verify(messageStore).endRun(RUN_ID, 4, 4, ScrapeStatus.COMPLETED, null);
    }

    @Test
    void nullEntryFromTheSourceIsSkipped() {
        List<RawMessage> withGap = new ArrayList<>(messages(2));
        withGap.add(1, null);
        when(chatSource.fetchRecentMessages(GROUP, 100)).thenReturn(withGap);

        ScrapeResult result = service.scrapeGroup(GROUP);

        assertThat(result.success()).isTrue();
        assertThat(result.messagesProcessed()).isEqualTo(2);
        verify(messageStore).endRun(RUN_ID, 2, 2, ScrapeStatus.COMPLETED, null);
    }

    @Test
    void notAGroupFailsWithoutOpeningARun() {
        when(chatSource.fetchGroup("94772147755@c.us")).thenReturn(GroupSnapshot.builder()
                .id("94772147755@c.us").name("Nimal").group(false).build());

        ScrapeResult result = service.scrapeGroup("94772147755@c.us");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Chat 94772147755@c.us is not a group");
        verify(messageStore, never()).upsertGroup(any());
        verify(messageStore, never()).startRun(anyString());
    }

    @Test
    void unreachableSourceFailsWithoutOpeningARun() {
        when(chatSource.fetchGroup(GROUP)).thenThrow(new ChatSourceException("Bridge circuit open"));

        ScrapeResult result = service.scrapeGroup(GROUP);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Bridge circuit open");
        verify(messageStore, never()).startRun(anyString());
    }

    @Test
    void failedMessageFetchClosesTheRunAsFailed() {
        when(chatSource.fetchRecentMessages(GROUP, 100)).thenThrow(new ChatSourceException("read timed out"));

        ScrapeResult result = service.scrapeGroup(GROUP);

        assertThat(result.success()).isFalse();
        verify(messageStore).endRun(RUN_ID, 0, 0, ScrapeStatus.FAILED, "read timed out");
    }

    @Test
    void lostDatabaseConnectionFailsTheRunWithPartialCounts() {
        when(chatSource.fetchRecentMessages(GROUP, 100)).thenReturn(messages(5));
        doThrow(new DataAccessResourceFailureException("connection reset"))
                .when(messageStore).insertMessage(argThat(m -> m != null && m.getId().equals("m3")));

        ScrapeResult result = service.scrapeGroup(GROUP);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("connection reset");
        verify(messageStore).endRun(RUN_ID, 2, 2, ScrapeStatus.FAILED, "connection reset");
        verify(messageStore, never()).endRun(anyLong(), anyInt(), anyInt(), eq(ScrapeStatus.COMPLETED), any());
    }

    @Test
    void neverThrowsEvenWhenTheRunCannotBeClosed() {
        when(chatSource.fetchRecentMessages(GROUP, 100)).thenThrow(new ChatSourceException("gone"));
        doThrow(new DataAccessResourceFailureException("db down"))
                .when(messageStore).endRun(anyLong(), anyInt(), anyInt(), any(), any());

        ScrapeResult result = service.scrapeGroup(GROUP);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("gone");
    }

    @Test
    void usesConfiguredMessageLimit() {
        properties.getScraper().setMessageLimit(25);
        when(chatSource.fetchRecentMessages(GROUP, 25)).thenReturn(List.of());

        ScrapeResult result = service.scrapeGroup(GROUP);

        assertThat(result.success()).isTrue();
        assertThat(result.messagesProcessed()).isZero();
        verify(messageStore).endRun(RUN_ID, 0, 0, ScrapeStatus.COMPLETED, null);
    }

    private static List<RawMessage> messages(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> RawMessage.builder()
                        .id("m" + i)
                        .body("message " + i)
                        .type("chat")
                        .timestampEpochSeconds(1714557600L + i)
                        .fromId(GROUP)
                        .authorId("94772147755@c.us")
                        .build())
                .toList();
    }
}

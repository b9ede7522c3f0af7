package com.chatintel.group.service;

import com.chatintel.group.model.Group;
import com.chatintel.group.model.GroupStatistics;
import com.chatintel.group.store.MessageStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MessageQueryServiceTest {

    private static final String GROUP = "120363041234567890@g.us";

    private final MessageStore messageStore = mock(MessageStore.class);
    private final MessageQueryService service = new MessageQueryService(messageStore);

    @Test
    void pageCarriesGroupNameAndTotal() {
        when(messageStore.getGroup(GROUP)).thenReturn(Optional.of(Group.builder().id(GROUP).name("Colombo Rentals").build()));
        when(messageStore.getMessagesByGroup(GROUP, 50, 100)).thenReturn(List.of());
        when(messageStore.countMessages(GROUP)).thenReturn(240L);

        Map<String, Object> page = service.getMessages(GROUP, 50, 100);

        assertThat(page).containsEntry("groupName", "Colombo Rentals")
                .containsEntry("total", 240L)
                .containsEntry("count", 0);
    }

    @Test
    void pagingIsValidated() {
        assertThatThrownBy(() -> service.getMessages(GROUP, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.getMessages(GROUP, 1001, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.getMessages(GROUP, 10, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rangeIsConvertedToEpochSeconds() {
        Instant start = Instant.parse("2024-05-01T00:00:00Z");
        Instant end = Instant.parse("2024-05-02T00:00:00Z");

        service.getMessagesBetween(GROUP, start, end);

        verify(messageStore).getMessagesByDateRange(GROUP, start.getEpochSecond(), end.getEpochSecond());
        assertThatThrownBy(() -> service.getMessagesBetween(GROUP, end, start))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statisticsExposeDatesOfFirstAndLastMessage() {
        when(messageStore.getGroupStatistics(GROUP)).thenReturn(GroupStatistics.builder()
                .totalMessages(2).firstMessageTimestamp(1714557600L).lastMessageTimestamp(1714561200L).build());

        Map<String, Object> stats = service.getStatistics(GROUP);

        assertThat(stats).containsEntry("firstMessageDate", Instant.ofEpochSecond(1714557600L))
                .containsEntry("lastMessageDate", Instant.ofEpochSecond(1714561200L));
    }
}

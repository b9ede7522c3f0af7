package com.chatintel.group.service;

import com.chatintel.group.model.Group;
import com.chatintel.group.model.GroupStatistics;
import com.chatintel.group.model.ScrapeRun;
import com.chatintel.group.model.StoredMessage;
import com.chatintel.group.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side for the API: stored groups, messages, statistics and scrape history.
 * Nothing here touches the chat source.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MessageQueryService {

    private static final int MAX_PAGE_SIZE = 1000;

    private final MessageStore messageStore;

    public List<Group> listGroups() {
        return messageStore.getAllGroups();
    }

    public Map<String, Object> getMessages(String groupId, int limit, int offset) {
        if (limit <= 0 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        List<StoredMessage> messages = messageStore.getMessagesByGroup(groupId, limit, offset);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("groupId", groupId);
        result.put("groupName", groupName(groupId).orElse(null));
        result.put("count", messages.size());
        result.put("total", messageStore.countMessages(groupId));
        result.put("messages", messages);
        return result;
    }

    /**
     * Messages sent between two instants, both inclusive.
     */
    public List<StoredMessage> getMessagesBetween(String groupId, Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }
        return messageStore.getMessagesByDateRange(groupId, start.getEpochSecond(), end.getEpochSecond());
    }

    public List<StoredMessage> search(String groupId, String term) {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("search term must not be empty");
        }
        return messageStore.searchMessages(groupId, term.trim());
    }

    public Map<String, Object> getStatistics(String groupId) {
        GroupStatistics stats = messageStore.getGroupStatistics(groupId);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("groupId", groupId);
        result.put("groupName", groupName(groupId).orElse(null));
        result.put("statistics", stats);
        result.put("firstMessageDate", toInstant(stats.getFirstMessageTimestamp()));
        result.put("lastMessageDate", toInstant(stats.getLastMessageTimestamp()));
        return result;
    }

    public List<ScrapeRun> getScrapeHistory(String groupId, int limit) {
        if (limit <= 0 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        return messageStore.getScrapeHistory(groupId, limit);
    }

    private Optional<String> groupName(String groupId) {
        return messageStore.getGroup(groupId).map(Group::getName);
    }

    private static Instant toInstant(Long epochSeconds) {
        return epochSeconds == null ? null : Instant.ofEpochSecond(epochSeconds);
    }
}

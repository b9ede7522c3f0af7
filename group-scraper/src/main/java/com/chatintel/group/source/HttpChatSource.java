package com.chatintel.group.source;

import com.chatintel.group.config.GroupScraperProperties;
import com.chatintel.group.exception.ChatSourceException;
import com.chatintel.group.exception.ContactLookupException;
import com.chatintel.group.model.ChatSummary;
import com.chatintel.group.model.ContactInfo;
import com.chatintel.group.model.GroupSnapshot;
import com.chatintel.group.model.MediaPayload;
import com.chatintel.group.model.RawMessage;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thin client over the chat bridge REST API.
 *
 * The bridge owns the chat session (pairing, reconnects, browser). Every call goes
 * through one circuit breaker so a dead bridge fails a scrape fast instead of
 * waiting out the read timeout once per participant. No call is retried here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HttpChatSource implements ChatSource {

    private final RestTemplate chatSourceRestTemplate;
    private final CircuitBreaker chatSourceCircuitBreaker;
    private final GroupScraperProperties properties;

    @Override
    public List<ChatSummary> listChats() {
        ChatSummary[] response = call("list chats",
                () -> chatSourceRestTemplate.getForObject(url("/chats"), ChatSummary[].class));
        if (response == null) {
            return Collections.emptyList();
        }
        log.debug("Bridge returned {} chats", response.length);
        return Arrays.asList(response);
    }

    @Override
    public GroupSnapshot fetchGroup(String chatId) {
        GroupSnapshot snapshot = call("fetch chat " + chatId,
                () -> chatSourceRestTemplate.getForObject(url("/groups/{id}"), GroupSnapshot.class, chatId));
        if (snapshot == null) {
            throw new ChatSourceException("Bridge returned no chat for " + chatId);
        }
        return snapshot;
    }

    @Override
    public List<RawMessage> fetchRecentMessages(String chatId, int limit) {
        RawMessage[] response = call("fetch messages of " + chatId,
                () -> chatSourceRestTemplate.getForObject(url("/groups/{id}/messages?limit={limit}"),
                        RawMessage[].class, chatId, limit));
        if (response == null) {
            return Collections.emptyList();
        }
        log.debug("Bridge returned {} messages for {}", response.length, chatId);
        return Arrays.asList(response);
    }

    @Override
    public ContactInfo resolveContact(String contactId) {
        ContactInfo contact = call("resolve contact " + contactId, () -> {
            try {
                return chatSourceRestTemplate.getForObject(url("/contacts/{id}"), ContactInfo.class, contactId);
            } catch (HttpClientErrorException.NotFound e) {
                // unknown contact is an answer, not a bridge failure
                return null;
            }
        });
        if (contact == null) {
            throw new ContactLookupException("Contact not found: " + contactId);
        }
        return contact;
    }

    @Override
    public Optional<MediaPayload> downloadMedia(String messageId) {
        MediaPayload media = call("download media of " + messageId, () -> {
            try {
                return chatSourceRestTemplate.getForObject(url("/messages/{id}/media"), MediaPayload.class, messageId);
            } catch (HttpClientErrorException.NotFound e) {
                return null;
            }
        });
        if (media == null || media.getData() == null) {
            return Optional.empty();
        }
        return Optional.of(media);
    }

    @Override
    public ConnectionState connectionState() {
        BridgeStatus status = call("read bridge status",
                () -> chatSourceRestTemplate.getForObject(url("/status"), BridgeStatus.class));
        if (status == null || status.getState() == null) {
            return ConnectionState.INITIALIZING;
        }
        String state = status.getState().toUpperCase(Locale.ROOT);
        try {
            return ConnectionState.valueOf(state);
        } catch (IllegalArgumentException e) {
            log.warn("Bridge reported unknown state '{}', treating as DISCONNECTED", state);
            return ConnectionState.DISCONNECTED;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String url(String path) {
        return properties.getSource().getBaseUrl() + path;
    }

    private <T> T call(String description, Supplier<T> request) {
        log.debug("Bridge call: {}", description);
        try {
            return chatSourceCircuitBreaker.executeSupplier(request);
        } catch (CallNotPermittedException e) {
            throw new ChatSourceException("Bridge circuit open, skipped: " + description, e);
        } catch (RestClientException e) {
            throw new ChatSourceException("Bridge call failed (" + description + "): " + e.getMessage(), e);
        }
    }
}

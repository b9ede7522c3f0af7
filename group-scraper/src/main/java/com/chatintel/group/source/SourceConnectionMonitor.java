package com.chatintel.group.source;

import com.chatintel.group.exception.ChatSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls the bridge for its connection state and tells listeners about transitions.
 * Replaces push-style ready/disconnected callbacks with a state the rest of the
 * service can read at any time.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SourceConnectionMonitor {

    private final ChatSource chatSource;
    private final List<SourceStateListener> listeners;

    private volatile ConnectionState state = ConnectionState.INITIALIZING;

    @Scheduled(fixedDelayString = "${group-scraper.source.status-poll-interval-ms:15000}", initialDelay = 1000)
    public void poll() {
        ConnectionState current;
        try {
            current = chatSource.connectionState();
        } catch (ChatSourceException e) {
            log.debug("Bridge status unavailable: {}", e.getMessage());
            current = ConnectionState.DISCONNECTED;
        }
        update(current);
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isReady() {
        return state == ConnectionState.READY;
    }

    synchronized void update(ConnectionState current) {
        ConnectionState previous = state;
        if (previous == current) return;
        state = current;

        if (current == ConnectionState.READY) {
            log.info("Chat source is ready");
        } else if (current == ConnectionState.DISCONNECTED) {
            log.warn("Chat source disconnected (was {})", previous);
        } else {
            log.info("Chat source state: {} -> {}", previous, current);
        }

        for (SourceStateListener listener : listeners) {
            try {
                listener.onStateChange(previous, current);
            } catch (Exception e) {
                log.error("State listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}

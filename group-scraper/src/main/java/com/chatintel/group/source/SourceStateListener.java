package com.chatintel.group.source;

/**
 * Notified by {@link SourceConnectionMonitor} whenever the bridge changes state.
 */
public interface SourceStateListener {

    void onStateChange(ConnectionState previous, ConnectionState current);
}

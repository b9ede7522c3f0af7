package com.chatintel.group.source;

public enum ConnectionState {
    INITIALIZING,
    AWAITING_PAIRING,
    AUTHENTICATED,
    READY,
    DISCONNECTED
}

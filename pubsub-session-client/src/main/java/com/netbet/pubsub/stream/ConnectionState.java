package com.netbet.pubsub.stream;

public enum ConnectionState {
    CLOSED,
    CONNECTING,
    OPEN,
    CLOSING
}

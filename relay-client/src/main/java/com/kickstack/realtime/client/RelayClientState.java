package com.kickstack.realtime.client;

/**
 * Lifecycle of a {@link RelayClient}
 */
public enum RelayClientState {
    IDLE,
    CONNECTING,
    OPEN,
    CLOSED_WILL_RETRY,
    CLOSED_TERMINAL
}

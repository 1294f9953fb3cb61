package com.kickstack.realtime.client;

import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.common.protocol.RelayMessage;

/**
 * Callbacks from a {@link RelayClient}. Invoked on transport threads;
 * implementations should hand off long-running work.
 */
public interface RelayClientListener {

    /**
     * Every server message, including change, connected, acknowledgements and errors.
     * For change messages the client's last seen id already includes this message.
     */
    void onMessage(RelayMessage message);

    default void onConnect() {
    }

    default void onDisconnect(int statusCode, String reason) {
    }

    default void onError(Throwable error) {
    }

    /**
     * Reconnect attempts are exhausted; the client stays closed until
     * {@link RelayClient#connect()} is called again.
     */
    default void onGiveUp(RelayException cause) {
    }
}

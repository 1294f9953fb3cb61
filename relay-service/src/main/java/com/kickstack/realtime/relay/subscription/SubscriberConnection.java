package com.kickstack.realtime.relay.subscription;

import com.kickstack.realtime.common.protocol.RelayMessage;

import java.io.IOException;

/**
 * Transport-level handle used to push frames to one subscriber.
 * Becomes invalid once the underlying connection closes.
 */
public interface SubscriberConnection {

    enum CloseReason {
        NORMAL,
        POLICY_VIOLATION,
        SERVER_ERROR
    }

    String getId();

    /**
     * Whether the transport currently accepts writes
     */
    boolean isOpen();

    void send(RelayMessage message) throws IOException;

    /**
     * Best-effort close; never throws
     */
    void close(CloseReason reason);
}

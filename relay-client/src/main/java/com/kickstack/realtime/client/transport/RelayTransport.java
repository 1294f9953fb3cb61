package com.kickstack.realtime.client.transport;

import java.net.URI;

/**
 * Opens connections to the relay. Every outcome, including a failed
 * connect, is reported through the {@link Listener}.
 */
public interface RelayTransport {

    void connect(URI uri, Listener listener);

    interface Listener {

        void onOpen(RelayChannel channel);

        /**
         * A complete text message
         */
        void onText(String text);

        void onClosed(int statusCode, String reason);

        /**
         * Connect failure or transport error; no further callbacks follow
         */
        void onError(Throwable error);
    }
}

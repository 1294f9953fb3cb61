package com.kickstack.realtime.client.transport;

/**
 * An open connection to the relay
 */
public interface RelayChannel {

    /**
     * Send one complete text frame. Sends are delivered in call order.
     */
    void send(String text);

    /**
     * Close with a normal status. Never throws.
     */
    void close();
}

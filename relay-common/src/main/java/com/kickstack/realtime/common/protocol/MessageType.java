package com.kickstack.realtime.common.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Value of the "type" field tagging every relay message.
 */
public enum MessageType {

    // Server -> client
    CONNECTED,
    CHANGE,
    SUBSCRIBED,
    UNSUBSCRIBED,
    PONG,
    ERROR,

    // Client -> server
    PING,
    SUBSCRIBE,
    UNSUBSCRIBE,

    @JsonEnumDefaultValue
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageType fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (MessageType type : values()) {
            if (type.value().equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}

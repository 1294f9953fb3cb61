package com.kickstack.realtime.common.exception;

/**
 * Error codes for categorizing relay failures.
 * Error codes are organized by category:
 * - 1xxx: Client errors
 * - 2xxx: Change store errors
 * - 4xxx: Client connection errors
 */
public enum ErrorCode {

    // Client errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    NO_TABLES_SPECIFIED(1002, "No tables specified"),
    MALFORMED_MESSAGE(1003, "Message could not be parsed"),
    SERIALIZATION_FAILED(1004, "Message could not be serialized"),
    UNKNOWN_CONNECTION(1005, "Connection is not registered"),

    // Change store errors (2xxx)
    STORE_UNAVAILABLE(2001, "Change store is unavailable"),
    INVALID_STORE_CONFIG(2003, "Invalid change store configuration"),

    // Connection errors (4xxx)
    RECONNECT_EXHAUSTED(4004, "Maximum reconnection attempts reached");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}

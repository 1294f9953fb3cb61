package com.kickstack.realtime.common.constant;

/**
 * Application-wide constants shared by the relay service and its clients.
 */
public final class RelayConstants {

    private RelayConstants() {
        // Utility class - prevent instantiation
    }

    // Connect parameters
    public static final String PARAM_TABLE = "table";
    public static final String PARAM_SINCE = "since";
    public static final String TABLE_SEPARATOR = ",";

    // Change store defaults
    public static final String DEFAULT_CHANGE_STORE_TABLE = "kickstack_changes";
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final long INITIAL_WATERMARK = 0L;

    // Poller defaults (milliseconds)
    public static final long DEFAULT_POLL_INTERVAL_MS = 500L;

    // Client reconnect defaults (milliseconds)
    public static final long DEFAULT_RECONNECT_BASE_DELAY_MS = 1000L;
    public static final long DEFAULT_RECONNECT_MAX_DELAY_MS = 30000L;
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 10;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10000L;

    // Relay endpoint
    public static final String DEFAULT_RELAY_URL = "ws://localhost:8081";

    // Error messages sent to subscribers
    public static final String ERROR_NO_TABLES = "No tables specified";
    public static final String ERROR_BACKFILL_FAILED = "Failed to fetch missed changes, please reconnect";
    public static final String ERROR_SUBSCRIBE_FAILED = "Failed to subscribe to table";
}

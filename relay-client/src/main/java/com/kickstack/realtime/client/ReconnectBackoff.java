package com.kickstack.realtime.client;

/**
 * Capped exponential reconnect delay: {@code min(base * 2^attempt, cap)}
 */
public class ReconnectBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int maxAttempts;

    public ReconnectBackoff(long baseDelayMs, long maxDelayMs, int maxAttempts) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs || maxAttempts < 0) {
            throw new IllegalArgumentException(String.format(
                    "Invalid backoff: base=%dms, max=%dms, attempts=%d", baseDelayMs, maxDelayMs, maxAttempts));
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxAttempts = maxAttempts;
    }

    public static ReconnectBackoff from(RelayClientConfig config) {
        return new ReconnectBackoff(config.getBaseReconnectDelayMs(),
                config.getMaxReconnectDelayMs(),
                config.getMaxReconnectAttempts());
    }

    /**
     * Delay before reconnect number {@code attempt} (zero based)
     */
    public long delayFor(int attempt) {
        // Past 2^62 the shift overflows; the cap applies long before that
        if (attempt >= 62) {
            return maxDelayMs;
        }
        long factor = 1L << attempt;
        if (baseDelayMs > maxDelayMs / factor) {
            return maxDelayMs;
        }
        return Math.min(baseDelayMs * factor, maxDelayMs);
    }

    public boolean isExhausted(int attempt) {
        return attempt >= maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}

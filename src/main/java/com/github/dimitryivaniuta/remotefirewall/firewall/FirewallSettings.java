package com.github.dimitryivaniuta.remotefirewall.firewall;

import java.time.Duration;

/**
 * Immutable snapshot of the firewall options. Every component reads one snapshot per call.
 *
 * @throws IllegalArgumentException from the constructor when a value is out of range
 */
public record FirewallSettings(
        int maxLogCount,
        Duration cleanupInterval,
        Duration rateLimitWindow,
        int rateLimitMaxRequests,
        boolean debuggingMode,
        double logSampleRate
) {

    public FirewallSettings {
        if (maxLogCount <= 0) {
            throw new IllegalArgumentException("maxLogCount must be positive, got " + maxLogCount);
        }
        requirePositive("cleanupInterval", cleanupInterval);
        requirePositive("rateLimitWindow", rateLimitWindow);
        if (rateLimitMaxRequests <= 0) {
            throw new IllegalArgumentException("rateLimitMaxRequests must be positive, got " + rateLimitMaxRequests);
        }
        if (Double.isNaN(logSampleRate) || logSampleRate < 0.0 || logSampleRate > 1.0) {
            throw new IllegalArgumentException("logSampleRate must be within [0,1], got " + logSampleRate);
        }
    }

    public static FirewallSettings defaults() {
        return new FirewallProperties().toSettings();
    }

    public FirewallSettings withMaxLogCount(int v) {
        return new FirewallSettings(v, cleanupInterval, rateLimitWindow, rateLimitMaxRequests, debuggingMode, logSampleRate);
    }

    public FirewallSettings withCleanupInterval(Duration v) {
        return new FirewallSettings(maxLogCount, v, rateLimitWindow, rateLimitMaxRequests, debuggingMode, logSampleRate);
    }

    public FirewallSettings withRateLimit(int maxRequests, Duration window) {
        return new FirewallSettings(maxLogCount, cleanupInterval, window, maxRequests, debuggingMode, logSampleRate);
    }

    public FirewallSettings withDebuggingMode(boolean v) {
        return new FirewallSettings(maxLogCount, cleanupInterval, rateLimitWindow, rateLimitMaxRequests, v, logSampleRate);
    }

    public FirewallSettings withLogSampleRate(double v) {
        return new FirewallSettings(maxLogCount, cleanupInterval, rateLimitWindow, rateLimitMaxRequests, debuggingMode, v);
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, got " + d);
        }
    }
}

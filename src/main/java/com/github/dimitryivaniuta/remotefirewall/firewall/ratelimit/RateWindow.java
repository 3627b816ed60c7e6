package com.github.dimitryivaniuta.remotefirewall.firewall.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Request count of one bucket inside the window that started at {@code windowStart}.
 */
public record RateWindow(Instant windowStart, int count) {

    public boolean isStale(Instant now, Duration window) {
        return now.isAfter(windowStart.plus(window));
    }
}

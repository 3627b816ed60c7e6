package com.github.dimitryivaniuta.remotefirewall.firewall.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallConfiguration;
import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallReconfiguredEvent;
import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Fixed-window request counter per (caller, endpoint).
 *
 * <p>A call outside the current window starts a new one with count 1. Inside the window the
 * count is incremented and the call is allowed while it stays within the ceiling. Denied calls
 * leave the count at {@code ceiling + 1} and never move the window start, so spamming cannot
 * shorten the penalty.
 *
 * <p>Buckets are updated with {@code Map.compute} on a Caffeine cache, which locks per key.
 * Idle buckets expire after two windows; an expired bucket behaves like a stale one.
 */
@Component
public class CallRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(CallRateLimiter.class);

    private final FirewallConfiguration config;
    private final Clock clock;
    private final Cache<RateWindowKey, RateWindow> windows;

    public CallRateLimiter(FirewallConfiguration config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfter(new IdleWindowExpiry(config))
                .build();
    }

    public boolean allow(String callerId, String endpoint) {
        FirewallSettings s = config.current();
        Instant now = clock.instant();
        int ceiling = s.rateLimitMaxRequests();
        boolean[] allowed = new boolean[1];

        windows.asMap().compute(new RateWindowKey(callerId, endpoint), (k, w) -> {
            if (w == null || w.isStale(now, s.rateLimitWindow())) {
                allowed[0] = true;
                return new RateWindow(now, 1);
            }
            int next = Math.min(w.count() + 1, ceiling + 1);
            allowed[0] = next <= ceiling;
            return new RateWindow(w.windowStart(), next);
        });

        if (!allowed[0] && log.isDebugEnabled()) {
            log.debug("Rate limit exceeded caller={} endpoint={} ceiling={} window={}",
                    callerId, endpoint, ceiling, s.rateLimitWindow());
        }
        return allowed[0];
    }

    /**
     * Gives back a slot taken by {@link #allow} for a call that was rejected later in the
     * pipeline. Only the window that granted the slot is touched; a window that has since
     * gone stale or been replaced is left alone.
     */
    public void release(String callerId, String endpoint) {
        FirewallSettings s = config.current();
        Instant now = clock.instant();
        windows.asMap().computeIfPresent(new RateWindowKey(callerId, endpoint), (k, w) -> {
            if (w.isStale(now, s.rateLimitWindow()) || w.count() <= 0) return w;
            return new RateWindow(w.windowStart(), w.count() - 1);
        });
    }

    public Optional<RateWindow> window(String callerId, String endpoint) {
        return Optional.ofNullable(windows.getIfPresent(new RateWindowKey(callerId, endpoint)));
    }

    public long activeWindows() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    public void reset() {
        windows.invalidateAll();
    }

    @EventListener
    public void onReconfigured(FirewallReconfiguredEvent event) {
        if (event.rateWindowChanged()) {
            reset();
            log.info("Rate limit window changed to {}, all windows reset", event.current().rateLimitWindow());
        }
    }

    private static final class IdleWindowExpiry implements Expiry<RateWindowKey, RateWindow> {

        private final FirewallConfiguration config;

        IdleWindowExpiry(FirewallConfiguration config) {
            this.config = config;
        }

        private long ttlNanos() {
            return config.current().rateLimitWindow().multipliedBy(2).toNanos();
        }

        @Override
        public long expireAfterCreate(RateWindowKey key, RateWindow value, long currentTime) {
            return ttlNanos();
        }

        @Override
        public long expireAfterUpdate(RateWindowKey key, RateWindow value, long currentTime, long currentDuration) {
            return ttlNanos();
        }

        @Override
        public long expireAfterRead(RateWindowKey key, RateWindow value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

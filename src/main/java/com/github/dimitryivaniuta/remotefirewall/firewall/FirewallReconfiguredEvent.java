package com.github.dimitryivaniuta.remotefirewall.firewall;

/**
 * Published after {@link FirewallConfiguration#configure} swapped the active settings.
 */
public record FirewallReconfiguredEvent(FirewallSettings previous, FirewallSettings current) {

    public boolean logCapacityChanged() {
        return previous.maxLogCount() != current.maxLogCount();
    }

    public boolean rateWindowChanged() {
        return !previous.rateLimitWindow().equals(current.rateLimitWindow());
    }
}

package com.github.dimitryivaniuta.remotefirewall.firewall.ratelimit;

/**
 * Rate limit bucket: one per (caller, endpoint) pair.
 */
public record RateWindowKey(String callerId, String endpoint) {
}

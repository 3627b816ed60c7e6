package com.github.dimitryivaniuta.remotefirewall.firewall.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class FirewallMetrics {

    private final MeterRegistry registry;

    public FirewallMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Calls ----
    public void callFinished(String endpoint, String outcome) {
        Counter.builder("remote_firewall_calls_total")
                .tag("endpoint", endpoint)
                .tag("outcome", outcome) // completed | rejected_* | callback_error
                .register(registry)
                .increment();
    }

    public void unknownEndpoint() {
        Counter.builder("remote_firewall_unknown_endpoint_total")
                .register(registry)
                .increment();
    }

    // ---- Rate limiting ----
    public void rateLimitRejected(String endpoint) {
        Counter.builder("remote_firewall_ratelimit_rejected_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    // ---- Call log ----
    public void logEvicted(String reason, int count) {
        if (count <= 0) return;
        Counter.builder("remote_firewall_log_evictions_total")
                .tag("reason", reason) // wraparound | retention | resize
                .register(registry)
                .increment(count);
    }

    // ---- Duration ----
    public void callbackDuration(String endpoint, long nanos) {
        Timer.builder("remote_firewall_callback_duration_seconds")
                .tag("endpoint", endpoint)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}

package com.github.dimitryivaniuta.remotefirewall.firewall;

import com.github.dimitryivaniuta.remotefirewall.firewall.assertion.CallAssertions;
import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogService;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteHandler;
import com.github.dimitryivaniuta.remotefirewall.firewall.metrics.FirewallMetrics;
import com.github.dimitryivaniuta.remotefirewall.firewall.middleware.MiddlewareChain;
import com.github.dimitryivaniuta.remotefirewall.firewall.ratelimit.CallRateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the pipeline by hand, the way Spring would, with a controllable clock.
 * Reconfiguration events are delivered synchronously to the log and the rate limiter.
 */
public final class FirewallFixture {

    public final TestClock clock = TestClock.atEpoch();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final FirewallMetrics metrics = new FirewallMetrics(registry);
    public final List<Object> events = new ArrayList<>();
    public final FirewallConfiguration config;
    public final CallLogService callLog;
    public final CallRateLimiter rateLimiter;
    public final MiddlewareChain middleware = new MiddlewareChain();
    public final RemoteHandler handler;
    public final CallAssertions assertions;

    public FirewallFixture(FirewallSettings settings) {
        this.config = new FirewallConfiguration(settings, this::deliver);
        this.callLog = new CallLogService(config, clock, metrics);
        this.rateLimiter = new CallRateLimiter(config, clock);
        this.handler = new RemoteHandler(config, callLog, rateLimiter, middleware, metrics, clock);
        this.assertions = new CallAssertions(callLog);
    }

    public FirewallFixture() {
        this(FirewallSettings.defaults());
    }

    private void deliver(Object event) {
        events.add(event);
        if (event instanceof FirewallReconfiguredEvent e) {
            callLog.onReconfigured(e);
            rateLimiter.onReconfigured(e);
        }
    }
}

package com.github.dimitryivaniuta.remotefirewall.web;

import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallConfiguration;
import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallSettings;
import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogService;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.EndpointRegistration;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteCallKind;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteHandler;
import com.github.dimitryivaniuta.remotefirewall.firewall.middleware.MiddlewareChain;
import com.github.dimitryivaniuta.remotefirewall.firewall.ratelimit.CallRateLimiter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/firewall")
public class FirewallAdminController {

    private final FirewallConfiguration config;
    private final RemoteHandler handler;
    private final MiddlewareChain middleware;
    private final CallRateLimiter rateLimiter;
    private final CallLogService callLog;

    // ---------- DTOs ----------
    public record SettingsRequest(
            @Positive int maxLogCount,
            @Positive long cleanupIntervalSeconds,
            @Positive long rateLimitWindowSeconds,
            @Positive int rateLimitMaxRequests,
            boolean debuggingMode,
            @DecimalMin("0.0") @DecimalMax("1.0") double logSampleRate
    ) {}

    public record SettingsResponse(
            int maxLogCount,
            long cleanupIntervalSeconds,
            long rateLimitWindowSeconds,
            int rateLimitMaxRequests,
            boolean debuggingMode,
            double logSampleRate,
            int logCapacity,
            long activeRateWindows
    ) {}

    public record EndpointResponse(
            String name,
            RemoteCallKind kind,
            String params,
            boolean forceLogging,
            int middlewareCount
    ) {}

    // ---------- endpoints ----------

    @GetMapping("/settings")
    public SettingsResponse settings() {
        return toResponse(config.current());
    }

    @PutMapping("/settings")
    public SettingsResponse update(@Valid @RequestBody SettingsRequest req) {
        config.configure(new FirewallSettings(
                req.maxLogCount(),
                Duration.ofSeconds(req.cleanupIntervalSeconds()),
                Duration.ofSeconds(req.rateLimitWindowSeconds()),
                req.rateLimitMaxRequests(),
                req.debuggingMode(),
                req.logSampleRate()
        ));
        return toResponse(config.current());
    }

    @GetMapping("/endpoints")
    public List<EndpointResponse> endpoints() {
        return handler.endpoints().stream().map(this::toEndpointResponse).toList();
    }

    // ---------- mapping ----------
    private SettingsResponse toResponse(FirewallSettings s) {
        return new SettingsResponse(
                s.maxLogCount(),
                s.cleanupInterval().toSeconds(),
                s.rateLimitWindow().toSeconds(),
                s.rateLimitMaxRequests(),
                s.debuggingMode(),
                s.logSampleRate(),
                callLog.capacity(),
                rateLimiter.activeWindows()
        );
    }

    private EndpointResponse toEndpointResponse(EndpointRegistration r) {
        return new EndpointResponse(
                r.name(),
                r.kind(),
                r.spec().toString(),
                r.forceLogging(),
                middleware.gates(r.name()).size()
        );
    }
}

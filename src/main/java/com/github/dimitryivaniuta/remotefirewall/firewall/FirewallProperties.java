package com.github.dimitryivaniuta.remotefirewall.firewall;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Getter
@Setter
@ConfigurationProperties(prefix = "remote-firewall")
public class FirewallProperties {
    private boolean enabled = true;

    // circular buffer capacity of the call log
    private int maxLogCount = 1_000;

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration cleanupInterval = Duration.ofSeconds(60);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration rateLimitWindow = Duration.ofSeconds(60);

    private int rateLimitMaxRequests = 30;

    private boolean debuggingMode = false;

    // 1.0 = every call gets a log entry
    private double logSampleRate = 1.0;

    public FirewallSettings toSettings() {
        return new FirewallSettings(maxLogCount, cleanupInterval, rateLimitWindow,
                rateLimitMaxRequests, debuggingMode, logSampleRate);
    }
}

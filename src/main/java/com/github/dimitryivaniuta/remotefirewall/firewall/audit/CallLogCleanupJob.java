package com.github.dimitryivaniuta.remotefirewall.firewall.audit;

import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallConfiguration;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Periodically evicts call log entries older than the retention horizon.
 *
 * The period is re-read from the active settings after every run, so a reconfigured
 * cleanupInterval takes effect without a restart.
 */
@Component
@RequiredArgsConstructor
public class CallLogCleanupJob implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(CallLogCleanupJob.class);

    private final CallLogService service;
    private final FirewallConfiguration config;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addTriggerTask(this::cleanupExpired, ctx -> {
            Instant last = ctx.lastCompletion();
            Instant base = (last != null) ? last : Instant.now();
            return base.plus(config.current().cleanupInterval());
        });
    }

    public void cleanupExpired() {
        int evicted = service.compact();
        if (evicted > 0) {
            log.info("Call log cleanup evicted {} expired entries", evicted);
        }
    }
}

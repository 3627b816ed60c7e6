package com.github.dimitryivaniuta.remotefirewall.firewall;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the active {@link FirewallSettings}.
 *
 * <p>Initialized once from {@link FirewallProperties}; {@link #configure} is the only update path.
 * Readers take a snapshot with {@link #current()}, so a call never sees a half-applied change.
 */
@Component
@EnableConfigurationProperties(FirewallProperties.class)
public class FirewallConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FirewallConfiguration.class);

    private final AtomicReference<FirewallSettings> current;
    private final ApplicationEventPublisher publisher;

    @Autowired
    public FirewallConfiguration(FirewallProperties props, ApplicationEventPublisher publisher) {
        this(props.toSettings(), publisher);
    }

    public FirewallConfiguration(FirewallSettings initial, ApplicationEventPublisher publisher) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial settings must not be null"));
        this.publisher = publisher;
    }

    public FirewallSettings current() {
        return current.get();
    }

    /**
     * Replaces the active settings and notifies listeners (call log buffer, rate limiter).
     */
    public FirewallSettings configure(FirewallSettings next) {
        Objects.requireNonNull(next, "settings must not be null");
        FirewallSettings previous = current.getAndSet(next);
        log.info("Remote firewall reconfigured: {}", next);
        if (publisher != null && !previous.equals(next)) {
            publisher.publishEvent(new FirewallReconfiguredEvent(previous, next));
        }
        return previous;
    }

    public boolean debugging() {
        return current.get().debuggingMode();
    }
}

package com.github.dimitryivaniuta.remotefirewall.firewall;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FirewallConfigurationTest {

    @Test
    void defaultsMatchProperties() {
        FirewallSettings s = FirewallSettings.defaults();

        assertThat(s.maxLogCount()).isEqualTo(1000);
        assertThat(s.cleanupInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(s.rateLimitWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(s.rateLimitMaxRequests()).isEqualTo(30);
        assertThat(s.debuggingMode()).isFalse();
        assertThat(s.logSampleRate()).isEqualTo(1.0);
    }

    @Test
    void rejectsOutOfRangeValues() {
        FirewallSettings s = FirewallSettings.defaults();

        assertThatThrownBy(() -> s.withMaxLogCount(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> s.withCleanupInterval(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> s.withRateLimit(0, Duration.ofSeconds(1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> s.withLogSampleRate(1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void configurePublishesOnlyRealChanges() {
        FirewallFixture fx = new FirewallFixture();

        FirewallSettings previous = fx.config.configure(FirewallSettings.defaults());
        assertThat(fx.events).isEmpty();

        fx.config.configure(previous.withDebuggingMode(true));
        assertThat(fx.events).singleElement().isInstanceOfSatisfying(FirewallReconfiguredEvent.class, e -> {
            assertThat(e.previous()).isEqualTo(previous);
            assertThat(e.logCapacityChanged()).isFalse();
            assertThat(e.rateWindowChanged()).isFalse();
        });
        assertThat(fx.config.debugging()).isTrue();
    }
}

package com.github.dimitryivaniuta.remotefirewall.firewall.audit;

import java.time.Instant;

/**
 * Sub-event attached to a {@link CallLogEntry}.
 */
public record CallLogEvent(CallLogLevel level, String message, Instant timestamp) {
}

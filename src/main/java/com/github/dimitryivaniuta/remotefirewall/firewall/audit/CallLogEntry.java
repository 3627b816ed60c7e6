package com.github.dimitryivaniuta.remotefirewall.firewall.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of one call log entry. Live entries never leave {@link CallLogBuffer}.
 */
@Value
@Builder
public class CallLogEntry {

    long index;
    String callerId;
    String endpoint;
    Instant timestamp;
    CallOutcome outcome;
    List<CallLogEvent> events;

    public long getInfoCount() {
        return events.stream().filter(e -> e.level() == CallLogLevel.INFO).count();
    }

    public long getErrorCount() {
        return events.stream().filter(e -> e.level() == CallLogLevel.ERROR).count();
    }

    public boolean hasErrors() {
        return getErrorCount() > 0;
    }
}

package com.github.dimitryivaniuta.remotefirewall.firewall.audit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counts over the live call log.
 *
 * @param perEndpoint entries per endpoint name, sorted by name
 * @param perOutcome entries per terminal outcome, in enum order
 */
public record CallLogStatistics(
        long totalEntries,
        long entriesWithErrors,
        long totalInfoEvents,
        long totalErrorEvents,
        Map<String, Long> perEndpoint,
        Map<CallOutcome, Long> perOutcome
) {
    public CallLogStatistics {
        perEndpoint = Collections.unmodifiableMap(new TreeMap<>(perEndpoint));
        perOutcome = perOutcome.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(perOutcome));
    }
}

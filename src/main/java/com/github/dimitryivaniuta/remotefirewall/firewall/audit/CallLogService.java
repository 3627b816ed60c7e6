package com.github.dimitryivaniuta.remotefirewall.firewall.audit;

import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallConfiguration;
import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallReconfiguredEvent;
import com.github.dimitryivaniuta.remotefirewall.firewall.metrics.FirewallMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded in-memory log of remote call attempts.
 *
 * <p>Callers only ever hold a log index. Every operation on an index that has been evicted
 * (wraparound, retention cleanup or resize) is a silent no-op.
 */
@Service
public class CallLogService {

    /**
     * Handle of a call that was not sampled for logging.
     */
    public static final long NO_INDEX = 0L;

    private static final Logger log = LoggerFactory.getLogger(CallLogService.class);

    private final FirewallConfiguration config;
    private final Clock clock;
    private final FirewallMetrics metrics;
    private final CallLogBuffer buffer;

    public CallLogService(FirewallConfiguration config, Clock clock, FirewallMetrics metrics) {
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
        this.buffer = new CallLogBuffer(config.current().maxLogCount());
    }

    public long record(String callerId, String endpoint) {
        CallLogBuffer.Recorded r = buffer.record(callerId, endpoint, clock.instant());
        if (r.evicted() != null) {
            metrics.logEvicted("wraparound", 1);
            traceEviction("wraparound", r.evicted());
        }
        return r.index();
    }

    public void append(long index, CallLogLevel level, String message) {
        if (index == NO_INDEX) return;
        boolean live = buffer.append(index, level, message, clock.instant());
        if (!live && log.isTraceEnabled()) {
            log.trace("Dropped {} event for evicted log index {}: {}", level, index, message);
        }
    }

    public void info(long index, String message) {
        append(index, CallLogLevel.INFO, message);
    }

    public void error(long index, String message) {
        append(index, CallLogLevel.ERROR, message);
    }

    public void finish(long index, CallOutcome outcome) {
        if (index == NO_INDEX) return;
        buffer.finish(index, outcome);
    }

    public Optional<CallLogEntry> find(long index) {
        return Optional.ofNullable(buffer.get(index));
    }

    public boolean isLive(long index) {
        return buffer.get(index) != null;
    }

    // ---- queries (read-only copies, index order) ----

    public List<CallLogEntry> retrieveAll() {
        return buffer.snapshot(e -> true);
    }

    public List<CallLogEntry> retrieveBySender(String callerId) {
        return buffer.snapshot(e -> Objects.equals(e.getCallerId(), callerId));
    }

    /**
     * Entries with {@code start <= timestamp <= end}.
     */
    public List<CallLogEntry> retrieveByTimeRange(Instant start, Instant end) {
        return buffer.snapshot(e -> !e.getTimestamp().isBefore(start) && !e.getTimestamp().isAfter(end));
    }

    public List<CallLogEntry> retrieveWithMinInfoCount(long minInfoCount) {
        return buffer.snapshot(e -> e.getInfoCount() >= minInfoCount);
    }

    public CallLogStatistics statistics() {
        List<CallLogEntry> all = retrieveAll();
        long withErrors = 0;
        long infos = 0;
        long errors = 0;
        Map<String, Long> perEndpoint = new HashMap<>();
        Map<CallOutcome, Long> perOutcome = new EnumMap<>(CallOutcome.class);
        for (CallLogEntry e : all) {
            long ec = e.getErrorCount();
            if (ec > 0) withErrors++;
            errors += ec;
            infos += e.getInfoCount();
            perEndpoint.merge(e.getEndpoint(), 1L, Long::sum);
            perOutcome.merge(e.getOutcome(), 1L, Long::sum);
        }
        return new CallLogStatistics(all.size(), withErrors, infos, errors, perEndpoint, perOutcome);
    }

    public int capacity() {
        return buffer.capacity();
    }

    // ---- maintenance ----

    /**
     * Evicts entries older than the retention horizon (one cleanup interval).
     *
     * @return number of evicted entries
     */
    public int compact() {
        Instant cutoff = clock.instant().minus(config.current().cleanupInterval());
        List<CallLogEntry> evicted = buffer.evictOlderThan(cutoff);
        metrics.logEvicted("retention", evicted.size());
        for (CallLogEntry e : evicted) {
            traceEviction("retention", e);
        }
        return evicted.size();
    }

    @EventListener
    public void onReconfigured(FirewallReconfiguredEvent event) {
        if (!event.logCapacityChanged()) return;
        int dropped = buffer.resize(event.current().maxLogCount());
        metrics.logEvicted("resize", dropped);
        log.info("Call log resized from {} to {} entries, {} dropped",
                event.previous().maxLogCount(), event.current().maxLogCount(), dropped);
    }

    private void traceEviction(String reason, CallLogEntry e) {
        if (!config.debugging()) return;
        log.info("Evicted call log entry index={} endpoint={} caller={} reason={} errors={}",
                e.getIndex(), e.getEndpoint(), e.getCallerId(), reason, e.getErrorCount());
    }
}

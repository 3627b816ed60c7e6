package com.github.dimitryivaniuta.remotefirewall.firewall.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Fixed-capacity circular store of call log entries.
 *
 * <p>Index {@code i} lives in slot {@code i % capacity}; recording index {@code i + capacity}
 * overwrites it. Slots are guarded by striped locks so unrelated calls do not contend.
 * The structural lock is only taken exclusively by {@link #resize(int)}.
 *
 * <p>Indices start at 1 and are never reused, also across resizes.
 */
public final class CallLogBuffer {

    private static final int MAX_STRIPES = 64;

    private final ReentrantReadWriteLock structure = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();

    // replaced only under the write lock
    private Slot[] slots;
    private ReentrantLock[] stripes;

    public CallLogBuffer(int capacity) {
        allocate(capacity);
    }

    /**
     * Result of {@link #record}: the new index and the entry it displaced, if any.
     */
    public record Recorded(long index, CallLogEntry evicted) {}

    public Recorded record(String callerId, String endpoint, Instant timestamp) {
        structure.readLock().lock();
        try {
            long index = sequence.incrementAndGet();
            int slot = slotOf(index);
            ReentrantLock stripe = stripeOf(slot);
            stripe.lock();
            try {
                Slot current = slots[slot];
                if (current != null && current.index > index) {
                    // a newer index won the race for this slot; ours is already stale
                    return new Recorded(index, null);
                }
                slots[slot] = new Slot(index, callerId, endpoint, timestamp);
                return new Recorded(index, current == null ? null : current.snapshot());
            } finally {
                stripe.unlock();
            }
        } finally {
            structure.readLock().unlock();
        }
    }

    /**
     * Adds a sub-event. Returns false when the index is no longer live.
     */
    public boolean append(long index, CallLogLevel level, String message, Instant timestamp) {
        return withLive(index, s -> s.events.add(new CallLogEvent(level, message, timestamp)));
    }

    public boolean finish(long index, CallOutcome outcome) {
        return withLive(index, s -> s.outcome = outcome);
    }

    public CallLogEntry get(long index) {
        if (index <= 0) return null;
        structure.readLock().lock();
        try {
            int slot = slotOf(index);
            ReentrantLock stripe = stripeOf(slot);
            stripe.lock();
            try {
                Slot s = slots[slot];
                return (s != null && s.index == index) ? s.snapshot() : null;
            } finally {
                stripe.unlock();
            }
        } finally {
            structure.readLock().unlock();
        }
    }

    /**
     * Copies of the live entries matching {@code filter}, in index order.
     */
    public List<CallLogEntry> snapshot(Predicate<CallLogEntry> filter) {
        List<CallLogEntry> out = new ArrayList<>();
        structure.readLock().lock();
        try {
            for (int i = 0; i < slots.length; i++) {
                ReentrantLock stripe = stripeOf(i);
                stripe.lock();
                try {
                    Slot s = slots[i];
                    if (s == null) continue;
                    CallLogEntry e = s.snapshot();
                    if (filter.test(e)) out.add(e);
                } finally {
                    stripe.unlock();
                }
            }
        } finally {
            structure.readLock().unlock();
        }
        out.sort(Comparator.comparingLong(CallLogEntry::getIndex));
        return out;
    }

    /**
     * Evicts entries whose timestamp is before {@code cutoff}, one stripe at a time.
     *
     * @return the evicted entries
     */
    public List<CallLogEntry> evictOlderThan(Instant cutoff) {
        List<CallLogEntry> evicted = new ArrayList<>();
        structure.readLock().lock();
        try {
            for (int i = 0; i < slots.length; i++) {
                ReentrantLock stripe = stripeOf(i);
                stripe.lock();
                try {
                    Slot s = slots[i];
                    if (s != null && s.timestamp.isBefore(cutoff)) {
                        evicted.add(s.snapshot());
                        slots[i] = null;
                    }
                } finally {
                    stripe.unlock();
                }
            }
        } finally {
            structure.readLock().unlock();
        }
        return evicted;
    }

    /**
     * Rebuilds the buffer with a new capacity, keeping the newest entries.
     *
     * @return number of entries dropped
     */
    public int resize(int newCapacity) {
        if (newCapacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        structure.writeLock().lock();
        try {
            List<Slot> live = new ArrayList<>();
            for (Slot s : slots) {
                if (s != null) live.add(s);
            }
            live.sort(Comparator.comparingLong((Slot s) -> s.index).reversed());

            allocate(newCapacity);
            int kept = 0;
            for (Slot s : live) {
                if (kept == newCapacity) break;
                int slot = slotOf(s.index);
                if (slots[slot] == null) {
                    slots[slot] = s;
                    kept++;
                }
            }
            return live.size() - kept;
        } finally {
            structure.writeLock().unlock();
        }
    }

    public int capacity() {
        structure.readLock().lock();
        try {
            return slots.length;
        } finally {
            structure.readLock().unlock();
        }
    }

    public int size() {
        return snapshot(e -> true).size();
    }

    public long lastIndex() {
        return sequence.get();
    }

    private boolean withLive(long index, Consumer<Slot> action) {
        if (index <= 0) return false;
        structure.readLock().lock();
        try {
            int slot = slotOf(index);
            ReentrantLock stripe = stripeOf(slot);
            stripe.lock();
            try {
                Slot s = slots[slot];
                if (s == null || s.index != index) return false;
                action.accept(s);
                return true;
            } finally {
                stripe.unlock();
            }
        } finally {
            structure.readLock().unlock();
        }
    }

    private void allocate(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        int stripeCount = Math.min(capacity, MAX_STRIPES);
        ReentrantLock[] locks = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            locks[i] = new ReentrantLock();
        }
        this.slots = new Slot[capacity];
        this.stripes = locks;
    }

    private int slotOf(long index) {
        return (int) (index % slots.length);
    }

    private ReentrantLock stripeOf(int slot) {
        return stripes[slot % stripes.length];
    }

    private static final class Slot {
        final long index;
        final String callerId;
        final String endpoint;
        final Instant timestamp;
        final List<CallLogEvent> events = new ArrayList<>();
        CallOutcome outcome = CallOutcome.PENDING;

        Slot(long index, String callerId, String endpoint, Instant timestamp) {
            this.index = index;
            this.callerId = callerId;
            this.endpoint = endpoint;
            this.timestamp = timestamp;
        }

        CallLogEntry snapshot() {
            return CallLogEntry.builder()
                    .index(index)
                    .callerId(callerId)
                    .endpoint(endpoint)
                    .timestamp(timestamp)
                    .outcome(outcome)
                    .events(List.copyOf(events))
                    .build();
        }
    }
}

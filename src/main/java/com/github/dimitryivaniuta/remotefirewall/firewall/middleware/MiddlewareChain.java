package com.github.dimitryivaniuta.remotefirewall.firewall.middleware;

import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.EndpointRegistration;
import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-endpoint ordered gate lists.
 *
 * <p>Gates run in insertion order and the first rejection short-circuits. Appends are only
 * made through {@code RemoteHandler.addMiddleware}; there is no removal.
 */
@Component
public class MiddlewareChain {

    private static final Logger log = LoggerFactory.getLogger(MiddlewareChain.class);

    private final Map<String, List<MiddlewareGate>> chains = new ConcurrentHashMap<>();

    /**
     * Outcome of one chain run.
     *
     * @param gatePosition zero-based position of the rejecting gate, -1 when accepted
     * @param failure throwable raised by the rejecting gate, or null for a plain rejection
     */
    public record Result(boolean accepted, int gatePosition, String gateName, Throwable failure) {

        static final Result ACCEPTED = new Result(true, -1, null, null);

        public String reason() {
            if (accepted) return "accepted";
            if (failure != null) {
                return "gate #" + gatePosition + " (" + gateName + ") failed: " + failure;
            }
            return "gate #" + gatePosition + " (" + gateName + ") rejected the call";
        }
    }

    public void add(String endpoint, MiddlewareGate gate) {
        Objects.requireNonNull(gate, "gate must not be null");
        chains.computeIfAbsent(endpoint, k -> new CopyOnWriteArrayList<>()).add(gate);
    }

    public List<MiddlewareGate> gates(String endpoint) {
        List<MiddlewareGate> gates = chains.get(endpoint);
        return (gates == null) ? List.of() : List.copyOf(gates);
    }

    public Result run(EndpointRegistration endpoint, String callerId, long logIndex, List<RemoteValue> args) {
        List<MiddlewareGate> gates = chains.get(endpoint.name());
        if (gates == null) return Result.ACCEPTED;

        int position = 0;
        // CopyOnWriteArrayList iteration is a stable snapshot even if a gate is appended concurrently
        for (MiddlewareGate gate : gates) {
            try {
                if (!gate.test(callerId, logIndex, endpoint, args)) {
                    return new Result(false, position, gate.name(), null);
                }
            } catch (Throwable ex) {
                log.warn("Middleware gate {} of endpoint {} failed for caller {}",
                        gate.name(), endpoint.name(), callerId, ex);
                return new Result(false, position, gate.name(), ex);
            }
            position++;
        }
        return Result.ACCEPTED;
    }
}

package com.github.dimitryivaniuta.remotefirewall.firewall.dispatch;

import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallConfiguration;
import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallSettings;
import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogService;
import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallOutcome;
import com.github.dimitryivaniuta.remotefirewall.firewall.metrics.FirewallMetrics;
import com.github.dimitryivaniuta.remotefirewall.firewall.middleware.MiddlewareChain;
import com.github.dimitryivaniuta.remotefirewall.firewall.middleware.MiddlewareGate;
import com.github.dimitryivaniuta.remotefirewall.firewall.ratelimit.CallRateLimiter;
import com.github.dimitryivaniuta.remotefirewall.firewall.spec.ParamSpec;
import com.github.dimitryivaniuta.remotefirewall.firewall.spec.TypeSpecCompiler;
import com.github.dimitryivaniuta.remotefirewall.firewall.spec.ValidationResult;
import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Entry point of every inbound remote call.
 *
 * <p>Pipeline (outer -> inner), terminal at the first failing stage:
 * <ol>
 *   <li>Log entry allocated (subject to sampling, always when forceLogging)</li>
 *   <li>Middleware chain: first rejecting gate short-circuits</li>
 *   <li>Rate limit per (caller, endpoint)</li>
 *   <li>Parameter validation against the compiled spec</li>
 *   <li>Application callback</li>
 * </ol>
 *
 * <p>No stage ever throws to the caller. Request/response callers get a {@link CallResult}
 * failure sentinel, fire-and-forget callers get nothing.
 */
@Service
@RequiredArgsConstructor
public class RemoteHandler {

    public static final String MDC_CALLER = "remoteCaller";
    public static final String MDC_ENDPOINT = "remoteEndpoint";
    public static final String MDC_LOG_INDEX = "logIndex";

    private static final Logger log = LoggerFactory.getLogger(RemoteHandler.class);

    private final Map<String, EndpointRegistration> endpoints = new ConcurrentHashMap<>();

    private final FirewallConfiguration config;
    private final CallLogService callLog;
    private final CallRateLimiter rateLimiter;
    private final MiddlewareChain middleware;
    private final FirewallMetrics metrics;
    private final Clock clock;

    // ---------- registration ----------

    /**
     * Compiles the parameter spec and publishes the endpoint.
     *
     * @throws com.github.dimitryivaniuta.remotefirewall.firewall.spec.SpecException if the spec is malformed;
     *         nothing is registered in that case
     * @throws EndpointRegistrationException on a blank or duplicate name or a missing callback
     */
    public EndpointRegistration register(EndpointDefinition def) {
        if (def.name() == null || def.name().isBlank()) {
            throw new EndpointRegistrationException("Endpoint name must not be blank");
        }
        if (def.callback() == null) {
            throw new EndpointRegistrationException("Endpoint '" + def.name() + "' has no callback");
        }
        if (def.kind() == null) {
            throw new EndpointRegistrationException("Endpoint '" + def.name() + "' has no call kind");
        }

        ParamSpec spec = TypeSpecCompiler.compile(def.params());

        EndpointRegistration reg = new EndpointRegistration(
                def.name(), def.kind(), spec, def.callback(), def.forceLogging(), clock.instant());

        if (endpoints.putIfAbsent(reg.name(), reg) != null) {
            throw new EndpointRegistrationException("Endpoint '" + reg.name() + "' is already registered");
        }
        for (MiddlewareGate gate : def.middleware()) {
            middleware.add(reg.name(), gate);
        }

        log.info("Registered remote endpoint {} kind={} params={} forceLogging={}",
                reg.name(), reg.kind(), spec, reg.forceLogging());
        return reg;
    }

    /**
     * Appends a gate to the end of the endpoint's chain.
     */
    public void addMiddleware(String endpointName, MiddlewareGate gate) {
        if (!endpoints.containsKey(endpointName)) {
            throw new EndpointRegistrationException("Cannot add middleware: endpoint '" + endpointName + "' is not registered");
        }
        if (gate == null) {
            throw new EndpointRegistrationException("Middleware gate must not be null");
        }
        middleware.add(endpointName, gate);
        log.debug("Added middleware {} to endpoint {}", gate.name(), endpointName);
    }

    public Optional<EndpointRegistration> find(String endpointName) {
        return Optional.ofNullable(endpointName).map(endpoints::get);
    }

    public List<EndpointRegistration> endpoints() {
        return endpoints.values().stream()
                .sorted(Comparator.comparing(EndpointRegistration::name))
                .toList();
    }

    // ---------- dispatch ----------

    /**
     * Request/response entry point.
     */
    public CallResult invoke(String endpointName, String callerId, List<RemoteValue> args) {
        return dispatch(endpointName, callerId, args);
    }

    /**
     * Fire-and-forget entry point; the outcome is only visible in the call log.
     */
    public void fire(String endpointName, String callerId, List<RemoteValue> args) {
        dispatch(endpointName, callerId, args);
    }

    public CallResult dispatch(String endpointName, String callerId, List<RemoteValue> args) {
        EndpointRegistration reg = (endpointName == null) ? null : endpoints.get(endpointName);
        if (reg == null) {
            metrics.unknownEndpoint();
            log.warn("Remote call to unknown endpoint '{}' from caller {}", endpointName, callerId);
            return CallResult.failure(CallStage.ROUTING, "unknown endpoint", CallLogService.NO_INDEX);
        }
        if (callerId == null || callerId.isBlank()) {
            log.warn("Remote call to {} without caller identity", endpointName);
            return CallResult.failure(CallStage.ROUTING, "missing caller identity", CallLogService.NO_INDEX);
        }

        List<RemoteValue> safeArgs = (args == null) ? List.of() : args;
        FirewallSettings settings = config.current();
        long logIndex = shouldRecord(reg, settings)
                ? callLog.record(callerId, reg.name())
                : CallLogService.NO_INDEX;

        // a callback may dispatch another endpoint; the outer call's keys come back afterwards
        String outerCaller = MDC.get(MDC_CALLER);
        String outerEndpoint = MDC.get(MDC_ENDPOINT);
        String outerLogIndex = MDC.get(MDC_LOG_INDEX);
        MDC.put(MDC_CALLER, callerId);
        MDC.put(MDC_ENDPOINT, reg.name());
        MDC.put(MDC_LOG_INDEX, String.valueOf(logIndex));
        try {
            return runPipeline(reg, callerId, logIndex, safeArgs);
        } finally {
            restoreMdc(MDC_CALLER, outerCaller);
            restoreMdc(MDC_ENDPOINT, outerEndpoint);
            restoreMdc(MDC_LOG_INDEX, outerLogIndex);
        }
    }

    private static void restoreMdc(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    private CallResult runPipeline(EndpointRegistration reg, String callerId, long logIndex, List<RemoteValue> args) {
        MiddlewareChain.Result gates = middleware.run(reg, callerId, logIndex, args);
        if (!gates.accepted()) {
            return reject(reg, callerId, logIndex, CallStage.MIDDLEWARE, CallOutcome.REJECTED_MIDDLEWARE, gates.reason());
        }

        if (!rateLimiter.allow(callerId, reg.name())) {
            metrics.rateLimitRejected(reg.name());
            return reject(reg, callerId, logIndex, CallStage.RATE_LIMIT, CallOutcome.REJECTED_RATE_LIMIT,
                    "rate limit exceeded");
        }

        ValidationResult validation = reg.spec().validate(args);
        if (!validation.isOk()) {
            // malformed arguments do not count against the caller's window
            rateLimiter.release(callerId, reg.name());
            String reason = validation.error().map(e -> e.describe()).orElse("invalid arguments");
            return reject(reg, callerId, logIndex, CallStage.VALIDATION, CallOutcome.REJECTED_VALIDATION, reason);
        }

        return invokeCallback(reg, callerId, logIndex, reg.spec().normalize(args));
    }

    private CallResult invokeCallback(EndpointRegistration reg, String callerId, long logIndex, List<RemoteValue> args) {
        long startNs = System.nanoTime();
        try {
            Object result = unwrap(reg.callback().handle(callerId, logIndex, args));
            callLog.info(logIndex, "completed");
            callLog.finish(logIndex, CallOutcome.COMPLETED);
            metrics.callFinished(reg.name(), CallOutcome.COMPLETED.tag());
            return CallResult.success(reg.kind() == RemoteCallKind.FUNCTION ? result : null, logIndex);
        } catch (Throwable ex) {
            // never let application failures escape into the transport
            log.warn("Callback of endpoint {} failed for caller {}", reg.name(), callerId, ex);
            long idx = ensureRecorded(reg, callerId, logIndex);
            callLog.error(idx, "callback failed: " + ex);
            callLog.finish(idx, CallOutcome.CALLBACK_ERROR);
            metrics.callFinished(reg.name(), CallOutcome.CALLBACK_ERROR.tag());
            return CallResult.failure(CallStage.CALLBACK, "callback failed", idx);
        } finally {
            metrics.callbackDuration(reg.name(), System.nanoTime() - startNs);
        }
    }

    private CallResult reject(EndpointRegistration reg, String callerId, long logIndex,
                              CallStage stage, CallOutcome outcome, String reason) {
        long idx = ensureRecorded(reg, callerId, logIndex);
        callLog.error(idx, "rejected at " + stage + ": " + reason);
        callLog.finish(idx, outcome);
        metrics.callFinished(reg.name(), outcome.tag());

        if (config.debugging()) {
            log.info("Rejected call endpoint={} caller={} stage={} reason={}", reg.name(), callerId, stage, reason);
        } else if (log.isDebugEnabled()) {
            log.debug("Rejected call endpoint={} caller={} stage={} reason={}", reg.name(), callerId, stage, reason);
        }
        return CallResult.failure(stage, reason, idx);
    }

    /**
     * Failures of unsampled calls still get an entry.
     */
    private long ensureRecorded(EndpointRegistration reg, String callerId, long logIndex) {
        return (logIndex != CallLogService.NO_INDEX) ? logIndex : callLog.record(callerId, reg.name());
    }

    private static boolean shouldRecord(EndpointRegistration reg, FirewallSettings settings) {
        if (reg.forceLogging()) return true;
        double rate = settings.logSampleRate();
        if (rate >= 1.0) return true;
        if (rate <= 0.0) return false;
        return ThreadLocalRandom.current().nextDouble() < rate;
    }

    private static Object unwrap(Object result) {
        if (result instanceof Optional<?> opt) return opt.orElse(null);
        if (result instanceof RemoteValue rv && rv.isAbsent()) return null;
        return result;
    }
}

package com.github.dimitryivaniuta.remotefirewall.firewall.middleware;

import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.EndpointRegistration;
import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;

import java.util.List;

/**
 * Pre-validation gate of one endpoint. Returning false rejects the call.
 *
 * <p>Arguments have NOT been validated yet when a gate runs. A gate that throws is treated
 * as a rejection.
 */
@FunctionalInterface
public interface MiddlewareGate {

    boolean test(String callerId, long logIndex, EndpointRegistration endpoint, List<RemoteValue> args) throws Exception;

    /**
     * Label used in log messages.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    static MiddlewareGate named(String name, MiddlewareGate gate) {
        return new MiddlewareGate() {
            @Override
            public boolean test(String callerId, long logIndex, EndpointRegistration endpoint, List<RemoteValue> args)
                    throws Exception {
                return gate.test(callerId, logIndex, endpoint, args);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}

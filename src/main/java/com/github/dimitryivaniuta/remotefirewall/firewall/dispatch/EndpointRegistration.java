package com.github.dimitryivaniuta.remotefirewall.firewall.dispatch;

import com.github.dimitryivaniuta.remotefirewall.firewall.spec.ParamSpec;

import java.time.Instant;

/**
 * A registered endpoint. Owned by {@link RemoteHandler}; immutable once created.
 * Its middleware list is kept by the middleware chain registry.
 */
public record EndpointRegistration(
        String name,
        RemoteCallKind kind,
        ParamSpec spec,
        RemoteCallback callback,
        boolean forceLogging,
        Instant registeredAt
) {
}

package com.github.dimitryivaniuta.remotefirewall.sample;

import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteHandler;
import com.github.dimitryivaniuta.remotefirewall.firewall.middleware.MiddlewareGate;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Attaches example gates once all endpoints are registered.
 * Endpoints are only registered while the firewall is enabled, so the gates follow the same switch.
 */
@Component
@ConditionalOnProperty(prefix = "remote-firewall", name = "enabled", matchIfMissing = true)
public class SampleMiddlewareConfig implements SmartInitializingSingleton {

    private final RemoteHandler handler;
    private final Set<String> bannedCallers;

    public SampleMiddlewareConfig(RemoteHandler handler,
                                  @Value("${remote-firewall.sample.banned-callers:}") Set<String> bannedCallers) {
        this.handler = handler;
        this.bannedCallers = Set.copyOf(bannedCallers);
    }

    @Override
    public void afterSingletonsInstantiated() {
        MiddlewareGate notBanned = MiddlewareGate.named("notBanned",
                (callerId, logIndex, endpoint, args) -> !bannedCallers.contains(callerId));

        handler.addMiddleware("PurchaseItem", notBanned);
        handler.addMiddleware("GetInventory", notBanned);
    }
}

package com.github.dimitryivaniuta.remotefirewall.firewall.dispatch;

import com.github.dimitryivaniuta.remotefirewall.firewall.middleware.MiddlewareGate;

import java.util.ArrayList;
import java.util.List;

/**
 * Registration request for {@link RemoteHandler#register}.
 *
 * <pre>
 *   EndpointDefinition.builder()
 *       .name("PurchaseItem")
 *       .kind(RemoteCallKind.FUNCTION)
 *       .params("itemId", "string", "qty", "range[1,10]")
 *       .callback((caller, logIndex, args) -> ...)
 *       .build();
 * </pre>
 */
public record EndpointDefinition(
        String name,
        RemoteCallKind kind,
        List<String[]> params,
        RemoteCallback callback,
        boolean forceLogging,
        List<MiddlewareGate> middleware
) {

    public EndpointDefinition {
        params = List.copyOf(params);
        middleware = List.copyOf(middleware);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private RemoteCallKind kind = RemoteCallKind.FUNCTION;
        private final List<String[]> params = new ArrayList<>();
        private RemoteCallback callback;
        private boolean forceLogging;
        private final List<MiddlewareGate> middleware = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(RemoteCallKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder param(String name, String type) {
            params.add(new String[]{name, type});
            return this;
        }

        /**
         * Alternating names and types. An odd count is kept as-is so the compiler reports it.
         */
        public Builder params(String... nameTypePairs) {
            int n = nameTypePairs.length;
            for (int i = 0; i < n; i += 2) {
                params.add(i + 1 < n
                        ? new String[]{nameTypePairs[i], nameTypePairs[i + 1]}
                        : new String[]{nameTypePairs[i]});
            }
            return this;
        }

        public Builder callback(RemoteCallback callback) {
            this.callback = callback;
            return this;
        }

        public Builder forceLogging(boolean forceLogging) {
            this.forceLogging = forceLogging;
            return this;
        }

        public Builder middleware(MiddlewareGate gate) {
            this.middleware.add(gate);
            return this;
        }

        public EndpointDefinition build() {
            return new EndpointDefinition(name, kind, params, callback, forceLogging, middleware);
        }
    }
}

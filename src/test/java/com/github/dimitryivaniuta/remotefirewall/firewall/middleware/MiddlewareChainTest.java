package com.github.dimitryivaniuta.remotefirewall.firewall.middleware;

import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.EndpointRegistration;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteCallKind;
import com.github.dimitryivaniuta.remotefirewall.firewall.spec.ParamSpec;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MiddlewareChainTest {

    private final MiddlewareChain chain = new MiddlewareChain();
    private final EndpointRegistration endpoint = new EndpointRegistration(
            "Buy", RemoteCallKind.FUNCTION, ParamSpec.EMPTY, (c, i, a) -> null, false, Instant.EPOCH);

    @Test
    void firstRejectionShortCircuits() {
        List<String> ran = new ArrayList<>();
        chain.add("Buy", MiddlewareGate.named("A", (c, i, e, a) -> ran.add("A")));
        chain.add("Buy", MiddlewareGate.named("B", (c, i, e, a) -> {
            ran.add("B");
            return false;
        }));
        chain.add("Buy", MiddlewareGate.named("C", (c, i, e, a) -> ran.add("C")));

        MiddlewareChain.Result result = chain.run(endpoint, "p1", 1, List.of());

        assertThat(result.accepted()).isFalse();
        assertThat(result.gatePosition()).isEqualTo(1);
        assertThat(result.gateName()).isEqualTo("B");
        assertThat(result.reason()).isEqualTo("gate #1 (B) rejected the call");
        assertThat(ran).containsExactly("A", "B");
    }

    @Test
    void throwingGateIsARejection() {
        chain.add("Buy", MiddlewareGate.named("boom", (c, i, e, a) -> {
            throw new IllegalStateException("no session");
        }));

        MiddlewareChain.Result result = chain.run(endpoint, "p1", 1, List.of());

        assertThat(result.accepted()).isFalse();
        assertThat(result.failure()).isInstanceOf(IllegalStateException.class);
        assertThat(result.reason()).contains("boom").contains("no session");
    }

    @Test
    void gateErrorIsARejection() {
        List<String> ran = new ArrayList<>();
        chain.add("Buy", MiddlewareGate.named("recursive", (c, i, e, a) -> {
            throw new StackOverflowError();
        }));
        chain.add("Buy", MiddlewareGate.named("after", (c, i, e, a) -> ran.add("after")));

        MiddlewareChain.Result result = chain.run(endpoint, "p1", 1, List.of());

        assertThat(result.accepted()).isFalse();
        assertThat(result.gateName()).isEqualTo("recursive");
        assertThat(result.failure()).isInstanceOf(StackOverflowError.class);
        assertThat(ran).isEmpty();
    }

    @Test
    void emptyChainAccepts() {
        assertThat(chain.run(endpoint, "p1", 1, List.of()).accepted()).isTrue();
        assertThat(chain.gates("Buy")).isEmpty();
    }

    @Test
    void gatesSeeCallerAndLogIndex() {
        List<Object> seen = new ArrayList<>();
        chain.add("Buy", (c, i, e, a) -> {
            seen.add(c);
            seen.add(i);
            seen.add(e.name());
            return true;
        });

        assertThat(chain.run(endpoint, "p7", 42, List.of()).accepted()).isTrue();
        assertThat(seen).containsExactly("p7", 42L, "Buy");
    }
}

package com.github.dimitryivaniuta.remotefirewall.sample;

import com.github.dimitryivaniuta.remotefirewall.firewall.FirewallFixture;
import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogEvent;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValues.of;
import static org.assertj.core.api.Assertions.assertThat;

class ShopEndpointsTest {

    private final FirewallFixture fx = new FirewallFixture();
    private final ShopEndpoints shop = new ShopEndpoints(fx.assertions);

    @Test
    void shouldRejectFractionalQuantityWithoutBuying() {
        long idx = fx.callLog.record("p1", "PurchaseItem");

        Object result = shop.purchase("p1", idx, of("shield", 2.5, null));

        assertThat(result).isNull();
        assertThat(fx.callLog.find(idx).orElseThrow().getEvents())
                .extracting(CallLogEvent::message)
                .singleElement()
                .asString()
                .startsWith("assertType failed");
        assertThat(shop.inventory("p1", idx, of())).isEqualTo(Map.of());
    }

    @Test
    void shouldBuyWholeQuantities() {
        long idx = fx.callLog.record("p1", "PurchaseItem");

        Object result = shop.purchase("p1", idx, of("shield", 2, null));

        assertThat(result).isEqualTo(Map.of("itemId", "shield", "qty", 2, "total", 180));
        assertThat(shop.inventory("p1", idx, of())).isEqualTo(Map.of("shield", 2));
        assertThat(fx.callLog.find(idx).orElseThrow().getErrorCount()).isZero();
    }
}

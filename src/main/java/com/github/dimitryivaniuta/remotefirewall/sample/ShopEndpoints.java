package com.github.dimitryivaniuta.remotefirewall.sample;

import com.github.dimitryivaniuta.remotefirewall.firewall.annotations.RemoteEndpoint;
import com.github.dimitryivaniuta.remotefirewall.firewall.assertion.CallAssertions;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteCallKind;
import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@RequiredArgsConstructor
public class ShopEndpoints {

    private static final Logger log = LoggerFactory.getLogger(ShopEndpoints.class);

    static final Map<String, Integer> PRICES = Map.of(
            "sword", 150,
            "shield", 90,
            "potion", 25
    );

    private final CallAssertions assertions;

    private final Map<String, Map<String, AtomicInteger>> inventories = new ConcurrentHashMap<>();

    /**
     * Buys {@code qty} items for the caller. Unknown items and fractional quantities return no data.
     */
    @RemoteEndpoint(name = "PurchaseItem",
            params = {"itemId", "string", "qty", "range[1,10]", "note", "string?"})
    public Object purchase(String callerId, long logIndex, List<RemoteValue> args) {
        RemoteValue itemId = args.get(0);
        RemoteValue qtyValue = args.get(1);

        if (!assertions.assertInList(logIndex, itemId, PRICES.keySet())
                || !assertions.assertType(logIndex, qtyValue, "integer")) {
            return null;
        }
        int qty = (int) qtyValue.asLong();
        assertions.assertStringLength(logIndex, itemId, 1, 32);

        String item = itemId.asString();
        inventories.computeIfAbsent(callerId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(item, k -> new AtomicInteger())
                .addAndGet(qty);

        Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("itemId", item);
        receipt.put("qty", qty);
        receipt.put("total", PRICES.get(item) * qty);
        return receipt;
    }

    @RemoteEndpoint(name = "GetInventory")
    public Object inventory(String callerId, long logIndex, List<RemoteValue> args) {
        Map<String, AtomicInteger> inv = inventories.get(callerId);
        if (inv == null) return Map.of();
        Map<String, Integer> copy = new LinkedHashMap<>();
        inv.forEach((k, v) -> copy.put(k, v.get()));
        return copy;
    }

    /**
     * Position telemetry; out-of-world coordinates are recorded as assertion failures.
     */
    @RemoteEndpoint(name = "ReportPosition", kind = RemoteCallKind.EVENT, forceLogging = true,
            params = {"x", "number", "y", "number", "z", "number"})
    public void reportPosition(String callerId, long logIndex, List<RemoteValue> args) {
        boolean inWorld = assertions.assertInRange(logIndex, args.get(0), -4096, 4096)
                & assertions.assertInRange(logIndex, args.get(1), 0, 512)
                & assertions.assertInRange(logIndex, args.get(2), -4096, 4096);
        if (!inWorld) {
            log.debug("Caller {} reported a position outside the world", callerId);
        }
    }
}

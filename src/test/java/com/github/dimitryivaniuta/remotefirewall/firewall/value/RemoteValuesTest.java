package com.github.dimitryivaniuta.remotefirewall.firewall.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteValuesTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void shouldMapJsonArrayToPositionalArgs() throws Exception {
        JsonNode body = om.readTree("""
                ["sword", 3, true, null, {"a": [1, 2]}]
                """);

        List<RemoteValue> args = RemoteValues.argsFromJson(body, om);

        assertThat(args).extracting(RemoteValue::kind).containsExactly(
                RemoteValue.Kind.STRING, RemoteValue.Kind.NUMBER, RemoteValue.Kind.BOOLEAN,
                RemoteValue.Kind.ABSENT, RemoteValue.Kind.TABLE);
        assertThat(args.get(1).asLong()).isEqualTo(3L);
        assertThat(args.get(1).isIntegral()).isTrue();
        @SuppressWarnings("unchecked")
        Map<String, Object> table = (Map<String, Object>) args.get(4).asTable();
        assertThat(table).containsKey("a");
    }

    @Test
    void shouldTreatNonArrayBodyAsSingleArgument() throws Exception {
        assertThat(RemoteValues.argsFromJson(om.readTree("\"solo\""), om))
                .containsExactly(RemoteValue.of("solo"));
        assertThat(RemoteValues.argsFromJson(null, om)).isEmpty();
    }

    @Test
    void tablesAreDeepFrozenCopies() {
        List<Object> inner = new ArrayList<>(List.of(1, 2));
        RemoteValue v = RemoteValue.wrap(Map.of("xs", inner));
        inner.add(3);

        @SuppressWarnings("unchecked")
        Map<String, Object> table = (Map<String, Object>) v.asTable();
        @SuppressWarnings("unchecked")
        List<Object> xs = (List<Object>) table.get("xs");
        assertThat(xs).hasSize(2);
        assertThatThrownBy(() -> xs.add(4)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void wrongKindAccessFails() {
        assertThatThrownBy(() -> RemoteValue.of("x").asNumber()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RemoteValue.wrap(new Object())).isInstanceOf(IllegalArgumentException.class);
        assertThat(RemoteValue.of(2.5).isIntegral()).isFalse();
        assertThat(RemoteValue.wrap(7).equals(RemoteValue.of(7.0))).isTrue();
    }

    @Test
    void shouldRenderResultValuesAsJson() {
        assertThat(RemoteValues.toJson(RemoteValue.of("x"), om).asText()).isEqualTo("x");
        assertThat(RemoteValues.toJson(Map.of("total", 450), om).get("total").asInt()).isEqualTo(450);
    }
}

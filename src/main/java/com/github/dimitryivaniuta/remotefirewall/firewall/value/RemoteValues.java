package com.github.dimitryivaniuta.remotefirewall.firewall.value;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Jackson trees (what the HTTP transport carries) and {@link RemoteValue}.
 */
public final class RemoteValues {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private RemoteValues() {}

    public static RemoteValue fromJson(JsonNode node, ObjectMapper mapper) {
        if (node == null || node.isNull() || node.isMissingNode()) return RemoteValue.absent();
        if (node.isTextual()) return RemoteValue.of(node.asText());
        if (node.isNumber()) return RemoteValue.of(node.doubleValue());
        if (node.isBoolean()) return RemoteValue.of(node.booleanValue());
        if (node.isObject()) return RemoteValue.table(mapper.convertValue(node, MAP_TYPE));
        if (node.isArray()) return RemoteValue.table(mapper.convertValue(node, LIST_TYPE));
        // binary / POJO nodes never come from a parsed request body
        return RemoteValue.of(node.asText());
    }

    /**
     * Positional argument list from a JSON array; a non-array body is a single argument.
     */
    public static List<RemoteValue> argsFromJson(JsonNode body, ObjectMapper mapper) {
        List<RemoteValue> args = new ArrayList<>();
        if (body == null || body.isNull() || body.isMissingNode()) return args;
        if (!body.isArray()) {
            args.add(fromJson(body, mapper));
            return args;
        }
        for (JsonNode n : body) {
            args.add(fromJson(n, mapper));
        }
        return args;
    }

    public static JsonNode toJson(Object value, ObjectMapper mapper) {
        if (value instanceof RemoteValue rv) {
            return mapper.valueToTree(rv.payload());
        }
        return mapper.valueToTree(value);
    }

    public static List<RemoteValue> of(Object... raw) {
        List<RemoteValue> args = new ArrayList<>(raw.length);
        for (Object o : raw) {
            args.add(RemoteValue.wrap(o));
        }
        return args;
    }
}

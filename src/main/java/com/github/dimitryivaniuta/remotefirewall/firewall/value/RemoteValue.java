package com.github.dimitryivaniuta.remotefirewall.firewall.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One positional argument of a remote call.
 *
 * <p>Values are tagged with a {@link Kind}; the validator matches tags against declared
 * descriptors and never inspects payload classes directly.
 *
 * <p>Instances are immutable. TABLE payloads are deep-copied into unmodifiable maps/lists.
 */
public final class RemoteValue {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        TABLE,
        ABSENT
    }

    private static final RemoteValue ABSENT = new RemoteValue(Kind.ABSENT, null);
    private static final RemoteValue TRUE = new RemoteValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final RemoteValue FALSE = new RemoteValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object payload;

    private RemoteValue(Kind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static RemoteValue absent() {
        return ABSENT;
    }

    public static RemoteValue of(String s) {
        return (s == null) ? ABSENT : new RemoteValue(Kind.STRING, s);
    }

    public static RemoteValue of(double d) {
        return new RemoteValue(Kind.NUMBER, d);
    }

    public static RemoteValue of(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static RemoteValue table(Map<String, ?> map) {
        if (map == null) return ABSENT;
        return new RemoteValue(Kind.TABLE, freezeMap(map));
    }

    public static RemoteValue table(List<?> list) {
        if (list == null) return ABSENT;
        return new RemoteValue(Kind.TABLE, freezeList(list));
    }

    /**
     * Wraps a plain Java object: String, Number, Boolean, Map, List, RemoteValue or null.
     *
     * @throws IllegalArgumentException for any other type
     */
    public static RemoteValue wrap(Object o) {
        if (o == null) return ABSENT;
        if (o instanceof RemoteValue rv) return rv;
        if (o instanceof String s) return of(s);
        if (o instanceof Number n) return of(n.doubleValue());
        if (o instanceof Boolean b) return of(b.booleanValue());
        if (o instanceof Map<?, ?> m) return new RemoteValue(Kind.TABLE, freezeMap(m));
        if (o instanceof List<?> l) return table(l);
        throw new IllegalArgumentException("Unsupported remote value type: " + o.getClass().getName());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    /**
     * True for NUMBER values with no fractional part.
     */
    public boolean isIntegral() {
        if (kind != Kind.NUMBER) return false;
        double d = (Double) payload;
        return !Double.isInfinite(d) && Math.rint(d) == d;
    }

    public String asString() {
        requireKind(Kind.STRING);
        return (String) payload;
    }

    public double asNumber() {
        requireKind(Kind.NUMBER);
        return (Double) payload;
    }

    public long asLong() {
        requireKind(Kind.NUMBER);
        return (long) (double) (Double) payload;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) payload;
    }

    /**
     * Structured payload: an unmodifiable {@code Map<String, Object>} or {@code List<Object>}.
     */
    public Object asTable() {
        requireKind(Kind.TABLE);
        return payload;
    }

    /**
     * Raw payload; {@code null} for ABSENT.
     */
    public Object payload() {
        return payload;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " but value is " + kind);
        }
    }

    private static Map<String, Object> freezeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            copy.put(String.valueOf(e.getKey()), freeze(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static List<Object> freezeList(List<?> list) {
        List<Object> copy = new ArrayList<>(list.size());
        for (Object o : list) {
            copy.add(freeze(o));
        }
        return Collections.unmodifiableList(copy);
    }

    private static Object freeze(Object o) {
        if (o instanceof Map<?, ?> m) return freezeMap(m);
        if (o instanceof List<?> l) return freezeList(l);
        if (o instanceof RemoteValue rv) return rv.payload;
        return o;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RemoteValue other)) return false;
        return kind == other.kind && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ABSENT -> "absent";
            case STRING -> "\"" + payload + "\"";
            default -> String.valueOf(payload);
        };
    }
}

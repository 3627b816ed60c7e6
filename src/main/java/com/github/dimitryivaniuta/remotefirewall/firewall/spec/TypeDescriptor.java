package com.github.dimitryivaniuta.remotefirewall.firewall.spec;

import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiled form of one declared parameter type.
 *
 * <p>Produced once by {@link TypeSpecCompiler}; immutable and shared by every call.
 */
public sealed interface TypeDescriptor
        permits TypeDescriptor.Primitive, TypeDescriptor.OptionalOf, TypeDescriptor.Union,
                TypeDescriptor.Range, TypeDescriptor.Any {

    boolean accepts(RemoteValue value);

    /**
     * Canonical token, e.g. {@code string?}, {@code number|string}, {@code range[1.0,5.0]}.
     */
    String describe();

    default boolean acceptsAbsent() {
        return accepts(RemoteValue.absent());
    }

    record Primitive(PrimitiveType type) implements TypeDescriptor {
        @Override
        public boolean accepts(RemoteValue value) {
            return value != null && type.matches(value);
        }

        @Override
        public String describe() {
            return type.token();
        }
    }

    /**
     * Accepts absence or whatever the wrapped descriptor accepts.
     */
    record OptionalOf(TypeDescriptor inner) implements TypeDescriptor {
        @Override
        public boolean accepts(RemoteValue value) {
            return value == null || value.isAbsent() || inner.accepts(value);
        }

        @Override
        public String describe() {
            return inner.describe() + "?";
        }
    }

    record Union(Set<PrimitiveType> alternatives) implements TypeDescriptor {
        public Union {
            alternatives = Set.copyOf(EnumSet.copyOf(alternatives));
        }

        @Override
        public boolean accepts(RemoteValue value) {
            if (value == null) return false;
            for (PrimitiveType p : alternatives) {
                if (p.matches(value)) return true;
            }
            return false;
        }

        @Override
        public String describe() {
            // enum order keeps the token stable regardless of declaration order
            return EnumSet.copyOf(alternatives).stream()
                    .map(PrimitiveType::token)
                    .collect(Collectors.joining("|"));
        }
    }

    /**
     * Inclusive numeric range; non-numbers and absence never match.
     */
    record Range(double min, double max) implements TypeDescriptor {
        @Override
        public boolean accepts(RemoteValue value) {
            if (value == null || !value.is(RemoteValue.Kind.NUMBER)) return false;
            double v = value.asNumber();
            return v >= min && v <= max;
        }

        @Override
        public String describe() {
            return "range[" + min + "," + max + "]";
        }
    }

    record Any() implements TypeDescriptor {
        @Override
        public boolean accepts(RemoteValue value) {
            return true;
        }

        @Override
        public String describe() {
            return "any";
        }
    }
}

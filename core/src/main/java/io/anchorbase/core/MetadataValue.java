// file: src/main/java/io/anchorbase/core/MetadataValue.java
package io.anchorbase.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed set of dynamic values that can be attached to an anchor as metadata.
 * <p>
 * Variants:
 *  - Text     : UTF-8 string
 *  - Int      : 64-bit signed integer
 *  - Real     : double
 *  - Bool     : boolean
 *  - ListOf   : ordered list of values
 *  - MapOf    : insertion-ordered map of string keys to values
 *  - Null     : explicit null
 * <p>
 * Accessors never throw on a type mismatch: asking a Text for {@link #asLong()}
 * returns an empty Optional. Lists and maps are copied and unmodifiable.
 */
public sealed interface MetadataValue
        permits MetadataValue.Text, MetadataValue.Int, MetadataValue.Real, MetadataValue.Bool,
                MetadataValue.ListOf, MetadataValue.MapOf, MetadataValue.Null {

    /** Shared null instance. */
    Null NULL = new Null();

    static MetadataValue of(String value) { return new Text(value); }

    static MetadataValue of(long value) { return new Int(value); }

    static MetadataValue of(double value) { return new Real(value); }

    static MetadataValue of(boolean value) { return new Bool(value); }

    static MetadataValue of(List<MetadataValue> values) { return new ListOf(values); }

    static MetadataValue of(Map<String, MetadataValue> values) { return new MapOf(values); }

    static MetadataValue nullValue() { return NULL; }

    default Optional<String> asString() { return Optional.empty(); }

    default Optional<Long> asLong() { return Optional.empty(); }

    default Optional<Double> asDouble() { return Optional.empty(); }

    default Optional<Boolean> asBoolean() { return Optional.empty(); }

    default Optional<List<MetadataValue>> asList() { return Optional.empty(); }

    default Optional<Map<String, MetadataValue>> asMap() { return Optional.empty(); }

    default boolean isNull() { return false; }

    record Text(String value) implements MetadataValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override public Optional<String> asString() { return Optional.of(value); }
    }

    record Int(long value) implements MetadataValue {
        @Override public Optional<Long> asLong() { return Optional.of(value); }
    }

    /** Finite only: NaN and infinities have no JSON number form. */
    record Real(double value) implements MetadataValue {
        public Real {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("metadata number must be finite, got " + value);
            }
        }

        @Override public Optional<Double> asDouble() { return Optional.of(value); }
    }

    record Bool(boolean value) implements MetadataValue {
        @Override public Optional<Boolean> asBoolean() { return Optional.of(value); }
    }

    record ListOf(List<MetadataValue> values) implements MetadataValue {
        public ListOf {
            values = List.copyOf(values);
        }

        @Override public Optional<List<MetadataValue>> asList() { return Optional.of(values); }
    }

    record MapOf(Map<String, MetadataValue> values) implements MetadataValue {
        public MapOf {
            values = copyOrdered(values);
        }

        @Override public Optional<Map<String, MetadataValue>> asMap() { return Optional.of(values); }
    }

    record Null() implements MetadataValue {
        @Override public boolean isNull() { return true; }
    }

    /**
     * Copy a metadata map keeping insertion order.
     * Map.copyOf would lose ordering, which matters for byte-exact re-encoding.
     */
    static Map<String, MetadataValue> copyOrdered(Map<String, MetadataValue> source) {
        Objects.requireNonNull(source, "metadata");
        var copy = new LinkedHashMap<String, MetadataValue>(source.size() * 2);
        for (var e : source.entrySet()) {
            copy.put(Objects.requireNonNull(e.getKey(), "metadata key"),
                    Objects.requireNonNull(e.getValue(), "metadata value for " + e.getKey()));
        }
        return Collections.unmodifiableMap(copy);
    }
}

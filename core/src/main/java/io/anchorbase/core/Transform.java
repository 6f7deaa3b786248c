// file: src/main/java/io/anchorbase/core/Transform.java
package io.anchorbase.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable 4x4 transformation matrix stored as 16 doubles in column-major order.
 * <p>
 * Layout:
 *  - elements 0..3   : column 0
 *  - elements 4..7   : column 1
 *  - elements 8..11  : column 2
 *  - elements 12..15 : column 3 (translation x, y, z, w)
 * <p>
 * Invariants:
 *  - Exactly 16 finite elements, checked on construction.
 *  - Defensive copies on input and output, so instances are safe to share.
 *  - equals/hashCode compare element values exactly.
 */
public final class Transform {
    public static final int SIZE = 16;

    private static final Transform IDENTITY = new Transform(new double[]{
            1, 0, 0, 0,
            0, 1, 0, 0,
            0, 0, 1, 0,
            0, 0, 0, 1
    });

    private final double[] elements;

    private Transform(double[] elements) {
        Objects.requireNonNull(elements, "elements");
        if (elements.length != SIZE) {
            throw new IllegalArgumentException(
                    "Invalid transform: expected " + SIZE + " elements, got " + elements.length);
        }
        double[] copy = Arrays.copyOf(elements, SIZE);
        for (int i = 0; i < SIZE; i++) {
            if (!Double.isFinite(copy[i])) {
                throw new IllegalArgumentException(
                        "Invalid transform: element " + i + " is not finite (" + copy[i] + ")");
            }
        }
        this.elements = copy;
    }

    /** Build a transform from 16 column-major values. */
    public static Transform of(double... elements) {
        return new Transform(elements);
    }

    public static Transform of(List<? extends Number> elements) {
        Objects.requireNonNull(elements, "elements");
        double[] out = new double[elements.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = elements.get(i).doubleValue();
        }
        return new Transform(out);
    }

    public static Transform identity() { return IDENTITY; }

    /** Identity rotation with the given translation in the last column. */
    public static Transform translation(double x, double y, double z) {
        double[] m = IDENTITY.elements();
        m[12] = x;
        m[13] = y;
        m[14] = z;
        return new Transform(m);
    }

    /** Copy of the 16 column-major values. */
    public double[] elements() { return Arrays.copyOf(elements, SIZE); }

    public double get(int index) { return elements[index]; }

    /** Translation component (elements 12, 13, 14). */
    public Position position() {
        return new Position(elements[12], elements[13], elements[14]);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transform other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override public int hashCode() { return Arrays.hashCode(elements); }

    @Override public String toString() { return "Transform" + Arrays.toString(elements); }
}

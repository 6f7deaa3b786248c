package io.anchorbase.core;

/** A point in metres, extracted from the translation column of a {@link Transform}. */
public record Position(double x, double y, double z) {

    public double distanceTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}

package com.tfbuilder.tfbuilder_backend.model.domain;

/**
 * Canvas coordinate in layout units. Immutable.
 */
public record Point(double x, double y) {

    public static final Point ZERO = new Point(0, 0);

    public Point plus(Point other) {
        return new Point(x + other.x, y + other.y);
    }

    public Point minus(Point other) {
        return new Point(x - other.x, y - other.y);
    }

    public double distanceTo(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}

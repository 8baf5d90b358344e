package com.azazar.collections.kdtree;

import java.util.Arrays;

/**
 * Immutable point with a fixed number of {@code double} coordinates.
 * <p>
 * Equality is componentwise and numeric: {@code -0.0} is stored as {@code 0.0},
 * so the two compare equal just as they do under {@code ==} and {@code <}.
 *
 * @author m
 */
public final class Point {

    private final double[] coordinates;

    public Point(double[] coordinates) {
        if (coordinates == null) {
            throw new NullPointerException("Null coordinates are not supported");
        }
        if (coordinates.length == 0) {
            throw new IllegalArgumentException("Point must have at least one coordinate");
        }
        for (int i = 0; i < coordinates.length; i++) {
            if (!Double.isFinite(coordinates[i])) {
                throw new IllegalArgumentException("Coordinate " + i + " is not finite: " + coordinates[i]);
            }
        }
        this.coordinates = new double[coordinates.length];
        for (int i = 0; i < coordinates.length; i++) {
            // folds -0.0 into 0.0
            this.coordinates[i] = coordinates[i] + 0.0;
        }
    }

    public static Point of(double... coordinates) {
        return new Point(coordinates);
    }

    /**
     * @param axis coordinate index in {@code [0, dimensions())}
     * @return coordinate value on the given axis
     */
    public double get(int axis) {
        return coordinates[axis];
    }

    public int dimensions() {
        return coordinates.length;
    }

    /**
     * Returns the sum of squared per-axis differences between two points of the
     * same dimension.
     */
    public static double squaredDistance(Point p1, Point p2) {
        double sum = 0;
        for (int i = 0; i < p1.coordinates.length; i++) {
            double diff = p1.coordinates[i] - p2.coordinates[i];
            sum += diff * diff;
        }
        return sum;
    }

    /**
     * Squared distance between this point and {@code other} measured on a single
     * axis, i.e. the squared distance to the splitting plane through this point.
     */
    public double axisSquaredDistance(Point other, int axis) {
        double diff = coordinates[axis] - other.coordinates[axis];
        return diff * diff;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(coordinates, ((Point) obj).coordinates);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coordinates);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < coordinates.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            double c = coordinates[i];
            if (c == Math.rint(c) && Math.abs(c) < 1e15) {
                sb.append((long) c);
            } else {
                sb.append(c);
            }
        }
        return sb.append(')').toString();
    }

}

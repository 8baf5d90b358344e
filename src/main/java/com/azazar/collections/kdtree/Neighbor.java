package com.azazar.collections.kdtree;

import java.util.Objects;

/**
 * Result of a nearest neighbour query: the stored value closest to the query
 * together with its distance from it.
 *
 * @author m
 * @param <X> the type of the value
 */
public final class Neighbor<X> {

    private final X value;
    private final double distance;

    public Neighbor(X value, double distance) {
        this.value = Objects.requireNonNull(value, "value");
        this.distance = distance;
    }

    /**
     * Returns the stored value.
     *
     * @return the value
     */
    public X value() {
        return value;
    }

    /**
     * Returns the distance from the query to {@link #value()}, in the metric of the
     * index that produced this result. {@link KdTree} reports squared distances.
     *
     * @return the distance
     */
    public double distance() {
        return distance;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Neighbor)) {
            return false;
        }
        Neighbor<?> other = (Neighbor<?>) obj;
        return Double.compare(distance, other.distance) == 0 && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * value.hashCode() + Double.hashCode(distance);
    }

    @Override
    public String toString() {
        return value + " @ " + distance;
    }

}

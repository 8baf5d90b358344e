package com.azazar.collections.kdtree;

/**
 * Metric used by indexes that compare values only through distances.
 * A distance of {@code 0} means the two values are treated as equal.
 *
 * @author Mikhail Yevchenko <spam@azazar.com>
 * @param <X> type of compared values
 */
@FunctionalInterface
public interface DistanceCalculator<X> {

    double calcDistance(X o1, X o2);

    /**
     * Squared euclidean distance between points, the same metric {@link KdTree} reports.
     */
    static DistanceCalculator<Point> squaredEuclidean() {
        return Point::squaredDistance;
    }

}

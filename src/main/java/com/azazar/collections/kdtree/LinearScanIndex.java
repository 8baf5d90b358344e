package com.azazar.collections.kdtree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Brute force index that compares the query against every stored value.
 * Two values are considered equal when their distance is {@code 0}.
 *
 * @author Mikhail Yevchenko <spam@azazar.com>
 * @param <X> type of stored values
 */
public class LinearScanIndex<X> implements SpatialIndex<X> {

    private final DistanceCalculator<X> distanceCalculator;
    private final List<X> values = new ArrayList<>();

    public LinearScanIndex(DistanceCalculator<X> distanceCalculator) {
        if (distanceCalculator == null) {
            throw new NullPointerException("Distance calculator is required");
        }
        this.distanceCalculator = distanceCalculator;
    }

    /**
     * Index of points under squared euclidean distance, the same answers a
     * {@link KdTree} gives.
     */
    public static LinearScanIndex<Point> ofPoints() {
        return new LinearScanIndex<>(DistanceCalculator.squaredEuclidean());
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public void insert(X value) {
        if (value == null) {
            throw new NullPointerException("Null values are not supported");
        }
        values.add(value);
    }

    @Override
    public boolean search(X value) {
        return indexOf(value) >= 0;
    }

    @Override
    public boolean remove(X value) {
        int idx = indexOf(value);
        if (idx < 0) {
            return false;
        }
        values.remove(idx);
        return true;
    }

    @Override
    public Optional<Neighbor<X>> findNearest(X query) {
        if (query == null) {
            throw new NullPointerException("Null values are not supported");
        }
        X best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (X e : values) {
            double dist = distanceCalculator.calcDistance(query, e);
            if (best == null || dist < bestDist) {
                best = e;
                bestDist = dist;
                if (dist == 0) {
                    break;
                }
            }
        }
        return best == null ? Optional.empty() : Optional.of(new Neighbor<>(best, bestDist));
    }

    public List<X> toList() {
        return new ArrayList<>(values);
    }

    private int indexOf(X value) {
        if (value == null) {
            throw new NullPointerException("Null values are not supported");
        }
        for (int i = 0; i < values.size(); i++) {
            if (distanceCalculator.calcDistance(values.get(i), value) == 0) {
                return i;
            }
        }
        return -1;
    }

}

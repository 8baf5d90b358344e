package com.azazar.collections.kdtree;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Mutable collection of values supporting exact lookup and nearest neighbour
 * queries. Duplicates are allowed and are removed one instance at a time.
 * <p>
 * Implementations are not thread-safe.
 *
 * @author Mikhail Yevchenko <spam@azazar.com>
 * @param <X> type of stored values
 */
public interface SpatialIndex<X> {

    void insert(X value);

    /**
     * @return {@code true} if a value equal to {@code value} is stored
     */
    boolean search(X value);

    /**
     * Removes one stored instance equal to {@code value}.
     *
     * @return {@code true} if an instance was found and removed
     */
    boolean remove(X value);

    /**
     * Finds the stored value closest to {@code query}.
     *
     * @return the closest value and its distance, or empty if nothing is stored
     */
    Optional<Neighbor<X>> findNearest(X query);

    boolean isEmpty();

    /**
     * Returns the stored value closest to {@code query}.
     *
     * @throws NoSuchElementException if the index is empty
     */
    default X nearestNeighbor(X query) {
        return findNearest(query)
                .orElseThrow(() -> new NoSuchElementException(getClass().getSimpleName() + " is empty"))
                .value();
    }

}

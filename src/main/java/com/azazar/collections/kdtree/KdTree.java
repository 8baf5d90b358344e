package com.azazar.collections.kdtree;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * K-dimensional tree over {@link Point}s of a fixed dimension.
 * <p>
 * A node at depth {@code d} splits its subtree on axis {@code d % dimensions}:
 * points with a strictly smaller coordinate on that axis live in the left
 * subtree, all others (ties included) in the right one. The tree is never
 * rebalanced, its shape depends on insertion order only. A sorted insertion
 * sequence produces a tree as deep as it is large, and since every operation
 * recurses along a root-to-leaf path, callers storing many points should insert
 * them in randomized order to keep the recursion shallow. With the default thread
 * stack a path of a few tens of thousands of nodes (e.g. 50000 points inserted
 * in sorted order) already ends in {@link StackOverflowError}.
 * <p>
 * Duplicates are stored as separate nodes. This class is not thread-safe.
 *
 * @author m
 */
public class KdTree implements SpatialIndex<Point> {

    private static final Logger LOG = Logger.getLogger(KdTree.class.getName());

    private static final RemovalStrategy DEFAULT_REMOVAL_STRATEGY = RemovalStrategy.LEFT_SPLICE;

    private final int dimensions;
    private RemovalStrategy removalStrategy;

    private KdNode root;
    private boolean removed;

    public KdTree(int dimensions) {
        this(dimensions, DEFAULT_REMOVAL_STRATEGY);
    }

    public KdTree(int dimensions, RemovalStrategy removalStrategy) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("Dimension count must be positive: " + dimensions);
        }
        this.dimensions = dimensions;
        setRemovalStrategy(removalStrategy);
    }

    public int getDimensions() {
        return dimensions;
    }

    public RemovalStrategy getRemovalStrategy() {
        return removalStrategy;
    }

    public void setRemovalStrategy(RemovalStrategy removalStrategy) {
        if (removalStrategy == null) {
            throw new NullPointerException("Removal strategy is required");
        }
        this.removalStrategy = removalStrategy;
    }

    @Override
    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Returns the number of nodes on the longest root-to-leaf path, {@code 0} for
     * an empty tree.
     */
    public int height() {
        return height(root);
    }

    /**
     * Drops every stored point.
     */
    public void clear() {
        root = null;
    }

    KdNode root() {
        return root;
    }

    @Override
    public void insert(Point point) {
        checkPoint(point);
        root = insert(root, point, 0);
    }

    @Override
    public boolean search(Point point) {
        checkPoint(point);
        return search(root, point, 0);
    }

    /**
     * Removes one node holding {@code point}.
     * <p>
     * A matching node with a right subtree takes over the point that is smallest
     * on its own axis within that subtree, which is then removed from the subtree
     * recursively. A matching leaf is unlinked. A matching node with only a left
     * subtree is handled according to {@link #getRemovalStrategy()}.
     *
     * @return {@code true} if a matching point was found and removed
     */
    @Override
    public boolean remove(Point point) {
        checkPoint(point);
        removed = false;
        root = remove(root, point, 0);
        return removed;
    }

    /**
     * Branch-and-bound nearest neighbour search.
     *
     * @return the closest stored point along with its <em>squared</em> distance to
     * {@code query}, or empty if the tree is empty
     */
    @Override
    public Optional<Neighbor<Point>> findNearest(Point query) {
        checkPoint(query);
        if (root == null) {
            LOG.fine("Nearest neighbour requested from an empty tree");
            return Optional.empty();
        }
        NearestSearch search = new NearestSearch(query);
        nearest(root, search, 0);
        return Optional.of(new Neighbor<>(search.best.point, search.bestDistance));
    }

    private KdNode insert(KdNode node, Point point, int depth) {
        if (node == null) {
            return new KdNode(point);
        }
        int axis = depth % dimensions;
        if (point.get(axis) < node.point.get(axis)) {
            node.left = insert(node.left, point, depth + 1);
        } else {
            node.right = insert(node.right, point, depth + 1);
        }
        return node;
    }

    private boolean search(KdNode node, Point point, int depth) {
        if (node == null) {
            return false;
        }
        if (node.point.equals(point)) {
            return true;
        }
        int axis = depth % dimensions;
        return search(point.get(axis) < node.point.get(axis) ? node.left : node.right, point, depth + 1);
    }

    private KdNode remove(KdNode node, Point point, int depth) {
        if (node == null) {
            return null;
        }
        int axis = depth % dimensions;
        if (!node.point.equals(point)) {
            if (point.get(axis) < node.point.get(axis)) {
                node.left = remove(node.left, point, depth + 1);
            } else {
                node.right = remove(node.right, point, depth + 1);
            }
            return node;
        }

        removed = true;
        if (node.right != null) {
            node.point = findMin(node.right, axis, depth + 1);
            node.right = remove(node.right, node.point, depth + 1);
            return node;
        }
        if (node.isLeaf()) {
            return null;
        }
        if (removalStrategy == RemovalStrategy.LEFT_SPLICE) {
            if (LOG.isLoggable(Level.FINER)) {
                LOG.log(Level.FINER, "Lifting left subtree of {0} at depth {1}", new Object[]{point, depth});
            }
            return node.left;
        }
        node.point = findMin(node.left, axis, depth + 1);
        node.right = remove(node.left, node.point, depth + 1);
        node.left = null;
        return node;
    }

    /**
     * Finds the point with the smallest coordinate on {@code axis} in the subtree
     * rooted at {@code node}, which sits at {@code depth}.
     */
    private Point findMin(KdNode node, int axis, int depth) {
        if (depth % dimensions == axis) {
            // the right subtree can't hold anything smaller on the splitting axis
            return node.left == null ? node.point : findMin(node.left, axis, depth + 1);
        }
        Point min = node.point;
        if (node.left != null) {
            Point leftMin = findMin(node.left, axis, depth + 1);
            if (leftMin.get(axis) < min.get(axis)) {
                min = leftMin;
            }
        }
        if (node.right != null) {
            Point rightMin = findMin(node.right, axis, depth + 1);
            if (rightMin.get(axis) < min.get(axis)) {
                min = rightMin;
            }
        }
        return min;
    }

    private void nearest(KdNode node, NearestSearch search, int depth) {
        if (node == null) {
            return;
        }
        double d = Point.squaredDistance(search.query, node.point);
        if (search.best == null || d < search.bestDistance) {
            search.best = node;
            search.bestDistance = d;
        }
        int axis = depth % dimensions;
        boolean goLeft = search.query.get(axis) < node.point.get(axis);
        nearest(goLeft ? node.left : node.right, search, depth + 1);
        if (node.point.axisSquaredDistance(search.query, axis) < search.bestDistance) {
            nearest(goLeft ? node.right : node.left, search, depth + 1);
        }
    }

    private static int height(KdNode node) {
        if (node == null) {
            return 0;
        }
        return 1 + Math.max(height(node.left), height(node.right));
    }

    private void checkPoint(Point point) {
        if (point == null) {
            throw new NullPointerException("Null points are not supported");
        }
        if (point.dimensions() != dimensions) {
            throw new IllegalArgumentException("Expected a point with " + dimensions
                    + " coordinates, got " + point.dimensions() + ": " + point);
        }
    }

    /**
     * Running state of a nearest neighbour query
     */
    private static final class NearestSearch {
        final Point query;
        KdNode best;
        double bestDistance = Double.POSITIVE_INFINITY;

        NearestSearch(Point query) {
            this.query = query;
        }
    }

}

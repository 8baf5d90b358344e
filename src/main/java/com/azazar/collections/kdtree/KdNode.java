package com.azazar.collections.kdtree;

/**
 * Tree vertex. Each node is referenced by exactly one parent (or the tree root),
 * there are no back references.
 */
final class KdNode {

    // replaced only when a removal promotes a subtree minimum into this node
    Point point;
    KdNode left;
    KdNode right;

    KdNode(Point point) {
        this.point = point;
    }

    boolean isLeaf() {
        return left == null && right == null;
    }

}

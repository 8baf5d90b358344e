package com.azazar.collections.kdtree;

/**
 * How {@link KdTree#remove(Point)} rebuilds a matching node that has a left
 * subtree but no right subtree. Nodes with a right subtree always take the
 * minimum of that subtree on the node's axis; leaves are simply unlinked.
 *
 * @author m
 */
public enum RemovalStrategy {

    /**
     * The node is replaced by its left child.
     * <p>
     * Every node of the lifted subtree ends up one level closer to the root and is
     * therefore compared on a different axis than the one it was inserted under.
     * Later searches, removals and nearest neighbour queries may miss points of
     * that subtree. This is the classic simplified deletion and the default.
     */
    LEFT_SPLICE,

    /**
     * The minimum on the node's axis is taken from the left subtree, the left
     * subtree becomes the right one and the promoted point is removed from it.
     * The partition rule holds for every node after each removal.
     */
    SYMMETRIC

}

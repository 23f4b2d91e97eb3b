package org.labwire.graph;

import java.util.BitSet;

/**
 * A memory-efficient set of visited node indices for one traversal.
 * <p>
 * Wraps a {@link java.util.BitSet} for O(1) access and ~1 bit per node.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. Each traversal owns
 * its own instance.
 * </p>
 */
final class VisitedSet {

    private final BitSet visited;

    /**
     * @param initialCapacity expected number of nodes; avoids resizing when exact.
     */
    VisitedSet(int initialCapacity) {
        this.visited = new BitSet(initialCapacity);
    }

    /**
     * Marks a node as visited if it hasn't been visited already.
     *
     * @return {@code true} if the node was NOT previously visited.
     */
    boolean markVisited(int nodeIndex) {
        if (visited.get(nodeIndex)) {
            return false;
        }
        visited.set(nodeIndex);
        return true;
    }
}

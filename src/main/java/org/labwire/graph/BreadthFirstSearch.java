package org.labwire.graph;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Incremental breadth-first traversal over one {@link StationGraph} view.
 *
 * <p>Each call to {@link #advance()} yields the next tree edge, i.e. the edge through
 * which a node was first discovered. Neighbors are expanded in adjacency insertion
 * order. With {@code reverse=true} the traversal follows edges backwards, from
 * target to origin.</p>
 */
final class BreadthFirstSearch {
    static final int EXHAUSTED = -1;

    private final StationGraph graph;
    private final GraphArena arena;
    private final boolean reverse;
    private final VisitedSet visited;
    private final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

    private IntArrayList frontierEdges;
    private int cursor;
    private int discovered = EXHAUSTED;

    BreadthFirstSearch(StationGraph graph, int startNode, boolean reverse) {
        this.graph = graph;
        this.arena = graph.arena;
        this.reverse = reverse;
        this.visited = new VisitedSet(arena.nodeCount());
        visited.markVisited(startNode);
        queue.enqueue(startNode);
    }

    /**
     * Advances to the next tree edge.
     *
     * @return edge index, or {@link #EXHAUSTED} when every reachable node was discovered.
     */
    int advance() {
        while (true) {
            if (frontierEdges != null) {
                while (cursor < frontierEdges.size()) {
                    int edge = frontierEdges.getInt(cursor++);
                    if (!graph.includesEdge(edge)) {
                        continue;
                    }
                    int next = reverse ? arena.edgeOrigin(edge) : arena.edgeTarget(edge);
                    if (visited.markVisited(next)) {
                        queue.enqueue(next);
                        discovered = next;
                        return edge;
                    }
                }
                frontierEdges = null;
            }
            if (queue.isEmpty()) {
                discovered = EXHAUSTED;
                return EXHAUSTED;
            }
            int parent = queue.dequeueInt();
            frontierEdges = reverse ? arena.incomingEdges(parent) : arena.outgoingEdges(parent);
            cursor = 0;
        }
    }

    /**
     * Node discovered by the last {@link #advance()} call.
     */
    int discoveredNode() {
        return discovered;
    }
}

package org.labwire.graph;

/**
 * Station graph that accepts new nodes and edges.
 *
 * <p>Adding an edge registers its endpoints without values; {@link StationGraph#prune}
 * drops such placeholders.</p>
 */
public class MutableStationGraph extends StationGraph {

    public MutableStationGraph() {
        super(new GraphArena());
    }

    /**
     * Registers a node id without attaching a value. Existing nodes are left untouched.
     */
    public MutableStationGraph addNode(String nodeId) {
        arena.addNode(nodeId);
        return this;
    }

    public MutableStationGraph putNode(String nodeId, Node value) {
        arena.setNodeValue(arena.addNode(nodeId), value);
        return this;
    }

    /**
     * Registers a directed edge, and its endpoints, without attaching a value.
     */
    public MutableStationGraph addEdge(String from, String to) {
        arena.addEdge(arena.addNode(from), arena.addNode(to));
        return this;
    }

    public MutableStationGraph putEdge(String from, String to, Edge value) {
        int edge = arena.addEdge(arena.addNode(from), arena.addNode(to));
        arena.setEdgeValue(edge, value);
        return this;
    }

    public MutableStationGraph putEdge(EdgeId edgeId, Edge value) {
        return putEdge(edgeId.from(), edgeId.to(), value);
    }

    /**
     * Adds {@code (a, b)} and {@code (b, a)}, each with its own value.
     */
    public MutableStationGraph putBidirectionalEdge(String a, String b, Edge forward, Edge backward) {
        putEdge(a, b, forward);
        return putEdge(b, a, backward);
    }

    /**
     * Read-only view over the same store.
     */
    public StationGraph asStationGraph() {
        return new StationGraph(arena);
    }
}

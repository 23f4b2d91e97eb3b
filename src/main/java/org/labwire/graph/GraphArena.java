package org.labwire.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.labwire.core.id.IDMapper;

/**
 * Append-only storage behind every {@link StationGraph} view.
 * <p>
 * Nodes and edges are addressed by dense int indices in insertion order:
 * </p>
 * <ul>
 * <li>node index: assigned by the {@link IDMapper} on first registration.</li>
 * <li>edge index: position in the {@code edgeOrigin}/{@code edgeTarget} arrays.</li>
 * <li>edge lookup: {@code (origin << 32) | target} packed into one long key.</li>
 * </ul>
 * Adjacency lists keep edges in insertion order so traversals are deterministic.
 * The same structure is mirrored into a JGraphT graph whose vertices are node indices and
 * whose edges are edge indices, for the path algorithms.
 */
final class GraphArena {
    private final IDMapper nodeIds = IDMapper.create();
    private final ObjectArrayList<Node> nodeValues = new ObjectArrayList<>();
    private final ObjectArrayList<IntArrayList> outgoing = new ObjectArrayList<>();
    private final ObjectArrayList<IntArrayList> incoming = new ObjectArrayList<>();

    private final IntArrayList edgeOrigin = new IntArrayList();
    private final IntArrayList edgeTarget = new IntArrayList();
    private final ObjectArrayList<Edge> edgeValues = new ObjectArrayList<>();
    private final Long2IntOpenHashMap edgeIndex = new Long2IntOpenHashMap();
    private final Graph<Integer, Integer> structure = new DefaultDirectedGraph<>(null, null, false);

    GraphArena() {
        edgeIndex.defaultReturnValue(-1);
    }

    int nodeCount() {
        return nodeIds.size();
    }

    int edgeCount() {
        return edgeOrigin.size();
    }

    /**
     * Registers a node id, returning its index. Existing ids keep their index.
     */
    int addNode(String nodeId) {
        int index = nodeIds.register(nodeId);
        if (index == nodeValues.size()) {
            nodeValues.add(null);
            outgoing.add(new IntArrayList());
            incoming.add(new IntArrayList());
            structure.addVertex(index);
        }
        return index;
    }

    /**
     * Registers a directed edge between two registered nodes, returning its index.
     */
    int addEdge(int origin, int target) {
        long key = edgeKey(origin, target);
        int existing = edgeIndex.get(key);
        if (existing != -1) {
            return existing;
        }
        int index = edgeOrigin.size();
        edgeOrigin.add(origin);
        edgeTarget.add(target);
        edgeValues.add(null);
        edgeIndex.put(key, index);
        outgoing.get(origin).add(index);
        incoming.get(target).add(index);
        structure.addEdge(origin, target, index);
        return index;
    }

    /**
     * Returns the node index, or -1 when the id was never registered.
     */
    int nodeIndexOf(String nodeId) {
        return nodeId != null && nodeIds.containsExternal(nodeId) ? nodeIds.toInternal(nodeId) : -1;
    }

    /**
     * Returns the edge index, or -1 when the pair was never registered.
     */
    int edgeIndexOf(int origin, int target) {
        if (origin < 0 || target < 0) {
            return -1;
        }
        return edgeIndex.get(edgeKey(origin, target));
    }

    String nodeId(int nodeIndex) {
        return nodeIds.toExternal(nodeIndex);
    }

    Node nodeValue(int nodeIndex) {
        return nodeValues.get(nodeIndex);
    }

    void setNodeValue(int nodeIndex, Node value) {
        nodeValues.set(nodeIndex, value);
    }

    Edge edgeValue(int edgeIndex) {
        return edgeValues.get(edgeIndex);
    }

    void setEdgeValue(int edgeIndex, Edge value) {
        edgeValues.set(edgeIndex, value);
    }

    int edgeOrigin(int edgeIndex) {
        return edgeOrigin.getInt(edgeIndex);
    }

    int edgeTarget(int edgeIndex) {
        return edgeTarget.getInt(edgeIndex);
    }

    /**
     * Unfiltered JGraphT mirror of the store; views mask it rather than copy it.
     */
    Graph<Integer, Integer> structure() {
        return structure;
    }

    IntArrayList outgoingEdges(int nodeIndex) {
        return outgoing.get(nodeIndex);
    }

    IntArrayList incomingEdges(int nodeIndex) {
        return incoming.get(nodeIndex);
    }

    private static long edgeKey(int origin, int target) {
        return ((long) origin << 32) | (target & 0xFFFFFFFFL);
    }
}

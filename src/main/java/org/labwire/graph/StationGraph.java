package org.labwire.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.jgrapht.Graph;
import org.jgrapht.GraphPath;
import org.jgrapht.alg.shortestpath.YenShortestPathIterator;
import org.jgrapht.graph.MaskSubgraph;
import org.labwire.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * Directed graph of a measurement station: nodes keyed by string id, edges keyed by
 * ordered id pairs, one attached {@link Node}/{@link Edge} value per element.
 * <p>
 * Storage is a shared {@link GraphArena} addressed by dense int indices. A
 * {@code StationGraph} is a read view over that arena, optionally filtered: subgraphs
 * share the arena and its attached values, so activating a node seen through a subgraph
 * activates it everywhere. An edge is part of a view only if its own filter and the
 * filters of both endpoints accept it.
 * </p>
 * <p>
 * Lookups of ids outside the view raise {@link IDMapper.UnknownIDException}. Traversals
 * starting from an id the arena has never seen raise the same; traversals starting from
 * a known id that the view filters out yield nothing.
 * </p>
 */
public class StationGraph {
    private static final IntPredicate ALL = index -> true;

    final GraphArena arena;
    private final IntPredicate nodeFilter;
    private final IntPredicate edgeFilter;

    StationGraph(GraphArena arena, IntPredicate nodeFilter, IntPredicate edgeFilter) {
        this.arena = Objects.requireNonNull(arena, "arena");
        this.nodeFilter = Objects.requireNonNull(nodeFilter, "nodeFilter");
        this.edgeFilter = Objects.requireNonNull(edgeFilter, "edgeFilter");
    }

    StationGraph(GraphArena arena) {
        this(arena, ALL, ALL);
    }

    // ========================================================================
    // COMPOSITION
    // ========================================================================

    /**
     * Unions the nodes and edges of all graphs. Values of later graphs replace those of
     * earlier ones for the same id; ids without a value in a later graph keep the earlier value.
     * <p>
     * Every edge that is active in the union re-establishes the upstream link from its
     * origin to its destination.
     * </p>
     */
    public static StationGraph compose(StationGraph... graphs) {
        MutableStationGraph composition = new MutableStationGraph();
        for (StationGraph graph : graphs) {
            for (String nodeId : graph.nodes()) {
                composition.addNode(nodeId);
                Node value = graph.node(nodeId);
                if (value != null) {
                    composition.putNode(nodeId, value);
                }
            }
            for (EdgeId edgeId : graph.edges()) {
                composition.addEdge(edgeId.from(), edgeId.to());
                Edge value = graph.edge(edgeId);
                if (value != null) {
                    composition.putEdge(edgeId, value);
                }
            }
        }
        for (EdgeId edgeId : composition.edges()) {
            Edge edge = composition.edge(edgeId);
            if (edge == null || !edge.isActive()) {
                continue;
            }
            Node origin = composition.node(edgeId.from());
            Node destination = composition.node(edgeId.to());
            if (origin != null && destination != null) {
                destination.addSource(origin);
            }
        }
        return composition.asStationGraph();
    }

    /**
     * Copies {@code graph} without the nodes that carry no value.
     */
    public static StationGraph prune(StationGraph graph) {
        MutableStationGraph pruned = new MutableStationGraph();
        for (String nodeId : graph.nodes()) {
            Node value = graph.node(nodeId);
            if (value != null) {
                pruned.putNode(nodeId, value);
            }
        }
        for (EdgeId edgeId : graph.edges()) {
            if (pruned.containsNode(edgeId.from()) && pruned.containsNode(edgeId.to())) {
                pruned.addEdge(edgeId.from(), edgeId.to());
                Edge value = graph.edge(edgeId);
                if (value != null) {
                    pruned.putEdge(edgeId, value);
                }
            }
        }
        return pruned.asStationGraph();
    }

    /**
     * Filtered view of {@code graph}. Values are shared, not copied.
     */
    public static StationGraph subgraphOf(
            StationGraph graph,
            Predicate<String> isNodeIncluded,
            Predicate<EdgeId> isEdgeIncluded
    ) {
        Objects.requireNonNull(isNodeIncluded, "isNodeIncluded");
        Objects.requireNonNull(isEdgeIncluded, "isEdgeIncluded");
        GraphArena arena = graph.arena;
        return graph.filterByIndex(
                node -> isNodeIncluded.test(arena.nodeId(node)),
                edge -> isEdgeIncluded.test(graph.edgeIdAt(edge))
        );
    }

    public static StationGraph subgraphOf(StationGraph graph, Predicate<String> isNodeIncluded) {
        return subgraphOf(graph, isNodeIncluded, edgeId -> true);
    }

    /**
     * Filtered view addressed by store indices; see {@link #nodeIndexOf(String)}.
     * The filters are combined with this view's own filters.
     */
    public StationGraph filterByIndex(IntPredicate isNodeIncluded, IntPredicate isEdgeIncluded) {
        return new StationGraph(arena, nodeFilter.and(isNodeIncluded), edgeFilter.and(isEdgeIncluded));
    }

    // ========================================================================
    // LOOKUP
    // ========================================================================

    /**
     * Returns the value attached to a node, or {@code null} if none is attached.
     */
    public Node node(String nodeId) {
        return arena.nodeValue(requireNode(nodeId));
    }

    public Edge edge(EdgeId edgeId) {
        return arena.edgeValue(requireEdge(edgeId));
    }

    public Edge edge(String from, String to) {
        return edge(new EdgeId(from, to));
    }

    /**
     * Replaces the value of an existing node.
     */
    public void setNode(String nodeId, Node value) {
        arena.setNodeValue(requireNode(nodeId), value);
    }

    /**
     * Replaces the value of an existing edge.
     */
    public void setEdge(EdgeId edgeId, Edge value) {
        arena.setEdgeValue(requireEdge(edgeId), value);
    }

    public boolean containsNode(String nodeId) {
        int index = arena.nodeIndexOf(nodeId);
        return index >= 0 && includesNode(index);
    }

    public boolean containsEdge(EdgeId edgeId) {
        int index = edgeIndexIn(edgeId);
        return index >= 0 && includesEdge(index);
    }

    /**
     * Stable store index of a node, shared by every view over the same store.
     *
     * @throws IDMapper.UnknownIDException if the node is not part of this view.
     */
    public int nodeIndexOf(String nodeId) {
        return requireNode(nodeId);
    }

    /**
     * Stable store index of an edge, shared by every view over the same store.
     *
     * @throws IDMapper.UnknownIDException if the edge is not part of this view.
     */
    public int edgeIndexOf(EdgeId edgeId) {
        return requireEdge(edgeId);
    }

    public String nodeIdAt(int nodeIndex) {
        return arena.nodeId(nodeIndex);
    }

    public EdgeId edgeIdAt(int edgeIndex) {
        return new EdgeId(arena.nodeId(arena.edgeOrigin(edgeIndex)), arena.nodeId(arena.edgeTarget(edgeIndex)));
    }

    /**
     * Value attached to the edge at a store index, or null when none is attached.
     */
    public Edge edgeValueAt(int edgeIndex) {
        return arena.edgeValue(edgeIndex);
    }

    // ========================================================================
    // ITERATION
    // ========================================================================

    /**
     * Node ids of this view in insertion order.
     */
    public List<String> nodes() {
        List<String> nodes = new ArrayList<>();
        for (int node = 0; node < arena.nodeCount(); node++) {
            if (includesNode(node)) {
                nodes.add(arena.nodeId(node));
            }
        }
        return nodes;
    }

    /**
     * Edge ids of this view in insertion order.
     */
    public List<EdgeId> edges() {
        List<EdgeId> edges = new ArrayList<>();
        for (int edge = 0; edge < arena.edgeCount(); edge++) {
            if (includesEdge(edge)) {
                edges.add(edgeIdAt(edge));
            }
        }
        return edges;
    }

    public int nodeCount() {
        int count = 0;
        for (int node = 0; node < arena.nodeCount(); node++) {
            if (includesNode(node)) {
                count++;
            }
        }
        return count;
    }

    public int edgeCount() {
        int count = 0;
        for (int edge = 0; edge < arena.edgeCount(); edge++) {
            if (includesEdge(edge)) {
                count++;
            }
        }
        return count;
    }

    public List<String> successorsOf(String nodeId) {
        IntArrayList edges = arena.outgoingEdges(requireNode(nodeId));
        List<String> successors = new ArrayList<>(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            int edge = edges.getInt(i);
            if (includesEdge(edge)) {
                successors.add(arena.nodeId(arena.edgeTarget(edge)));
            }
        }
        return successors;
    }

    public List<String> predecessorsOf(String nodeId) {
        IntArrayList edges = arena.incomingEdges(requireNode(nodeId));
        List<String> predecessors = new ArrayList<>(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            int edge = edges.getInt(i);
            if (includesEdge(edge)) {
                predecessors.add(arena.nodeId(arena.edgeOrigin(edge)));
            }
        }
        return predecessors;
    }

    /**
     * Union of predecessors and successors, without duplicates.
     */
    public List<String> neighborsOf(String nodeId) {
        Set<String> neighbors = new LinkedHashSet<>(predecessorsOf(nodeId));
        neighbors.addAll(successorsOf(nodeId));
        return new ArrayList<>(neighbors);
    }

    /**
     * Lazy breadth-first node sequence starting with {@code nodeId} itself.
     *
     * @param reverse follow edges from target to origin.
     */
    public Iterator<String> breadthFirstNodesFrom(String nodeId, boolean reverse) {
        int start = requireKnownNode(nodeId);
        if (!includesNode(start)) {
            return Collections.emptyIterator();
        }
        BreadthFirstSearch search = new BreadthFirstSearch(this, start, reverse);
        return new LookaheadIterator<>() {
            private boolean startYielded;

            @Override
            String computeNext() {
                if (!startYielded) {
                    startYielded = true;
                    return arena.nodeId(start);
                }
                return search.advance() == BreadthFirstSearch.EXHAUSTED
                        ? null
                        : arena.nodeId(search.discoveredNode());
            }
        };
    }

    public Iterator<String> breadthFirstNodesFrom(String nodeId) {
        return breadthFirstNodesFrom(nodeId, false);
    }

    /**
     * Lazy sequence of the edges through which a breadth-first traversal discovers nodes.
     * Edges are reported by their stored id; in reverse mode the discovered node is the
     * edge's origin.
     */
    public Iterator<EdgeId> breadthFirstEdgesFrom(String nodeId, boolean reverse) {
        int start = requireKnownNode(nodeId);
        if (!includesNode(start)) {
            return Collections.emptyIterator();
        }
        BreadthFirstSearch search = new BreadthFirstSearch(this, start, reverse);
        return new LookaheadIterator<>() {
            @Override
            EdgeId computeNext() {
                int edge = search.advance();
                return edge == BreadthFirstSearch.EXHAUSTED ? null : edgeIdAt(edge);
            }
        };
    }

    /**
     * Lazy sequence of simple paths from {@code source} to {@code destination} in ascending
     * length, enumerated with Yen's algorithm over a masked view of the store. Paths of equal
     * length come in no specified order. The sequence may be very long; callers must bound
     * consumption.
     */
    public Iterator<List<String>> shortestPathsBetween(String source, String destination) {
        int from = requireKnownNode(source);
        int to = requireKnownNode(destination);
        if (!includesNode(from) || !includesNode(to)) {
            return Collections.emptyIterator();
        }
        if (from == to) {
            return List.of(List.of(arena.nodeId(from))).iterator();
        }
        Graph<Integer, Integer> view = new MaskSubgraph<>(
                arena.structure(),
                node -> !includesNode(node),
                edge -> !includesEdge(edge)
        );
        YenShortestPathIterator<Integer, Integer> paths = new YenShortestPathIterator<>(view, from, to);
        return new LookaheadIterator<>() {
            @Override
            List<String> computeNext() {
                return paths.hasNext() ? nodeIdsOf(paths.next()) : null;
            }
        };
    }

    private List<String> nodeIdsOf(GraphPath<Integer, Integer> path) {
        List<Integer> vertices = path.getVertexList();
        List<String> nodeIds = new ArrayList<>(vertices.size());
        for (int node : vertices) {
            nodeIds.add(arena.nodeId(node));
        }
        return List.copyOf(nodeIds);
    }

    // ========================================================================
    // VIEW MEMBERSHIP
    // ========================================================================

    boolean includesNode(int nodeIndex) {
        return nodeIndex >= 0 && nodeIndex < arena.nodeCount() && nodeFilter.test(nodeIndex);
    }

    boolean includesEdge(int edgeIndex) {
        return edgeFilter.test(edgeIndex)
                && includesNode(arena.edgeOrigin(edgeIndex))
                && includesNode(arena.edgeTarget(edgeIndex));
    }

    private int requireKnownNode(String nodeId) {
        int index = arena.nodeIndexOf(nodeId);
        if (index < 0) {
            throw new IDMapper.UnknownIDException("Unknown node: " + nodeId);
        }
        return index;
    }

    private int requireNode(String nodeId) {
        int index = requireKnownNode(nodeId);
        if (!includesNode(index)) {
            throw new IDMapper.UnknownIDException("Node not in graph: " + nodeId);
        }
        return index;
    }

    private int requireEdge(EdgeId edgeId) {
        int index = edgeIndexIn(edgeId);
        if (index < 0 || !includesEdge(index)) {
            throw new IDMapper.UnknownIDException("Edge not in graph: " + edgeId);
        }
        return index;
    }

    private int edgeIndexIn(EdgeId edgeId) {
        Objects.requireNonNull(edgeId, "edgeId");
        return arena.edgeIndexOf(arena.nodeIndexOf(edgeId.from()), arena.nodeIndexOf(edgeId.to()));
    }

    @Override
    public String toString() {
        return String.format("StationGraph[nodes=%d, edges=%d]", nodeCount(), edgeCount());
    }

    /**
     * Iterator driven by a {@code computeNext} step returning {@code null} at the end.
     */
    private abstract static class LookaheadIterator<T> implements Iterator<T> {
        private T next;
        private boolean done;

        abstract T computeNext();

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                next = computeNext();
                done = next == null;
            }
            return next != null;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T value = next;
            next = null;
            return value;
        }
    }
}

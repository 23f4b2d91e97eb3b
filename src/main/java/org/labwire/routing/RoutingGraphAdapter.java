package org.labwire.routing;

import org.labwire.graph.Edge;
import org.labwire.graph.EdgeId;
import org.labwire.graph.InvalidEdgeTransitionException;
import org.labwire.graph.Node;
import org.labwire.graph.StationGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Station graph plus the table of terminals that claim each node and edge.
 *
 * <p>A node or edge stays active while at least one terminal claims it. Activation and
 * deactivation go through this adapter so the claims and the attached values stay in step.</p>
 */
final class RoutingGraphAdapter {
    private final StationGraph graph;
    private final ClaimTable nodeClaims = new ClaimTable();
    private final ClaimTable edgeClaims = new ClaimTable();

    RoutingGraphAdapter(StationGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    StationGraph graph() {
        return graph;
    }

    Node node(String nodeId) {
        Node node = graph.node(nodeId);
        if (node == null) {
            throw new IllegalStateException("Node " + nodeId + " has no value attached");
        }
        return node;
    }

    Edge edge(EdgeId edgeId) {
        Edge edge = graph.edge(edgeId);
        if (edge == null) {
            throw new IllegalStateException("Edge " + edgeId + " has no value attached");
        }
        return edge;
    }

    void activateNode(String nodeId, String terminalId) {
        node(nodeId).activate();
        nodeClaims.add(graph.nodeIndexOf(nodeId), terminalId);
    }

    void deactivateNode(String nodeId, String terminalId) {
        if (nodeClaims.remove(graph.nodeIndexOf(nodeId), terminalId, nodeId)) {
            node(nodeId).deactivate();
        }
    }

    /**
     * @throws InvalidEdgeTransitionException before any claim is recorded if the edge cannot be switched.
     */
    void activateEdge(EdgeId edgeId, String terminalId) {
        Edge edge = edge(edgeId);
        if (!edge.isSwitchable()) {
            throw new InvalidEdgeTransitionException(
                    "Cannot route through " + edgeId + " of type " + edge.type() + " with status " + edge.status());
        }
        node(edgeId.to()).addSource(node(edgeId.from()));
        edgeClaims.add(graph.edgeIndexOf(edgeId), terminalId);
        edge.activate();
    }

    void deactivateEdge(EdgeId edgeId, String terminalId) {
        if (edgeClaims.remove(graph.edgeIndexOf(edgeId), terminalId, edgeId)) {
            node(edgeId.to()).removeSource(node(edgeId.from()));
            edge(edgeId).deactivate();
        }
    }

    /**
     * All nodes, but only the edges claimed by {@code terminalId}.
     */
    StationGraph routedSubgraphOf(String terminalId) {
        return graph.filterByIndex(node -> true, edge -> edgeClaims.isClaimedBy(edge, terminalId));
    }

    /**
     * Nodes and edges that are free or already claimed by one of {@code terminalIds}. Only
     * edges that routing can switch, or that already conduct, are kept.
     */
    StationGraph makeSearchGraphFor(Collection<String> terminalIds) {
        List<String> eligible = new ArrayList<>(terminalIds);
        return graph.filterByIndex(
                node -> nodeClaims.isAvailableTo(node, eligible),
                edge -> edgeClaims.isAvailableTo(edge, eligible) && isRoutable(graph.edgeValueAt(edge))
        );
    }

    private static boolean isRoutable(Edge edge) {
        return edge != null && (edge.isActive() || edge.isSwitchable());
    }

    Set<String> terminalsClaiming(String nodeId) {
        return nodeClaims.terminalsAt(graph.nodeIndexOf(nodeId));
    }

    Set<String> terminalsClaiming(EdgeId edgeId) {
        return edgeClaims.terminalsAt(graph.edgeIndexOf(edgeId));
    }

    /**
     * Drops every claim without touching activation state.
     */
    void releaseAllClaims() {
        nodeClaims.clear();
        edgeClaims.clear();
    }
}

package org.labwire.routing;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.labwire.graph.Edge;
import org.labwire.graph.EdgeId;
import org.labwire.graph.Node;
import org.labwire.graph.StationGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Routes station terminals to sources over node-disjoint paths and releases them again.
 *
 * <p>Every node and edge committed by a request is claimed by the terminal it leads to and
 * stays active while any terminal claims it. Resources claimed by other terminals are
 * invisible to a request; resources already claimed by one of the request's own terminals
 * may be reused.</p>
 *
 * <p>Instances are not thread-safe: callers must serialize {@code connect}, {@code route}
 * and {@code vacate} on one router. Committing paths is not transactional; a failure
 * while activating leaves the already activated prefix in place.</p>
 */
public final class Router {
    private static final Logger log = LogManager.getLogger(Router.class);

    public static final String REASON_NO_ELIGIBLE_SOURCE = "NO_ELIGIBLE_SOURCE";
    public static final String REASON_NO_AVAILABLE_ROUTE = "NO_AVAILABLE_ROUTE";
    public static final String REASON_MULTIPLE_SOURCE_GROUPS = "MULTIPLE_SOURCE_GROUPS";
    public static final String REASON_SOURCE_TERMINAL_COUNT_MISMATCH = "SOURCE_TERMINAL_COUNT_MISMATCH";
    public static final String REASON_UNKNOWN_NODE = "UNKNOWN_NODE";
    public static final String REASON_EMPTY_REQUEST = "EMPTY_REQUEST";

    private static final String DEFAULT_UNIT = "V";

    private final RoutingGraphAdapter graph;
    private final RouterConfig config;

    /**
     * Creates a router with {@link RouterConfig#defaults()}.
     */
    public Router(StationGraph graph) {
        this(graph, RouterConfig.defaults());
    }

    /**
     * Creates a router over {@code graph}.
     * <p>
     * Edges that are already active are adopted: their destinations record the origin as a
     * source. Dynamic-source nodes are then connected to each of their eligible sources
     * when the config asks for it. Both leave their resources active but unclaimed.
     * </p>
     */
    public Router(StationGraph graph, RouterConfig config) {
        this.graph = new RoutingGraphAdapter(Objects.requireNonNull(graph, "graph"));
        this.config = Objects.requireNonNull(config, "config");
        initializeActiveEdges();
        if (config.isConnectDynamicSources()) {
            activateDynamicEdges();
        }
        this.graph.releaseAllClaims();
    }

    public StationGraph graph() {
        return graph.graph();
    }

    // ========================================================================
    // CONNECT
    // ========================================================================

    /**
     * Connects one source to one terminal.
     *
     * @throws RoutingException if no free path exists or an id is unknown.
     */
    public void connect(String sourceId, String terminalId) {
        connect(List.of(sourceId), List.of(List.of(terminalId)));
    }

    /**
     * Connects {@code sourceIds.get(i)} to every terminal of {@code terminalGroups.get(i)}.
     * Paths of different groups share no node unless the groups share a terminal.
     *
     * @throws RoutingException if the counts differ, an id is unknown or no disjoint paths exist.
     */
    public void connect(List<String> sourceIds, List<? extends Collection<String>> terminalGroups) {
        connectGroups(List.of(sourceIds), terminalGroups);
    }

    /**
     * Connects each key (a source) to the terminals listed as its value.
     */
    public void connectByMap(Map<String, ? extends Collection<String>> connections) {
        connect(new ArrayList<>(connections.keySet()), new ArrayList<>(connections.values()));
    }

    /**
     * Group-of-groups form of {@link #connect(List, List)}; exactly one source group is accepted.
     */
    public void connectGroups(List<? extends Collection<String>> sourceGroups, List<? extends Collection<String>> terminalGroups) {
        if (sourceGroups.size() > 1) {
            throw new RoutingException(REASON_MULTIPLE_SOURCE_GROUPS,
                    "More than one source group supplied to connect: " + sourceGroups);
        }
        connectCandidates(copyGroups(sourceGroups), copyGroups(terminalGroups));
    }

    // ========================================================================
    // ROUTE
    // ========================================================================

    /**
     * Routes each terminal to its own source, choosing the best-appraised feasible combination.
     */
    public void route(Appraiser appraiser, String... terminalIds) {
        List<List<String>> groups = new ArrayList<>(terminalIds.length);
        for (String terminalId : terminalIds) {
            groups.add(List.of(terminalId));
        }
        route(groups, appraiser);
    }

    /**
     * Routes terminal groups to sources. Terminals of one group share one source; the
     * appraiser receives one candidate node per group.
     *
     * @throws RoutingException if no combination is eligible or none of the eligible ones can be routed.
     */
    public void route(List<? extends Collection<String>> terminalGroups, Appraiser appraiser) {
        Objects.requireNonNull(appraiser, "appraiser");
        List<List<String>> groups = copyGroups(terminalGroups);
        requireTerminalGroups(groups);
        List<List<String>> candidates = new SourceFinder(graph, appraiser, config).findEligibleSourceGroups(groups);
        if (candidates.isEmpty()) {
            throw new RoutingException(REASON_NO_ELIGIBLE_SOURCE, "No eligible sources found for " + groups + ".");
        }
        connectCandidates(candidates, groups);
    }

    public void routeToSource(String terminalId) {
        routeToSource(List.of(terminalId), null);
    }

    /**
     * Routes to a programmable (non-constant) source; a {@code null} unit accepts any unit.
     */
    public void routeToSource(Collection<String> terminalGroup, String unit) {
        Predicate<Node> unitMatches = unitFilter(unit);
        route(List.of(terminalGroup), Appraiser.of(node -> Appraisals.nodeIsSource(node)
                && !Appraisals.nodeIsConstantSource(node)
                && unitMatches.test(node)));
    }

    public void routeToMeter(String terminalId) {
        routeToMeter(List.of(terminalId), null);
    }

    /**
     * Routes to a non-constant meter; a {@code null} unit accepts any unit.
     */
    public void routeToMeter(Collection<String> terminalGroup, String unit) {
        Predicate<Node> unitMatches = unitFilter(unit);
        route(List.of(terminalGroup), Appraiser.of(node -> Appraisals.nodeIsMeter(node)
                && !Appraisals.nodeIsConstantMeter(node)
                && unitMatches.test(node)));
    }

    public void routeToGround(String terminalId) {
        routeToGround(List.of(terminalId), DEFAULT_UNIT);
    }

    public void routeToGround(Collection<String> terminalGroup, String unit) {
        routeToNamedSource(terminalGroup, "ground", unit);
    }

    public void routeToFloat(String terminalId) {
        routeToFloat(List.of(terminalId), DEFAULT_UNIT);
    }

    public void routeToFloat(Collection<String> terminalGroup, String unit) {
        routeToNamedSource(terminalGroup, "float", unit);
    }

    public void routeToHighZ(String terminalId) {
        routeToHighZ(List.of(terminalId), DEFAULT_UNIT);
    }

    public void routeToHighZ(Collection<String> terminalGroup, String unit) {
        routeToNamedSource(terminalGroup, "highz", unit);
    }

    /**
     * Groups terminals by their set of eligible sources and routes each group jointly to one
     * source. Overlapping eligible-source sets of distinct groups are logged as a warning;
     * routing proceeds but later groups may find their sources taken.
     *
     * @param appraiser single-node appraiser.
     */
    public void jointRoutePerSameEligibleSources(Collection<String> terminalIds, Appraiser appraiser) {
        Map<Set<String>, Set<String>> terminalsPerEligibleSources = new LinkedHashMap<>();
        for (String terminalId : terminalIds) {
            Set<String> eligible = new LinkedHashSet<>(eligibleSourcesOf(terminalId, appraiser));
            terminalsPerEligibleSources.computeIfAbsent(eligible, key -> new LinkedHashSet<>()).add(terminalId);
        }

        List<Set<String>> uniqueSourceSets = new ArrayList<>(terminalsPerEligibleSources.keySet());
        Set<String> shared = new LinkedHashSet<>();
        for (int i = 0; i < uniqueSourceSets.size(); i++) {
            for (int j = i + 1; j < uniqueSourceSets.size(); j++) {
                for (String source : uniqueSourceSets.get(i)) {
                    if (uniqueSourceSets.get(j).contains(source)) {
                        shared.add(source);
                    }
                }
            }
        }
        if (!shared.isEmpty()) {
            log.warn("{} found to have overlapping unique sources that they can be routed to, "
                    + "hence the routing may not be successful: {}", terminalIds, shared);
        }

        for (Set<String> terminals : terminalsPerEligibleSources.values()) {
            route(List.of(terminals), appraiser);
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    /**
     * Sources reachable from {@code terminalId} over free resources, nearest first.
     */
    public List<String> eligibleSourcesOf(String terminalId) {
        return eligibleSourcesOf(terminalId, Appraisals.ALWAYS_TRUE);
    }

    /**
     * Sources reachable from {@code terminalId} that {@code appraiser} accepts, best first.
     *
     * @throws RoutingException if there is none.
     */
    public List<String> eligibleSourcesOf(String terminalId, Appraiser appraiser) {
        requireKnownNodes(List.of(terminalId));
        List<List<String>> terminalGroups = List.of(List.of(terminalId));
        List<List<String>> candidates = new SourceFinder(graph, appraiser, config).findEligibleSourceGroups(terminalGroups);
        if (candidates.isEmpty()) {
            throw new RoutingException(REASON_NO_ELIGIBLE_SOURCE, "No eligible sources found for " + terminalGroups + ".");
        }
        List<String> sources = new ArrayList<>(candidates.size());
        for (List<String> candidate : candidates) {
            sources.add(candidate.get(0));
        }
        return Collections.unmodifiableList(sources);
    }

    /**
     * Terminals currently holding a claim on the node; empty if it is free.
     */
    public Set<String> terminalsClaiming(String nodeId) {
        return graph.terminalsClaiming(nodeId);
    }

    public Set<String> terminalsClaiming(EdgeId edgeId) {
        return graph.terminalsClaiming(edgeId);
    }

    // ========================================================================
    // VACATE
    // ========================================================================

    /**
     * Releases every node and edge claimed by {@code terminalId}. Nodes are released first,
     * nearest the terminal first, then the edges feeding each of them.
     *
     * @throws ClaimUnderflowException if the terminal holds no claim, e.g. when vacated twice.
     */
    public void vacate(String terminalId) {
        requireKnownNodes(List.of(terminalId));
        StationGraph vacationGraph = graph.routedSubgraphOf(terminalId);
        List<String> nodesFromTerminal = new ArrayList<>();
        Iterator<String> nodes = vacationGraph.breadthFirstNodesFrom(terminalId, true);
        while (nodes.hasNext()) {
            nodesFromTerminal.add(nodes.next());
        }
        for (String node : nodesFromTerminal) {
            graph.deactivateNode(node, terminalId);
        }
        for (String node : nodesFromTerminal) {
            for (String predecessor : vacationGraph.predecessorsOf(node)) {
                graph.deactivateEdge(new EdgeId(predecessor, node), terminalId);
            }
        }
        log.info("Vacated terminal {}", terminalId);
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private void routeToNamedSource(Collection<String> terminalGroup, String name, String unit) {
        Predicate<Node> predicate = unit == null
                ? Appraisals.nodeHasQuantityName(name).and(Appraisals::nodeIsSource)
                : Appraisals.nodeIsSourceWithName(name, unit);
        route(List.of(terminalGroup), Appraiser.of(predicate));
    }

    private static Predicate<Node> unitFilter(String unit) {
        return unit == null ? node -> true : Appraisals.nodeHasUnit(unit);
    }

    /**
     * Tries each source combination in order and commits the first that has disjoint paths.
     */
    private void connectCandidates(List<List<String>> sourceGroups, List<List<String>> terminalGroups) {
        requireTerminalGroups(terminalGroups);
        for (List<String> sources : sourceGroups) {
            if (sources.size() != terminalGroups.size()) {
                throw new RoutingException(REASON_SOURCE_TERMINAL_COUNT_MISMATCH,
                        "Trying to route a source group of " + sources.size() + " source(s) to "
                                + terminalGroups.size() + " terminal group(s). Each source group must have as many "
                                + "sources as there are terminal groups.");
            }
            requireKnownNodes(sources);
        }
        logConnections(sourceGroups, terminalGroups);

        List<List<String>> paths = new RouteFinder(graph, config)
                .findPathsFor(sourceGroups, terminalGroups)
                .orElseThrow(() -> new RoutingException(REASON_NO_AVAILABLE_ROUTE,
                        "No available routes between " + sourceGroups + " and " + terminalGroups + "."));

        activateOrderedPaths(orderPathsForActivation(paths));

        Set<String> terminals = new LinkedHashSet<>();
        for (List<String> group : terminalGroups) {
            terminals.addAll(group);
        }
        for (String terminal : terminals) {
            graph.activateNode(terminal, terminal);
        }
    }

    /**
     * Converts each path into its edges, each tagged with the path's terminal.
     */
    private static List<List<ClaimedEdge>> orderPathsForActivation(List<List<String>> paths) {
        List<List<ClaimedEdge>> orderedPaths = new ArrayList<>(paths.size());
        for (List<String> path : paths) {
            String terminal = path.get(path.size() - 1);
            List<ClaimedEdge> edges = new ArrayList<>(Math.max(0, path.size() - 1));
            for (int i = 0; i + 1 < path.size(); i++) {
                edges.add(new ClaimedEdge(new EdgeId(path.get(i), path.get(i + 1)), terminal));
            }
            orderedPaths.add(edges);
        }
        return orderedPaths;
    }

    /**
     * Activates the first edge of every path, then every second edge, and so on. Each edge's
     * origin is claimed together with the edge.
     */
    private void activateOrderedPaths(List<List<ClaimedEdge>> orderedPaths) {
        int longest = 0;
        for (List<ClaimedEdge> path : orderedPaths) {
            longest = Math.max(longest, path.size());
        }
        for (int step = 0; step < longest; step++) {
            for (List<ClaimedEdge> path : orderedPaths) {
                if (step < path.size()) {
                    ClaimedEdge claimed = path.get(step);
                    graph.activateEdge(claimed.edge(), claimed.terminalId());
                    graph.activateNode(claimed.edge().from(), claimed.terminalId());
                }
            }
        }
    }

    private void initializeActiveEdges() {
        StationGraph stationGraph = graph.graph();
        for (EdgeId edgeId : stationGraph.edges()) {
            Edge edge = stationGraph.edge(edgeId);
            if (edge != null && edge.isActive()) {
                graph.activateEdge(edgeId, edgeId.to());
                graph.activateNode(edgeId.from(), edgeId.to());
            }
        }
    }

    private void activateDynamicEdges() {
        StationGraph stationGraph = graph.graph();
        for (String nodeId : stationGraph.nodes()) {
            Node node = stationGraph.node(nodeId);
            if (node == null || !node.isDynamicSource()) {
                continue;
            }
            List<List<String>> candidates = new SourceFinder(graph, Appraisals.ALWAYS_TRUE, config)
                    .findEligibleSourceGroups(List.of(List.of(nodeId)));
            if (candidates.isEmpty()) {
                log.warn("Dynamic source {} has no eligible sources to connect to", nodeId);
                continue;
            }
            for (List<String> sources : candidates) {
                connectCandidates(List.of(sources), List.of(List.of(nodeId)));
            }
        }
    }

    private void requireTerminalGroups(List<List<String>> terminalGroups) {
        if (terminalGroups.isEmpty()) {
            throw new RoutingException(REASON_EMPTY_REQUEST, "At least one terminal group is required.");
        }
        for (List<String> group : terminalGroups) {
            if (group.isEmpty()) {
                throw new RoutingException(REASON_EMPTY_REQUEST, "Terminal groups must not be empty: " + terminalGroups);
            }
            requireKnownNodes(group);
        }
    }

    private void requireKnownNodes(Collection<String> nodeIds) {
        StationGraph stationGraph = graph.graph();
        for (String nodeId : nodeIds) {
            if (nodeId == null || !stationGraph.containsNode(nodeId)) {
                throw new RoutingException(REASON_UNKNOWN_NODE, "Unknown node: " + nodeId);
            }
        }
    }

    private static List<List<String>> copyGroups(List<? extends Collection<String>> groups) {
        Objects.requireNonNull(groups, "groups");
        List<List<String>> copy = new ArrayList<>(groups.size());
        for (Collection<String> group : groups) {
            copy.add(List.copyOf(group));
        }
        return copy;
    }

    private static void logConnections(List<List<String>> sourceGroups, List<List<String>> terminalGroups) {
        for (int i = 0; i < terminalGroups.size(); i++) {
            List<String> potentialSources = new ArrayList<>(sourceGroups.size());
            for (List<String> sources : sourceGroups) {
                potentialSources.add(sources.get(i));
            }
            log.info("Connecting terminals: {} to one of the sources: {}", terminalGroups.get(i), potentialSources);
        }
    }

    private record ClaimedEdge(EdgeId edge, String terminalId) {
    }
}

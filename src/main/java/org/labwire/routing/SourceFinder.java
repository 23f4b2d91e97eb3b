package org.labwire.routing;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.labwire.graph.EdgeId;
import org.labwire.graph.Node;
import org.labwire.graph.StationGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ranks combinations of source nodes for a set of terminal groups.
 *
 * <p>Candidates for one group are the sources a reverse breadth-first search reaches from
 * every terminal of the group, nearest first. Combinations across groups are scored by the
 * appraiser; positively scored combinations are returned best first. Equal scores go to the
 * combination with the smaller total hop distance, then to product order.</p>
 */
final class SourceFinder {
    private static final Logger log = LogManager.getLogger(SourceFinder.class);

    private final RoutingGraphAdapter graph;
    private final Appraiser appraiser;
    private final int candidateBound;

    SourceFinder(RoutingGraphAdapter graph, Appraiser appraiser, RouterConfig config) {
        this.graph = graph;
        this.appraiser = appraiser;
        this.candidateBound = config.sourceCandidateBound();
    }

    /**
     * Returns the eligible source combinations, best first, or an empty list if none is eligible.
     */
    List<List<String>> findEligibleSourceGroups(List<List<String>> terminalGroups) {
        List<List<Candidate>> candidatesPerGroup = new ArrayList<>(terminalGroups.size());
        for (List<String> terminalGroup : terminalGroups) {
            candidatesPerGroup.add(nearestSourcesAvailableTo(terminalGroup));
        }

        List<Appraisal> appraisals = new ArrayList<>();
        CartesianProduct<Candidate> combinations = CartesianProduct.ofLists(candidatesPerGroup);
        int appraised = 0;
        while (combinations.hasNext() && appraised < candidateBound) {
            List<Candidate> combination = combinations.next();
            List<String> sources = new ArrayList<>(combination.size());
            int distance = 0;
            for (Candidate candidate : combination) {
                sources.add(candidate.sourceId());
                distance += candidate.distance();
            }
            appraisals.add(new Appraisal(appraise(sources), distance, List.copyOf(sources)));
            appraised++;
        }
        if (log.isDebugEnabled()) {
            log.debug("Found the following appraisals of potential sources for {}: {}", terminalGroups, appraisals);
        }

        List<List<String>> eligible = new ArrayList<>();
        appraisals.stream()
                .filter(appraisal -> appraisal.score() > 0)
                .sorted(Comparator.comparingInt(Appraisal::score).reversed()
                        .thenComparingInt(Appraisal::distance))
                .forEachOrdered(appraisal -> eligible.add(appraisal.sources()));
        log.info("Found the following eligible sources for {}: {}", terminalGroups, eligible);
        return eligible;
    }

    private int appraise(List<String> sourceIds) {
        List<Node> nodes = new ArrayList<>(sourceIds.size());
        for (String sourceId : sourceIds) {
            nodes.add(graph.node(sourceId));
        }
        return appraiser.appraise(nodes);
    }

    private List<Candidate> nearestSourcesAvailableTo(List<String> terminalGroup) {
        StationGraph searchGraph = graph.makeSearchGraphFor(terminalGroup);
        List<List<Candidate>> perTerminal = new ArrayList<>(terminalGroup.size());
        for (String terminalId : terminalGroup) {
            perTerminal.add(ascendingDistanceSourcesOf(searchGraph, terminalId));
        }
        if (perTerminal.size() == 1) {
            return perTerminal.get(0);
        }

        Set<String> common = new LinkedHashSet<>();
        for (Candidate candidate : perTerminal.get(0)) {
            common.add(candidate.sourceId());
        }
        for (int i = 1; i < perTerminal.size(); i++) {
            Set<String> reached = new HashSet<>();
            for (Candidate candidate : perTerminal.get(i)) {
                reached.add(candidate.sourceId());
            }
            common.retainAll(reached);
        }
        List<Candidate> sorted = new ArrayList<>(common.size());
        for (String sourceId : common) {
            sorted.add(new Candidate(sourceId, totalDistance(searchGraph, sourceId, terminalGroup)));
        }
        sorted.sort(Comparator.comparingInt(Candidate::distance));
        return sorted;
    }

    /**
     * Sources met by a reverse breadth-first search from {@code terminalId}, with their hop distance.
     */
    private static List<Candidate> ascendingDistanceSourcesOf(StationGraph searchGraph, String terminalId) {
        List<Candidate> sources = new ArrayList<>();
        if (!searchGraph.containsNode(terminalId)) {
            return sources;
        }
        Set<String> visitedNonSources = new HashSet<>();
        Object2IntOpenHashMap<String> depth = new Object2IntOpenHashMap<>();
        depth.put(terminalId, 0);
        visit(searchGraph, terminalId, 0, sources, visitedNonSources);
        Iterator<EdgeId> edges = searchGraph.breadthFirstEdgesFrom(terminalId, true);
        while (edges.hasNext()) {
            EdgeId edge = edges.next();
            int distance = depth.getInt(edge.to()) + 1;
            depth.put(edge.from(), distance);
            visit(searchGraph, edge.from(), distance, sources, visitedNonSources);
        }
        return sources;
    }

    private static void visit(StationGraph searchGraph, String nodeId, int distance,
                              List<Candidate> sources, Set<String> visitedNonSources) {
        if (isBreadthFirstSource(searchGraph, nodeId, visitedNonSources)) {
            sources.add(new Candidate(nodeId, distance));
        } else {
            visitedNonSources.add(nodeId);
        }
    }

    /**
     * A node reached by the reverse search is a source if it is flagged as one, or if every
     * node feeding it has already been passed over as a non-source.
     */
    private static boolean isBreadthFirstSource(StationGraph searchGraph, String nodeId, Set<String> visitedNonSources) {
        Node node = searchGraph.node(nodeId);
        if (node != null && node.isEligibleSource()) {
            return true;
        }
        return visitedNonSources.containsAll(searchGraph.predecessorsOf(nodeId));
    }

    /**
     * Sum over the group of the hop count of the shortest path from {@code sourceId}.
     */
    private static int totalDistance(StationGraph searchGraph, String sourceId, List<String> terminalGroup) {
        int total = 0;
        for (String terminalId : terminalGroup) {
            Iterator<List<String>> paths = searchGraph.shortestPathsBetween(sourceId, terminalId);
            total += paths.hasNext() ? paths.next().size() - 1 : Integer.MAX_VALUE / (terminalGroup.size() + 1);
        }
        return total;
    }

    private record Candidate(String sourceId, int distance) {
    }

    private record Appraisal(int score, int distance, List<String> sources) {
        @Override
        public String toString() {
            return "(" + score + ", " + sources + ")";
        }
    }
}

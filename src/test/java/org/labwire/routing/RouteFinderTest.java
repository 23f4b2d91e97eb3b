package org.labwire.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.labwire.graph.MutableStationGraph;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.labwire.testutil.StationFixtures.connector;
import static org.labwire.testutil.StationFixtures.endpoint;
import static org.labwire.testutil.StationFixtures.voltageSource;
import static org.labwire.testutil.StationFixtures.wire;

@DisplayName("Route Finder Tests")
class RouteFinderTest {

    private static final RouterConfig UNBOUNDED = RouterConfig.builder().build();

    /**
     * S1 reaches T1 through B, or the longer way through A and D; S2 reaches T2 only through B.
     */
    private static MutableStationGraph contestedConnector() {
        MutableStationGraph graph = new MutableStationGraph()
                .putNode("S1", voltageSource("S1"))
                .putNode("S2", voltageSource("S2"))
                .putNode("A", connector("A"))
                .putNode("B", connector("B"))
                .putNode("D", connector("D"))
                .putNode("T1", endpoint("T1"))
                .putNode("T2", endpoint("T2"));
        wire(graph, "S1", "B", "T1");
        wire(graph, "S1", "A", "D", "T1");
        wire(graph, "S2", "B", "T2");
        return graph;
    }

    private static Optional<List<List<String>>> find(MutableStationGraph graph, RouterConfig config,
                                                     List<List<String>> sourceGroups, List<List<String>> terminalGroups) {
        return new RouteFinder(new RoutingGraphAdapter(graph), config).findPathsFor(sourceGroups, terminalGroups);
    }

    @Test
    @DisplayName("Paths of different groups share no node")
    void testDisjointPaths() {
        Optional<List<List<String>>> paths = find(contestedConnector(), UNBOUNDED,
                List.of(List.of("S1", "S2")), List.of(List.of("T1"), List.of("T2")));

        assertEquals(Optional.of(List.of(List.of("S1", "A", "D", "T1"), List.of("S2", "B", "T2"))), paths);
    }

    @Test
    @DisplayName("Path bound can exhaust the search")
    void testPathBound() {
        RouterConfig onePath = RouterConfig.builder().maxPathsPerPair(1).build();

        assertTrue(find(contestedConnector(), onePath,
                List.of(List.of("S1", "S2")), List.of(List.of("T1"), List.of("T2"))).isEmpty());
    }

    @Test
    @DisplayName("Groups sharing a terminal are merged instead of rejected")
    void testIntersectingTerminalGroups() {
        MutableStationGraph graph = new MutableStationGraph()
                .putNode("S1", voltageSource("S1"))
                .putNode("S2", voltageSource("S2"))
                .putNode("T1", endpoint("T1"))
                .putNode("T2", endpoint("T2"))
                .putNode("T3", endpoint("T3"));
        wire(graph, "S1", "T1");
        wire(graph, "S1", "T2");
        wire(graph, "S2", "T2");
        wire(graph, "S2", "T3");

        Optional<List<List<String>>> paths = find(graph, UNBOUNDED,
                List.of(List.of("S1", "S2")), List.of(List.of("T1", "T2"), List.of("T2", "T3")));

        assertEquals(Optional.of(List.of(
                List.of("S2", "T2"), List.of("S2", "T3"),
                List.of("S1", "T1"), List.of("S1", "T2")
        )), paths);
    }

    @Test
    @DisplayName("Later candidates are tried when earlier ones have no route")
    void testCandidateFallthrough() {
        MutableStationGraph graph = contestedConnector().putNode("X", voltageSource("X"));

        Optional<List<List<String>>> paths = find(graph, UNBOUNDED,
                List.of(List.of("X"), List.of("S2")), List.of(List.of("T2")));

        assertEquals(Optional.of(List.of(List.of("S2", "B", "T2"))), paths);
    }
}

package org.labwire.routing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.labwire.graph.AbstractNode;
import org.labwire.graph.BasicEdge;
import org.labwire.graph.EdgeId;
import org.labwire.graph.EdgeStatus;
import org.labwire.graph.MutableStationGraph;
import org.labwire.graph.NodeStatus;
import org.labwire.graph.StationGraph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.labwire.testutil.StationFixtures.ammeter;
import static org.labwire.testutil.StationFixtures.connector;
import static org.labwire.testutil.StationFixtures.dynamicOutput;
import static org.labwire.testutil.StationFixtures.endpoint;
import static org.labwire.testutil.StationFixtures.ground;
import static org.labwire.testutil.StationFixtures.groundConnectorTerminal;
import static org.labwire.testutil.StationFixtures.namedSource;
import static org.labwire.testutil.StationFixtures.voltageSource;
import static org.labwire.testutil.StationFixtures.wire;

@DisplayName("Router Tests")
class RouterTest {

    private static final RouterConfig CONFIG = RouterConfig.builder().build();

    private static boolean active(StationGraph graph, String from, String to) {
        return graph.edge(from, to).isActive();
    }

    private static NodeStatus status(StationGraph graph, String nodeId) {
        return graph.node(nodeId).status();
    }

    @Nested
    @DisplayName("1. Route And Vacate")
    class RouteAndVacateTests {

        private MutableStationGraph graph;
        private Router router;

        @BeforeEach
        void setUp() {
            graph = groundConnectorTerminal();
            router = new Router(graph, CONFIG);
        }

        @Test
        @DisplayName("Ground route activates the path and claims the terminal for itself")
        void testRouteToGround() {
            router.route(Appraiser.of(Appraisals.NODE_IS_GROUND), "T");

            assertTrue(active(graph, "G", "C"));
            assertTrue(active(graph, "C", "T"));
            assertEquals(NodeStatus.ACTIVE, status(graph, "C"));
            assertEquals(Set.of("T"), router.terminalsClaiming("T"));
            assertEquals(Set.of("T"), router.terminalsClaiming("C"));
            assertEquals(Set.of("T"), router.terminalsClaiming(EdgeId.of("G", "C")));
            assertEquals(graph.node("G").quantities(), graph.node("C").quantities());
        }

        @Test
        @DisplayName("Edges that cannot be switched are routed around")
        void testFixedEdgeShortcutIgnored() {
            graph.putEdge("G", "T", BasicEdge.partOf());

            router.routeToGround("T");

            assertTrue(active(graph, "G", "C"));
            assertTrue(active(graph, "C", "T"));
            assertEquals(EdgeStatus.PART_OF, graph.edge("G", "T").status());
            assertTrue(router.terminalsClaiming(EdgeId.of("G", "T")).isEmpty());
        }

        @Test
        @DisplayName("A route made only of fixed edges is reported as unavailable")
        void testOnlyFixedEdges() {
            MutableStationGraph fixed = new MutableStationGraph()
                    .putNode("G", ground("G"))
                    .putNode("T", endpoint("T"))
                    .putEdge("G", "T", BasicEdge.capacitiveCoupling());
            Router fixedRouter = new Router(fixed, CONFIG);

            RoutingException ex = assertThrows(RoutingException.class, () -> fixedRouter.connect("G", "T"));

            assertEquals(Router.REASON_NO_AVAILABLE_ROUTE, ex.getReasonCode());
            assertTrue(fixedRouter.terminalsClaiming(EdgeId.of("G", "T")).isEmpty());
            assertEquals(NodeStatus.INACTIVE, status(fixed, "G"));
        }

        @Test
        @DisplayName("Vacate releases every node and edge of the route")
        void testVacate() {
            router.routeToGround("T");
            router.vacate("T");

            assertFalse(active(graph, "G", "C"));
            assertFalse(active(graph, "C", "T"));
            assertEquals(NodeStatus.INACTIVE, status(graph, "C"));
            assertEquals(NodeStatus.INACTIVE, status(graph, "T"));
            assertEquals(NodeStatus.INACTIVE, status(graph, "G"));
            assertTrue(router.terminalsClaiming("C").isEmpty());
            assertTrue(((AbstractNode) graph.node("T")).sources().isEmpty());
        }

        @Test
        @DisplayName("Connect then vacate restores the previous activation state")
        void testRoundTrip() {
            Map<String, NodeStatus> nodesBefore = new LinkedHashMap<>();
            graph.nodes().forEach(id -> nodesBefore.put(id, status(graph, id)));
            Map<EdgeId, EdgeStatus> edgesBefore = new LinkedHashMap<>();
            graph.edges().forEach(id -> edgesBefore.put(id, graph.edge(id).status()));

            router.connect("G", "T");
            router.vacate("T");

            graph.nodes().forEach(id -> assertEquals(nodesBefore.get(id), status(graph, id), id));
            graph.edges().forEach(id -> assertEquals(edgesBefore.get(id), graph.edge(id).status(), id.toString()));
        }

        @Test
        @DisplayName("Second vacate of the same terminal is a claim underflow")
        void testDoubleVacate() {
            router.connect("G", "T");
            router.vacate("T");

            assertThrows(ClaimUnderflowException.class, () -> router.vacate("T"));
        }

        @Test
        @DisplayName("Routing an isolated terminal finds no eligible source")
        void testNoEligibleSource() {
            graph.putNode("LONE", endpoint("LONE"));

            RoutingException ex = assertThrows(RoutingException.class, () -> router.routeToGround("LONE"));
            assertEquals(Router.REASON_NO_ELIGIBLE_SOURCE, ex.getReasonCode());
            assertTrue(ex.getMessage().startsWith("[NO_ELIGIBLE_SOURCE] "));
        }

        @Test
        @DisplayName("Unknown ids are rejected with UNKNOWN_NODE")
        void testUnknownNode() {
            assertEquals(Router.REASON_UNKNOWN_NODE,
                    assertThrows(RoutingException.class, () -> router.routeToGround("nope")).getReasonCode());
            assertEquals(Router.REASON_UNKNOWN_NODE,
                    assertThrows(RoutingException.class, () -> router.connect("nope", "T")).getReasonCode());
            assertEquals(Router.REASON_UNKNOWN_NODE,
                    assertThrows(RoutingException.class, () -> router.vacate("nope")).getReasonCode());
        }

        @Test
        @DisplayName("Empty requests are rejected")
        void testEmptyRequest() {
            assertEquals(Router.REASON_EMPTY_REQUEST,
                    assertThrows(RoutingException.class, () -> router.route(Appraisals.ALWAYS_TRUE)).getReasonCode());
            assertEquals(Router.REASON_EMPTY_REQUEST,
                    assertThrows(RoutingException.class,
                            () -> router.connect(List.of("G"), List.of(List.<String>of()))).getReasonCode());
        }
    }

    @Nested
    @DisplayName("2. Connect Contracts")
    class ConnectTests {

        private MutableStationGraph graph;
        private Router router;

        /**
         * S1 reaches T1 through B or A; S2 reaches T2 through B; S3 feeds T3.
         */
        @BeforeEach
        void setUp() {
            graph = new MutableStationGraph()
                    .putNode("S1", voltageSource("S1"))
                    .putNode("S2", voltageSource("S2"))
                    .putNode("S3", voltageSource("S3"))
                    .putNode("A", connector("A"))
                    .putNode("B", connector("B"))
                    .putNode("T1", endpoint("T1"))
                    .putNode("T2", endpoint("T2"))
                    .putNode("T3", endpoint("T3"));
            wire(graph, "S1", "B", "T1");
            wire(graph, "S1", "A", "T1");
            wire(graph, "S2", "B", "T2");
            wire(graph, "S3", "T3");
            router = new Router(graph, CONFIG);
        }

        @Test
        @DisplayName("Concurrent groups are committed on node-disjoint paths")
        void testDisjointCommit() {
            router.connect(List.of("S1", "S2"), List.of(List.of("T1"), List.of("T2")));

            assertTrue(active(graph, "S1", "A"));
            assertTrue(active(graph, "A", "T1"));
            assertTrue(active(graph, "S2", "B"));
            assertTrue(active(graph, "B", "T2"));
            assertFalse(active(graph, "S1", "B"));
            assertFalse(active(graph, "B", "T1"));
            assertEquals(Set.of("T2"), router.terminalsClaiming("B"));
            assertEquals(Set.of("T1"), router.terminalsClaiming("A"));
        }

        @Test
        @DisplayName("Source count must equal terminal group count, checked before activation")
        void testCountMismatch() {
            RoutingException ex = assertThrows(RoutingException.class, () -> router.connect(
                    List.of("S1", "S2"), List.of(List.of("T1"), List.of("T2"), List.of("T3"))));

            assertEquals(Router.REASON_SOURCE_TERMINAL_COUNT_MISMATCH, ex.getReasonCode());
            for (EdgeId edge : graph.edges()) {
                assertFalse(graph.edge(edge).isActive(), edge.toString());
            }
            for (String node : graph.nodes()) {
                assertEquals(NodeStatus.INACTIVE, status(graph, node), node);
            }
        }

        @Test
        @DisplayName("More than one source group is rejected")
        void testMultipleSourceGroups() {
            RoutingException ex = assertThrows(RoutingException.class, () -> router.connectGroups(
                    List.of(List.of("S1"), List.of("S2")), List.of(List.of("T1"))));

            assertEquals(Router.REASON_MULTIPLE_SOURCE_GROUPS, ex.getReasonCode());
        }

        @Test
        @DisplayName("Resources claimed by another terminal are not available")
        void testClaimedResourcesExcluded() {
            router.connect("S2", "T2");
            router.connect("S1", "T1");

            assertTrue(active(graph, "S1", "A"), "S1 must detour around B, which T2 holds");
            assertFalse(active(graph, "S1", "B"));
            assertFalse(active(graph, "B", "T1"));
            assertEquals(Set.of("T2"), router.terminalsClaiming("B"));
        }

        @Test
        @DisplayName("A terminal may reuse resources it already claims")
        void testOwnClaimsReusable() {
            router.connect("S2", "T2");
            router.connect("S1", "T2");

            assertTrue(active(graph, "S1", "B"));
            assertEquals(Set.of("T2"), router.terminalsClaiming(EdgeId.of("S1", "B")));
        }

        @Test
        @DisplayName("Connect by map routes each key to its terminals")
        void testConnectByMap() {
            Map<String, List<String>> connections = new LinkedHashMap<>();
            connections.put("S2", List.of("T2"));
            connections.put("S3", List.of("T3"));

            router.connectByMap(connections);

            assertTrue(active(graph, "B", "T2"));
            assertTrue(active(graph, "S3", "T3"));
        }
    }

    @Nested
    @DisplayName("3. Shared Claims")
    class SharedClaimTests {

        private MutableStationGraph graph;
        private Router router;

        /**
         * S feeds connector C, which fans out to T1 and T2; S1/S2 feed C as alternatives.
         */
        @BeforeEach
        void setUp() {
            graph = new MutableStationGraph()
                    .putNode("S", voltageSource("S"))
                    .putNode("S1", voltageSource("S1"))
                    .putNode("S2", voltageSource("S2"))
                    .putNode("C", connector("C"))
                    .putNode("T1", endpoint("T1"))
                    .putNode("T2", endpoint("T2"));
            wire(graph, "S", "C", "T1");
            wire(graph, "C", "T2");
            wire(graph, "S1", "C");
            wire(graph, "S2", "C");
            router = new Router(graph, CONFIG);
        }

        @Test
        @DisplayName("Shared connector stays active until every claiming terminal is vacated")
        void testReferenceCounting() {
            router.connect(List.of("S"), List.of(List.of("T1", "T2")));

            assertEquals(Set.of("T1", "T2"), router.terminalsClaiming("C"));
            assertEquals(Set.of("T1", "T2"), router.terminalsClaiming(EdgeId.of("S", "C")));

            router.vacate("T1");
            assertEquals(NodeStatus.ACTIVE, status(graph, "C"));
            assertTrue(active(graph, "S", "C"));
            assertFalse(active(graph, "C", "T1"));
            assertEquals(NodeStatus.INACTIVE, status(graph, "T1"));

            router.vacate("T2");
            assertEquals(NodeStatus.INACTIVE, status(graph, "C"));
            assertFalse(active(graph, "S", "C"));
            assertFalse(active(graph, "C", "T2"));
        }

        @Test
        @DisplayName("A terminal can extend resources it already claims")
        void testRerouteWithOwnClaims() {
            router.connect("S", "T1");
            router.connect(List.of("S"), List.of(List.of("T1", "T2")));

            assertEquals(Set.of("T1", "T2"), router.terminalsClaiming("C"));
            router.vacate("T2");
            assertTrue(active(graph, "S", "C"));
            assertEquals(NodeStatus.ACTIVE, status(graph, "C"));
        }

        @Test
        @DisplayName("Distinct sources cannot share a connector claimed by another terminal")
        void testDistinctSourcesThroughSharedConnector() {
            router.connect("S1", "T1");

            RoutingException ex = assertThrows(RoutingException.class, () -> router.connect("S2", "T2"));

            assertEquals(Router.REASON_NO_AVAILABLE_ROUTE, ex.getReasonCode());
            assertFalse(active(graph, "S2", "C"));
            assertEquals(NodeStatus.INACTIVE, status(graph, "T2"));
        }
    }

    @Nested
    @DisplayName("4. Source Selection")
    class SourceSelectionTests {

        private MutableStationGraph graph;
        private Router router;

        /**
         * Source A feeds T directly; source B through connector C.
         */
        @BeforeEach
        void setUp() {
            graph = new MutableStationGraph()
                    .putNode("A", voltageSource("A"))
                    .putNode("B", voltageSource("B"))
                    .putNode("C", connector("C"))
                    .putNode("T", endpoint("T"));
            wire(graph, "A", "T");
            wire(graph, "B", "C", "T");
            router = new Router(graph, CONFIG);
        }

        @Test
        @DisplayName("Route commits the higher-scoring source")
        void testAppraisalOrdering() {
            Appraiser preferB = sources -> sources.get(0).fullName().equals("B") ? 5 : 3;

            assertEquals(List.of("B", "A"), router.eligibleSourcesOf("T", preferB));

            router.route(preferB, "T");

            assertTrue(active(graph, "B", "C"));
            assertTrue(active(graph, "C", "T"));
            assertFalse(active(graph, "A", "T"));
        }

        @Test
        @DisplayName("Eligible sources are nearest first by default")
        void testEligibleSources() {
            assertEquals(List.of("A", "B"), router.eligibleSourcesOf("T"));
        }

        @Test
        @DisplayName("Sources claimed by other terminals are not offered")
        void testClaimedSourceSkipped() {
            graph.putNode("T0", endpoint("T0"));
            wire(graph, "B", "T0");
            router.connect("B", "T0");

            Appraiser preferB = sources -> sources.get(0).fullName().equals("B") ? 5 : 3;
            router.route(preferB, "T");

            assertTrue(active(graph, "A", "T"));
        }

        @Test
        @DisplayName("Wrappers select by capability and unit")
        void testConvenienceWrappers() {
            graph.putNode("DMM", ammeter("DMM"))
                    .putNode("FLOAT", namedSource("FLOAT", "float"))
                    .putNode("HIZ", namedSource("HIZ", "highz"))
                    .putNode("M", endpoint("M"))
                    .putNode("F", endpoint("F"))
                    .putNode("H", endpoint("H"));
            wire(graph, "DMM", "M");
            wire(graph, "FLOAT", "F");
            wire(graph, "HIZ", "H");
            Router wrappers = new Router(graph, CONFIG);

            wrappers.routeToMeter("M");
            wrappers.routeToFloat("F");
            wrappers.routeToHighZ("H");
            wrappers.routeToSource(List.of("T"), "V");

            assertTrue(active(graph, "DMM", "M"));
            assertTrue(active(graph, "FLOAT", "F"));
            assertTrue(active(graph, "HIZ", "H"));
            assertTrue(active(graph, "A", "T"));
            assertEquals(Router.REASON_NO_ELIGIBLE_SOURCE,
                    assertThrows(RoutingException.class, () -> wrappers.routeToGround("M")).getReasonCode());
        }
    }

    @Nested
    @DisplayName("5. Joint Routing")
    class JointRoutingTests {

        @Test
        @DisplayName("Terminals with the same eligible sources share one source")
        void testJointRoute() {
            MutableStationGraph graph = new MutableStationGraph()
                    .putNode("G", ground("G"))
                    .putNode("C1", connector("C1"))
                    .putNode("C2", connector("C2"))
                    .putNode("T1", endpoint("T1"))
                    .putNode("T2", endpoint("T2"));
            wire(graph, "G", "C1", "T1");
            wire(graph, "G", "C2", "T2");
            Router router = new Router(graph, CONFIG);

            router.jointRoutePerSameEligibleSources(List.of("T1", "T2"), Appraiser.of(Appraisals.NODE_IS_GROUND));

            assertEquals(Set.of("T1", "T2"), router.terminalsClaiming("G"));
            assertTrue(active(graph, "C1", "T1"));
            assertTrue(active(graph, "C2", "T2"));
        }

        @Test
        @DisplayName("Overlapping eligible sources still route each group")
        void testOverlappingGroups() {
            MutableStationGraph graph = new MutableStationGraph()
                    .putNode("G1", ground("G1"))
                    .putNode("G2", ground("G2"))
                    .putNode("C", connector("C"))
                    .putNode("T1", endpoint("T1"))
                    .putNode("T2", endpoint("T2"));
            wire(graph, "G1", "T1");
            wire(graph, "G2", "C", "T1");
            wire(graph, "G2", "T2");
            Router router = new Router(graph, CONFIG);

            router.jointRoutePerSameEligibleSources(List.of("T1", "T2"), Appraiser.of(Appraisals.NODE_IS_GROUND));

            assertTrue(active(graph, "G1", "T1"));
            assertTrue(active(graph, "G2", "T2"));
            assertFalse(active(graph, "C", "T1"));
        }
    }

    @Nested
    @DisplayName("6. Start-up")
    class StartupTests {

        @Test
        @DisplayName("Pre-activated edges are adopted without claims")
        void testInitialActiveEdges() {
            MutableStationGraph graph = groundConnectorTerminal();
            graph.setEdge(EdgeId.of("G", "C"), BasicEdge.electrical(true));

            Router router = new Router(graph, CONFIG);

            assertTrue(((AbstractNode) graph.node("C")).sources().contains(graph.node("G")));
            assertTrue(router.terminalsClaiming(EdgeId.of("G", "C")).isEmpty());
            assertTrue(router.terminalsClaiming("G").isEmpty());
        }

        @Test
        @DisplayName("Dynamic sources are connected to their eligible sources and left unclaimed")
        void testDynamicSources() {
            MutableStationGraph graph = new MutableStationGraph()
                    .putNode("G", ground("G"))
                    .putNode("OUT", dynamicOutput("OUT"));
            wire(graph, "G", "OUT");

            Router router = new Router(graph, CONFIG);

            assertTrue(active(graph, "G", "OUT"));
            assertEquals(NodeStatus.ACTIVE, status(graph, "OUT"));
            assertTrue(router.terminalsClaiming("OUT").isEmpty());
            assertTrue(router.terminalsClaiming(EdgeId.of("G", "OUT")).isEmpty());
        }

        @Test
        @DisplayName("Dynamic-source connection can be switched off")
        void testDynamicSourcesDisabled() {
            MutableStationGraph graph = new MutableStationGraph()
                    .putNode("G", ground("G"))
                    .putNode("OUT", dynamicOutput("OUT"));
            wire(graph, "G", "OUT");

            new Router(graph, RouterConfig.builder().connectDynamicSources(false).build());

            assertFalse(active(graph, "G", "OUT"));
        }
    }
}

package org.labwire.station;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.labwire.graph.BasicEdge;
import org.labwire.graph.ConnectorNode;
import org.labwire.graph.MutableStationGraph;
import org.labwire.graph.StationGraph;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static wiring between instruments, such as a cable or a daughterboard.
 *
 * <p>Each connection becomes a {@link ConnectorNode} with id {@code <connector>[<connection>]},
 * joined to each of its endpoints by a pair of opposite, inactive electrical edges:</p>
 * <pre>
 *   X ---- O ---- X
 * </pre>
 * <p>Connectors can be chained; a connection only has to list the endpoints not already
 * listed by the neighbouring connector.</p>
 */
public final class Connector {
    private static final Logger log = LogManager.getLogger(Connector.class);
    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^0-9a-zA-Z_]");

    private final String name;
    private final List<ConnectorMapping> connections;
    private final MutableStationGraph graph = new MutableStationGraph();

    /**
     * @throws IllegalArgumentException if two connections resolve to the same identifier.
     */
    public Connector(String name, List<ConnectorMapping> connections) {
        this.name = Objects.requireNonNull(name, "name");
        this.connections = List.copyOf(connections);
        requireUniqueConnectionIds(this.connections);
        addSubgraph();
        log.debug("Built connector {} with {} connection(s)", name, this.connections.size());
    }

    public String name() {
        return name;
    }

    public List<ConnectorMapping> connections() {
        return connections;
    }

    public StationGraph graph() {
        return graph.asStationGraph();
    }

    /**
     * Node id of the connection at {@code index}.
     */
    public String connectionNodeId(int index) {
        return name + "[" + connectionId(connections.get(index), index) + "]";
    }

    /**
     * Replaces every character that may not appear in a Java identifier part with {@code _}.
     */
    public static String substituteNonIdentifierCharacters(String nodeName) {
        return substituteNonIdentifierCharacters(nodeName, "_");
    }

    public static String substituteNonIdentifierCharacters(String nodeName, String replacement) {
        return NON_IDENTIFIER.matcher(nodeName).replaceAll(Matcher.quoteReplacement(replacement));
    }

    private void addSubgraph() {
        for (int index = 0; index < connections.size(); index++) {
            String connectorNode = connectionNodeId(index);
            graph.putNode(connectorNode, new ConnectorNode(substituteNonIdentifierCharacters("resistance_" + connectorNode)));
            for (String endpoint : connections.get(index).endpoints()) {
                graph.putBidirectionalEdge(endpoint, connectorNode, BasicEdge.electrical(false), BasicEdge.electrical(false));
            }
        }
    }

    private static String connectionId(ConnectorMapping connection, int index) {
        return connection.name() != null ? connection.name() : String.valueOf(index);
    }

    private static void requireUniqueConnectionIds(List<ConnectorMapping> connections) {
        Set<String> ids = new HashSet<>();
        for (int index = 0; index < connections.size(); index++) {
            String id = connectionId(connections.get(index), index);
            if (!ids.add(id)) {
                throw new IllegalArgumentException("Connection names must be unique, duplicate: " + id);
            }
        }
    }
}

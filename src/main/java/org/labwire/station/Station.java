package org.labwire.station;

import org.labwire.graph.MutableStationGraph;
import org.labwire.graph.StationGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Collection of instrument and connector graphs composed into one station graph.
 */
public final class Station {
    private final List<StationGraph> components = new ArrayList<>();
    private StationGraph graph = new MutableStationGraph().asStationGraph();

    public Station(StationGraph... components) {
        add(components);
    }

    /**
     * Adds component graphs and recomposes the station graph; later components override
     * values of earlier ones for the same ids.
     */
    public Station add(StationGraph... components) {
        this.components.addAll(List.of(components));
        this.graph = StationGraph.compose(this.components.toArray(new StationGraph[0]));
        return this;
    }

    public Station add(Connector connector) {
        return add(connector.graph());
    }

    public StationGraph graph() {
        return graph;
    }

    public List<StationGraph> components() {
        return List.copyOf(components);
    }
}

package org.labwire.graph;

/**
 * Value attached to a station graph arc.
 */
public interface Edge {

    EdgeType type();

    EdgeStatus status();

    /**
     * Switches the connection on.
     *
     * @throws InvalidEdgeTransitionException if this is not a switchable electrical connection.
     */
    void activate();

    /**
     * Switches the connection off.
     *
     * @throws InvalidEdgeTransitionException if this is not a switchable electrical connection.
     */
    void deactivate();

    /**
     * Whether the edge currently conducts.
     */
    default boolean isActive() {
        return status() == EdgeStatus.ACTIVE_ELECTRICAL_CONNECTION;
    }

    /**
     * Whether {@link #activate()} and {@link #deactivate()} are permitted.
     */
    default boolean isSwitchable() {
        return type() == EdgeType.ELECTRICAL_CONNECTION && status().isElectrical();
    }
}

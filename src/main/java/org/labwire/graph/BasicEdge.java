package org.labwire.graph;

import java.util.Objects;

/**
 * In-memory {@link Edge} whose status is the only state.
 */
public class BasicEdge implements Edge {
    private final EdgeType type;
    private EdgeStatus status;

    /**
     * Inactive electrical connection.
     */
    public BasicEdge() {
        this(EdgeType.ELECTRICAL_CONNECTION, EdgeStatus.INACTIVE_ELECTRICAL_CONNECTION);
    }

    public BasicEdge(EdgeType type, EdgeStatus status) {
        this.type = Objects.requireNonNull(type, "type");
        this.status = Objects.requireNonNull(status, "status");
        if (!isConsistent(type, status)) {
            throw new IllegalArgumentException("edge type " + type + " cannot have status " + status);
        }
    }

    public static BasicEdge electrical(boolean active) {
        return new BasicEdge(
                EdgeType.ELECTRICAL_CONNECTION,
                active ? EdgeStatus.ACTIVE_ELECTRICAL_CONNECTION : EdgeStatus.INACTIVE_ELECTRICAL_CONNECTION
        );
    }

    public static BasicEdge partOf() {
        return new BasicEdge(EdgeType.PART_OF, EdgeStatus.PART_OF);
    }

    public static BasicEdge capacitiveCoupling() {
        return new BasicEdge(EdgeType.CAPACITIVE_COUPLING, EdgeStatus.CAPACITIVE_COUPLING);
    }

    @Override
    public EdgeType type() {
        return type;
    }

    @Override
    public EdgeStatus status() {
        return status;
    }

    @Override
    public void activate() {
        requireSwitchable("activate");
        status = EdgeStatus.ACTIVE_ELECTRICAL_CONNECTION;
    }

    @Override
    public void deactivate() {
        requireSwitchable("deactivate");
        status = EdgeStatus.INACTIVE_ELECTRICAL_CONNECTION;
    }

    private void requireSwitchable(String action) {
        if (!isSwitchable()) {
            throw new InvalidEdgeTransitionException(
                    "Cannot " + action + " an edge of type " + type + " with status " + status);
        }
    }

    private static boolean isConsistent(EdgeType type, EdgeStatus status) {
        return switch (type) {
            case ELECTRICAL_CONNECTION -> status.isElectrical();
            case PART_OF -> status == EdgeStatus.PART_OF;
            case CAPACITIVE_COUPLING -> status == EdgeStatus.CAPACITIVE_COUPLING;
        };
    }

    @Override
    public String toString() {
        return "BasicEdge[" + type + ", " + status + "]";
    }
}

package org.labwire.graph;

/**
 * Observable status of a station edge.
 */
public enum EdgeStatus {
    ACTIVE_ELECTRICAL_CONNECTION,
    INACTIVE_ELECTRICAL_CONNECTION,
    PART_OF,
    CAPACITIVE_COUPLING;

    /**
     * Returns whether this status belongs to a switchable electrical connection.
     */
    public boolean isElectrical() {
        return this == ACTIVE_ELECTRICAL_CONNECTION || this == INACTIVE_ELECTRICAL_CONNECTION;
    }
}

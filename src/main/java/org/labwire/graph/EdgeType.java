package org.labwire.graph;

/**
 * Physical meaning of a station edge.
 */
public enum EdgeType {
    /** A galvanic connection that can be switched on and off by routing. */
    ELECTRICAL_CONNECTION,
    /** Structural containment, e.g. a channel that is part of an instrument. */
    PART_OF,
    /** Parasitic coupling between conductors; never switched. */
    CAPACITIVE_COUPLING
}

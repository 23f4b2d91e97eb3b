package org.labwire.graph;

/**
 * Activation state of a station node.
 */
public enum NodeStatus {
    ACTIVE,
    INACTIVE
}

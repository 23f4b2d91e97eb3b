package org.labwire.graph;

import lombok.experimental.StandardException;

import java.util.List;
import java.util.Set;

/**
 * Value attached to a station graph vertex: an instrument endpoint, a connector
 * junction or an abstract source.
 *
 * <p>Activation is idempotent. A node is {@link NodeStatus#ACTIVE} iff it has been
 * activated and not deactivated since. The upstream-source set records which nodes
 * currently drive this one through an active edge.</p>
 */
public interface Node {

    /**
     * Unique display name used in logs.
     */
    String fullName();

    /**
     * Quantities reachable through this node.
     */
    List<Quantity> quantities();

    /**
     * Records {@code source} as currently driving this node. Adding a present source is a no-op.
     */
    void addSource(Node source);

    /**
     * Removes {@code source} from the upstream-source set.
     *
     * @throws SourceError if {@code source} is not a current upstream source.
     */
    void removeSource(Node source);

    void activate();

    void deactivate();

    NodeStatus status();

    /**
     * Instrument-module nodes ultimately feeding this node.
     */
    Set<Node> upstream();

    /**
     * Whether breadth-first source search treats this node as a routing source.
     */
    default boolean isEligibleSource() {
        return false;
    }

    /**
     * Whether a router connects this node to all of its eligible sources on construction.
     */
    default boolean isDynamicSource() {
        return false;
    }

    /**
     * Raised on upstream-source membership violations.
     */
    @StandardException
    class SourceError extends RuntimeException {
    }
}

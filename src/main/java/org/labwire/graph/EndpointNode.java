package org.labwire.graph;

import java.util.List;
import java.util.Set;

/**
 * Bare endpoint, e.g. a device pad, with no quantities of its own.
 */
public class EndpointNode extends AbstractNode {

    public EndpointNode(String fullName) {
        super(fullName);
    }

    @Override
    public List<Quantity> quantities() {
        return List.of();
    }

    @Override
    public Set<Node> upstream() {
        return resolveUpstream();
    }
}

package org.labwire.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Junction inside a cable or daughterboard.
 *
 * <p>A connector owns no quantities of its own; it exposes those of the instrument
 * modules currently driving it.</p>
 */
public class ConnectorNode extends AbstractNode {

    public ConnectorNode(String fullName) {
        super(fullName);
    }

    @Override
    public List<Quantity> quantities() {
        List<Quantity> quantities = new ArrayList<>();
        for (Node node : upstream()) {
            quantities.addAll(node.quantities());
        }
        return quantities;
    }

    @Override
    public Set<Node> upstream() {
        return resolveUpstream();
    }
}

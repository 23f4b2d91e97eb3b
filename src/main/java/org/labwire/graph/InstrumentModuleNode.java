package org.labwire.graph;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Node backed by an instrument {@link Port}.
 *
 * <p>Upstream resolution ends here: the node is its own upstream. Eligible sources
 * (grounds, floats, voltage outputs) are flagged at construction.</p>
 */
public class InstrumentModuleNode extends AbstractNode {
    private final Port port;
    private final boolean eligibleSource;
    private final boolean dynamicSource;

    public InstrumentModuleNode(Port port) {
        this(port, false, false);
    }

    public InstrumentModuleNode(Port port, boolean eligibleSource) {
        this(port, eligibleSource, false);
    }

    public InstrumentModuleNode(Port port, boolean eligibleSource, boolean dynamicSource) {
        super(Objects.requireNonNull(port, "port").fullName());
        this.port = port;
        this.eligibleSource = eligibleSource;
        this.dynamicSource = dynamicSource;
    }

    public Port port() {
        return port;
    }

    @Override
    public List<Quantity> quantities() {
        return port.quantities();
    }

    @Override
    public Set<Node> upstream() {
        return Set.of(this);
    }

    @Override
    public boolean isEligibleSource() {
        return eligibleSource;
    }

    @Override
    public boolean isDynamicSource() {
        return dynamicSource;
    }

    @Override
    protected boolean resolvesThroughSources() {
        return false;
    }
}

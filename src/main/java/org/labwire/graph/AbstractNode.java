package org.labwire.graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Shared activation flag and upstream-source bookkeeping for node variants.
 */
public abstract class AbstractNode implements Node {
    private static final Logger log = LogManager.getLogger(AbstractNode.class);

    private final String fullName;
    private final Set<Node> sources = new LinkedHashSet<>();
    private NodeStatus status = NodeStatus.INACTIVE;

    protected AbstractNode(String fullName) {
        this.fullName = Objects.requireNonNull(fullName, "fullName");
    }

    @Override
    public String fullName() {
        return fullName;
    }

    @Override
    public void addSource(Node source) {
        Objects.requireNonNull(source, "source");
        log.info("Adding source {} to node {}", source.fullName(), fullName);
        sources.add(source);
    }

    @Override
    public void removeSource(Node source) {
        if (!sources.remove(source)) {
            throw new SourceError(
                    (source == null ? "null" : source.fullName()) + " is not a source of " + fullName);
        }
        log.info("Removing source {} from node {}", source.fullName(), fullName);
    }

    @Override
    public void activate() {
        if (status != NodeStatus.ACTIVE) {
            log.info("Activating node {}", fullName);
        }
        status = NodeStatus.ACTIVE;
    }

    @Override
    public void deactivate() {
        if (status != NodeStatus.INACTIVE) {
            log.info("Deactivating node {}", fullName);
        }
        status = NodeStatus.INACTIVE;
    }

    @Override
    public NodeStatus status() {
        return status;
    }

    /**
     * Current upstream sources, in the order they were added.
     */
    public Set<Node> sources() {
        return Collections.unmodifiableSet(sources);
    }

    /**
     * Whether upstream resolution passes through this node to its own sources.
     * Instrument modules terminate resolution.
     */
    protected boolean resolvesThroughSources() {
        return true;
    }

    /**
     * Walks the source links breadth-first, collecting nodes that terminate resolution.
     * Cycles of bidirectional links are visited once.
     */
    protected Set<Node> resolveUpstream() {
        Set<Node> result = new LinkedHashSet<>();
        Set<Node> visited = new LinkedHashSet<>();
        Deque<Node> queue = new ArrayDeque<>(sources);
        visited.add(this);
        while (!queue.isEmpty()) {
            Node candidate = queue.poll();
            if (!visited.add(candidate)) {
                continue;
            }
            if (candidate instanceof AbstractNode node) {
                if (node.resolvesThroughSources()) {
                    queue.addAll(node.sources);
                } else {
                    result.add(node);
                }
            } else {
                result.addAll(candidate.upstream());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + fullName + ", " + status + "]";
    }
}

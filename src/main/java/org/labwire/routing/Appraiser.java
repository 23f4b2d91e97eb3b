package org.labwire.routing;

import org.labwire.graph.Node;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Scores a candidate combination of source nodes, one node per terminal group.
 *
 * <p>A positive score makes the combination eligible; higher scores are tried first.</p>
 */
@FunctionalInterface
public interface Appraiser {

    int appraise(List<Node> sources);

    /**
     * Adapts a single-node predicate: {@code true} scores 1, {@code false} scores 0.
     *
     * @throws IllegalArgumentException when applied to other than exactly one node.
     */
    static Appraiser of(Predicate<? super Node> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return sources -> {
            if (sources.size() != 1) {
                throw new IllegalArgumentException(
                        "single-node appraiser applied to " + sources.size() + " nodes");
            }
            return predicate.test(sources.get(0)) ? 1 : 0;
        };
    }
}

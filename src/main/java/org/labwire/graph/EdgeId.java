package org.labwire.graph;

import java.util.Objects;

/**
 * Ordered pair of node ids identifying a directed edge.
 *
 * <p>{@code (a, b)} and {@code (b, a)} are distinct edges.</p>
 */
public record EdgeId(String from, String to) {

    public EdgeId {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static EdgeId of(String from, String to) {
        return new EdgeId(from, to);
    }

    @Override
    public String toString() {
        return "(" + from + ", " + to + ")";
    }
}

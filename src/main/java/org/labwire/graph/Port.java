package org.labwire.graph;

import java.util.List;

/**
 * An addressable hardware endpoint, typically an instrument channel.
 */
public interface Port {

    /**
     * Unique name with elements separated by {@code .}, e.g. {@code dmm.ch1}.
     */
    String fullName();

    /**
     * Quantities controllable through this port.
     */
    List<Quantity> quantities();
}

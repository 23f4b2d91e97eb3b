package org.labwire.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * Immutable {@link Port} description.
 */
@Value
@Builder
@Accessors(fluent = true)
public class BasicPort implements Port {
    String fullName;
    @Singular
    List<Quantity> quantities;
}

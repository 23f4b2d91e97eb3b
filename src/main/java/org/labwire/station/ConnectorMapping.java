package org.labwire.station;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * One connection of a {@link Connector}: a wire or trace joining its endpoints.
 */
@Value
@Builder
@Accessors(fluent = true)
public class ConnectorMapping {
    /**
     * Identifier unique within the connector; the connection's position is used when absent.
     */
    String name;

    /**
     * Node ids joined by this connection.
     */
    @NonNull
    @Singular
    List<String> endpoints;

    /**
     * Series resistance in ohms; informational.
     */
    Double ohms;

    public static ConnectorMapping of(String name, String... endpoints) {
        return ConnectorMapping.builder().name(name).endpoints(List.of(endpoints)).build();
    }
}

package org.labwire.graph;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Immutable descriptive {@link Quantity}.
 */
@Value
@Builder
@Accessors(fluent = true)
public class BasicQuantity implements Quantity {
    String name;
    String unit;
    boolean settable;
    @Builder.Default
    boolean gettable = true;
    String instrumentName;

    /**
     * Settable quantity with the given name and unit.
     */
    public static BasicQuantity settable(String name, String unit) {
        return BasicQuantity.builder().name(name).unit(unit).settable(true).build();
    }

    /**
     * Read-only quantity with the given name and unit.
     */
    public static BasicQuantity readOnly(String name, String unit) {
        return BasicQuantity.builder().name(name).unit(unit).settable(false).build();
    }
}

package org.labwire.graph;

import java.util.Set;

/**
 * Predicates over single {@link Quantity} descriptors.
 */
public final class Quantities {
    /**
     * Names of quantities that represent fixed source states rather than programmable outputs.
     */
    public static final Set<String> CONSTANT_SOURCE_NAMES = Set.of("ground", "ground_force", "highz", "float");

    /**
     * Names of quantities that represent fixed meter states.
     */
    public static final Set<String> CONSTANT_METER_NAMES = Set.of("ground_sense");

    private Quantities() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static boolean isSettable(Quantity quantity) {
        return quantity.settable();
    }

    public static boolean isGettable(Quantity quantity) {
        return quantity.gettable();
    }

    public static boolean hasConstantSourceName(Quantity quantity) {
        return CONSTANT_SOURCE_NAMES.contains(quantity.name());
    }

    public static boolean hasConstantMeterName(Quantity quantity) {
        return CONSTANT_METER_NAMES.contains(quantity.name());
    }
}

package org.labwire.routing;

import org.labwire.graph.Node;
import org.labwire.graph.Quantities;
import org.labwire.graph.Quantity;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Stock node predicates and appraisers for source selection.
 *
 * <p>A node is a <em>source</em> if it exposes a settable quantity and a <em>meter</em>
 * if it exposes a readable quantity and nothing settable.</p>
 */
public final class Appraisals {

    /**
     * Accepts every combination with score 1.
     */
    public static final Appraiser ALWAYS_TRUE = sources -> 1;

    /**
     * Ground source measured in volts.
     */
    public static final Predicate<Node> NODE_IS_GROUND = nodeIsGeneralGround("V");

    private Appraisals() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static int sourceCountOf(Node node) {
        int count = 0;
        for (Quantity quantity : node.quantities()) {
            if (Quantities.isSettable(quantity)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Number of readable quantities, or 0 if any quantity is settable.
     */
    public static int meterCountOf(Node node) {
        int count = 0;
        for (Quantity quantity : node.quantities()) {
            if (Quantities.isSettable(quantity)) {
                return 0;
            }
            if (Quantities.isGettable(quantity)) {
                count++;
            }
        }
        return count;
    }

    public static boolean nodeIsSource(Node node) {
        return sourceCountOf(node) > 0;
    }

    public static boolean nodeIsMeter(Node node) {
        return meterCountOf(node) > 0;
    }

    /**
     * Matches nodes with at least one quantity in one of {@code units}; a {@code null}
     * unit matches dimensionless quantities.
     */
    public static Predicate<Node> nodeHasUnit(String... units) {
        List<String> accepted = Arrays.asList(units);
        return node -> node.quantities().stream().anyMatch(quantity -> accepted.contains(quantity.unit()));
    }

    public static Predicate<Node> nodeHasQuantityFromInstrumentNamed(String instrumentName) {
        Objects.requireNonNull(instrumentName, "instrumentName");
        return node -> node.quantities().stream()
                .anyMatch(quantity -> instrumentName.equals(quantity.instrumentName()));
    }

    public static Predicate<Node> nodeHasQuantityName(String... names) {
        List<String> accepted = Arrays.asList(names);
        return node -> node.quantities().stream().anyMatch(quantity -> accepted.contains(quantity.name()));
    }

    public static boolean nodeIsConstantSource(Node node) {
        return node.quantities().stream().anyMatch(Quantities::hasConstantSourceName);
    }

    public static boolean nodeIsConstantMeter(Node node) {
        return node.quantities().stream().anyMatch(Quantities::hasConstantMeterName);
    }

    public static Predicate<Node> nodeIsSourceWithName(String name, String unit) {
        Predicate<Node> hasName = nodeHasQuantityName(name);
        Predicate<Node> hasUnit = nodeHasUnit(unit);
        return node -> hasName.test(node) && nodeIsSource(node) && hasUnit.test(node);
    }

    public static Predicate<Node> nodeIsMeterWithName(String name, String unit) {
        Predicate<Node> hasName = nodeHasQuantityName(name);
        Predicate<Node> hasUnit = nodeHasUnit(unit);
        return node -> hasName.test(node) && nodeIsMeter(node) && hasUnit.test(node);
    }

    /**
     * Matches nodes whose quantities belong to the named instrument.
     *
     * @throws IllegalArgumentException when tested against a node without quantities.
     */
    public static Predicate<Node> nodeIsInstrument(String instrumentName) {
        Objects.requireNonNull(instrumentName, "instrumentName");
        return node -> {
            List<Quantity> quantities = node.quantities();
            if (quantities.isEmpty()) {
                throw new IllegalArgumentException(
                        "Cannot determine the instrument of node " + node.fullName() + " that has no quantities.");
            }
            return quantities.stream().anyMatch(quantity -> instrumentName.equals(quantity.instrumentName()));
        };
    }

    public static Predicate<Node> nodeIsGeneralGround(String unit) {
        return nodeIsSourceWithName("ground", unit);
    }
}

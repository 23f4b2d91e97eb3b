package org.labwire.graph;

/**
 * A controllable or observable quantity exposed by a port, e.g. a voltage setpoint.
 *
 * <p>The router only inspects the descriptive attributes below; reading and writing the
 * underlying hardware value is the concern of the instrument driver.</p>
 */
public interface Quantity {

    /** Short name of the quantity, e.g. {@code ground} or {@code voltage}. */
    String name();

    /** Physical unit, e.g. {@code V}; may be null when dimensionless. */
    String unit();

    /** Whether the quantity accepts set commands. */
    boolean settable();

    /** Whether the quantity can be read back. */
    boolean gettable();

    /** Full name of the owning instrument; may be null for free-standing quantities. */
    String instrumentName();
}

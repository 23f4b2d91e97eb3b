package org.labwire.routing;

import lombok.experimental.StandardException;

/**
 * Raised when a terminal releases a node or edge it does not hold a claim on,
 * typically a second {@code vacate} of the same terminal.
 */
@StandardException
public class ClaimUnderflowException extends IllegalStateException {
}

package org.labwire.graph;

import lombok.experimental.StandardException;

/**
 * Raised when an edge is asked to switch although its type or status forbids it.
 */
@StandardException
public class InvalidEdgeTransitionException extends RuntimeException {
}

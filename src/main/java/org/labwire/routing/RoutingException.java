package org.labwire.routing;

import lombok.Getter;

import java.util.Objects;

/**
 * Routing failure with a deterministic reason code.
 *
 * <p>The message is prefixed with the reason code, e.g.
 * {@code [NO_AVAILABLE_ROUTE] No available routes between ...}.</p>
 */
@Getter
public final class RoutingException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded routing failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RoutingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

package org.Aayush.navigation.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a route tree violates its structural contract.
 *
 * <p>Messages are prefixed with deterministic reason-code text for observability.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RouteConfigurationException extends RuntimeException {
    public static final String REASON_ROUTE_ID_COLLISION = "ROUTE_ID_COLLISION";
    public static final String REASON_INDEX_ROUTE_WITH_CHILDREN = "INDEX_ROUTE_WITH_CHILDREN";
    public static final String REASON_INVALID_ABSOLUTE_PATH = "INVALID_ABSOLUTE_PATH";
    public static final String REASON_EMPTY_ROUTES = "EMPTY_ROUTES";

    private final String reasonCode;

    /**
     * Creates a reason-coded configuration failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public RouteConfigurationException(String reasonCode, String message) {
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

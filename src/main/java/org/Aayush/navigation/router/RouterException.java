package org.Aayush.navigation.router;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Runtime contract violation raised by the navigation engine.
 *
 * <p>Loader and action failures never surface as this exception; they are captured
 * into router state. Messages are prefixed with deterministic reason-code text.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RouterException extends RuntimeException {
    public static final String REASON_MISSING_PATH_PARAM = "MISSING_PATH_PARAM";
    public static final String REASON_MISSING_REDIRECT_LOCATION = "MISSING_REDIRECT_LOCATION";
    public static final String REASON_DEFER_IN_ACTION = "DEFER_IN_ACTION";
    public static final String REASON_UNKNOWN_FETCHER_CONTROLLER = "UNKNOWN_FETCHER_CONTROLLER";
    public static final String REASON_ROUTER_DISPOSED = "ROUTER_DISPOSED";

    private final String reasonCode;

    /**
     * Creates a reason-coded router failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public RouterException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded router failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying cause.
     */
    public RouterException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
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

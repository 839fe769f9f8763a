package org.Aayush.navigation.data;

import lombok.Value;

/**
 * Error payload derived from a thrown response or raised by the router itself
 * (404 for unmatched URLs, 405 for missing actions, 400 for bad submissions).
 */
@Value
public class ErrorResponse {
    int status;
    String statusText;
    Object data;
    /** True when the router created this error rather than user code. */
    boolean internal;

    public ErrorResponse(int status, String statusText, Object data) {
        this(status, statusText, data, false);
    }

    public ErrorResponse(int status, String statusText, Object data, boolean internal) {
        this.status = status;
        this.statusText = statusText == null ? "" : statusText;
        this.data = data;
        this.internal = internal;
    }
}

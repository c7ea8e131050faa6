package de.mirkosertic.mcp.canvasindex.canvas;

import java.io.IOException;

/**
 * A failed Canvas API call, classified by what the caller can do about it.
 */
public class CanvasApiException extends IOException {

    public enum Reason {
        /** 401 or 403: the token may not see this resource. Not retried. */
        UNAUTHORIZED,
        /** 404. */
        NOT_FOUND,
        /** 429. */
        RATE_LIMITED,
        /** 5xx, I/O failure or timeout. */
        UNAVAILABLE
    }

    private final Reason reason;
    private final int statusCode;

    public CanvasApiException(final Reason reason, final int statusCode, final String message) {
        super(message);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public CanvasApiException(final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = -1;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the HTTP status, or -1 when the request never got a response
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isPermissionDenied() {
        return reason == Reason.UNAUTHORIZED;
    }

    public boolean isTransient() {
        return reason == Reason.RATE_LIMITED || reason == Reason.UNAVAILABLE;
    }

    public static Reason reasonForStatus(final int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return Reason.UNAUTHORIZED;
        }
        if (statusCode == 404) {
            return Reason.NOT_FOUND;
        }
        if (statusCode == 429) {
            return Reason.RATE_LIMITED;
        }
        return Reason.UNAVAILABLE;
    }
}

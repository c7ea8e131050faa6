package de.mirkosertic.mcp.canvasindex.index;

import java.io.IOException;

/**
 * A failed call to the search index service.
 */
public class SearchIndexException extends IOException {

    private final int statusCode;

    public SearchIndexException(final int statusCode, final String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public SearchIndexException(final String message, final Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return the HTTP status, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Rate limiting, server errors and connection failures are worth retrying.
     */
    public boolean isTransient() {
        return statusCode == -1 || statusCode == 429 || statusCode >= 500;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}

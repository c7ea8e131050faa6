package de.mirkosertic.mcp.canvasindex.sync;

import de.mirkosertic.mcp.canvasindex.canvas.CanvasApiException;
import de.mirkosertic.mcp.canvasindex.index.SearchIndexException;
import de.mirkosertic.mcp.canvasindex.index.UnsupportedFormatException;
import de.mirkosertic.mcp.canvasindex.mirror.MirrorEntryNotFoundException;

import java.io.IOException;

/**
 * Per-file failure categories. Each one is counted separately in progress and summaries.
 */
public enum FailureKind {
    /** The LMS denied access. Recorded as inaccessible, never retried. */
    PERMISSION_DENIED,
    /** Rate limiting, server error or I/O failure. Retried with backoff. */
    TRANSIENT,
    /** The index cannot take this content. Not retried. */
    UNSUPPORTED_FORMAT,
    /** The file vanished between listing and transfer. */
    NOT_FOUND,
    /** Anything else, including index service rejections. */
    ERROR;

    public static FailureKind classify(final Throwable error) {
        if (error instanceof CanvasApiException canvasError) {
            return switch (canvasError.getReason()) {
                case UNAUTHORIZED -> PERMISSION_DENIED;
                case NOT_FOUND -> NOT_FOUND;
                case RATE_LIMITED, UNAVAILABLE -> TRANSIENT;
            };
        }
        if (error instanceof UnsupportedFormatException) {
            return UNSUPPORTED_FORMAT;
        }
        if (error instanceof SearchIndexException indexError) {
            if (indexError.isTransient()) {
                return TRANSIENT;
            }
            return indexError.isNotFound() ? NOT_FOUND : ERROR;
        }
        if (error instanceof MirrorEntryNotFoundException) {
            return NOT_FOUND;
        }
        if (error instanceof IOException) {
            return TRANSIENT;
        }
        return ERROR;
    }
}

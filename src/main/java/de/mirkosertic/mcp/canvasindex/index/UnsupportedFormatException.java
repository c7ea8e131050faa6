package de.mirkosertic.mcp.canvasindex.index;

import java.io.IOException;

/**
 * The content cannot be added to a search index (type, size or no extractable text).
 */
public class UnsupportedFormatException extends IOException {

    public UnsupportedFormatException(final String message) {
        super(message);
    }

    public UnsupportedFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

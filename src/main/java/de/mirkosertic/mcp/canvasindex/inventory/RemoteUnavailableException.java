package de.mirkosertic.mcp.canvasindex.inventory;

import java.io.IOException;

/**
 * The LMS could not be reached or no requested course could be inventoried.
 */
public class RemoteUnavailableException extends IOException {

    public RemoteUnavailableException(final String message) {
        super(message);
    }

    public RemoteUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

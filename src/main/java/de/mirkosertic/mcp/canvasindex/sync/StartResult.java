package de.mirkosertic.mcp.canvasindex.sync;

/**
 * Answer to a sync request.
 */
public enum StartResult {
    STARTED,
    /** Another run is planning or executing; nothing was changed. */
    ALREADY_RUNNING
}

package de.mirkosertic.mcp.canvasindex.sync;

/**
 * Lifecycle of a sync run. At most one run is active per process.
 */
public enum SyncState {
    IDLE,
    PLANNING,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == PLANNING || this == EXECUTING;
    }
}

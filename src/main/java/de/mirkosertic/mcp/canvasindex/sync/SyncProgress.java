package de.mirkosertic.mcp.canvasindex.sync;

import java.util.List;

/**
 * Live view of the current (or last) run.
 */
public record SyncProgress(
        boolean running,
        SyncState state,
        long filesPlanned,
        long filesCompleted,
        long filesDownloaded,
        long filesUploaded,
        long filesSkippedInaccessible,
        long filesUnsupported,
        long filesFailed,
        int coursesTouched,
        long elapsedTimeMs,
        List<ActiveFile> currentlyProcessing
) {
    public SyncProgress {
        currentlyProcessing = List.copyOf(currentlyProcessing);
    }

    /** A file currently being downloaded or uploaded. */
    public record ActiveFile(String path, long processingDurationMs) {
    }
}

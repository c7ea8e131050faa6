package de.mirkosertic.mcp.canvasindex.mcp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.mcp.canvasindex.sync.SyncProgress;
import de.mirkosertic.mcp.canvasindex.sync.SyncSummary;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response DTO for the getSyncProgress tool.
 */
public record SyncProgressResponse(
        boolean success,
        @JsonProperty("isRunning") Boolean running,
        String state,
        Long filesPlanned,
        Long filesCompleted,
        Long filesDownloaded,
        Long filesUploaded,
        Long filesSkippedInaccessible,
        Long filesUnsupported,
        Long filesFailed,
        Integer coursesTouched,
        Long elapsedTimeMs,
        List<SyncProgress.ActiveFile> currentlyProcessing,
        @Nullable SyncSummary lastSummary,
        String error
) {
    public static SyncProgressResponse success(final SyncProgress progress, @Nullable final SyncSummary lastSummary) {
        return new SyncProgressResponse(
                true,
                progress.running(),
                progress.state().name(),
                progress.filesPlanned(),
                progress.filesCompleted(),
                progress.filesDownloaded(),
                progress.filesUploaded(),
                progress.filesSkippedInaccessible(),
                progress.filesUnsupported(),
                progress.filesFailed(),
                progress.coursesTouched(),
                progress.elapsedTimeMs(),
                progress.currentlyProcessing(),
                lastSummary,
                null);
    }

    public static SyncProgressResponse error(final String errorMessage) {
        return new SyncProgressResponse(false, null, null, null, null, null, null, null, null, null,
                null, null, List.of(), null, errorMessage);
    }
}

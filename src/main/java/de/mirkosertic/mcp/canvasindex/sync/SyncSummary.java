package de.mirkosertic.mcp.canvasindex.sync;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a finished sync run.
 */
public record SyncSummary(
        SyncState state,
        long filesPlanned,
        long filesDownloaded,
        long filesUploaded,
        long filesSkippedInaccessible,
        long filesUnsupported,
        long filesFailed,
        int coursesTouched,
        /** Courses whose inventory failed, with the error message. */
        Map<Long, String> coursesFailed,
        /** Every file-level failure of the run, inaccessible and unsupported files included. */
        List<FileFailure> failures,
        /** The run was cancelled before all planned files were processed. */
        boolean cancelled,
        /** Why the run failed, for {@link SyncState#FAILED}. */
        @Nullable String errorMessage,
        long startTimeMs,
        long endTimeMs
) {
    public SyncSummary {
        coursesFailed = Map.copyOf(coursesFailed);
        failures = List.copyOf(failures);
    }

    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }

    /** True if nothing was transferred and nothing failed. */
    public boolean isNoOp() {
        return filesDownloaded == 0 && filesUploaded == 0 && filesSkippedInaccessible == 0
                && filesUnsupported == 0 && filesFailed == 0;
    }
}

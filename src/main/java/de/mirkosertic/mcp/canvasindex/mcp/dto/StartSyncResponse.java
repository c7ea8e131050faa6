package de.mirkosertic.mcp.canvasindex.mcp.dto;

/**
 * Response DTO for the startSync tool.
 *
 * @param status {@code started} or {@code already_running}
 */
public record StartSyncResponse(
        boolean success,
        String status,
        String message,
        String error
) {
    public static StartSyncResponse started(final boolean skipDownload) {
        return new StartSyncResponse(true, "started",
                (skipDownload ? "Upload-only sync started." : "Sync started.")
                        + " Use getSyncProgress to follow it.", null);
    }

    public static StartSyncResponse alreadyRunning() {
        return new StartSyncResponse(true, "already_running",
                "A sync is already in progress. Use getSyncProgress to follow it.", null);
    }

    public static StartSyncResponse error(final String errorMessage) {
        return new StartSyncResponse(false, null, null, errorMessage);
    }
}

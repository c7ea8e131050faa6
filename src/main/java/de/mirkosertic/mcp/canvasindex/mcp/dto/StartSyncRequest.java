package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mcp.Description;
import de.mirkosertic.mcp.canvasindex.mcp.RequestArguments;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for the startSync tool.
 */
public record StartSyncRequest(
        @Nullable
        @Description("Canvas course ids to sync. Default is the configured course filter, or all courses.")
        List<Long> courseIds,

        @Nullable
        @Description("If true, only upload files that are already mirrored locally; nothing is downloaded. "
                + "Default is false.")
        Boolean skipDownload
) {
    public static StartSyncRequest fromMap(final Map<String, Object> args) {
        return new StartSyncRequest(
                RequestArguments.optionalLongList(args, "courseIds"),
                RequestArguments.optionalBoolean(args, "skipDownload"));
    }

    public boolean effectiveSkipDownload() {
        return skipDownload != null && skipDownload;
    }
}

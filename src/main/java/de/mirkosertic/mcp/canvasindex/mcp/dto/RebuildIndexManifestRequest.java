package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mcp.Description;
import de.mirkosertic.mcp.canvasindex.mcp.RequestArguments;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the rebuildIndexManifest tool.
 */
public record RebuildIndexManifestRequest(
        @Description("Canvas course id whose index manifest is rebuilt")
        Long courseId,

        @Nullable
        @Description("Index (vector store) id of the course. Required when the manifest does not know it.")
        String indexId,

        @Description("Must be set to true to confirm. The course's manifest entries are replaced by "
                + "what the index service reports.")
        Boolean confirm
) {
    public static RebuildIndexManifestRequest fromMap(final Map<String, Object> args) {
        return new RebuildIndexManifestRequest(
                RequestArguments.optionalLong(args, "courseId"),
                RequestArguments.optionalString(args, "indexId"),
                RequestArguments.optionalBoolean(args, "confirm"));
    }

    public boolean isConfirmed() {
        return confirm != null && confirm;
    }
}

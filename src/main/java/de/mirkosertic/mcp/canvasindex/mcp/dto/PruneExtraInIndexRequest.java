package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mcp.Description;
import de.mirkosertic.mcp.canvasindex.mcp.RequestArguments;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the pruneExtraInIndex tool.
 * This is a destructive operation and requires explicit confirmation.
 */
public record PruneExtraInIndexRequest(
        @Nullable
        @Description("Only prune documents of this course. Default is all courses.")
        Long courseId,

        @Description("Must be set to true to confirm. WARNING: index documents whose Canvas file "
                + "no longer exists are deleted from the search index.")
        Boolean confirm
) {
    public static PruneExtraInIndexRequest fromMap(final Map<String, Object> args) {
        return new PruneExtraInIndexRequest(
                RequestArguments.optionalLong(args, "courseId"),
                RequestArguments.optionalBoolean(args, "confirm"));
    }

    public boolean isConfirmed() {
        return confirm != null && confirm;
    }
}

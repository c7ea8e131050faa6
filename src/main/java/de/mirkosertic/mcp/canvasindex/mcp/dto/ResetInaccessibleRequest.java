package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mcp.Description;
import de.mirkosertic.mcp.canvasindex.mcp.RequestArguments;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the resetInaccessible tool.
 */
public record ResetInaccessibleRequest(
        @Nullable
        @Description("Only forget inaccessible files of this course. Default is all courses.")
        Long courseId
) {
    public static ResetInaccessibleRequest fromMap(final Map<String, Object> args) {
        return new ResetInaccessibleRequest(RequestArguments.optionalLong(args, "courseId"));
    }
}

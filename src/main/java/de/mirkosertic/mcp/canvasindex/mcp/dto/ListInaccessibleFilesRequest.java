package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mcp.Description;
import de.mirkosertic.mcp.canvasindex.mcp.RequestArguments;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the listInaccessibleFiles tool.
 */
public record ListInaccessibleFilesRequest(
        @Nullable
        @Description("Only list files of this course. Default is all courses.")
        Long courseId
) {
    public static ListInaccessibleFilesRequest fromMap(final Map<String, Object> args) {
        return new ListInaccessibleFilesRequest(RequestArguments.optionalLong(args, "courseId"));
    }
}

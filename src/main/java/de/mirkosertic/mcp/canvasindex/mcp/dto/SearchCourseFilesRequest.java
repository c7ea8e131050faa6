package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mcp.Description;
import de.mirkosertic.mcp.canvasindex.mcp.RequestArguments;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the searchCourseFiles tool.
 */
public record SearchCourseFilesRequest(
        @Description("Canvas course id to search in")
        Long courseId,

        @Description("Search query")
        String query,

        @Nullable
        @Description("Maximum number of hits. Default is 10, maximum 50.")
        Integer maxResults
) {
    public static final int DEFAULT_MAX_RESULTS = 10;
    public static final int LIMIT_MAX_RESULTS = 50;

    public static SearchCourseFilesRequest fromMap(final Map<String, Object> args) {
        return new SearchCourseFilesRequest(
                RequestArguments.optionalLong(args, "courseId"),
                RequestArguments.optionalString(args, "query"),
                RequestArguments.optionalInt(args, "maxResults"));
    }

    public int effectiveMaxResults() {
        if (maxResults == null || maxResults <= 0) {
            return DEFAULT_MAX_RESULTS;
        }
        return Math.min(maxResults, LIMIT_MAX_RESULTS);
    }
}

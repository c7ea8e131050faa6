package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.index.SearchHit;

import java.util.List;

/**
 * Response DTO for the searchCourseFiles tool.
 */
public record SearchCourseFilesResponse(
        boolean success,
        Long courseId,
        String query,
        Integer hitCount,
        List<SearchHit> hits,
        Long searchTimeMs,
        String error
) {
    public static SearchCourseFilesResponse success(final long courseId, final String query,
                                                    final List<SearchHit> hits, final long searchTimeMs) {
        return new SearchCourseFilesResponse(true, courseId, query, hits.size(), hits, searchTimeMs, null);
    }

    public static SearchCourseFilesResponse error(final String errorMessage) {
        return new SearchCourseFilesResponse(false, null, null, null, List.of(), null, errorMessage);
    }
}

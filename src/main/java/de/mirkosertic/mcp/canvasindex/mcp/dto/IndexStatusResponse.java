package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.sync.IndexStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for the getIndexStatus tool.
 */
public record IndexStatusResponse(
        boolean success,
        Integer canvasCourses,
        Long canvasFilesTotal,
        Long indexedFilesTotal,
        Long missingFilesCount,
        Long extraFilesCount,
        Integer vectorStoresCount,
        Boolean hasLocalIndex,
        Map<String, Integer> missingByCourse,
        List<String> missingFilesSample,
        Long upToDateCount,
        Long notIndexableCount,
        Long missingLocallyCount,
        Long missingInIndexCount,
        Long changedCount,
        Long inaccessibleCount,
        Map<Long, String> coursesFailed,
        String computedAt,
        String error
) {
    public static IndexStatusResponse success(final IndexStatus status) {
        return new IndexStatusResponse(
                true,
                status.canvasCourses(),
                status.canvasFilesTotal(),
                status.indexedFilesTotal(),
                status.missingFilesCount(),
                status.extraFilesCount(),
                status.vectorStoresCount(),
                status.hasLocalIndex(),
                status.missingByCourse(),
                status.missingFilesSample(),
                status.upToDateCount(),
                status.notIndexableCount(),
                status.missingLocallyCount(),
                status.missingInIndexCount(),
                status.changedCount(),
                status.inaccessibleCount(),
                status.coursesFailed(),
                Instant.ofEpochMilli(status.computedAtMs()).toString(),
                null);
    }

    public static IndexStatusResponse error(final String errorMessage) {
        return new IndexStatusResponse(false, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, errorMessage);
    }
}

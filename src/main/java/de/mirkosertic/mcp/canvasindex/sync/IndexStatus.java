package de.mirkosertic.mcp.canvasindex.sync;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How far the local mirror and the search indexes lag behind the LMS, derived from a {@link SyncPlan}.
 */
public record IndexStatus(
        int canvasCourses,
        long canvasFilesTotal,
        long indexedFilesTotal,
        long missingFilesCount,
        long extraFilesCount,
        int vectorStoresCount,
        boolean hasLocalIndex,
        /** Missing files per course name, courses without missing files omitted. */
        Map<String, Integer> missingByCourse,
        /** Paths of up to the configured number of missing files. */
        List<String> missingFilesSample,
        long upToDateCount,
        /** Current in the mirror, but not indexable. */
        long notIndexableCount,
        long missingLocallyCount,
        long missingInIndexCount,
        long changedCount,
        long inaccessibleCount,
        Map<Long, String> coursesFailed,
        long computedAtMs
) {

    public static IndexStatus from(final SyncPlan plan, final long indexedFilesTotal, final int indexCount,
                                   final boolean hasLocalIndex, final int sampleSize) {
        final Map<String, Integer> missingByCourse = new LinkedHashMap<>();
        for (final CourseCounts counts : plan.courseCounts().values()) {
            if (counts.missingCount() > 0) {
                missingByCourse.merge(counts.courseName(), counts.missingCount(), Integer::sum);
            }
        }
        final List<String> sample = plan.filesNeedingWork().stream()
                .limit(Math.max(0, sampleSize))
                .map(p -> p.file().courseName() + "/" + p.file().path())
                .toList();

        return new IndexStatus(
                plan.courseCount(),
                plan.files().size(),
                indexedFilesTotal,
                plan.missingCount(),
                plan.count(FileClassification.EXTRA_IN_INDEX),
                indexCount,
                hasLocalIndex,
                missingByCourse,
                sample,
                plan.upToDateCount(),
                plan.notIndexableCount(),
                plan.count(FileClassification.MISSING_LOCALLY),
                plan.count(FileClassification.MISSING_IN_INDEX),
                plan.count(FileClassification.CHANGED),
                plan.count(FileClassification.KNOWN_INACCESSIBLE),
                plan.coursesFailed(),
                plan.computedAt().toEpochMilli());
    }
}

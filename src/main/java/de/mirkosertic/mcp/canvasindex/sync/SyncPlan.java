package de.mirkosertic.mcp.canvasindex.sync;

import de.mirkosertic.mcp.canvasindex.index.IndexedEntry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of a reconciliation. Derived on demand, never persisted.
 */
public record SyncPlan(
        /** One entry per remote file of the successfully inventoried courses. */
        List<PlannedFile> files,
        /** Index entries whose remote file is gone. Only removed by an explicit prune. */
        List<IndexedEntry> extraInIndex,
        /** Counts per course id, in inventory order. */
        Map<Long, CourseCounts> courseCounts,
        /** Courses whose inventory failed, with the error message. */
        Map<Long, String> coursesFailed,
        /** Number of courses in the inventory. */
        int courseCount,
        Instant computedAt,
        /** Wall-clock time in milliseconds spent planning. */
        long planningTimeMs
) {
    public SyncPlan {
        files = List.copyOf(files);
        extraInIndex = List.copyOf(extraInIndex);
        courseCounts = Collections.unmodifiableMap(new LinkedHashMap<>(courseCounts));
        coursesFailed = Map.copyOf(coursesFailed);
    }

    public long count(final FileClassification classification) {
        if (classification == FileClassification.EXTRA_IN_INDEX) {
            return extraInIndex.size();
        }
        return files.stream().filter(f -> f.classification() == classification).count();
    }

    /** Files mirrored and indexed at their remote fingerprint. */
    public long upToDateCount() {
        return count(FileClassification.UP_TO_DATE) - notIndexableCount();
    }

    public long notIndexableCount() {
        return files.stream().filter(PlannedFile::notIndexable).count();
    }

    /** Files that a sync pass would download or upload. */
    public long missingCount() {
        return count(FileClassification.MISSING_LOCALLY)
                + count(FileClassification.MISSING_IN_INDEX)
                + count(FileClassification.CHANGED);
    }

    public List<PlannedFile> filesNeedingWork() {
        return files.stream().filter(f -> f.classification().needsWork()).toList();
    }
}

package de.mirkosertic.mcp.canvasindex.sync;

/**
 * Classification counts of one course.
 */
public record CourseCounts(
        long courseId,
        String courseName,
        int remoteFiles,
        /** Mirrored and indexed at the remote fingerprint. */
        int upToDate,
        /** Mirrored at the remote fingerprint, but not indexable. */
        int notIndexable,
        int missingLocally,
        int missingInIndex,
        int changed,
        int knownInaccessible,
        int extraInIndex) {

    /** Files that a sync pass would download or upload. */
    public int missingCount() {
        return missingLocally + missingInIndex + changed;
    }
}

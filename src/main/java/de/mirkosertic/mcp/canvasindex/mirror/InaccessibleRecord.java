package de.mirkosertic.mcp.canvasindex.mirror;

import de.mirkosertic.mcp.canvasindex.inventory.FileKey;

import java.time.Instant;
import java.util.Objects;

/**
 * A remote file the caller was denied access to.
 *
 * @param remoteId      namespaced remote id
 * @param courseId      owning course
 * @param path          course-relative path at the time of the failure
 * @param reason        error reported by the LMS
 * @param firstSeenAt   first denied attempt
 * @param lastAttemptAt most recent denied attempt
 */
public record InaccessibleRecord(
        String remoteId,
        long courseId,
        String path,
        String reason,
        Instant firstSeenAt,
        Instant lastAttemptAt) {

    public InaccessibleRecord {
        Objects.requireNonNull(remoteId, "remoteId");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(firstSeenAt, "firstSeenAt");
        Objects.requireNonNull(lastAttemptAt, "lastAttemptAt");
        reason = reason == null ? "" : reason;
    }

    public FileKey key() {
        return new FileKey(courseId, remoteId);
    }
}

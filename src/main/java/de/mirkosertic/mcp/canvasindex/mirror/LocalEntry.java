package de.mirkosertic.mcp.canvasindex.mirror;

import de.mirkosertic.mcp.canvasindex.inventory.FileKey;

import java.time.Instant;

/**
 * A file in the local mirror.
 *
 * @param remoteId              namespaced remote id
 * @param courseId              owning course
 * @param localPath             path relative to the mirror directory, {@code /} separated
 * @param fingerprintAtDownload remote fingerprint the bytes were downloaded at
 * @param size                  size of the stored bytes
 * @param downloadedAt          when the bytes were stored
 * @param status                entry state
 */
public record LocalEntry(
        String remoteId,
        long courseId,
        String localPath,
        String fingerprintAtDownload,
        long size,
        Instant downloadedAt,
        EntryStatus status) {

    public FileKey key() {
        return new FileKey(courseId, remoteId);
    }

    public boolean isUsable() {
        return status != EntryStatus.INACCESSIBLE;
    }

    public LocalEntry withStatus(final EntryStatus newStatus) {
        return new LocalEntry(remoteId, courseId, localPath, fingerprintAtDownload, size, downloadedAt, newStatus);
    }
}

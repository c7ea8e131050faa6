package de.mirkosertic.mcp.canvasindex.index;

import de.mirkosertic.mcp.canvasindex.inventory.FileKey;

import java.time.Instant;

/**
 * A file uploaded to a course's search index.
 *
 * @param remoteId            namespaced remote id
 * @param courseId            owning course
 * @param indexId             the course's index
 * @param documentId          document id assigned by the index service
 * @param fingerprintAtUpload fingerprint of the uploaded bytes
 * @param uploadedAt          upload time
 */
public record IndexedEntry(
        String remoteId,
        long courseId,
        String indexId,
        String documentId,
        String fingerprintAtUpload,
        Instant uploadedAt) {

    public FileKey key() {
        return new FileKey(courseId, remoteId);
    }
}

package de.mirkosertic.mcp.canvasindex.inventory;

/**
 * Identity of a file across the remote inventory, the local mirror and the search index.
 */
public record FileKey(long courseId, String remoteId) {

    @Override
    public String toString() {
        return courseId + "/" + remoteId;
    }
}

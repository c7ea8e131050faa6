package de.mirkosertic.mcp.canvasindex.sync;

import de.mirkosertic.mcp.canvasindex.index.IndexedEntry;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import de.mirkosertic.mcp.canvasindex.mirror.LocalEntry;
import org.jspecify.annotations.Nullable;

/**
 * A remote file with its classification and the manifest entries it was compared against.
 */
public record PlannedFile(
        RemoteFile file,
        FileClassification classification,
        @Nullable LocalEntry localEntry,
        @Nullable IndexedEntry indexedEntry) {

    /**
     * Mirrored at the remote fingerprint but kept out of the index, because of its type, its size or an
     * earlier rejection by the index service.
     */
    public boolean notIndexable() {
        return classification == FileClassification.UP_TO_DATE && indexedEntry == null;
    }
}

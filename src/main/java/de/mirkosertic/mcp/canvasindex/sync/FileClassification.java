package de.mirkosertic.mcp.canvasindex.sync;

/**
 * Outcome of reconciling one file across the remote inventory, the local mirror and the search index.
 */
public enum FileClassification {
    UP_TO_DATE,
    MISSING_LOCALLY,
    MISSING_IN_INDEX,
    CHANGED,
    KNOWN_INACCESSIBLE,
    EXTRA_IN_INDEX;

    /**
     * @return true if a sync pass has work to do for a file in this class
     */
    public boolean needsWork() {
        return this == MISSING_LOCALLY || this == MISSING_IN_INDEX || this == CHANGED;
    }

    /**
     * @return true if a sync pass must download the file first
     */
    public boolean needsDownload() {
        return this == MISSING_LOCALLY || this == CHANGED;
    }
}

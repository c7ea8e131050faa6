package de.mirkosertic.mcp.canvasindex.mirror;

/**
 * State of a mirrored file.
 */
public enum EntryStatus {
    /** Bytes match the fingerprint recorded at download. */
    OK,
    /** Mirrored before, permission denied since. Not a usable local copy. */
    INACCESSIBLE,
    /** The remote fingerprint changed after the download. */
    STALE
}

package de.mirkosertic.mcp.canvasindex.mirror;

import de.mirkosertic.mcp.canvasindex.inventory.FileKey;

import java.io.IOException;

/**
 * No usable local copy exists for a file.
 */
public class MirrorEntryNotFoundException extends IOException {

    private final FileKey key;

    public MirrorEntryNotFoundException(final FileKey key, final String message) {
        super(message);
        this.key = key;
    }

    public FileKey getKey() {
        return key;
    }
}

package de.mirkosertic.mcp.canvasindex.canvas;

/**
 * Canvas course areas content is listed from.
 */
public enum ContentKind {
    FILES,
    MODULE_ITEMS,
    PAGES,
    ASSIGNMENTS
}

package de.mirkosertic.mcp.canvasindex.index;

import java.util.Map;

/**
 * A document as listed by the search index service.
 *
 * @param documentId service-assigned id
 * @param fileName   uploaded file name
 * @param metadata   attributes attached at upload
 */
public record IndexedDocument(String documentId, String fileName, Map<String, String> metadata) {

    public IndexedDocument {
        metadata = Map.copyOf(metadata);
    }
}

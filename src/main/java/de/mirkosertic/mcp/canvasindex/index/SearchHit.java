package de.mirkosertic.mcp.canvasindex.index;

import java.util.Map;

/**
 * One search result.
 *
 * @param documentId matching document
 * @param fileName   its file name
 * @param score      relevance as reported by the backend
 * @param snippet    matching text, may be empty
 * @param metadata   attributes attached at upload
 */
public record SearchHit(String documentId, String fileName, double score, String snippet,
                        Map<String, String> metadata) {

    public SearchHit {
        metadata = Map.copyOf(metadata);
    }
}

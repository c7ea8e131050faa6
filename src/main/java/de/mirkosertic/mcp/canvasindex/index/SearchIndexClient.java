package de.mirkosertic.mcp.canvasindex.index;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * A semantic search index service holding one index per course.
 */
public interface SearchIndexClient {

    /**
     * Create a new index.
     *
     * @return the id of the created index
     */
    String createIndex(long courseId, String name) throws IOException;

    /**
     * Add a document to an index.
     *
     * @return the id of the created document
     * @throws UnsupportedFormatException if the service rejects the content type
     */
    String uploadDocument(String indexId, String fileName, byte[] content, Map<String, String> metadata)
            throws IOException;

    List<IndexedDocument> listDocuments(String indexId) throws IOException;

    void deleteDocument(String indexId, String documentId) throws IOException;

    List<SearchHit> search(String indexId, String query, int maxResults) throws IOException;

    /**
     * @return short backend name for status output
     */
    String backendName();
}

package de.mirkosertic.mcp.canvasindex.mcp.dto;

/**
 * Response DTO for the pruneExtraInIndex tool.
 */
public record PruneExtraInIndexResponse(
        boolean success,
        Integer documentsRemoved,
        String message,
        String error
) {
    public static PruneExtraInIndexResponse success(final int removed) {
        return new PruneExtraInIndexResponse(true, removed,
                "Removed " + removed + " document(s) without a Canvas counterpart.", null);
    }

    public static PruneExtraInIndexResponse notConfirmed() {
        return new PruneExtraInIndexResponse(false, null, null,
                "Operation not confirmed. Set confirm=true to proceed. "
                        + "WARNING: This deletes documents from the search index.");
    }

    public static PruneExtraInIndexResponse error(final String errorMessage) {
        return new PruneExtraInIndexResponse(false, null, null, errorMessage);
    }
}

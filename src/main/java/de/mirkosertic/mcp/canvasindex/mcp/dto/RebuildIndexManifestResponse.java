package de.mirkosertic.mcp.canvasindex.mcp.dto;

/**
 * Response DTO for the rebuildIndexManifest tool.
 */
public record RebuildIndexManifestResponse(
        boolean success,
        Long courseId,
        Integer documentsImported,
        String message,
        String error
) {
    public static RebuildIndexManifestResponse success(final long courseId, final int imported) {
        return new RebuildIndexManifestResponse(true, courseId, imported,
                "Imported " + imported + " document(s) from the index service.", null);
    }

    public static RebuildIndexManifestResponse notConfirmed() {
        return new RebuildIndexManifestResponse(false, null, null, null,
                "Operation not confirmed. Set confirm=true to proceed.");
    }

    public static RebuildIndexManifestResponse error(final String errorMessage) {
        return new RebuildIndexManifestResponse(false, null, null, null, errorMessage);
    }
}

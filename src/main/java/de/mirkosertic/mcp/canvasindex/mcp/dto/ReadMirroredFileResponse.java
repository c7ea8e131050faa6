package de.mirkosertic.mcp.canvasindex.mcp.dto;

/**
 * Response DTO for the readMirroredFile tool.
 */
public record ReadMirroredFileResponse(
        boolean success,
        Long courseId,
        String remoteId,
        String localPath,
        String text,
        Integer characters,
        Boolean truncated,
        String error
) {
    public static ReadMirroredFileResponse success(final long courseId, final String remoteId,
                                                   final String localPath, final String text,
                                                   final boolean truncated) {
        return new ReadMirroredFileResponse(true, courseId, remoteId, localPath, text, text.length(),
                truncated, null);
    }

    public static ReadMirroredFileResponse error(final String errorMessage) {
        return new ReadMirroredFileResponse(false, null, null, null, null, null, null, errorMessage);
    }
}

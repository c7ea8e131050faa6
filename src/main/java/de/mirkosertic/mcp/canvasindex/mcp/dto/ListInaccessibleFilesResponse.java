package de.mirkosertic.mcp.canvasindex.mcp.dto;

import de.mirkosertic.mcp.canvasindex.mirror.InaccessibleRecord;

import java.util.List;

/**
 * Response DTO for the listInaccessibleFiles tool.
 */
public record ListInaccessibleFilesResponse(
        boolean success,
        Integer count,
        List<InaccessibleFile> files,
        String error
) {
    public record InaccessibleFile(
            long courseId,
            String remoteId,
            String path,
            String reason,
            String firstSeenAt,
            String lastAttemptAt
    ) {
        static InaccessibleFile from(final InaccessibleRecord record) {
            return new InaccessibleFile(record.courseId(), record.remoteId(), record.path(), record.reason(),
                    record.firstSeenAt().toString(), record.lastAttemptAt().toString());
        }
    }

    public static ListInaccessibleFilesResponse success(final List<InaccessibleRecord> records) {
        final List<InaccessibleFile> files = records.stream().map(InaccessibleFile::from).toList();
        return new ListInaccessibleFilesResponse(true, files.size(), files, null);
    }

    public static ListInaccessibleFilesResponse error(final String errorMessage) {
        return new ListInaccessibleFilesResponse(false, null, List.of(), errorMessage);
    }
}

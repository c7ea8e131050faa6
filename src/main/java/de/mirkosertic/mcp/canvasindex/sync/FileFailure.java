package de.mirkosertic.mcp.canvasindex.sync;

/**
 * A file that could not be fully synchronized in a run.
 *
 * @param courseId owning course
 * @param remoteId namespaced remote id
 * @param path     course-relative path
 * @param kind     failure category
 * @param phase    {@code download} or {@code upload}
 * @param message  error message
 */
public record FileFailure(long courseId, String remoteId, String path, FailureKind kind, String phase,
                          String message) {
}

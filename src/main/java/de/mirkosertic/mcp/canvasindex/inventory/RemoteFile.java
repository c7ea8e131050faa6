package de.mirkosertic.mcp.canvasindex.inventory;

import de.mirkosertic.mcp.canvasindex.canvas.ContentKind;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A file as the LMS currently reports it. Rebuilt on every inventory fetch.
 *
 * @param id          namespaced remote id ({@code file:42}, {@code page:intro}, {@code assignment:7})
 * @param courseId    owning course
 * @param courseName  course folder name, {@code <course_code>_<name>}
 * @param path        course-relative path, segments sanitized
 * @param size        size in bytes, 0 when unknown
 * @param fingerprint provider change token
 * @param modifiedAt  last modification reported by the LMS
 * @param kind        area the file was first listed from
 */
public record RemoteFile(
        String id,
        long courseId,
        String courseName,
        String path,
        long size,
        String fingerprint,
        @Nullable Instant modifiedAt,
        ContentKind kind) {

    public FileKey key() {
        return new FileKey(courseId, id);
    }

    /**
     * @return the last path segment
     */
    public String fileName() {
        final int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}

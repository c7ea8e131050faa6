package de.mirkosertic.mcp.canvasindex.canvas;

import java.util.List;

/**
 * Read access to the Canvas LMS REST API.
 */
public interface CanvasClient {

    /**
     * List the caller's active course enrollments.
     */
    List<CanvasCourse> listCourses() throws CanvasApiException;

    /**
     * List the content of one course area. Module items of type File, Page and Assignment are
     * returned with their module as {@link CanvasContent#containerName()}; other item types are skipped.
     */
    List<CanvasContent> listCourseContent(long courseId, ContentKind kind) throws CanvasApiException;

    /**
     * Metadata of a single file, including its signed download url.
     */
    CanvasContent getFile(long courseId, long fileId) throws CanvasApiException;

    /**
     * A wiki page including its HTML body.
     */
    CanvasContent getPage(long courseId, String pageUrl) throws CanvasApiException;

    /**
     * An assignment including its description and attachments.
     */
    CanvasContent getAssignment(long courseId, long assignmentId) throws CanvasApiException;

    /**
     * Download the bytes behind a namespaced content id. Files are fetched through their
     * signed url, pages and assignments yield their HTML as UTF-8.
     */
    byte[] downloadContent(long courseId, String contentId) throws CanvasApiException;
}

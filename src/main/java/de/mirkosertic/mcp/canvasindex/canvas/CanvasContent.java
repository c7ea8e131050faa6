package de.mirkosertic.mcp.canvasindex.canvas;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One piece of course content as listed by Canvas.
 * <p>
 * Content ids are namespaced by type so identifiers from different areas never collide:
 * {@code file:<id>}, {@code page:<url>}, {@code assignment:<id>}.
 *
 * @param contentId     namespaced content id
 * @param kind          area the content was listed from
 * @param title         display name or title
 * @param updatedAt     Canvas {@code updated_at} timestamp, if any
 * @param size          size in bytes, 0 when unknown
 * @param downloadUrl   signed download url (files only)
 * @param containerName enclosing module name (module items only)
 * @param html          inline HTML body (pages and assignment descriptions)
 * @param attachments   file attachments (assignments only)
 */
public record CanvasContent(
        String contentId,
        ContentKind kind,
        String title,
        @Nullable String updatedAt,
        long size,
        @Nullable String downloadUrl,
        @Nullable String containerName,
        @Nullable String html,
        List<CanvasContent> attachments) {

    public static final String FILE_PREFIX = "file:";
    public static final String PAGE_PREFIX = "page:";
    public static final String ASSIGNMENT_PREFIX = "assignment:";

    public CanvasContent {
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    public boolean isFile() {
        return contentId.startsWith(FILE_PREFIX);
    }

    public boolean isPage() {
        return contentId.startsWith(PAGE_PREFIX);
    }

    public boolean isAssignment() {
        return contentId.startsWith(ASSIGNMENT_PREFIX);
    }

    public static String fileId(final long id) {
        return FILE_PREFIX + id;
    }

    public static String pageId(final String pageUrl) {
        return PAGE_PREFIX + pageUrl;
    }

    public static String assignmentId(final long id) {
        return ASSIGNMENT_PREFIX + id;
    }

    /**
     * Strip the type prefix from a namespaced content id.
     */
    public static String localPart(final String contentId) {
        final int colon = contentId.indexOf(':');
        return colon >= 0 ? contentId.substring(colon + 1) : contentId;
    }
}

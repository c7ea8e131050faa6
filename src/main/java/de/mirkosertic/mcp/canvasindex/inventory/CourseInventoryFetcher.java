package de.mirkosertic.mcp.canvasindex.inventory;

import com.google.common.hash.Hashing;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasApiException;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasClient;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasContent;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasCourse;
import de.mirkosertic.mcp.canvasindex.canvas.ContentKind;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Enumerates the remote files of the caller's courses.
 * <p>
 * Per course the areas are walked in the order modules, pages, assignments, files area. Every
 * piece of content is keyed by {@code (courseId, namespaced id)} and the first occurrence wins,
 * so a file that is linked from a module and also listed in the files area is reported once,
 * under its module path. Files linked from page or assignment HTML are resolved and added too.
 */
public class CourseInventoryFetcher {

    private static final Logger logger = LoggerFactory.getLogger(CourseInventoryFetcher.class);

    private static final Pattern FILE_LINK = Pattern.compile("/files/(\\d+)(?:/download)?");
    static final String UNRESOLVED_FINGERPRINT = "unresolved";

    private final CanvasClient canvasClient;

    public CourseInventoryFetcher(final CanvasClient canvasClient) {
        this.canvasClient = canvasClient;
    }

    /**
     * Fetch the inventory of all active courses, or of the given subset.
     *
     * @param courseIds restrict to these course ids; null or empty means all
     * @throws RemoteUnavailableException if the course list cannot be fetched or every course fails
     * @throws PartialInventoryException  if some courses fail; carries the usable remainder
     */
    public Inventory fetchInventory(@Nullable final Collection<Long> courseIds)
            throws RemoteUnavailableException, PartialInventoryException {
        final long startTime = System.currentTimeMillis();

        final List<CanvasCourse> allCourses;
        try {
            allCourses = canvasClient.listCourses();
        } catch (final CanvasApiException e) {
            throw new RemoteUnavailableException("Cannot list Canvas courses: " + e.getMessage(), e);
        }

        final List<CanvasCourse> courses = selectCourses(allCourses, courseIds);
        final List<RemoteFile> files = new ArrayList<>();
        final Map<Long, String> failed = new LinkedHashMap<>();

        for (final CanvasCourse course : courses) {
            try {
                final Collection<RemoteFile> courseFiles = fetchCourse(course);
                files.addAll(courseFiles);
                logger.info("Course {} ({}): {} remote files", course.id(), course.name(), courseFiles.size());
            } catch (final CanvasApiException e) {
                logger.warn("Inventory of course {} ({}) failed: {}", course.id(), course.name(), e.getMessage());
                failed.put(course.id(), e.getMessage());
            }
        }

        final Inventory inventory = new Inventory(courses, files, failed);
        final long duration = System.currentTimeMillis() - startTime;
        logger.info("Inventory fetched in {}ms: courses={}, files={}, failedCourses={}",
                duration, courses.size(), files.size(), failed.size());

        if (!courses.isEmpty() && failed.size() == courses.size()) {
            throw new RemoteUnavailableException("Inventory failed for every course: " + failed);
        }
        if (!failed.isEmpty()) {
            throw new PartialInventoryException(inventory);
        }
        return inventory;
    }

    private List<CanvasCourse> selectCourses(final List<CanvasCourse> allCourses,
                                             @Nullable final Collection<Long> courseIds) {
        if (courseIds == null || courseIds.isEmpty()) {
            return allCourses;
        }
        final List<CanvasCourse> selected = new ArrayList<>();
        final Set<Long> known = new LinkedHashSet<>();
        for (final CanvasCourse course : allCourses) {
            known.add(course.id());
            if (courseIds.contains(course.id())) {
                selected.add(course);
            }
        }
        for (final Long requested : courseIds) {
            if (!known.contains(requested)) {
                logger.warn("Requested course {} is not among the active enrollments, ignoring", requested);
            }
        }
        return selected;
    }

    // ==================== Per course ====================

    Collection<RemoteFile> fetchCourse(final CanvasCourse course) throws CanvasApiException {
        final CourseCollector collector = new CourseCollector(course);

        for (final CanvasContent item : listArea(course, ContentKind.MODULE_ITEMS)) {
            final String container = "Modules/" + FileNames.sanitize(item.containerName());
            if (item.isFile()) {
                collector.addResolvedFile(Long.parseLong(CanvasContent.localPart(item.contentId())),
                        container, item.title(), ContentKind.MODULE_ITEMS);
            } else if (item.isPage()) {
                collector.addPage(CanvasContent.localPart(item.contentId()), item.title(), container,
                        ContentKind.MODULE_ITEMS);
            } else if (item.isAssignment()) {
                collector.addAssignment(Long.parseLong(CanvasContent.localPart(item.contentId())), item.title(),
                        container, ContentKind.MODULE_ITEMS);
            }
        }

        for (final CanvasContent page : listArea(course, ContentKind.PAGES)) {
            if (page.html() != null) {
                collector.addHtml(page, page.title() + ".html", "Pages", ContentKind.PAGES);
            } else {
                collector.addPage(CanvasContent.localPart(page.contentId()), page.title(), "Pages", ContentKind.PAGES);
            }
        }

        for (final CanvasContent assignment : listArea(course, ContentKind.ASSIGNMENTS)) {
            collector.addAssignmentContent(assignment, assignment.title(), "Assignments", ContentKind.ASSIGNMENTS);
        }

        for (final CanvasContent file : listArea(course, ContentKind.FILES)) {
            collector.addFile(file, "Files", ContentKind.FILES);
        }

        return collector.files.values();
    }

    /**
     * List one area; an area the caller may not see (401/403/404) is skipped, other failures fail the course.
     */
    private List<CanvasContent> listArea(final CanvasCourse course, final ContentKind kind) throws CanvasApiException {
        try {
            return canvasClient.listCourseContent(course.id(), kind);
        } catch (final CanvasApiException e) {
            if (e.getReason() == CanvasApiException.Reason.UNAUTHORIZED
                    || e.getReason() == CanvasApiException.Reason.NOT_FOUND) {
                logger.warn("Skipping {} of course {} ({}): {}", kind, course.id(), course.name(), e.getMessage());
                return List.of();
            }
            throw e;
        }
    }

    /**
     * Accumulates the files of one course with first-occurrence-wins semantics.
     */
    private final class CourseCollector {

        private final CanvasCourse course;
        private final String courseFolder;
        private final Map<String, RemoteFile> files = new LinkedHashMap<>();

        CourseCollector(final CanvasCourse course) {
            this.course = course;
            this.courseFolder = FileNames.courseFolder(course);
        }

        void addResolvedFile(final long fileId, final String container, final String fallbackTitle,
                             final ContentKind kind) throws CanvasApiException {
            if (files.containsKey(CanvasContent.fileId(fileId))) {
                return;
            }
            try {
                addFile(canvasClient.getFile(course.id(), fileId), container, kind);
            } catch (final CanvasApiException e) {
                if (e.getReason() == CanvasApiException.Reason.UNAUTHORIZED) {
                    // Listed but locked: keep it so the download attempt records it as inaccessible
                    logger.debug("File {} in course {} is not readable, listing it unresolved", fileId, course.id());
                    put(new RemoteFile(CanvasContent.fileId(fileId), course.id(), courseFolder,
                            container + "/" + FileNames.sanitize(fallbackTitle), 0, UNRESOLVED_FINGERPRINT, null, kind));
                } else if (e.getReason() == CanvasApiException.Reason.NOT_FOUND) {
                    logger.debug("File {} in course {} no longer exists", fileId, course.id());
                } else {
                    throw e;
                }
            }
        }

        void addFile(final CanvasContent file, final String container, final ContentKind kind) {
            final String fingerprint = file.updatedAt() != null
                    ? file.updatedAt() + "|" + file.size()
                    : sha256(file.contentId() + "|" + file.size() + "|" + file.title());
            put(new RemoteFile(file.contentId(), course.id(), courseFolder,
                    container + "/" + FileNames.sanitize(file.title()),
                    file.size(), fingerprint, parseInstant(file.updatedAt()), kind));
        }

        void addPage(final String pageUrl, final String title, final String container, final ContentKind kind)
                throws CanvasApiException {
            if (files.containsKey(CanvasContent.pageId(pageUrl))) {
                return;
            }
            final CanvasContent page;
            try {
                page = canvasClient.getPage(course.id(), pageUrl);
            } catch (final CanvasApiException e) {
                if (e.isTransient()) {
                    throw e;
                }
                logger.debug("Page {} of course {} skipped: {}", pageUrl, course.id(), e.getMessage());
                return;
            }
            addHtml(page, title + ".html", container, kind);
        }

        void addAssignment(final long assignmentId, final String title, final String container,
                           final ContentKind kind) throws CanvasApiException {
            if (files.containsKey(CanvasContent.assignmentId(assignmentId))) {
                return;
            }
            final CanvasContent assignment;
            try {
                assignment = canvasClient.getAssignment(course.id(), assignmentId);
            } catch (final CanvasApiException e) {
                if (e.isTransient()) {
                    throw e;
                }
                logger.debug("Assignment {} of course {} skipped: {}", assignmentId, course.id(), e.getMessage());
                return;
            }
            addAssignmentContent(assignment, title, container, kind);
        }

        void addAssignmentContent(final CanvasContent assignment, final String title, final String container,
                                  final ContentKind kind) throws CanvasApiException {
            addHtml(assignment, title + "_description.html", container, kind);
            for (final CanvasContent attachment : assignment.attachments()) {
                addFile(attachment, container, kind);
            }
        }

        /**
         * Add an HTML document (page body or assignment description) and the files it links to.
         */
        void addHtml(final CanvasContent content, final String fileName, final String container,
                     final ContentKind kind) throws CanvasApiException {
            final String html = content.html();
            if (html == null || html.isBlank()) {
                return;
            }
            final byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
            final String fingerprint = content.updatedAt() != null ? content.updatedAt() : sha256(html);
            put(new RemoteFile(content.contentId(), course.id(), courseFolder,
                    container + "/" + FileNames.sanitize(fileName),
                    bytes.length, fingerprint, parseInstant(content.updatedAt()), kind));

            for (final long linkedId : linkedFileIds(html)) {
                addResolvedLink(linkedId, container, kind);
            }
        }

        private void addResolvedLink(final long fileId, final String container, final ContentKind kind)
                throws CanvasApiException {
            if (files.containsKey(CanvasContent.fileId(fileId))) {
                return;
            }
            try {
                addFile(canvasClient.getFile(course.id(), fileId), container, kind);
            } catch (final CanvasApiException e) {
                if (e.isTransient()) {
                    throw e;
                }
                // Links may point into other courses or to deleted files
                logger.debug("Linked file {} in course {} not resolvable: {}", fileId, course.id(), e.getMessage());
            }
        }

        private void put(final RemoteFile file) {
            files.putIfAbsent(file.id(), file);
        }
    }

    // ==================== Helpers ====================

    /**
     * Canvas file ids referenced from an HTML body, in order of appearance.
     */
    static Set<Long> linkedFileIds(@Nullable final String html) {
        final Set<Long> ids = new LinkedHashSet<>();
        if (html == null || html.isEmpty()) {
            return ids;
        }
        final Matcher matcher = FILE_LINK.matcher(html);
        while (matcher.find()) {
            try {
                ids.add(Long.parseLong(matcher.group(1)));
            } catch (final NumberFormatException e) {
                logger.debug("Ignoring oversized file id in link: {}", matcher.group(1));
            }
        }
        return ids;
    }

    static String sha256(final String content) {
        return "sha256:" + Hashing.sha256().hashString(content, StandardCharsets.UTF_8);
    }

    private static @Nullable Instant parseInstant(@Nullable final String timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return Instant.parse(timestamp);
        } catch (final DateTimeParseException e) {
            logger.debug("Unparseable Canvas timestamp: {}", timestamp);
            return null;
        }
    }
}

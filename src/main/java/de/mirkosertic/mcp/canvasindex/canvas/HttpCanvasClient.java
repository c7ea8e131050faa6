package de.mirkosertic.mcp.canvasindex.canvas;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.canvasindex.config.ApplicationConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link CanvasClient} over the Canvas REST API using the JDK HTTP client.
 * <p>
 * List endpoints are paginated with {@code per_page} and followed through the
 * {@code Link: <...>; rel="next"} response header until exhausted.
 */
public class HttpCanvasClient implements CanvasClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpCanvasClient.class);

    private final String baseUrl;
    private final String accessToken;
    private final int pageSize;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpCanvasClient(final String baseUrl, final String accessToken, final int pageSize,
                            final Duration requestTimeout, final ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.accessToken = accessToken;
        this.pageSize = pageSize;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public static HttpCanvasClient fromConfig(final ApplicationConfig config, final ObjectMapper objectMapper) {
        return new HttpCanvasClient(
                config.getCanvasUrl(),
                config.getCanvasAccessToken(),
                config.getCanvasPageSize(),
                Duration.ofMillis(config.getCanvasRequestTimeoutMs()),
                objectMapper);
    }

    @Override
    public List<CanvasCourse> listCourses() throws CanvasApiException {
        final List<JsonNode> nodes = getAllPages(apiUrl("/courses") + "?enrollment_state=active&per_page=" + pageSize);
        final List<CanvasCourse> courses = new ArrayList<>();
        for (final JsonNode node : nodes) {
            final long id = node.path("id").asLong();
            // Courses the user can no longer access come back as stubs with access_restricted_by_date
            if (node.path("access_restricted_by_date").asBoolean(false)) {
                logger.debug("Skipping date-restricted course {}", id);
                continue;
            }
            courses.add(new CanvasCourse(id,
                    textOr(node, "name", "Course_" + id),
                    text(node, "course_code")));
        }
        logger.info("Found {} active Canvas courses", courses.size());
        return courses;
    }

    @Override
    public List<CanvasContent> listCourseContent(final long courseId, final ContentKind kind) throws CanvasApiException {
        return switch (kind) {
            case FILES -> listFiles(courseId);
            case MODULE_ITEMS -> listModuleItems(courseId);
            case PAGES -> listPages(courseId);
            case ASSIGNMENTS -> listAssignments(courseId);
        };
    }

    @Override
    public CanvasContent getFile(final long courseId, final long fileId) throws CanvasApiException {
        return toFile(getJson(apiUrl("/files/" + fileId)), ContentKind.FILES, null);
    }

    @Override
    public CanvasContent getPage(final long courseId, final String pageUrl) throws CanvasApiException {
        return toPage(getJson(apiUrl("/courses/" + courseId + "/pages/" + encode(pageUrl))));
    }

    @Override
    public CanvasContent getAssignment(final long courseId, final long assignmentId) throws CanvasApiException {
        return toAssignment(getJson(apiUrl("/courses/" + courseId + "/assignments/" + assignmentId)));
    }

    @Override
    public byte[] downloadContent(final long courseId, final String contentId) throws CanvasApiException {
        final String localPart = CanvasContent.localPart(contentId);
        if (contentId.startsWith(CanvasContent.PAGE_PREFIX)) {
            return htmlBytes(getPage(courseId, localPart));
        }
        if (contentId.startsWith(CanvasContent.ASSIGNMENT_PREFIX)) {
            return htmlBytes(getAssignment(courseId, parseId(contentId, localPart)));
        }
        if (contentId.startsWith(CanvasContent.FILE_PREFIX)) {
            final CanvasContent file = getFile(courseId, parseId(contentId, localPart));
            if (file.downloadUrl() == null || file.downloadUrl().isBlank()) {
                // Canvas hides the url of locked files
                throw new CanvasApiException(CanvasApiException.Reason.UNAUTHORIZED, 403,
                        "No download url for " + contentId + " in course " + courseId);
            }
            // The signed url carries its own verifier, so no bearer token is sent
            final HttpRequest request = HttpRequest.newBuilder(URI.create(file.downloadUrl()))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            final HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray());
            return response.body();
        }
        throw new CanvasApiException(CanvasApiException.Reason.NOT_FOUND, 404, "Unknown content id: " + contentId);
    }

    // ==================== Listing ====================

    private List<CanvasContent> listFiles(final long courseId) throws CanvasApiException {
        final List<CanvasContent> result = new ArrayList<>();
        for (final JsonNode node : getAllPages(apiUrl("/courses/" + courseId + "/files") + "?per_page=" + pageSize)) {
            result.add(toFile(node, ContentKind.FILES, null));
        }
        return result;
    }

    private List<CanvasContent> listModuleItems(final long courseId) throws CanvasApiException {
        final List<CanvasContent> result = new ArrayList<>();
        final List<JsonNode> modules = getAllPages(
                apiUrl("/courses/" + courseId + "/modules") + "?include%5B%5D=items&per_page=" + pageSize);
        for (final JsonNode module : modules) {
            final long moduleId = module.path("id").asLong();
            final String moduleName = textOr(module, "name", "Module_" + moduleId);

            // Canvas omits inline items for large modules
            List<JsonNode> items = new ArrayList<>();
            module.path("items").forEach(items::add);
            if (items.isEmpty()) {
                items = getAllPages(apiUrl("/courses/" + courseId + "/modules/" + moduleId + "/items")
                        + "?per_page=" + pageSize);
            }

            for (final JsonNode item : items) {
                final String type = item.path("type").asText("");
                final String title = textOr(item, "title", "unnamed");
                final String contentId;
                switch (type) {
                    case "File" -> contentId = CanvasContent.fileId(item.path("content_id").asLong());
                    case "Page" -> {
                        final String pageUrl = text(item, "page_url");
                        if (pageUrl == null) {
                            continue;
                        }
                        contentId = CanvasContent.pageId(pageUrl);
                    }
                    case "Assignment" -> contentId = CanvasContent.assignmentId(item.path("content_id").asLong());
                    default -> {
                        logger.debug("Skipping module item '{}' of type {}", title, type);
                        continue;
                    }
                }
                result.add(new CanvasContent(contentId, ContentKind.MODULE_ITEMS, title,
                        null, 0, null, moduleName, null, List.of()));
            }
        }
        return result;
    }

    private List<CanvasContent> listPages(final long courseId) throws CanvasApiException {
        final List<CanvasContent> result = new ArrayList<>();
        for (final JsonNode node : getAllPages(apiUrl("/courses/" + courseId + "/pages") + "?per_page=" + pageSize)) {
            result.add(toPage(node));
        }
        return result;
    }

    private List<CanvasContent> listAssignments(final long courseId) throws CanvasApiException {
        final List<CanvasContent> result = new ArrayList<>();
        for (final JsonNode node : getAllPages(apiUrl("/courses/" + courseId + "/assignments") + "?per_page=" + pageSize)) {
            result.add(toAssignment(node));
        }
        return result;
    }

    // ==================== Mapping ====================

    private CanvasContent toFile(final JsonNode node, final ContentKind kind, @Nullable final String container) {
        final long id = node.path("id").asLong();
        final String title = text(node, "display_name") != null
                ? text(node, "display_name")
                : textOr(node, "filename", "unnamed");
        return new CanvasContent(CanvasContent.fileId(id), kind, title,
                text(node, "updated_at"), node.path("size").asLong(0), text(node, "url"),
                container, null, List.of());
    }

    private CanvasContent toPage(final JsonNode node) {
        final String pageUrl = textOr(node, "url", String.valueOf(node.path("page_id").asLong()));
        return new CanvasContent(CanvasContent.pageId(pageUrl), ContentKind.PAGES,
                textOr(node, "title", pageUrl), text(node, "updated_at"), 0, null, null,
                text(node, "body"), List.of());
    }

    private CanvasContent toAssignment(final JsonNode node) {
        final long id = node.path("id").asLong();
        final List<CanvasContent> attachments = new ArrayList<>();
        node.path("attachments").forEach(a -> attachments.add(toFile(a, ContentKind.ASSIGNMENTS, null)));
        return new CanvasContent(CanvasContent.assignmentId(id), ContentKind.ASSIGNMENTS,
                textOr(node, "name", "Assignment_" + id), text(node, "updated_at"), 0, null, null,
                text(node, "description"), attachments);
    }

    // ==================== HTTP ====================

    private JsonNode getJson(final String url) throws CanvasApiException {
        final HttpResponse<String> response = send(authorizedGet(url), HttpResponse.BodyHandlers.ofString());
        return parse(url, response.body());
    }

    /**
     * Fetch a list endpoint and all following pages.
     */
    List<JsonNode> getAllPages(final String firstUrl) throws CanvasApiException {
        final List<JsonNode> result = new ArrayList<>();
        String url = firstUrl;
        int pages = 0;
        while (url != null) {
            final HttpResponse<String> response = send(authorizedGet(url), HttpResponse.BodyHandlers.ofString());
            final JsonNode body = parse(url, response.body());
            if (body.isArray()) {
                body.forEach(result::add);
            } else {
                result.add(body);
            }
            pages++;
            url = nextLink(response.headers().firstValue("Link").orElse(null));
        }
        logger.debug("Fetched {} items over {} page(s) from {}", result.size(), pages, firstUrl);
        return result;
    }

    private HttpRequest authorizedGet(final String url) {
        return HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + accessToken)
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    private <T> HttpResponse<T> send(final HttpRequest request, final HttpResponse.BodyHandler<T> handler)
            throws CanvasApiException {
        final HttpResponse<T> response;
        try {
            response = httpClient.send(request, handler);
        } catch (final HttpTimeoutException e) {
            throw new CanvasApiException(CanvasApiException.Reason.UNAVAILABLE,
                    "Timeout calling " + request.uri(), e);
        } catch (final IOException e) {
            throw new CanvasApiException(CanvasApiException.Reason.UNAVAILABLE,
                    "I/O error calling " + request.uri() + ": " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CanvasApiException(CanvasApiException.Reason.UNAVAILABLE,
                    "Interrupted calling " + request.uri(), e);
        }

        final int status = response.statusCode();
        if (status < 200 || status >= 300) {
            final CanvasApiException.Reason reason = CanvasApiException.reasonForStatus(status);
            logger.debug("Canvas request {} failed with HTTP {} ({})", request.uri(), status, reason);
            throw new CanvasApiException(reason, status, "HTTP " + status + " for " + request.uri());
        }
        return response;
    }

    private JsonNode parse(final String url, final String body) throws CanvasApiException {
        try {
            return objectMapper.readTree(body);
        } catch (final IOException e) {
            throw new CanvasApiException(CanvasApiException.Reason.UNAVAILABLE,
                    "Malformed JSON from " + url, e);
        }
    }

    /**
     * Extract the {@code rel="next"} target from an RFC 5988 Link header.
     */
    static @Nullable String nextLink(@Nullable final String linkHeader) {
        if (linkHeader == null || linkHeader.isBlank()) {
            return null;
        }
        for (final String link : linkHeader.split(",")) {
            if (link.contains("rel=\"next\"")) {
                final int start = link.indexOf('<');
                final int end = link.indexOf('>');
                if (start >= 0 && end > start) {
                    return link.substring(start + 1, end);
                }
            }
        }
        return null;
    }

    // ==================== Helpers ====================

    private String apiUrl(final String path) {
        return baseUrl + "/api/v1" + path;
    }

    private static byte[] htmlBytes(final CanvasContent content) {
        return content.html() != null ? content.html().getBytes(StandardCharsets.UTF_8) : new byte[0];
    }

    private static long parseId(final String contentId, final String localPart) throws CanvasApiException {
        try {
            return Long.parseLong(localPart);
        } catch (final NumberFormatException e) {
            throw new CanvasApiException(CanvasApiException.Reason.NOT_FOUND, 404, "Malformed content id: " + contentId);
        }
    }

    private static String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static @Nullable String text(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static String textOr(final JsonNode node, final String field, final String fallback) {
        final String value = text(node, field);
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static String stripTrailingSlash(@Nullable final String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

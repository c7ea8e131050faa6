package de.mirkosertic.mcp.canvasindex.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.canvasindex.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link SearchIndexClient} backed by OpenAI vector stores. Each course index is a vector store;
 * documents are uploaded as files with {@code purpose=assistants} and attached with their metadata
 * as vector store file attributes.
 */
public class OpenAiVectorStoreClient implements SearchIndexClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiVectorStoreClient.class);

    static final int MAX_NAME_LENGTH = 100;
    private static final int LIST_PAGE_SIZE = 100;

    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiVectorStoreClient(final String baseUrl, final String apiKey, final Duration requestTimeout,
                                   final ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
    }

    public static OpenAiVectorStoreClient fromConfig(final ApplicationConfig config, final ObjectMapper objectMapper) {
        return new OpenAiVectorStoreClient(config.getOpenAiBaseUrl(), config.getOpenAiApiKey(),
                Duration.ofMillis(config.getCanvasRequestTimeoutMs()), objectMapper);
    }

    @Override
    public String createIndex(final long courseId, final String name) throws IOException {
        final String truncated = name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
        final ObjectNode body = objectMapper.createObjectNode();
        body.put("name", truncated);
        body.putObject("metadata").put("course_id", String.valueOf(courseId));

        final JsonNode response = sendJson(jsonRequest("/vector_stores").POST(bodyOf(body)).build());
        final String id = response.path("id").asText();
        logger.info("Created vector store {} ('{}') for course {}", id, truncated, courseId);
        return id;
    }

    @Override
    public String uploadDocument(final String indexId, final String fileName, final byte[] content,
                                 final Map<String, String> metadata) throws IOException {
        final String fileId = uploadFile(fileName, content);

        final ObjectNode body = objectMapper.createObjectNode();
        body.put("file_id", fileId);
        final ObjectNode attributes = body.putObject("attributes");
        metadata.forEach(attributes::put);
        sendJson(jsonRequest("/vector_stores/" + indexId + "/files").POST(bodyOf(body)).build());

        logger.debug("Attached file {} ({}) to vector store {}", fileId, fileName, indexId);
        return fileId;
    }

    @Override
    public List<IndexedDocument> listDocuments(final String indexId) throws IOException {
        final List<IndexedDocument> result = new ArrayList<>();
        String after = null;
        boolean hasMore = true;
        while (hasMore) {
            String path = "/vector_stores/" + indexId + "/files?limit=" + LIST_PAGE_SIZE;
            if (after != null) {
                path += "&after=" + URLEncoder.encode(after, StandardCharsets.UTF_8);
            }
            final JsonNode page = sendJson(jsonRequest(path).GET().build());
            for (final JsonNode file : page.path("data")) {
                final Map<String, String> attributes = attributesOf(file.path("attributes"));
                result.add(new IndexedDocument(file.path("id").asText(),
                        attributes.getOrDefault(IndexUploader.META_FILE_NAME, ""), attributes));
            }
            hasMore = page.path("has_more").asBoolean(false);
            after = page.path("last_id").asText(null);
            if (after == null) {
                hasMore = false;
            }
        }
        logger.debug("Vector store {} lists {} files", indexId, result.size());
        return result;
    }

    @Override
    public void deleteDocument(final String indexId, final String documentId) throws IOException {
        sendJson(jsonRequest("/vector_stores/" + indexId + "/files/" + documentId).DELETE().build());
        try {
            sendJson(jsonRequest("/files/" + documentId).DELETE().build());
        } catch (final SearchIndexException e) {
            // The store no longer references it; an orphaned upload only costs storage
            logger.warn("Detached file {} from {} but could not delete it: {}", documentId, indexId, e.getMessage());
        }
    }

    @Override
    public List<SearchHit> search(final String indexId, final String query, final int maxResults)
            throws IOException {
        final ObjectNode body = objectMapper.createObjectNode();
        body.put("query", query);
        body.put("max_num_results", Math.max(1, Math.min(50, maxResults)));

        final JsonNode response = sendJson(jsonRequest("/vector_stores/" + indexId + "/search")
                .POST(bodyOf(body)).build());
        final List<SearchHit> hits = new ArrayList<>();
        for (final JsonNode hit : response.path("data")) {
            final StringBuilder snippet = new StringBuilder();
            for (final JsonNode part : hit.path("content")) {
                if ("text".equals(part.path("type").asText())) {
                    if (!snippet.isEmpty()) {
                        snippet.append('\n');
                    }
                    snippet.append(part.path("text").asText());
                }
            }
            hits.add(new SearchHit(hit.path("file_id").asText(), hit.path("filename").asText(),
                    hit.path("score").asDouble(), snippet.toString(), attributesOf(hit.path("attributes"))));
        }
        return hits;
    }

    @Override
    public String backendName() {
        return "openai";
    }

    // ==================== HTTP ====================

    private String uploadFile(final String fileName, final byte[] content) throws IOException {
        final String boundary = "----canvasindex" + UUID.randomUUID().toString().replace("-", "");
        final ByteArrayOutputStream multipart = new ByteArrayOutputStream(content.length + 512);
        final String safeName = fileName.replace("\"", "_");
        writeUtf8(multipart, "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"purpose\"\r\n\r\n"
                + "assistants\r\n"
                + "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + safeName + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n");
        multipart.write(content);
        writeUtf8(multipart, "\r\n--" + boundary + "--\r\n");

        final HttpRequest request = baseRequest("/files")
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(multipart.toByteArray()))
                .build();
        try {
            return sendJson(request).path("id").asText();
        } catch (final SearchIndexException e) {
            if (e.getStatusCode() == 400 || e.getStatusCode() == 413 || e.getStatusCode() == 415) {
                throw new UnsupportedFormatException("Rejected " + fileName + ": " + e.getMessage(), e);
            }
            throw e;
        }
    }

    private HttpRequest.Builder baseRequest(final String path) {
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiKey);
    }

    private HttpRequest.Builder jsonRequest(final String path) {
        return baseRequest(path).header("Content-Type", "application/json");
    }

    private HttpRequest.BodyPublisher bodyOf(final JsonNode body) throws IOException {
        return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8);
    }

    private JsonNode sendJson(final HttpRequest request) throws IOException {
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (final IOException e) {
            throw new SearchIndexException("I/O error calling " + request.uri() + ": " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchIndexException("Interrupted calling " + request.uri(), e);
        }

        final int status = response.statusCode();
        if (status < 200 || status >= 300) {
            final String message = errorMessage(response.body());
            logger.debug("{} {} failed with HTTP {}: {}", request.method(), request.uri(), status, message);
            throw new SearchIndexException(status, "HTTP " + status + " for " + request.uri() + ": " + message);
        }
        final String body = response.body();
        return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
    }

    private String errorMessage(final String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            final JsonNode node = objectMapper.readTree(body);
            return node.path("error").path("message").asText(body);
        } catch (final IOException e) {
            return body;
        }
    }

    private static Map<String, String> attributesOf(final JsonNode node) {
        final Map<String, String> attributes = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            attributes.put(field.getKey(), field.getValue().asText());
        }
        return attributes;
    }

    private static void writeUtf8(final ByteArrayOutputStream out, final String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }
}

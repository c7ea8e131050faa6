package de.mirkosertic.mcp.canvasindex;

import de.mirkosertic.mcp.canvasindex.index.ContentExtractor;
import de.mirkosertic.mcp.canvasindex.index.IndexUploader;
import de.mirkosertic.mcp.canvasindex.index.SearchHit;
import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.mcp.SchemaGenerator;
import de.mirkosertic.mcp.canvasindex.mcp.ToolResultHelper;
import de.mirkosertic.mcp.canvasindex.mcp.dto.*;
import de.mirkosertic.mcp.canvasindex.mirror.InaccessibilityTracker;
import de.mirkosertic.mcp.canvasindex.mirror.InaccessibleRecord;
import de.mirkosertic.mcp.canvasindex.mirror.LocalEntry;
import de.mirkosertic.mcp.canvasindex.mirror.LocalMirrorStore;
import de.mirkosertic.mcp.canvasindex.sync.IndexStatus;
import de.mirkosertic.mcp.canvasindex.sync.StartResult;
import de.mirkosertic.mcp.canvasindex.sync.SyncOrchestrator;
import de.mirkosertic.mcp.canvasindex.sync.SyncProgress;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MCP tools for keeping the course file indexes in sync with Canvas.
 * Provides status, sync control, maintenance and read access to the mirror.
 */
public class SyncTools {

    private static final Logger logger = LoggerFactory.getLogger(SyncTools.class);

    private static final String STATUS_DESCRIPTION = """
            Report how far the local mirror and the course search indexes lag behind Canvas. \
            Returns counts of Canvas files, indexed files, missing files (not mirrored, not indexed or changed), \
            extra index documents without a Canvas file, missing files per course and a sample of missing paths. \
            Pass refresh=true to fetch a fresh inventory from Canvas first; this can take a while for many courses.""";

    private static final String START_SYNC_DESCRIPTION = """
            Start a background sync: list every course's files, modules, pages and assignments, download \
            what is missing or changed into the local mirror and upload it to the course's search index. \
            Returns immediately with status 'started' or 'already_running'. Use getSyncProgress to follow it.""";

    private final SyncOrchestrator orchestrator;
    private final InaccessibilityTracker inaccessibilityTracker;
    private final IndexUploader indexUploader;
    private final LocalMirrorStore mirrorStore;
    private final ContentExtractor contentExtractor;

    public SyncTools(final SyncOrchestrator orchestrator,
                     final InaccessibilityTracker inaccessibilityTracker,
                     final IndexUploader indexUploader,
                     final LocalMirrorStore mirrorStore,
                     final ContentExtractor contentExtractor) {
        this.orchestrator = orchestrator;
        this.inaccessibilityTracker = inaccessibilityTracker;
        this.indexUploader = indexUploader;
        this.mirrorStore = mirrorStore;
        this.contentExtractor = contentExtractor;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getIndexStatus")
                        .description(STATUS_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(GetIndexStatusRequest.class))
                        .build())
                .callHandler((exchange, request) -> getIndexStatus(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("startSync")
                        .description(START_SYNC_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(StartSyncRequest.class))
                        .build())
                .callHandler((exchange, request) -> startSync(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getSyncProgress")
                        .description("Get the progress of the running sync (files planned, completed, downloaded, "
                                + "uploaded, skipped, failed, files in progress) and the summary of the last finished sync.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getSyncProgress())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("cancelSync")
                        .description("Cancel the running sync. Files already in progress are finished, "
                                + "remaining files are left for the next sync.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> cancelSync())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("resetInaccessible")
                        .description("Forget files recorded as inaccessible (Canvas denied access) so that the next "
                                + "sync attempts them again.")
                        .inputSchema(SchemaGenerator.generateSchema(ResetInaccessibleRequest.class))
                        .build())
                .callHandler((exchange, request) -> resetInaccessible(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("listInaccessibleFiles")
                        .description("List files Canvas denied access to, with reason and first/last attempt time.")
                        .inputSchema(SchemaGenerator.generateSchema(ListInaccessibleFilesRequest.class))
                        .build())
                .callHandler((exchange, request) -> listInaccessibleFiles(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("pruneExtraInIndex")
                        .description("Delete search index documents whose Canvas file no longer exists. "
                                + "Fetches a fresh inventory first. Requires confirm=true. Refused while a sync runs.")
                        .inputSchema(SchemaGenerator.generateSchema(PruneExtraInIndexRequest.class))
                        .build())
                .callHandler((exchange, request) -> pruneExtraInIndex(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("rebuildIndexManifest")
                        .description("Rebuild the local record of a course's indexed documents from what the index "
                                + "service reports. Use after the manifest was lost. Requires confirm=true.")
                        .inputSchema(SchemaGenerator.generateSchema(RebuildIndexManifestRequest.class))
                        .build())
                .callHandler((exchange, request) -> rebuildIndexManifest(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("searchCourseFiles")
                        .description("Search the indexed files of one course. Returns hits with file name, score, "
                                + "snippet and metadata (remote_id, path, fingerprint).")
                        .inputSchema(SchemaGenerator.generateSchema(SearchCourseFilesRequest.class))
                        .build())
                .callHandler((exchange, request) -> searchCourseFiles(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("readMirroredFile")
                        .description("Return the extracted text of a mirrored course file. Use the remote_id from "
                                + "search hit metadata.")
                        .inputSchema(SchemaGenerator.generateSchema(ReadMirroredFileRequest.class))
                        .build())
                .callHandler((exchange, request) -> readMirroredFile(request.arguments()))
                .build());

        return tools;
    }

    McpSchema.CallToolResult getIndexStatus(final Map<String, Object> args) {
        try {
            final GetIndexStatusRequest request = GetIndexStatusRequest.fromMap(args);
            logger.info("Index status request: refresh={}", request.effectiveRefresh());

            final IndexStatus status = orchestrator.getStatus(request.effectiveRefresh());

            logger.info("Index status: canvasFiles={}, indexed={}, missing={}, extra={}",
                    status.canvasFilesTotal(), status.indexedFilesTotal(), status.missingFilesCount(),
                    status.extraFilesCount());

            return ToolResultHelper.createResult(IndexStatusResponse.success(status));

        } catch (final Exception e) {
            logger.error("Error computing index status", e);
            return ToolResultHelper.createResult(IndexStatusResponse.error("Error computing index status: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult startSync(final Map<String, Object> args) {
        try {
            final StartSyncRequest request = StartSyncRequest.fromMap(args);
            logger.info("Start sync request: courseIds={}, skipDownload={}", request.courseIds(), request.skipDownload());

            final StartResult result = orchestrator.startSync(request.courseIds(), request.effectiveSkipDownload());
            if (result == StartResult.ALREADY_RUNNING) {
                return ToolResultHelper.createResult(StartSyncResponse.alreadyRunning());
            }
            return ToolResultHelper.createResult(StartSyncResponse.started(request.effectiveSkipDownload()));

        } catch (final Exception e) {
            logger.error("Error starting sync", e);
            return ToolResultHelper.createResult(StartSyncResponse.error("Error starting sync: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getSyncProgress() {
        try {
            final SyncProgress progress = orchestrator.getProgress();
            logger.debug("Sync progress: state={}, completed={}/{}", progress.state(), progress.filesCompleted(),
                    progress.filesPlanned());
            return ToolResultHelper.createResult(
                    SyncProgressResponse.success(progress, orchestrator.getLastSummary().orElse(null)));

        } catch (final Exception e) {
            logger.error("Error getting sync progress", e);
            return ToolResultHelper.createResult(SyncProgressResponse.error("Error getting sync progress: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult cancelSync() {
        logger.info("Cancel sync request");
        try {
            if (orchestrator.cancelSync()) {
                return ToolResultHelper.createResult(SimpleMessageResponse.success(
                        "Cancellation requested. Files in progress are finished first."));
            }
            return ToolResultHelper.createResult(SimpleMessageResponse.success("No sync is running"));

        } catch (final Exception e) {
            logger.error("Error cancelling sync", e);
            return ToolResultHelper.createResult(SimpleMessageResponse.error("Error cancelling sync: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult resetInaccessible(final Map<String, Object> args) {
        try {
            final ResetInaccessibleRequest request = ResetInaccessibleRequest.fromMap(args);
            logger.info("Reset inaccessible request: courseId={}", request.courseId());

            final int cleared = orchestrator.resetInaccessible(request.courseId());
            return ToolResultHelper.createResult(ResetInaccessibleResponse.success(cleared));

        } catch (final Exception e) {
            logger.error("Error resetting inaccessible files", e);
            return ToolResultHelper.createResult(ResetInaccessibleResponse.error(
                    "Error resetting inaccessible files: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult listInaccessibleFiles(final Map<String, Object> args) {
        try {
            final ListInaccessibleFilesRequest request = ListInaccessibleFilesRequest.fromMap(args);
            final List<InaccessibleRecord> records = inaccessibilityTracker.records(request.courseId());
            logger.info("Listed {} inaccessible files (courseId={})", records.size(), request.courseId());
            return ToolResultHelper.createResult(ListInaccessibleFilesResponse.success(records));

        } catch (final Exception e) {
            logger.error("Error listing inaccessible files", e);
            return ToolResultHelper.createResult(ListInaccessibleFilesResponse.error(
                    "Error listing inaccessible files: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult pruneExtraInIndex(final Map<String, Object> args) {
        final PruneExtraInIndexRequest request;
        try {
            request = PruneExtraInIndexRequest.fromMap(args);
        } catch (final IllegalArgumentException e) {
            return ToolResultHelper.createResult(PruneExtraInIndexResponse.error(e.getMessage()));
        }
        logger.info("Prune extra documents request: courseId={}, confirm={}", request.courseId(), request.confirm());

        if (!request.isConfirmed()) {
            logger.warn("Prune request not confirmed");
            return ToolResultHelper.createResult(PruneExtraInIndexResponse.notConfirmed());
        }

        try {
            final int removed = orchestrator.pruneExtraInIndex(request.courseId());
            logger.info("Pruned {} extra documents", removed);
            return ToolResultHelper.createResult(PruneExtraInIndexResponse.success(removed));

        } catch (final Exception e) {
            logger.error("Error pruning extra documents", e);
            return ToolResultHelper.createResult(PruneExtraInIndexResponse.error(
                    "Error pruning extra documents: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult rebuildIndexManifest(final Map<String, Object> args) {
        final RebuildIndexManifestRequest request;
        try {
            request = RebuildIndexManifestRequest.fromMap(args);
        } catch (final IllegalArgumentException e) {
            return ToolResultHelper.createResult(RebuildIndexManifestResponse.error(e.getMessage()));
        }
        logger.info("Rebuild index manifest request: courseId={}, indexId={}, confirm={}",
                request.courseId(), request.indexId(), request.confirm());

        if (request.courseId() == null) {
            return ToolResultHelper.createResult(RebuildIndexManifestResponse.error("courseId is required"));
        }
        if (!request.isConfirmed()) {
            logger.warn("Rebuild index manifest request not confirmed");
            return ToolResultHelper.createResult(RebuildIndexManifestResponse.notConfirmed());
        }

        try {
            final int imported = orchestrator.rebuildIndexManifest(request.courseId(), request.indexId());
            return ToolResultHelper.createResult(RebuildIndexManifestResponse.success(request.courseId(), imported));

        } catch (final Exception e) {
            logger.error("Error rebuilding index manifest of course {}", request.courseId(), e);
            return ToolResultHelper.createResult(RebuildIndexManifestResponse.error(
                    "Error rebuilding index manifest: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult searchCourseFiles(final Map<String, Object> args) {
        try {
            final SearchCourseFilesRequest request = SearchCourseFilesRequest.fromMap(args);
            if (request.courseId() == null) {
                return ToolResultHelper.createResult(SearchCourseFilesResponse.error("courseId is required"));
            }
            if (request.query() == null || request.query().isBlank()) {
                return ToolResultHelper.createResult(SearchCourseFilesResponse.error("query must not be empty"));
            }
            if (indexUploader.indexId(request.courseId()).isEmpty()) {
                return ToolResultHelper.createResult(SearchCourseFilesResponse.error(
                        "Course " + request.courseId() + " has no search index yet. Run startSync first."));
            }

            logger.info("Search request: courseId={}, query='{}', maxResults={}",
                    request.courseId(), request.query(), request.effectiveMaxResults());
            final long start = System.currentTimeMillis();
            final List<SearchHit> hits = indexUploader.search(request.courseId(), request.query(),
                    request.effectiveMaxResults());
            final long duration = System.currentTimeMillis() - start;
            logger.info("Search returned {} hits in {}ms", hits.size(), duration);

            return ToolResultHelper.createResult(SearchCourseFilesResponse.success(request.courseId(),
                    request.query(), hits, duration));

        } catch (final Exception e) {
            logger.error("Error searching course files", e);
            return ToolResultHelper.createResult(SearchCourseFilesResponse.error("Error searching: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult readMirroredFile(final Map<String, Object> args) {
        try {
            final ReadMirroredFileRequest request = ReadMirroredFileRequest.fromMap(args);
            if (request.courseId() == null || request.remoteId() == null) {
                return ToolResultHelper.createResult(ReadMirroredFileResponse.error("courseId and remoteId are required"));
            }
            final Optional<LocalEntry> entry = mirrorStore.get(new FileKey(request.courseId(), request.remoteId()));
            if (entry.isEmpty()) {
                return ToolResultHelper.createResult(ReadMirroredFileResponse.error(
                        "File " + request.remoteId() + " of course " + request.courseId() + " is not mirrored"));
            }

            final byte[] content = mirrorStore.read(request.courseId(), request.remoteId());
            final Path localPath = mirrorStore.localPath(entry.get());
            final int maxCharacters = request.effectiveMaxCharacters();
            final String extracted = contentExtractor.extract(content, localPath.getFileName().toString(),
                    maxCharacters + 1);
            final boolean truncated = extracted.length() > maxCharacters;
            final String text = truncated ? extracted.substring(0, maxCharacters) : extracted;

            logger.info("Read mirrored file {}: {} characters{}", localPath, text.length(), truncated ? " (truncated)" : "");
            return ToolResultHelper.createResult(ReadMirroredFileResponse.success(request.courseId(),
                    request.remoteId(), entry.get().localPath(), text, truncated));

        } catch (final IOException e) {
            logger.error("Error reading mirrored file", e);
            return ToolResultHelper.createResult(ReadMirroredFileResponse.error("Error reading file: " + e.getMessage()));
        } catch (final Exception e) {
            logger.error("Unexpected error reading mirrored file", e);
            return ToolResultHelper.createResult(ReadMirroredFileResponse.error("Unexpected error: " + e.getMessage()));
        }
    }
}

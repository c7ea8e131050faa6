package de.mirkosertic.mcp.canvasindex;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasClient;
import de.mirkosertic.mcp.canvasindex.canvas.HttpCanvasClient;
import de.mirkosertic.mcp.canvasindex.config.ApplicationConfig;
import de.mirkosertic.mcp.canvasindex.config.BuildInfo;
import de.mirkosertic.mcp.canvasindex.config.LoggingConfigurator;
import de.mirkosertic.mcp.canvasindex.index.ContentExtractor;
import de.mirkosertic.mcp.canvasindex.index.IndexUploader;
import de.mirkosertic.mcp.canvasindex.index.LuceneSearchIndexClient;
import de.mirkosertic.mcp.canvasindex.index.OpenAiVectorStoreClient;
import de.mirkosertic.mcp.canvasindex.index.SearchIndexClient;
import de.mirkosertic.mcp.canvasindex.inventory.CourseInventoryFetcher;
import de.mirkosertic.mcp.canvasindex.mcp.CanvasIndexStdioTransportProvider;
import de.mirkosertic.mcp.canvasindex.mirror.InaccessibilityTracker;
import de.mirkosertic.mcp.canvasindex.mirror.LocalMirrorStore;
import de.mirkosertic.mcp.canvasindex.sync.RetryPolicy;
import de.mirkosertic.mcp.canvasindex.sync.SyncExecutorService;
import de.mirkosertic.mcp.canvasindex.sync.SyncOrchestrator;
import de.mirkosertic.mcp.canvasindex.sync.SyncStateRepository;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Main entry point for the MCP Canvas Index Server.
 * Wires all services and starts the MCP server using STDIO transport.
 */
public class CanvasIndexApplication {

    private static final Logger logger = LoggerFactory.getLogger(CanvasIndexApplication.class);

    static final String LOCAL_MANIFEST_FILE = "local-manifest.yaml";
    static final String INDEX_MANIFEST_FILE = "index-manifest.yaml";
    static final String INACCESSIBLE_FILE = "inaccessible-files.yaml";
    static final String SYNC_STATE_FILE = "sync-state.yaml";
    static final String SYNC_REPORT_FILE = "sync-report.json";
    static final String LUCENE_DIRECTORY = "lucene";

    private final ApplicationConfig config;
    private final SearchIndexClient indexClient;
    private final SyncExecutorService syncExecutor;
    private final SyncOrchestrator orchestrator;
    private final SyncTools syncTools;
    private McpSyncServer mcpServer;

    public CanvasIndexApplication(final ApplicationConfig config) throws IOException {
        this.config = config;

        final Path dataDir = config.getDataDir();
        Files.createDirectories(dataDir);
        Files.createDirectories(config.getMirrorDir());

        final ObjectMapper objectMapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        final CanvasClient canvasClient = HttpCanvasClient.fromConfig(config, objectMapper);
        final ContentExtractor contentExtractor = new ContentExtractor();
        this.indexClient = createIndexClient(config, objectMapper, contentExtractor);

        final LocalMirrorStore mirrorStore = new LocalMirrorStore(config.getMirrorDir(),
                dataDir.resolve(LOCAL_MANIFEST_FILE));
        final InaccessibilityTracker inaccessibilityTracker =
                new InaccessibilityTracker(dataDir.resolve(INACCESSIBLE_FILE));
        final IndexUploader indexUploader = new IndexUploader(indexClient, dataDir.resolve(INDEX_MANIFEST_FILE),
                config.getSupportedExtensions(), config.getMaxUploadSizeBytes());
        final SyncStateRepository stateRepository = new SyncStateRepository(dataDir.resolve(SYNC_STATE_FILE),
                dataDir.resolve(SYNC_REPORT_FILE), objectMapper);

        this.syncExecutor = new SyncExecutorService(config.getThreadPoolSize());

        this.orchestrator = new SyncOrchestrator(
                new CourseInventoryFetcher(canvasClient),
                canvasClient,
                mirrorStore,
                inaccessibilityTracker,
                indexUploader,
                syncExecutor,
                RetryPolicy.fromConfig(config),
                stateRepository,
                new SyncOrchestrator.Settings(
                        config.getCourseIds(),
                        config.getDownloadsPerSecond(),
                        config.getUploadsPerSecond(),
                        config.getMissingSampleSize(),
                        config.isSyncOnStartup()));

        this.syncTools = new SyncTools(orchestrator, inaccessibilityTracker, indexUploader, mirrorStore,
                contentExtractor);
    }

    static SearchIndexClient createIndexClient(final ApplicationConfig config, final ObjectMapper objectMapper,
                                               final ContentExtractor contentExtractor) {
        if (ApplicationConfig.BACKEND_LUCENE.equals(config.getIndexBackend())) {
            logger.info("Using local Lucene index backend");
            return new LuceneSearchIndexClient(config.getDataDir().resolve(LUCENE_DIRECTORY), contentExtractor);
        }
        if (config.getOpenAiApiKey() == null || config.getOpenAiApiKey().isBlank()) {
            throw new IllegalStateException("index.backend is '" + config.getIndexBackend()
                    + "' but no OpenAI API key is configured (OPENAI_API_KEY)");
        }
        logger.info("Using OpenAI vector store backend at {}", config.getOpenAiBaseUrl());
        return OpenAiVectorStoreClient.fromConfig(config, objectMapper);
    }

    /**
     * Initialize all services.
     */
    public void init() {
        logger.info("Initializing MCP Canvas Index Server...");
        if (!config.isCanvasConfigured()) {
            logger.warn("Canvas URL or access token is not configured, syncs will fail until CANVAS_URL "
                    + "and CANVAS_ACCESS_TOKEN are set");
        }
        orchestrator.init();
        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Canvas Index Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final CanvasIndexStdioTransportProvider transportProvider =
                new CanvasIndexStdioTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(syncTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
        monitorParentProcess();

        // The STDIO transport handles communication on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    private void monitorParentProcess() {
        ProcessHandle.current().parent().ifPresent(parent -> {
            parent.onExit().thenRun(() -> {
                logger.info("Parent process terminated, shutting down...");
                System.exit(0);
            });
            logger.info("Monitoring parent process PID: {}", parent.pid());
        });
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down MCP Canvas Index Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            orchestrator.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down sync orchestrator", e);
        }

        if (indexClient instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (final IOException e) {
                logger.error("Error closing index client", e);
            }
        }

        logger.info("MCP Canvas Index Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging must be configured before anything logs
            final boolean deployedMode = "deployed".equals(System.getProperty("spring.profiles.active"))
                    || "deployed".equals(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode, LoggingConfigurator.defaultLogDirectory());

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Canvas URL: {}", config.getCanvasUrl());
                logger.info("Data directory: {}", config.getDataDir());
                logger.info("Index backend: {}", config.getIndexBackend());
            }

            final CanvasIndexApplication app = new CanvasIndexApplication(config);
            app.init();
            app.start();

        } catch (final Exception e) {
            // Console logging may be off in deployed mode
            System.err.println("Failed to start MCP Canvas Index Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}

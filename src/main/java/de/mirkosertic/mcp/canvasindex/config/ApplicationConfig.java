package de.mirkosertic.mcp.canvasindex.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the MCP Canvas Index Server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.canvasindex/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CANVAS_URL = "CANVAS_URL";
    private static final String ENV_CANVAS_TOKEN = "CANVAS_ACCESS_TOKEN";
    private static final String ENV_COURSE_IDS = "CANVAS_COURSE_IDS";
    private static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    private static final String ENV_INDEX_BACKEND = "CANVAS_INDEX_BACKEND";
    private static final String ENV_DATA_DIR = "CANVAS_INDEX_DATA_DIR";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".canvasindex";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    public static final String BACKEND_OPENAI = "openai";
    public static final String BACKEND_LUCENE = "lucene";

    // Canvas settings
    private String canvasUrl;
    private String canvasAccessToken;
    private int canvasPageSize = 100;
    private long canvasRequestTimeoutMs = 30000;
    private List<Long> courseIds = new ArrayList<>();

    // Index settings
    private String indexBackend = BACKEND_OPENAI;
    private String openAiApiKey;
    private String openAiBaseUrl = "https://api.openai.com";
    private List<String> supportedExtensions = List.of(
            ".pdf", ".txt", ".md", ".doc", ".docx",
            ".ppt", ".pptx", ".xls", ".xlsx",
            ".json", ".csv", ".html"
    );
    private long maxUploadSizeBytes = 512L * 1024 * 1024;

    // Storage settings
    private String dataDir;
    private String mirrorDir;

    // Sync settings
    private int threadPoolSize = 4;
    private int maxAttempts = 3;
    private long initialBackoffMs = 500;
    private long maxBackoffMs = 8000;
    private double uploadsPerSecond = 10.0;
    private double downloadsPerSecond = 20.0;
    private boolean syncOnStartup = false;
    private int missingSampleSize = 20;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: canvasUrl={}, backend={}, dataDir={}, courses={}, deployedMode={}",
                config.canvasUrl, config.indexBackend, config.dataDir, config.courseIds, config.deployedMode);

        return config;
    }

    /**
     * Build a configuration from a parsed YAML document only, without touching the
     * environment or the user config file. Storage paths default relative to {@code dataDir}.
     */
    public static ApplicationConfig fromYaml(final Map<String, Object> yamlConfig, final Path dataDir) {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(yamlConfig);
        if (config.dataDir == null || config.dataDir.isEmpty()) {
            config.dataDir = dataDir.toString();
        }
        config.applyStorageDefaults();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("canvasindex");
        if (root == null) {
            return;
        }

        final Map<String, Object> canvasConfig = (Map<String, Object>) root.get("canvas");
        if (canvasConfig != null) {
            applyCanvasConfig(canvasConfig);
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            applyIndexConfig(indexConfig);
        }

        final Map<String, Object> storageConfig = (Map<String, Object>) root.get("storage");
        if (storageConfig != null) {
            if (storageConfig.get("data-dir") != null) {
                this.dataDir = resolveVariables(storageConfig.get("data-dir").toString());
            }
            if (storageConfig.get("mirror-dir") != null) {
                this.mirrorDir = resolveVariables(storageConfig.get("mirror-dir").toString());
            }
        }

        final Map<String, Object> syncConfig = (Map<String, Object>) root.get("sync");
        if (syncConfig != null) {
            applySyncConfig(syncConfig);
        }
    }

    private void applyCanvasConfig(final Map<String, Object> canvasConfig) {
        if (canvasConfig.get("url") != null) {
            this.canvasUrl = resolveVariables(canvasConfig.get("url").toString());
        }
        if (canvasConfig.get("access-token") != null) {
            this.canvasAccessToken = resolveVariables(canvasConfig.get("access-token").toString());
        }
        if (canvasConfig.containsKey("page-size")) {
            this.canvasPageSize = ((Number) canvasConfig.get("page-size")).intValue();
        }
        if (canvasConfig.containsKey("request-timeout-ms")) {
            this.canvasRequestTimeoutMs = ((Number) canvasConfig.get("request-timeout-ms")).longValue();
        }
        if (canvasConfig.get("course-ids") instanceof List<?> ids) {
            final List<Long> parsed = new ArrayList<>();
            for (final Object id : ids) {
                parsed.add(Long.parseLong(id.toString().trim()));
            }
            this.courseIds = parsed;
        }
    }

    @SuppressWarnings("unchecked")
    private void applyIndexConfig(final Map<String, Object> indexConfig) {
        if (indexConfig.get("backend") != null) {
            this.indexBackend = resolveVariables(indexConfig.get("backend").toString()).trim().toLowerCase();
        }
        if (indexConfig.get("openai-api-key") != null) {
            this.openAiApiKey = resolveVariables(indexConfig.get("openai-api-key").toString());
        }
        if (indexConfig.get("openai-base-url") != null) {
            this.openAiBaseUrl = resolveVariables(indexConfig.get("openai-base-url").toString());
        }
        if (indexConfig.containsKey("supported-extensions")) {
            final Object extensions = indexConfig.get("supported-extensions");
            if (extensions instanceof List) {
                this.supportedExtensions = new ArrayList<>((List<String>) extensions);
            }
        }
        if (indexConfig.containsKey("max-upload-size-bytes")) {
            this.maxUploadSizeBytes = ((Number) indexConfig.get("max-upload-size-bytes")).longValue();
        }
    }

    private void applySyncConfig(final Map<String, Object> syncConfig) {
        if (syncConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) syncConfig.get("thread-pool-size")).intValue();
        }
        if (syncConfig.containsKey("max-attempts")) {
            this.maxAttempts = ((Number) syncConfig.get("max-attempts")).intValue();
        }
        if (syncConfig.containsKey("initial-backoff-ms")) {
            this.initialBackoffMs = ((Number) syncConfig.get("initial-backoff-ms")).longValue();
        }
        if (syncConfig.containsKey("max-backoff-ms")) {
            this.maxBackoffMs = ((Number) syncConfig.get("max-backoff-ms")).longValue();
        }
        if (syncConfig.containsKey("uploads-per-second")) {
            this.uploadsPerSecond = ((Number) syncConfig.get("uploads-per-second")).doubleValue();
        }
        if (syncConfig.containsKey("downloads-per-second")) {
            this.downloadsPerSecond = ((Number) syncConfig.get("downloads-per-second")).doubleValue();
        }
        if (syncConfig.containsKey("sync-on-startup")) {
            this.syncOnStartup = (Boolean) syncConfig.get("sync-on-startup");
        }
        if (syncConfig.containsKey("missing-sample-size")) {
            this.missingSampleSize = ((Number) syncConfig.get("missing-sample-size")).intValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envUrl = System.getenv(ENV_CANVAS_URL);
        if (envUrl != null && !envUrl.trim().isEmpty()) {
            this.canvasUrl = envUrl.trim();
        }

        final String envToken = System.getenv(ENV_CANVAS_TOKEN);
        if (envToken != null && !envToken.trim().isEmpty()) {
            this.canvasAccessToken = envToken.trim();
        }

        final String envApiKey = System.getenv(ENV_OPENAI_API_KEY);
        if (envApiKey != null && !envApiKey.trim().isEmpty()) {
            this.openAiApiKey = envApiKey.trim();
        }

        final String envBackend = System.getenv(ENV_INDEX_BACKEND);
        if (envBackend != null && !envBackend.trim().isEmpty()) {
            this.indexBackend = envBackend.trim().toLowerCase();
            logger.info("Index backend from environment: {}", this.indexBackend);
        }

        // Course filter from environment (overrides all other sources)
        final String envCourses = System.getenv(ENV_COURSE_IDS);
        if (envCourses != null && !envCourses.trim().isEmpty()) {
            this.courseIds = new ArrayList<>();
            for (final String id : envCourses.split(",")) {
                final String trimmed = id.trim();
                if (!trimmed.isEmpty()) {
                    this.courseIds.add(Long.parseLong(trimmed));
                }
            }
            logger.info("Course filter from environment: {}", this.courseIds);
        }

        final String envDataDir = System.getenv(ENV_DATA_DIR);
        if (envDataDir != null && !envDataDir.trim().isEmpty()) {
            this.dataDir = envDataDir.trim();
        }

        // System property for data dir
        final String propDataDir = System.getProperty("canvasindex.data.dir");
        if (propDataDir != null && !propDataDir.isEmpty()) {
            this.dataDir = propDataDir;
        }

        // Default data dir if not set
        if (this.dataDir == null || this.dataDir.isEmpty()) {
            this.dataDir = getConfigDirectory().toString();
        }
        applyStorageDefaults();
    }

    private void applyStorageDefaults() {
        if (this.mirrorDir == null || this.mirrorDir.isEmpty()) {
            this.mirrorDir = Paths.get(this.dataDir, "file_index").toString();
        }
    }

    private void determineProfile() {
        // Check system property for profile (supports both old Spring-style and new style)
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Whether Canvas credentials are present. Without them no inventory can be fetched.
     */
    public boolean isCanvasConfigured() {
        return canvasUrl != null && !canvasUrl.isBlank()
                && canvasAccessToken != null && !canvasAccessToken.isBlank();
    }

    // Getters
    @Nullable
    public String getCanvasUrl() {
        return canvasUrl;
    }

    @Nullable
    public String getCanvasAccessToken() {
        return canvasAccessToken;
    }

    public int getCanvasPageSize() {
        return canvasPageSize;
    }

    public long getCanvasRequestTimeoutMs() {
        return canvasRequestTimeoutMs;
    }

    public List<Long> getCourseIds() {
        return courseIds;
    }

    public String getIndexBackend() {
        return indexBackend;
    }

    @Nullable
    public String getOpenAiApiKey() {
        return openAiApiKey;
    }

    public String getOpenAiBaseUrl() {
        return openAiBaseUrl;
    }

    public List<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    public long getMaxUploadSizeBytes() {
        return maxUploadSizeBytes;
    }

    public Path getDataDir() {
        return Paths.get(dataDir);
    }

    public Path getMirrorDir() {
        return Paths.get(mirrorDir);
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public double getUploadsPerSecond() {
        return uploadsPerSecond;
    }

    public double getDownloadsPerSecond() {
        return downloadsPerSecond;
    }

    public boolean isSyncOnStartup() {
        return syncOnStartup;
    }

    public int getMissingSampleSize() {
        return missingSampleSize;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}

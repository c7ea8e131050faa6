package de.mirkosertic.mcp.canvasindex.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version, name and build timestamp of the server, taken from the Maven-filtered
 * {@code build-info.properties}. Running from an IDE without resource filtering
 * yields {@code dev} and {@code unknown}.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String UNFILTERED_MARKER = "${";

    private static final Properties PROPERTIES = loadProperties();

    private BuildInfo() {
    }

    public static String getVersion() {
        return value("build.version", "dev");
    }

    public static String getBuildTimestamp() {
        return value("build.timestamp", "unknown");
    }

    public static String getServerName() {
        return value("build.name", "MCP Canvas Index Server");
    }

    private static String value(final String key, final String fallback) {
        final String value = PROPERTIES.getProperty(key);
        if (value == null || value.isBlank() || value.contains(UNFILTERED_MARKER)) {
            return fallback;
        }
        return value;
    }

    private static Properties loadProperties() {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
                logger.debug("Loaded build info: {}", props);
            } else {
                logger.debug("Build info file not found, using defaults (IDE/dev mode)");
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }
        return props;
    }
}

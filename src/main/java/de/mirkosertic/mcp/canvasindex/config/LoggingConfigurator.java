package de.mirkosertic.mcp.canvasindex.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Selects the Logback configuration for the active profile.
 * <p>
 * The deployed profile talks MCP JSON-RPC over STDIO, so anything written to stdout
 * corrupts the protocol stream. In that mode {@code logback-deployed.xml} is loaded,
 * which logs to {@code <log dir>/canvas-index.log} only. The development profile keeps
 * the automatically loaded {@code logback.xml} with console output.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "canvasindex.log.dir";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used.
     *
     * @param deployedMode true for the STDIO deployment
     * @param logDirectory directory for the log file in deployed mode
     */
    public static void configure(final boolean deployedMode, final Path logDirectory) {
        if (!deployedMode) {
            return;
        }
        System.setProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDirectory);
        }
        reload(DEPLOYED_CONFIG);
    }

    /**
     * Default log directory below the user's {@code ~/.canvasindex}.
     */
    public static Path defaultLogDirectory() {
        return Paths.get(System.getProperty("user.home"), ".canvasindex", "log");
    }

    private static void reload(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}

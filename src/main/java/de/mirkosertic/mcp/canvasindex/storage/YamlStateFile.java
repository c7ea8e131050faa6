package de.mirkosertic.mcp.canvasindex.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A YAML document on disk holding durable engine state (manifests, last sync state).
 * <p>
 * Writes go to a sibling {@code .tmp} file that is then moved over the target, so a reader
 * (or a restarted process) sees either the previous or the new document, never a torn one.
 * Unreadable documents are logged and treated as empty.
 */
public class YamlStateFile {

    private static final Logger logger = LoggerFactory.getLogger(YamlStateFile.class);

    private final Path path;
    private final Yaml yaml;

    public YamlStateFile(final Path path) {
        this.path = path;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    public Path getPath() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * Load the document root.
     *
     * @return the root mapping, empty if the file does not exist or cannot be parsed
     */
    public synchronized Map<String, Object> load() {
        if (!Files.exists(path)) {
            logger.debug("State file does not exist: {}", path);
            return new LinkedHashMap<>();
        }

        try (final Reader reader = Files.newBufferedReader(path)) {
            final Object document = yaml.load(reader);
            if (document == null) {
                logger.debug("State file is empty: {}", path);
                return new LinkedHashMap<>();
            }
            if (!(document instanceof Map)) {
                logger.error("Invalid state file structure in {}: expected a mapping", path);
                return new LinkedHashMap<>();
            }
            @SuppressWarnings("unchecked")
            final Map<String, Object> root = (Map<String, Object>) document;
            return root;
        } catch (final IOException e) {
            logger.error("Failed to load state file: {}", path, e);
            return new LinkedHashMap<>();
        } catch (final RuntimeException e) {
            logger.error("Failed to parse state file: {}", path, e);
            return new LinkedHashMap<>();
        }
    }

    /**
     * Replace the document with the given root mapping.
     *
     * @throws IOException if the document cannot be written
     */
    public synchronized void save(final Map<String, Object> root) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            logger.debug("Created state directory: {}", parent);
        }

        final Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try (final Writer writer = Files.newBufferedWriter(temp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(root, writer);
        }
        moveIntoPlace(temp, path);
    }

    /**
     * Move a fully written temp file over its target, atomically where the filesystem allows.
     */
    public static void moveIntoPlace(final Path source, final Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // ==================== Value helpers ====================

    public static String string(final Map<String, Object> map, final String key) {
        final Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    public static long number(final Map<String, Object> map, final String key, final long fallback) {
        final Object value = map.get(key);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString());
            } catch (final NumberFormatException e) {
                logger.warn("Invalid number for key {}: {}", key, value);
            }
        }
        return fallback;
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> list(final Map<String, Object> map, final String key) {
        final Object value = map.get(key);
        if (!(value instanceof List<?> list)) {
            return new ArrayList<>();
        }
        final List<Map<String, Object>> result = new ArrayList<>();
        for (final Object element : list) {
            if (element instanceof Map) {
                result.add((Map<String, Object>) element);
            }
        }
        return result;
    }
}

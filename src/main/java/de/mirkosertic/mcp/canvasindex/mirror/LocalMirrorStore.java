package de.mirkosertic.mcp.canvasindex.mirror;

import com.google.common.util.concurrent.Striped;
import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.inventory.FileNames;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import de.mirkosertic.mcp.canvasindex.storage.YamlStateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.stream.Stream;

/**
 * The local mirror of downloaded course content plus its durable manifest.
 * <p>
 * Bytes are staged in a {@code .part} file next to the target, moved into place and only then
 * published in the manifest. A crash therefore leaves at most an orphan {@code .part} file,
 * which is removed the next time the store is opened.
 */
public class LocalMirrorStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalMirrorStore.class);

    static final String PART_SUFFIX = ".part";

    private final Path mirrorDir;
    private final YamlStateFile manifestFile;
    private final Map<FileKey, LocalEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, FileKey> claimedPaths = new HashMap<>();
    private final Striped<Lock> writeLocks = Striped.lock(64);

    public LocalMirrorStore(final Path mirrorDir, final Path manifestPath) {
        this.mirrorDir = mirrorDir;
        this.manifestFile = new YamlStateFile(manifestPath);
        loadManifest();
        removeOrphanedParts();
    }

    public Path getMirrorDir() {
        return mirrorDir;
    }

    /**
     * @return true if a usable local copy exists
     */
    public boolean has(final long courseId, final String remoteId) {
        final LocalEntry entry = entries.get(new FileKey(courseId, remoteId));
        return entry != null && entry.isUsable() && Files.exists(localPath(entry));
    }

    public Optional<LocalEntry> get(final FileKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Store the bytes of a remote file and publish its manifest entry.
     * Concurrent writes of the same file are serialized; the last completed write wins.
     */
    public LocalEntry write(final RemoteFile remoteFile, final byte[] bytes) throws IOException {
        final FileKey key = remoteFile.key();
        final Lock lock = writeLocks.get(key);
        lock.lock();
        try {
            final String relativePath = claimPath(key, remoteFile.courseName() + "/" + remoteFile.path());
            final Path target = mirrorDir.resolve(relativePath);
            Files.createDirectories(target.getParent());

            final Path staging = target.resolveSibling(target.getFileName() + PART_SUFFIX);
            Files.write(staging, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            YamlStateFile.moveIntoPlace(staging, target);

            final LocalEntry previous = entries.get(key);
            final LocalEntry entry = new LocalEntry(remoteFile.id(), remoteFile.courseId(), relativePath,
                    remoteFile.fingerprint(), bytes.length, Instant.now(), EntryStatus.OK);
            entries.put(key, entry);
            persist();

            if (previous != null && !previous.localPath().equals(relativePath)) {
                releasePath(previous.localPath(), key);
                Files.deleteIfExists(mirrorDir.resolve(previous.localPath()));
                logger.debug("Removed previous copy of {} at {}", key, previous.localPath());
            }

            logger.debug("Mirrored {} ({} bytes) to {}", key, bytes.length, relativePath);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read the mirrored bytes of a file.
     *
     * @throws MirrorEntryNotFoundException if there is no usable local copy
     */
    public byte[] read(final long courseId, final String remoteId) throws IOException {
        final FileKey key = new FileKey(courseId, remoteId);
        final LocalEntry entry = entries.get(key);
        if (entry == null || !entry.isUsable()) {
            throw new MirrorEntryNotFoundException(key, "No local copy of " + key);
        }
        final Path path = localPath(entry);
        if (!Files.exists(path)) {
            throw new MirrorEntryNotFoundException(key, "Local copy of " + key + " is missing at " + path);
        }
        return Files.readAllBytes(path);
    }

    public List<LocalEntry> manifestSnapshot() {
        return List.copyOf(entries.values());
    }

    public void markStale(final FileKey key) throws IOException {
        updateStatus(key, EntryStatus.STALE);
    }

    public void markInaccessible(final FileKey key) throws IOException {
        updateStatus(key, EntryStatus.INACCESSIBLE);
    }

    public Path localPath(final LocalEntry entry) {
        return mirrorDir.resolve(entry.localPath());
    }

    private void updateStatus(final FileKey key, final EntryStatus status) throws IOException {
        final Lock lock = writeLocks.get(key);
        lock.lock();
        try {
            final LocalEntry entry = entries.get(key);
            if (entry == null || entry.status() == status) {
                return;
            }
            entries.put(key, entry.withStatus(status));
            persist();
            logger.debug("Marked {} as {}", key, status);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Path claims ====================

    /**
     * Reserve a mirror-relative path for a key. A path held by another key is disambiguated
     * as {@code name-<id>.ext}.
     */
    private synchronized String claimPath(final FileKey key, final String desired) {
        final FileKey owner = claimedPaths.get(desired);
        if (owner == null || owner.equals(key)) {
            claimedPaths.put(desired, key);
            return desired;
        }
        final String alternative = withIdSuffix(desired, key.remoteId());
        claimedPaths.put(alternative, key);
        logger.debug("Path {} already used by {}, storing {} at {}", desired, owner, key, alternative);
        return alternative;
    }

    private synchronized void releasePath(final String path, final FileKey key) {
        claimedPaths.remove(path, key);
    }

    static String withIdSuffix(final String path, final String remoteId) {
        final int slash = path.lastIndexOf('/');
        final String dir = slash >= 0 ? path.substring(0, slash + 1) : "";
        final String name = slash >= 0 ? path.substring(slash + 1) : path;
        final String extension = FileNames.extension(name);
        final String base = name.substring(0, name.length() - extension.length());
        final String id = FileNames.sanitize(remoteId.replace(':', '-'));
        return dir + base + "-" + id + extension;
    }

    // ==================== Persistence ====================

    private void loadManifest() {
        final Map<String, Object> root = manifestFile.load();
        for (final Map<String, Object> map : YamlStateFile.list(root, "entries")) {
            try {
                final LocalEntry entry = new LocalEntry(
                        YamlStateFile.string(map, "remoteId"),
                        YamlStateFile.number(map, "courseId", 0),
                        YamlStateFile.string(map, "localPath"),
                        YamlStateFile.string(map, "fingerprint"),
                        YamlStateFile.number(map, "size", 0),
                        Instant.parse(YamlStateFile.string(map, "downloadedAt")),
                        EntryStatus.valueOf(YamlStateFile.string(map, "status")));
                entries.put(entry.key(), entry);
                claimedPaths.put(entry.localPath(), entry.key());
            } catch (final RuntimeException e) {
                logger.warn("Skipping malformed local manifest entry {}: {}", map, e.getMessage());
            }
        }
        logger.info("Local mirror manifest loaded: {} entries from {}", entries.size(), manifestFile.getPath());
    }

    private synchronized void persist() throws IOException {
        final List<Map<String, Object>> list = new ArrayList<>();
        for (final LocalEntry entry : entries.values()) {
            final Map<String, Object> map = new LinkedHashMap<>();
            map.put("remoteId", entry.remoteId());
            map.put("courseId", entry.courseId());
            map.put("localPath", entry.localPath());
            map.put("fingerprint", entry.fingerprintAtDownload());
            map.put("size", entry.size());
            map.put("downloadedAt", entry.downloadedAt().toString());
            map.put("status", entry.status().name());
            list.add(map);
        }
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("entries", list);
        manifestFile.save(root);
    }

    private void removeOrphanedParts() {
        if (!Files.isDirectory(mirrorDir)) {
            return;
        }
        try (final Stream<Path> paths = Files.walk(mirrorDir)) {
            final List<Path> orphans = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(PART_SUFFIX))
                    .toList();
            for (final Path orphan : orphans) {
                Files.deleteIfExists(orphan);
                logger.info("Removed interrupted download {}", orphan);
            }
        } catch (final IOException e) {
            logger.warn("Failed to clean up interrupted downloads in {}", mirrorDir, e);
        }
    }
}

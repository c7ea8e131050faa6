package de.mirkosertic.mcp.canvasindex.index;

import com.google.common.util.concurrent.Striped;
import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.inventory.FileNames;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import de.mirkosertic.mcp.canvasindex.storage.YamlStateFile;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;

/**
 * Uploads mirrored files into per-course search indexes and keeps the durable index manifest.
 * <p>
 * Uploads are idempotent by {@code (remoteId, fingerprint)}: re-uploading unchanged content
 * returns the existing entry without contacting the index service. A changed file is uploaded
 * as a new document first; the superseded document is deleted afterwards. A changed file that cannot
 * be indexed loses its outdated document.
 */
public class IndexUploader {

    private static final Logger logger = LoggerFactory.getLogger(IndexUploader.class);

    public static final String META_REMOTE_ID = "remote_id";
    public static final String META_COURSE_ID = "course_id";
    public static final String META_FINGERPRINT = "fingerprint";
    public static final String META_FILE_NAME = "file_name";
    public static final String META_PATH = "path";

    private final SearchIndexClient indexClient;
    private final YamlStateFile manifestFile;
    private final Set<String> supportedExtensions;
    private final long maxUploadSizeBytes;

    private final Map<Long, String> indexIds = new ConcurrentHashMap<>();
    private final Map<FileKey, IndexedEntry> entries = new ConcurrentHashMap<>();
    private final Map<FileKey, String> rejectedFingerprints = new ConcurrentHashMap<>();
    private final Striped<Lock> courseLocks = Striped.lock(16);
    private final Striped<Lock> fileLocks = Striped.lock(64);

    public IndexUploader(final SearchIndexClient indexClient, final Path manifestPath,
                         final Collection<String> supportedExtensions, final long maxUploadSizeBytes) {
        this.indexClient = indexClient;
        this.manifestFile = new YamlStateFile(manifestPath);
        this.supportedExtensions = supportedExtensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.maxUploadSizeBytes = maxUploadSizeBytes;
        loadManifest();
    }

    public SearchIndexClient getIndexClient() {
        return indexClient;
    }

    /**
     * Return the course's index id, creating the index on first use.
     */
    public String ensureIndex(final long courseId, final String courseName) throws IOException {
        final String existing = indexIds.get(courseId);
        if (existing != null) {
            return existing;
        }
        final Lock lock = courseLocks.get(courseId);
        lock.lock();
        try {
            final String known = indexIds.get(courseId);
            if (known != null) {
                return known;
            }
            final String created = indexClient.createIndex(courseId, courseName);
            indexIds.put(courseId, created);
            persist();
            logger.info("Course {} ({}) now uses index {}", courseId, courseName, created);
            return created;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Upload the content of a remote file to its course's index.
     *
     * @throws UnsupportedFormatException if the file type or size cannot be indexed
     */
    public IndexedEntry upload(final RemoteFile file, final byte[] content) throws IOException {
        final Lock lock = fileLocks.get(file.key());
        lock.lock();
        try {
            final IndexedEntry previous = entries.get(file.key());
            if (previous != null && previous.fingerprintAtUpload().equals(file.fingerprint())) {
                logger.debug("{} already indexed at fingerprint {}", file.key(), file.fingerprint());
                return previous;
            }

            try {
                checkSupported(file.fileName(), content.length);
            } catch (final UnsupportedFormatException e) {
                throw dropOutdatedOnRejection(previous, file, e);
            }

            final String indexId = ensureIndex(file.courseId(), file.courseName());
            final String documentId;
            try {
                documentId = indexClient.uploadDocument(indexId, file.fileName(), content, metadata(file));
            } catch (final UnsupportedFormatException e) {
                rejectedFingerprints.put(file.key(), file.fingerprint());
                persist();
                throw dropOutdatedOnRejection(previous, file, e);
            }
            rejectedFingerprints.remove(file.key());
            final IndexedEntry entry = new IndexedEntry(file.id(), file.courseId(), indexId, documentId,
                    file.fingerprint(), Instant.now());
            entries.put(file.key(), entry);
            persist();
            logger.debug("Uploaded {} to index {} as {}", file.key(), indexId, documentId);

            if (previous != null) {
                deleteSuperseded(previous);
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the index document of a file whose current version cannot be indexed, so that the index stops
     * serving the outdated version.
     *
     * @return true if an outdated document was removed
     */
    public boolean dropOutdated(final RemoteFile file) throws IOException {
        final Lock lock = fileLocks.get(file.key());
        lock.lock();
        try {
            final IndexedEntry current = entries.get(file.key());
            if (current == null || current.fingerprintAtUpload().equals(file.fingerprint())) {
                return false;
            }
            try {
                indexClient.deleteDocument(current.indexId(), current.documentId());
            } catch (final SearchIndexException e) {
                if (!e.isNotFound()) {
                    throw e;
                }
                logger.debug("Document {} already gone from {}", current.documentId(), current.indexId());
            }
            entries.remove(file.key());
            persist();
            logger.info("Removed outdated document {} of {} ({} is not indexable)",
                    current.documentId(), file.key(), file.fingerprint());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param courseId restrict to one course; null for all
     */
    public List<IndexedEntry> listIndexed(@Nullable final Long courseId) {
        return entries.values().stream()
                .filter(e -> courseId == null || e.courseId() == courseId)
                .toList();
    }

    public Optional<IndexedEntry> indexedEntry(final FileKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * @return course id to index id, for every course with an index
     */
    public Map<Long, String> indexIds() {
        return new TreeMap<>(indexIds);
    }

    public Optional<String> indexId(final long courseId) {
        return Optional.ofNullable(indexIds.get(courseId));
    }

    /**
     * Delete index documents whose remote file no longer exists.
     *
     * @return number of entries removed from index and manifest
     */
    public int pruneExtra(final List<IndexedEntry> extraEntries) throws IOException {
        int removed = 0;
        for (final IndexedEntry extra : extraEntries) {
            final Lock lock = fileLocks.get(extra.key());
            lock.lock();
            try {
                final IndexedEntry current = entries.get(extra.key());
                if (current == null || !current.documentId().equals(extra.documentId())) {
                    continue;
                }
                try {
                    indexClient.deleteDocument(current.indexId(), current.documentId());
                } catch (final SearchIndexException e) {
                    if (!e.isNotFound()) {
                        throw e;
                    }
                    logger.debug("Document {} already gone from {}", current.documentId(), current.indexId());
                }
                entries.remove(extra.key());
                persist();
                removed++;
            } finally {
                lock.unlock();
            }
        }
        logger.info("Pruned {} of {} extra index entries", removed, extraEntries.size());
        return removed;
    }

    /**
     * Rebuild the manifest entries of a course from the metadata stored in its index, e.g. after the
     * manifest file was lost. Documents without our metadata are ignored.
     *
     * @param indexId index to read; null uses the course's known index
     * @return number of entries imported
     */
    public int importRemoteDocuments(final long courseId, @Nullable final String indexId) throws IOException {
        final String effectiveIndexId = indexId != null ? indexId : indexIds.get(courseId);
        if (effectiveIndexId == null) {
            throw new IllegalArgumentException("No index known for course " + courseId + ", an index id is required");
        }

        final Lock lock = courseLocks.get(courseId);
        lock.lock();
        try {
            final List<IndexedDocument> documents = indexClient.listDocuments(effectiveIndexId);
            final Map<FileKey, IndexedEntry> imported = new LinkedHashMap<>();
            for (final IndexedDocument document : documents) {
                final String remoteId = document.metadata().get(META_REMOTE_ID);
                final String course = document.metadata().get(META_COURSE_ID);
                final String fingerprint = document.metadata().get(META_FINGERPRINT);
                if (remoteId == null || fingerprint == null || !String.valueOf(courseId).equals(course)) {
                    logger.debug("Ignoring document {} without matching metadata", document.documentId());
                    continue;
                }
                imported.put(new FileKey(courseId, remoteId), new IndexedEntry(remoteId, courseId,
                        effectiveIndexId, document.documentId(), fingerprint, Instant.now()));
            }

            entries.keySet().removeIf(key -> key.courseId() == courseId);
            entries.putAll(imported);
            indexIds.put(courseId, effectiveIndexId);
            persist();
            logger.info("Imported {} manifest entries for course {} from index {} ({} documents listed)",
                    imported.size(), courseId, effectiveIndexId, documents.size());
            return imported.size();
        } finally {
            lock.unlock();
        }
    }

    public List<SearchHit> search(final long courseId, final String query, final int maxResults) throws IOException {
        final String indexId = indexIds.get(courseId);
        if (indexId == null) {
            return List.of();
        }
        return indexClient.search(indexId, query, maxResults);
    }

    /**
     * @throws UnsupportedFormatException if the file cannot be uploaded
     */
    public void checkSupported(final String fileName, final long size) throws UnsupportedFormatException {
        final String extension = FileNames.extension(fileName);
        if (!supportedExtensions.contains(extension)) {
            throw new UnsupportedFormatException("File type '" + extension + "' of " + fileName + " is not indexable");
        }
        if (size > maxUploadSizeBytes) {
            throw new UnsupportedFormatException(fileName + " is " + size + " bytes, above the limit of "
                    + maxUploadSizeBytes);
        }
    }

    public boolean isSupported(final String fileName, final long size) {
        return supportedExtensions.contains(FileNames.extension(fileName)) && size <= maxUploadSizeBytes;
    }

    /**
     * A file is indexable if its type and size are supported and the backend has not rejected
     * it at its current fingerprint.
     */
    public boolean isIndexable(final RemoteFile file) {
        if (!isSupported(file.fileName(), file.size())) {
            return false;
        }
        return !file.fingerprint().equals(rejectedFingerprints.get(file.key()));
    }

    private UnsupportedFormatException dropOutdatedOnRejection(@Nullable final IndexedEntry previous,
                                                               final RemoteFile file,
                                                               final UnsupportedFormatException rejection) {
        if (previous == null) {
            return rejection;
        }
        try {
            dropOutdated(file);
        } catch (final IOException e) {
            logger.warn("Could not remove outdated document {} of {}: {}",
                    previous.documentId(), file.key(), e.getMessage());
            rejection.addSuppressed(e);
        }
        return rejection;
    }

    private void deleteSuperseded(final IndexedEntry previous) {
        try {
            indexClient.deleteDocument(previous.indexId(), previous.documentId());
            logger.debug("Deleted superseded document {} of {}", previous.documentId(), previous.key());
        } catch (final IOException e) {
            logger.warn("Could not delete superseded document {} of {} from {}: {}",
                    previous.documentId(), previous.key(), previous.indexId(), e.getMessage());
        }
    }

    private static Map<String, String> metadata(final RemoteFile file) {
        final Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(META_REMOTE_ID, file.id());
        metadata.put(META_COURSE_ID, String.valueOf(file.courseId()));
        metadata.put(META_FINGERPRINT, file.fingerprint());
        metadata.put(META_FILE_NAME, file.fileName());
        metadata.put(META_PATH, truncate(file.path(), 512));
        return metadata;
    }

    private static String truncate(final String value, final int maxLength) {
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    // ==================== Persistence ====================

    private void loadManifest() {
        final Map<String, Object> root = manifestFile.load();
        for (final Map<String, Object> map : YamlStateFile.list(root, "indexes")) {
            final long courseId = YamlStateFile.number(map, "courseId", -1);
            final String indexId = YamlStateFile.string(map, "indexId");
            if (courseId >= 0 && indexId != null) {
                indexIds.put(courseId, indexId);
            }
        }
        for (final Map<String, Object> map : YamlStateFile.list(root, "documents")) {
            try {
                final IndexedEntry entry = new IndexedEntry(
                        YamlStateFile.string(map, "remoteId"),
                        YamlStateFile.number(map, "courseId", 0),
                        YamlStateFile.string(map, "indexId"),
                        YamlStateFile.string(map, "documentId"),
                        YamlStateFile.string(map, "fingerprint"),
                        Instant.parse(YamlStateFile.string(map, "uploadedAt")));
                entries.put(entry.key(), entry);
            } catch (final RuntimeException e) {
                logger.warn("Skipping malformed index manifest entry {}: {}", map, e.getMessage());
            }
        }
        for (final Map<String, Object> map : YamlStateFile.list(root, "rejected")) {
            final String remoteId = YamlStateFile.string(map, "remoteId");
            final String fingerprint = YamlStateFile.string(map, "fingerprint");
            if (remoteId != null && fingerprint != null) {
                rejectedFingerprints.put(new FileKey(YamlStateFile.number(map, "courseId", 0), remoteId), fingerprint);
            }
        }
        logger.info("Index manifest loaded: {} indexes, {} documents", indexIds.size(), entries.size());
    }

    private synchronized void persist() throws IOException {
        final List<Map<String, Object>> indexes = new ArrayList<>();
        for (final Map.Entry<Long, String> index : new TreeMap<>(indexIds).entrySet()) {
            final Map<String, Object> map = new LinkedHashMap<>();
            map.put("courseId", index.getKey());
            map.put("indexId", index.getValue());
            indexes.add(map);
        }
        final List<Map<String, Object>> documents = new ArrayList<>();
        for (final IndexedEntry entry : entries.values()) {
            final Map<String, Object> map = new LinkedHashMap<>();
            map.put("remoteId", entry.remoteId());
            map.put("courseId", entry.courseId());
            map.put("indexId", entry.indexId());
            map.put("documentId", entry.documentId());
            map.put("fingerprint", entry.fingerprintAtUpload());
            map.put("uploadedAt", entry.uploadedAt().toString());
            documents.add(map);
        }
        final List<Map<String, Object>> rejected = new ArrayList<>();
        for (final Map.Entry<FileKey, String> entry : rejectedFingerprints.entrySet()) {
            final Map<String, Object> map = new LinkedHashMap<>();
            map.put("remoteId", entry.getKey().remoteId());
            map.put("courseId", entry.getKey().courseId());
            map.put("fingerprint", entry.getValue());
            rejected.add(map);
        }
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("backend", indexClient.backendName());
        root.put("indexes", indexes);
        root.put("documents", documents);
        root.put("rejected", rejected);
        manifestFile.save(root);
    }
}

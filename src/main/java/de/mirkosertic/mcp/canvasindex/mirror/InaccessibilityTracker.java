package de.mirkosertic.mcp.canvasindex.mirror;

import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import de.mirkosertic.mcp.canvasindex.storage.YamlStateFile;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable record of files the caller was denied access to. Records stay until explicitly reset,
 * so such files are not retried on every sync.
 */
public class InaccessibilityTracker {

    private static final Logger logger = LoggerFactory.getLogger(InaccessibilityTracker.class);

    private final YamlStateFile stateFile;
    private final Map<FileKey, InaccessibleRecord> records = new ConcurrentHashMap<>();

    public InaccessibilityTracker(final Path path) {
        this.stateFile = new YamlStateFile(path);
        load();
    }

    /**
     * Record a permission-denied download. A repeated mark keeps {@code firstSeenAt}.
     */
    public synchronized InaccessibleRecord markInaccessible(final RemoteFile file, final String reason)
            throws IOException {
        final Instant now = Instant.now();
        final InaccessibleRecord previous = records.get(file.key());
        final InaccessibleRecord record = new InaccessibleRecord(file.id(), file.courseId(), file.path(), reason,
                previous != null ? previous.firstSeenAt() : now, now);
        records.put(file.key(), record);
        persist();
        logger.info("File {} ({}) marked inaccessible: {}", file.key(), file.path(), reason);
        return record;
    }

    public boolean isInaccessible(final long courseId, final String remoteId) {
        return records.containsKey(new FileKey(courseId, remoteId));
    }

    /**
     * Clear records so the files are attempted again.
     *
     * @param courseId only clear this course; null clears everything
     * @return number of records cleared
     */
    public synchronized int reset(@Nullable final Long courseId) throws IOException {
        final int before = records.size();
        if (courseId == null) {
            records.clear();
        } else {
            records.keySet().removeIf(key -> key.courseId() == courseId);
        }
        final int cleared = before - records.size();
        if (cleared > 0) {
            persist();
        }
        logger.info("Reset {} inaccessible record(s){}", cleared, courseId != null ? " of course " + courseId : "");
        return cleared;
    }

    /**
     * @param courseId restrict to one course; null for all
     * @return records ordered by course and path
     */
    public List<InaccessibleRecord> records(@Nullable final Long courseId) {
        return records.values().stream()
                .filter(r -> courseId == null || r.courseId() == courseId)
                .sorted(Comparator.comparingLong(InaccessibleRecord::courseId).thenComparing(InaccessibleRecord::path))
                .toList();
    }

    public Set<FileKey> keys() {
        return Set.copyOf(records.keySet());
    }

    private void load() {
        final Map<String, Object> root = stateFile.load();
        for (final Map<String, Object> map : YamlStateFile.list(root, "files")) {
            try {
                final InaccessibleRecord record = new InaccessibleRecord(
                        YamlStateFile.string(map, "remoteId"),
                        YamlStateFile.number(map, "courseId", 0),
                        YamlStateFile.string(map, "path"),
                        YamlStateFile.string(map, "reason"),
                        Instant.parse(YamlStateFile.string(map, "firstSeenAt")),
                        Instant.parse(YamlStateFile.string(map, "lastAttemptAt")));
                records.put(record.key(), record);
            } catch (final RuntimeException e) {
                logger.warn("Skipping malformed inaccessible record {}: {}", map, e.getMessage());
            }
        }
        if (!records.isEmpty()) {
            logger.info("Loaded {} inaccessible file record(s)", records.size());
        }
    }

    private void persist() throws IOException {
        final List<Map<String, Object>> list = new ArrayList<>();
        for (final InaccessibleRecord record : records(null)) {
            final Map<String, Object> map = new LinkedHashMap<>();
            map.put("remoteId", record.remoteId());
            map.put("courseId", record.courseId());
            map.put("path", record.path());
            map.put("reason", record.reason());
            map.put("firstSeenAt", record.firstSeenAt().toString());
            map.put("lastAttemptAt", record.lastAttemptAt().toString());
            list.add(map);
        }
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("files", list);
        stateFile.save(root);
    }
}

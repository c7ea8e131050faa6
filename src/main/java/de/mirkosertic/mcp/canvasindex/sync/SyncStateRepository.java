package de.mirkosertic.mcp.canvasindex.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.canvasindex.mirror.InaccessibleRecord;
import de.mirkosertic.mcp.canvasindex.storage.YamlStateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the outcome of the last sync run: a compact {@code sync-state.yaml} that is read back
 * on startup, and a human-readable JSON report with every failure and all inaccessible files.
 */
public class SyncStateRepository {

    private static final Logger logger = LoggerFactory.getLogger(SyncStateRepository.class);

    private final YamlStateFile stateFile;
    private final Path reportPath;
    private final ObjectMapper objectMapper;

    public SyncStateRepository(final Path statePath, final Path reportPath, final ObjectMapper objectMapper) {
        this.stateFile = new YamlStateFile(statePath);
        this.reportPath = reportPath;
        this.objectMapper = objectMapper;
    }

    public Path getReportPath() {
        return reportPath;
    }

    /**
     * Record a finished run.
     */
    public void save(final SyncSummary summary, final List<InaccessibleRecord> inaccessible) throws IOException {
        final Map<String, Object> last = new LinkedHashMap<>();
        last.put("state", summary.state().name());
        last.put("startTimeMs", summary.startTimeMs());
        last.put("endTimeMs", summary.endTimeMs());
        last.put("filesPlanned", summary.filesPlanned());
        last.put("filesDownloaded", summary.filesDownloaded());
        last.put("filesUploaded", summary.filesUploaded());
        last.put("filesSkippedInaccessible", summary.filesSkippedInaccessible());
        last.put("filesUnsupported", summary.filesUnsupported());
        last.put("filesFailed", summary.filesFailed());
        last.put("coursesTouched", summary.coursesTouched());
        last.put("cancelled", summary.cancelled());
        if (summary.errorMessage() != null) {
            last.put("errorMessage", summary.errorMessage());
        }
        final Map<String, Object> failedCourses = new LinkedHashMap<>();
        summary.coursesFailed().forEach((courseId, message) -> failedCourses.put(String.valueOf(courseId), message));
        last.put("coursesFailed", failedCourses);

        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("lastSync", last);
        stateFile.save(root);

        writeReport(summary, inaccessible);
        logger.info("Sync state saved: state={}, downloaded={}, uploaded={}, report={}",
                summary.state(), summary.filesDownloaded(), summary.filesUploaded(), reportPath);
    }

    /**
     * @return the summary of the last recorded run; per-file failures are only kept in the report
     */
    @SuppressWarnings("unchecked")
    public Optional<SyncSummary> loadLastSummary() {
        final Map<String, Object> root = stateFile.load();
        final Object value = root.get("lastSync");
        if (!(value instanceof Map)) {
            return Optional.empty();
        }
        final Map<String, Object> last = (Map<String, Object>) value;
        try {
            final Map<Long, String> coursesFailed = new LinkedHashMap<>();
            if (last.get("coursesFailed") instanceof Map<?, ?> failed) {
                failed.forEach((k, v) -> coursesFailed.put(Long.parseLong(String.valueOf(k)), String.valueOf(v)));
            }
            final SyncSummary summary = new SyncSummary(
                    SyncState.valueOf(YamlStateFile.string(last, "state")),
                    YamlStateFile.number(last, "filesPlanned", 0),
                    YamlStateFile.number(last, "filesDownloaded", 0),
                    YamlStateFile.number(last, "filesUploaded", 0),
                    YamlStateFile.number(last, "filesSkippedInaccessible", 0),
                    YamlStateFile.number(last, "filesUnsupported", 0),
                    YamlStateFile.number(last, "filesFailed", 0),
                    (int) YamlStateFile.number(last, "coursesTouched", 0),
                    coursesFailed,
                    List.of(),
                    Boolean.TRUE.equals(last.get("cancelled")),
                    YamlStateFile.string(last, "errorMessage"),
                    YamlStateFile.number(last, "startTimeMs", 0),
                    YamlStateFile.number(last, "endTimeMs", 0));
            logger.info("Loaded last sync state: state={}, finished at {}", summary.state(),
                    Instant.ofEpochMilli(summary.endTimeMs()));
            return Optional.of(summary);
        } catch (final RuntimeException e) {
            logger.warn("Ignoring unreadable sync state in {}: {}", stateFile.getPath(), e.getMessage());
            return Optional.empty();
        }
    }

    private void writeReport(final SyncSummary summary, final List<InaccessibleRecord> inaccessible)
            throws IOException {
        final List<SyncReport.InaccessibleFile> files = inaccessible.stream()
                .map(r -> new SyncReport.InaccessibleFile(r.courseId(), r.remoteId(), r.path(), r.reason(),
                        r.firstSeenAt().toString(), r.lastAttemptAt().toString()))
                .toList();
        final SyncReport report = new SyncReport(Instant.now().toString(), summary, files);

        final Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path temp = reportPath.resolveSibling(reportPath.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), report);
        YamlStateFile.moveIntoPlace(temp, reportPath);
    }

    /**
     * JSON report layout.
     */
    public record SyncReport(String generatedAt, SyncSummary summary, List<InaccessibleFile> inaccessibleFiles) {

        public record InaccessibleFile(long courseId, String remoteId, String path, String reason,
                                       String firstSeenAt, String lastAttemptAt) {
        }
    }
}

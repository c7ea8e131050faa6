package de.mirkosertic.mcp.canvasindex.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.canvasindex.mirror.InaccessibleRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SyncStateRepository Tests")
class SyncStateRepositoryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SyncStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new SyncStateRepository(tempDir.resolve("sync-state.yaml"), tempDir.resolve("sync-report.json"),
                objectMapper);
    }

    private static SyncSummary summary() {
        return new SyncSummary(SyncState.COMPLETED, 10, 7, 6, 1, 1, 1, 2,
                Map.of(9L, "HTTP 503"),
                List.of(new FileFailure(1L, "file:3", "Files/c.pdf", FailureKind.ERROR, "upload", "boom")),
                false, null, 1_000L, 5_000L);
    }

    @Test
    @DisplayName("Should return nothing before the first run")
    void shouldBeEmptyInitially() {
        assertThat(repository.loadLastSummary()).isEmpty();
    }

    @Test
    @DisplayName("Should restore counters and failed courses of the last run")
    void shouldRestoreLastRun() throws Exception {
        repository.save(summary(), List.of());

        final Optional<SyncSummary> restored = new SyncStateRepository(tempDir.resolve("sync-state.yaml"),
                tempDir.resolve("sync-report.json"), objectMapper).loadLastSummary();

        assertThat(restored).hasValueSatisfying(s -> {
            assertThat(s.state()).isEqualTo(SyncState.COMPLETED);
            assertThat(s.filesDownloaded()).isEqualTo(7);
            assertThat(s.filesUploaded()).isEqualTo(6);
            assertThat(s.coursesTouched()).isEqualTo(2);
            assertThat(s.coursesFailed()).containsEntry(9L, "HTTP 503");
            assertThat(s.elapsedTimeMs()).isEqualTo(4_000L);
            assertThat(s.failures()).isEmpty();
        });
    }

    @Test
    @DisplayName("Should write a JSON report with failures and inaccessible files")
    void shouldWriteReport() throws Exception {
        final Instant now = Instant.parse("2024-05-01T12:00:00Z");
        repository.save(summary(), List.of(
                new InaccessibleRecord("file:5", 1L, "Files/locked.pdf", "HTTP 403", now, now)));

        final JsonNode report = objectMapper.readTree(Files.readString(repository.getReportPath()));

        assertThat(report.path("summary").path("failures")).hasSize(1);
        assertThat(report.path("summary").path("failures").get(0).path("remoteId").asText()).isEqualTo("file:3");
        assertThat(report.path("inaccessibleFiles").get(0).path("reason").asText()).isEqualTo("HTTP 403");
        assertThat(report.path("inaccessibleFiles").get(0).path("firstSeenAt").asText())
                .isEqualTo("2024-05-01T12:00:00Z");
    }

    @Test
    @DisplayName("Should ignore a state file with an unknown state")
    void shouldIgnoreCorruptState() throws Exception {
        Files.writeString(tempDir.resolve("sync-state.yaml"), "lastSync:\n  state: EXPLODED\n");

        assertThat(repository.loadLastSummary()).isEmpty();
    }
}

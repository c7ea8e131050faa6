package de.mirkosertic.mcp.canvasindex.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasApiException;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasClient;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasCourse;
import de.mirkosertic.mcp.canvasindex.canvas.ContentKind;
import de.mirkosertic.mcp.canvasindex.index.IndexUploader;
import de.mirkosertic.mcp.canvasindex.index.SearchIndexClient;
import de.mirkosertic.mcp.canvasindex.index.UnsupportedFormatException;
import de.mirkosertic.mcp.canvasindex.inventory.CourseInventoryFetcher;
import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.inventory.Inventory;
import de.mirkosertic.mcp.canvasindex.inventory.PartialInventoryException;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteUnavailableException;
import de.mirkosertic.mcp.canvasindex.mirror.InaccessibilityTracker;
import de.mirkosertic.mcp.canvasindex.mirror.LocalMirrorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SyncOrchestrator Tests")
class SyncOrchestratorTest {

    private static final CanvasCourse COURSE = new CanvasCourse(1L, "Algebra", "MATH101");
    private static final CanvasCourse HISTORY = new CanvasCourse(2L, "History", "HIST200");

    @TempDir
    Path tempDir;

    private CourseInventoryFetcher fetcher;
    private CanvasClient canvasClient;
    private SearchIndexClient indexClient;
    private InaccessibilityTracker tracker;
    private LocalMirrorStore mirrorStore;
    private IndexUploader uploader;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws IOException {
        fetcher = mock(CourseInventoryFetcher.class);
        canvasClient = mock(CanvasClient.class);
        indexClient = mock(SearchIndexClient.class);

        final AtomicInteger documentCounter = new AtomicInteger();
        when(indexClient.createIndex(anyLong(), anyString()))
                .thenAnswer(invocation -> "vs_" + invocation.getArgument(0));
        when(indexClient.uploadDocument(anyString(), anyString(), any(byte[].class), anyMap()))
                .thenAnswer(invocation -> "doc-" + documentCounter.incrementAndGet());
        when(canvasClient.downloadContent(anyLong(), anyString()))
                .thenAnswer(invocation -> ("content of " + invocation.getArgument(1)).getBytes(StandardCharsets.UTF_8));

        tracker = new InaccessibilityTracker(tempDir.resolve("inaccessible-files.yaml"));
        mirrorStore = new LocalMirrorStore(tempDir.resolve("file_index"), tempDir.resolve("local-manifest.yaml"));
        uploader = new IndexUploader(indexClient, tempDir.resolve("index-manifest.yaml"), List.of(".pdf"), 1_000_000);

        orchestrator = new SyncOrchestrator(
                fetcher,
                canvasClient,
                mirrorStore,
                tracker,
                uploader,
                new SyncExecutorService(2),
                new RetryPolicy(3, 1, 1),
                new SyncStateRepository(tempDir.resolve("sync-state.yaml"), tempDir.resolve("sync-report.json"),
                        new ObjectMapper()),
                new SyncOrchestrator.Settings(List.of(), 1000.0, 1000.0, 20, false));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private static RemoteFile file(final long id, final String fingerprint) {
        return new RemoteFile("file:" + id, 1L, "MATH101_Algebra", "Files/doc" + id + ".pdf", 10, fingerprint,
                null, ContentKind.FILES);
    }

    private static RemoteFile historyFile(final long id, final String fingerprint) {
        return new RemoteFile("file:" + id, 2L, "HIST200_History", "Files/doc" + id + ".pdf", 10, fingerprint,
                null, ContentKind.FILES);
    }

    private static Inventory inventory(final RemoteFile... files) {
        return new Inventory(List.of(COURSE), List.of(files), Map.of());
    }

    private SyncSummary runToCompletion() throws InterruptedException {
        assertThat(orchestrator.startSync(null, false)).isEqualTo(StartResult.STARTED);
        assertThat(orchestrator.awaitCompletion(10000)).isTrue();
        return orchestrator.getLastSummary().orElseThrow();
    }

    @Test
    @DisplayName("Should download and upload everything, then do nothing on a second run")
    void shouldConvergeAndBeIdempotent() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v1"), file(2, "v1"), file(3, "v1")));

        final SyncSummary first = runToCompletion();

        assertThat(first.state()).isEqualTo(SyncState.COMPLETED);
        assertThat(first.filesDownloaded()).isEqualTo(3);
        assertThat(first.filesUploaded()).isEqualTo(3);
        assertThat(first.filesFailed()).isZero();
        assertThat(first.coursesTouched()).isEqualTo(1);
        assertThat(mirrorStore.manifestSnapshot()).hasSize(3);
        assertThat(uploader.listIndexed(1L)).hasSize(3);

        final SyncSummary second = runToCompletion();

        assertThat(second.filesPlanned()).isZero();
        assertThat(second.filesDownloaded()).isZero();
        assertThat(second.filesUploaded()).isZero();
        assertThat(second.filesSkippedInaccessible()).isZero();
        assertThat(second.filesFailed()).isZero();
        assertThat(orchestrator.getStatus(false).missingFilesCount()).isZero();
        verify(canvasClient, times(3)).downloadContent(anyLong(), anyString());
    }

    @Test
    @DisplayName("Should record a permission error as inaccessible and skip the file afterwards")
    void shouldRecordInaccessibleFiles() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v1"), file(2, "v1")));
        when(canvasClient.downloadContent(1L, "file:2"))
                .thenThrow(new CanvasApiException(CanvasApiException.Reason.UNAUTHORIZED, 403, "Forbidden"));

        final SyncSummary first = runToCompletion();

        assertThat(first.filesDownloaded()).isEqualTo(1);
        assertThat(first.filesSkippedInaccessible()).isEqualTo(1);
        assertThat(first.filesFailed()).isZero();
        assertThat(first.failures()).singleElement()
                .satisfies(f -> assertThat(f.kind()).isEqualTo(FailureKind.PERMISSION_DENIED));
        assertThat(tracker.isInaccessible(1L, "file:2")).isTrue();
        verify(canvasClient, times(1)).downloadContent(1L, "file:2");

        final SyncSummary second = runToCompletion();

        assertThat(second.filesPlanned()).isZero();
        assertThat(second.filesSkippedInaccessible()).isZero();
        verify(canvasClient, times(1)).downloadContent(1L, "file:2");
        assertThat(orchestrator.getStatus(false).inaccessibleCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry a transient download failure")
    void shouldRetryTransientFailure() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v1")));
        when(canvasClient.downloadContent(1L, "file:1"))
                .thenThrow(new CanvasApiException(CanvasApiException.Reason.UNAVAILABLE, 503, "Service Unavailable"))
                .thenReturn("ok".getBytes(StandardCharsets.UTF_8));

        final SyncSummary summary = runToCompletion();

        assertThat(summary.filesDownloaded()).isEqualTo(1);
        assertThat(summary.filesUploaded()).isEqualTo(1);
        assertThat(summary.filesFailed()).isZero();
        verify(canvasClient, times(2)).downloadContent(1L, "file:1");
    }

    @Test
    @DisplayName("Should count a file as failed once retries are exhausted")
    void shouldFailAfterRetries() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v1"), file(2, "v1")));
        when(canvasClient.downloadContent(1L, "file:1"))
                .thenThrow(new CanvasApiException(CanvasApiException.Reason.RATE_LIMITED, 429, "Too Many Requests"));

        final SyncSummary summary = runToCompletion();

        assertThat(summary.state()).isEqualTo(SyncState.COMPLETED);
        assertThat(summary.filesFailed()).isEqualTo(1);
        assertThat(summary.filesDownloaded()).isEqualTo(1);
        assertThat(tracker.keys()).isEmpty();
        verify(canvasClient, times(3)).downloadContent(1L, "file:1");
    }

    @Test
    @DisplayName("Should reject a second start while running without side effects")
    void shouldRejectConcurrentStart() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch planning = new CountDownLatch(1);
        when(fetcher.fetchInventory(any())).thenAnswer(invocation -> {
            planning.countDown();
            release.await(10, TimeUnit.SECONDS);
            return inventory(file(1, "v1"));
        });

        assertThat(orchestrator.startSync(null, false)).isEqualTo(StartResult.STARTED);
        assertThat(planning.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.startSync(List.of(1L), false)).isEqualTo(StartResult.ALREADY_RUNNING);
        assertThat(orchestrator.getState()).isEqualTo(SyncState.PLANNING);

        release.countDown();
        assertThat(orchestrator.awaitCompletion(10000)).isTrue();
        verify(fetcher, times(1)).fetchInventory(any());
    }

    @Test
    @DisplayName("Should re-download and re-upload a changed file and delete the old document")
    void shouldHandleChangedFile() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v1")));
        runToCompletion();

        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v2")));
        final SyncSummary summary = runToCompletion();

        assertThat(summary.filesDownloaded()).isEqualTo(1);
        assertThat(summary.filesUploaded()).isEqualTo(1);
        assertThat(uploader.listIndexed(1L)).singleElement()
                .satisfies(e -> {
                    assertThat(e.fingerprintAtUpload()).isEqualTo("v2");
                    assertThat(e.documentId()).isEqualTo("doc-2");
                });
        verify(indexClient).deleteDocument("vs_1", "doc-1");
    }

    @Test
    @DisplayName("Should upload mirrored files only when downloads are skipped")
    void shouldSkipDownloads() throws Exception {
        final RemoteFile mirrored = file(1, "v1");
        mirrorStore.write(mirrored, "local".getBytes(StandardCharsets.UTF_8));
        when(fetcher.fetchInventory(any())).thenReturn(inventory(mirrored, file(2, "v1")));

        assertThat(orchestrator.startSync(null, true)).isEqualTo(StartResult.STARTED);
        assertThat(orchestrator.awaitCompletion(10000)).isTrue();
        final SyncSummary summary = orchestrator.getLastSummary().orElseThrow();

        assertThat(summary.filesDownloaded()).isZero();
        assertThat(summary.filesUploaded()).isEqualTo(1);
        verify(canvasClient, never()).downloadContent(anyLong(), anyString());
        verify(indexClient).uploadDocument(eq("vs_1"), eq("doc1.pdf"), any(byte[].class), anyMap());
    }

    @Test
    @DisplayName("Should stop submitting work after cancellation")
    void shouldCancel() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch planning = new CountDownLatch(1);
        when(fetcher.fetchInventory(any())).thenAnswer(invocation -> {
            planning.countDown();
            release.await(10, TimeUnit.SECONDS);
            return inventory(file(1, "v1"), file(2, "v1"));
        });

        orchestrator.startSync(null, false);
        assertThat(planning.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(orchestrator.cancelSync()).isTrue();
        release.countDown();
        assertThat(orchestrator.awaitCompletion(10000)).isTrue();

        final SyncSummary summary = orchestrator.getLastSummary().orElseThrow();
        assertThat(summary.cancelled()).isTrue();
        assertThat(summary.filesDownloaded()).isZero();
        verify(canvasClient, never()).downloadContent(anyLong(), anyString());
    }

    @Test
    @DisplayName("Should fail the run when the inventory is unavailable")
    void shouldFailOnTotalInventoryFailure() throws Exception {
        when(fetcher.fetchInventory(any())).thenThrow(new RemoteUnavailableException("Canvas is down"));

        final SyncSummary summary = runToCompletion();

        assertThat(summary.state()).isEqualTo(SyncState.FAILED);
        assertThat(summary.errorMessage()).contains("Canvas is down");
        assertThat(orchestrator.getState()).isEqualTo(SyncState.FAILED);
        assertThat(orchestrator.isRunning()).isFalse();
        verify(canvasClient, never()).downloadContent(anyLong(), anyString());
    }

    @Test
    @DisplayName("Should restore the last summary after a restart")
    void shouldRestoreLastSummary() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v1")));
        runToCompletion();

        final SyncStateRepository repository = new SyncStateRepository(tempDir.resolve("sync-state.yaml"),
                tempDir.resolve("sync-report.json"), new ObjectMapper());

        assertThat(repository.loadLastSummary()).hasValueSatisfying(s -> {
            assertThat(s.state()).isEqualTo(SyncState.COMPLETED);
            assertThat(s.filesDownloaded()).isEqualTo(1);
        });
        assertThat(tempDir.resolve("sync-report.json")).exists();
    }

    @Test
    @DisplayName("Should remove the outdated document when the new version is rejected by the index")
    void shouldDropOutdatedDocumentOfRejectedChange() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v1")));
        runToCompletion();
        assertThat(uploader.listIndexed(1L)).singleElement()
                .satisfies(e -> assertThat(e.documentId()).isEqualTo("doc-1"));

        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v2")));
        doThrow(new UnsupportedFormatException("No text in doc1.pdf"))
                .when(indexClient).uploadDocument(anyString(), anyString(), any(byte[].class), anyMap());
        final SyncSummary rejected = runToCompletion();

        assertThat(rejected.filesDownloaded()).isEqualTo(1);
        assertThat(rejected.filesUploaded()).isZero();
        assertThat(rejected.filesUnsupported()).isEqualTo(1);
        verify(indexClient).deleteDocument("vs_1", "doc-1");
        assertThat(uploader.listIndexed(1L)).isEmpty();

        final IndexStatus status = orchestrator.getStatus(false);
        assertThat(status.upToDateCount()).isZero();
        assertThat(status.notIndexableCount()).isEqualTo(1);
        assertThat(status.missingInIndexCount()).isZero();
        assertThat(status.indexedFilesTotal()).isZero();

        final SyncSummary next = runToCompletion();

        assertThat(next.filesPlanned()).isZero();
        verify(indexClient, times(2)).uploadDocument(anyString(), anyString(), any(byte[].class), anyMap());
    }

    @Test
    @DisplayName("Should download a file again after its course's inaccessible records are reset")
    void shouldRetryAfterResetInaccessible() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(inventory(file(1, "v1"), file(2, "v1")));
        when(canvasClient.downloadContent(1L, "file:2"))
                .thenThrow(new CanvasApiException(CanvasApiException.Reason.UNAUTHORIZED, 403, "Forbidden"));
        tracker.markInaccessible(historyFile(9, "v1"), "HTTP 403");

        runToCompletion();
        assertThat(tracker.isInaccessible(1L, "file:2")).isTrue();

        assertThat(runToCompletion().filesPlanned()).isZero();
        verify(canvasClient, times(1)).downloadContent(1L, "file:2");

        assertThat(orchestrator.resetInaccessible(1L)).isEqualTo(1);
        assertThat(tracker.isInaccessible(2L, "file:9")).isTrue();

        doReturn("unlocked".getBytes(StandardCharsets.UTF_8)).when(canvasClient).downloadContent(1L, "file:2");
        final SyncSummary afterReset = runToCompletion();

        assertThat(afterReset.filesDownloaded()).isEqualTo(1);
        assertThat(afterReset.filesUploaded()).isEqualTo(1);
        assertThat(afterReset.filesSkippedInaccessible()).isZero();
        verify(canvasClient, times(2)).downloadContent(1L, "file:2");
        assertThat(tracker.isInaccessible(1L, "file:2")).isFalse();
        assertThat(tracker.keys()).extracting(FileKey::courseId).containsExactly(2L);
        assertThat(mirrorStore.read(1L, "file:2")).asString(StandardCharsets.UTF_8).isEqualTo("unlocked");
    }

    @Test
    @DisplayName("Should sync the remaining courses of a partial inventory and keep the failed course's documents")
    void shouldProceedWithPartialInventory() throws Exception {
        when(fetcher.fetchInventory(any())).thenReturn(new Inventory(List.of(COURSE, HISTORY),
                List.of(file(1, "v1"), historyFile(7, "v1")), Map.of()));
        runToCompletion();
        assertThat(uploader.listIndexed(2L)).hasSize(1);

        when(fetcher.fetchInventory(any())).thenThrow(new PartialInventoryException(new Inventory(List.of(COURSE),
                List.of(file(1, "v1"), file(3, "v1")), Map.of(2L, "HTTP 500"))));
        final SyncSummary summary = runToCompletion();

        assertThat(summary.state()).isEqualTo(SyncState.COMPLETED);
        assertThat(summary.coursesFailed()).containsOnlyKeys(2L);
        assertThat(summary.filesDownloaded()).isEqualTo(1);
        assertThat(summary.filesUploaded()).isEqualTo(1);
        verify(canvasClient).downloadContent(1L, "file:3");

        final IndexStatus status = orchestrator.getStatus(false);
        assertThat(status.extraFilesCount()).isZero();
        assertThat(status.coursesFailed()).containsOnlyKeys(2L);
        assertThat(uploader.listIndexed(2L)).singleElement()
                .satisfies(e -> assertThat(e.remoteId()).isEqualTo("file:7"));
        verify(indexClient, never()).deleteDocument(eq("vs_2"), anyString());
    }
}

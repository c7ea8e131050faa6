package de.mirkosertic.mcp.canvasindex.sync;

import com.google.common.util.concurrent.RateLimiter;
import de.mirkosertic.mcp.canvasindex.canvas.CanvasClient;
import de.mirkosertic.mcp.canvasindex.index.IndexUploader;
import de.mirkosertic.mcp.canvasindex.index.IndexedEntry;
import de.mirkosertic.mcp.canvasindex.inventory.CourseInventoryFetcher;
import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.inventory.Inventory;
import de.mirkosertic.mcp.canvasindex.inventory.PartialInventoryException;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import de.mirkosertic.mcp.canvasindex.mirror.InaccessibilityTracker;
import de.mirkosertic.mcp.canvasindex.mirror.LocalEntry;
import de.mirkosertic.mcp.canvasindex.mirror.LocalMirrorStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs sync passes: inventory, plan, then download and upload every file that needs it.
 * <p>
 * At most one pass runs at a time. Planning and task submission happen on a coordinator thread,
 * per-file work on the {@link SyncExecutorService}. Each file task downloads (if needed) and then
 * uploads the same file, so an upload never precedes its download. File failures are classified,
 * counted and never abort the pass.
 */
public class SyncOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    static final String PHASE_DOWNLOAD = "download";
    static final String PHASE_UPLOAD = "upload";

    private final CourseInventoryFetcher inventoryFetcher;
    private final CanvasClient canvasClient;
    private final LocalMirrorStore mirrorStore;
    private final InaccessibilityTracker inaccessibilityTracker;
    private final IndexUploader indexUploader;
    private final ReconciliationPlanner planner;
    private final SyncExecutorService executor;
    private final RetryPolicy retryPolicy;
    private final SyncStateRepository stateRepository;
    private final SyncStatisticsTracker statisticsTracker;
    private final RateLimiter downloadLimiter;
    private final RateLimiter uploadLimiter;
    private final List<Long> defaultCourseIds;
    private final int missingSampleSize;
    private final boolean syncOnStartup;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private volatile SyncState state = SyncState.IDLE;
    private volatile Thread coordinatorThread;
    private volatile SyncPlan lastPlan;
    private volatile SyncSummary lastSummary;

    public SyncOrchestrator(
            final CourseInventoryFetcher inventoryFetcher,
            final CanvasClient canvasClient,
            final LocalMirrorStore mirrorStore,
            final InaccessibilityTracker inaccessibilityTracker,
            final IndexUploader indexUploader,
            final SyncExecutorService executor,
            final RetryPolicy retryPolicy,
            final SyncStateRepository stateRepository,
            final Settings settings) {
        this.inventoryFetcher = inventoryFetcher;
        this.canvasClient = canvasClient;
        this.mirrorStore = mirrorStore;
        this.inaccessibilityTracker = inaccessibilityTracker;
        this.indexUploader = indexUploader;
        this.planner = new ReconciliationPlanner();
        this.executor = executor;
        this.retryPolicy = retryPolicy;
        this.stateRepository = stateRepository;
        this.statisticsTracker = new SyncStatisticsTracker();
        this.downloadLimiter = RateLimiter.create(settings.downloadsPerSecond());
        this.uploadLimiter = RateLimiter.create(settings.uploadsPerSecond());
        this.defaultCourseIds = List.copyOf(settings.defaultCourseIds());
        this.missingSampleSize = settings.missingSampleSize();
        this.syncOnStartup = settings.syncOnStartup();
    }

    /**
     * Tunables of the orchestrator.
     *
     * @param defaultCourseIds   courses to sync when a request names none; empty means all
     * @param downloadsPerSecond download throttle
     * @param uploadsPerSecond   upload throttle
     * @param missingSampleSize  number of missing paths reported by {@link #getStatus(boolean)}
     * @param syncOnStartup      start a pass from {@link #init()}
     */
    public record Settings(List<Long> defaultCourseIds, double downloadsPerSecond, double uploadsPerSecond,
                           int missingSampleSize, boolean syncOnStartup) {
    }

    /**
     * Restore the last summary and optionally start a pass.
     */
    public void init() {
        stateRepository.loadLastSummary().ifPresent(summary -> lastSummary = summary);
        if (syncOnStartup) {
            logger.info("Sync on startup is enabled");
            final StartResult result = startSync(null, false);
            logger.info("Startup sync: {}", result);
        }
    }

    /**
     * Start a sync pass in the background.
     *
     * @param courseIds    restrict to these courses; null or empty uses the configured default
     * @param skipDownload only upload files that are already mirrored
     * @return {@link StartResult#ALREADY_RUNNING} without any side effect if a pass is active
     */
    public StartResult startSync(@Nullable final Collection<Long> courseIds, final boolean skipDownload) {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Sync already in progress ({}), request rejected", state);
            return StartResult.ALREADY_RUNNING;
        }

        cancelRequested.set(false);
        statisticsTracker.reset();
        state = SyncState.PLANNING;
        final List<Long> effectiveCourseIds = effectiveCourseIds(courseIds);
        logger.info("Starting sync: courses={}, skipDownload={}",
                effectiveCourseIds == null ? "all" : effectiveCourseIds, skipDownload);

        final Thread coordinator = new Thread(() -> runSync(effectiveCourseIds, skipDownload), "sync-coordinator");
        coordinator.setDaemon(true);
        coordinatorThread = coordinator;
        coordinator.start();
        return StartResult.STARTED;
    }

    private void runSync(@Nullable final List<Long> courseIds, final boolean skipDownload) {
        Map<Long, String> coursesFailed = Map.of();
        try {
            final Inventory inventory = fetchInventory(courseIds);
            coursesFailed = inventory.failedCourses();
            final SyncPlan plan = plan(inventory, courseIds);
            lastPlan = plan;

            for (final PlannedFile planned : plan.files()) {
                if (!skipDownload && planned.classification() == FileClassification.CHANGED) {
                    mirrorStore.markStale(planned.file().key());
                }
            }

            final List<PlannedFile> work = selectWork(plan, skipDownload);
            statisticsTracker.setFilesPlanned(work.size());
            state = SyncState.EXECUTING;
            logger.info("Executing sync: {} files to process ({} up to date, {} not indexable, {} inaccessible)",
                    work.size(), plan.upToDateCount(), plan.notIndexableCount(),
                    plan.count(FileClassification.KNOWN_INACCESSIBLE));

            final int submitted = executor.runGroupedByCourse(work, p -> p.file().courseId(),
                    p -> processFile(p, skipDownload), cancelRequested::get);
            logger.debug("{} of {} file tasks ran", submitted, work.size());

            // Re-plan against the same inventory so status reflects the finished pass without another fetch
            lastPlan = plan(inventory, courseIds);
            finish(SyncState.COMPLETED, coursesFailed, null);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Sync coordinator interrupted");
            finish(SyncState.FAILED, coursesFailed, "Interrupted");
        } catch (final Exception e) {
            logger.error("Sync failed", e);
            finish(SyncState.FAILED, coursesFailed, e.getMessage());
        }
    }

    private void finish(final SyncState finalState, final Map<Long, String> coursesFailed,
                        @Nullable final String errorMessage) {
        try {
            statisticsTracker.markFinished();
            final SyncSummary summary = statisticsTracker.summary(finalState, coursesFailed,
                    cancelRequested.get(), errorMessage);
            lastSummary = summary;
            logger.info("Sync {} in {}ms: downloaded={}, uploaded={}, inaccessible={}, unsupported={}, failed={}, "
                            + "coursesTouched={}, coursesFailed={}, cancelled={}",
                    finalState, summary.elapsedTimeMs(), summary.filesDownloaded(), summary.filesUploaded(),
                    summary.filesSkippedInaccessible(), summary.filesUnsupported(), summary.filesFailed(),
                    summary.coursesTouched(), summary.coursesFailed().size(), summary.cancelled());
            try {
                stateRepository.save(summary, inaccessibilityTracker.records(null));
            } catch (final IOException e) {
                logger.error("Failed to persist sync state", e);
            }
        } finally {
            state = finalState;
            running.set(false);
        }
    }

    private List<PlannedFile> selectWork(final SyncPlan plan, final boolean skipDownload) {
        final List<PlannedFile> work = new ArrayList<>();
        for (final PlannedFile planned : plan.filesNeedingWork()) {
            if (skipDownload && planned.classification().needsDownload()) {
                logger.debug("Skipping download of {} (upload only)", planned.file().key());
                continue;
            }
            work.add(planned);
        }
        return work;
    }

    // ==================== Per file ====================

    void processFile(final PlannedFile planned, final boolean skipDownload) {
        if (cancelRequested.get()) {
            return;
        }
        final RemoteFile file = planned.file();
        final String displayPath = file.courseName() + "/" + file.path();
        statisticsTracker.registerActiveFile(displayPath);
        String phase = PHASE_DOWNLOAD;
        try {
            final byte[] content;
            if (planned.classification().needsDownload() && !skipDownload) {
                downloadLimiter.acquire();
                content = retryPolicy.execute("Download of " + displayPath,
                        () -> canvasClient.downloadContent(file.courseId(), file.id()));
                mirrorStore.write(file, content);
                statisticsTracker.recordDownloaded(file.courseId());
            } else {
                content = mirrorStore.read(file.courseId(), file.id());
            }

            if (!indexUploader.isIndexable(file)) {
                phase = PHASE_UPLOAD;
                if (indexUploader.dropOutdated(file)) {
                    statisticsTracker.recordFailure(new FileFailure(file.courseId(), file.id(), file.path(),
                            FailureKind.UNSUPPORTED_FORMAT, phase, "No longer indexable, outdated document removed"));
                }
                logger.debug("{} is mirrored but not indexable", displayPath);
                return;
            }
            phase = PHASE_UPLOAD;
            uploadLimiter.acquire();
            final Optional<IndexedEntry> before = indexUploader.indexedEntry(file.key());
            final IndexedEntry entry = retryPolicy.execute("Upload of " + displayPath,
                    () -> indexUploader.upload(file, content));
            if (before.isEmpty() || !before.get().documentId().equals(entry.documentId())) {
                statisticsTracker.recordUploaded(file.courseId());
            }
        } catch (final IOException e) {
            handleFailure(file, phase, e);
        } catch (final RuntimeException e) {
            logger.error("Unexpected error syncing {}", displayPath, e);
            statisticsTracker.recordFailure(new FileFailure(file.courseId(), file.id(), file.path(),
                    FailureKind.ERROR, phase, String.valueOf(e.getMessage())));
        } finally {
            statisticsTracker.unregisterActiveFile(displayPath);
            statisticsTracker.recordCompleted();
        }
    }

    private void handleFailure(final RemoteFile file, final String phase, final IOException error) {
        final FailureKind kind = FailureKind.classify(error);
        final String message = String.valueOf(error.getMessage());
        statisticsTracker.recordFailure(new FileFailure(file.courseId(), file.id(), file.path(), kind, phase, message));

        switch (kind) {
            case PERMISSION_DENIED -> {
                logger.info("Access denied to {} ({}), recording as inaccessible", file.path(), file.key());
                try {
                    inaccessibilityTracker.markInaccessible(file, message);
                    mirrorStore.markInaccessible(file.key());
                } catch (final IOException e) {
                    logger.error("Failed to record {} as inaccessible", file.key(), e);
                }
            }
            case UNSUPPORTED_FORMAT -> logger.info("Not indexable: {} ({})", file.path(), message);
            default -> logger.warn("Failed to {} {} ({}): {} {}", phase, file.path(), file.key(), kind, message);
        }
    }

    // ==================== Planning ====================

    private Inventory fetchInventory(@Nullable final List<Long> courseIds) throws IOException {
        try {
            return inventoryFetcher.fetchInventory(courseIds);
        } catch (final PartialInventoryException e) {
            logger.warn("Proceeding with partial inventory, failed courses: {}", e.coursesFailed());
            return e.partialInventory();
        }
    }

    private SyncPlan plan(final Inventory inventory, @Nullable final List<Long> courseIds) {
        final Collection<LocalEntry> local = mirrorStore.manifestSnapshot().stream()
                .filter(e -> courseIds == null || courseIds.contains(e.courseId()))
                .toList();
        final Collection<IndexedEntry> indexed = indexUploader.listIndexed(null).stream()
                .filter(e -> courseIds == null || courseIds.contains(e.courseId()))
                .toList();
        final Set<FileKey> inaccessible = inaccessibilityTracker.keys();
        return planner.plan(inventory, local, indexed, inaccessible, indexUploader::isIndexable);
    }

    private @Nullable List<Long> effectiveCourseIds(@Nullable final Collection<Long> requested) {
        if (requested != null && !requested.isEmpty()) {
            return List.copyOf(requested);
        }
        return defaultCourseIds.isEmpty() ? null : defaultCourseIds;
    }

    // ==================== Queries and operator actions ====================

    /**
     * Reconciliation status. Recomputed (fetching the inventory) when requested or when no plan exists yet.
     */
    public IndexStatus getStatus(final boolean refresh) throws IOException {
        SyncPlan plan = lastPlan;
        if (refresh || plan == null) {
            final List<Long> courseIds = effectiveCourseIds(null);
            plan = plan(fetchInventory(courseIds), courseIds);
            lastPlan = plan;
        }
        return IndexStatus.from(plan,
                indexUploader.listIndexed(null).size(),
                indexUploader.indexIds().size(),
                !mirrorStore.manifestSnapshot().isEmpty(),
                missingSampleSize);
    }

    public SyncProgress getProgress() {
        return statisticsTracker.snapshot(state, running.get());
    }

    public Optional<SyncSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    public SyncState getState() {
        return state;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Ask the active pass to stop. Files already in progress finish; the rest are not started.
     *
     * @return true if a pass was running
     */
    public boolean cancelSync() {
        if (!running.get()) {
            return false;
        }
        cancelRequested.set(true);
        logger.info("Sync cancellation requested");
        return true;
    }

    /**
     * Delete index documents whose remote file is gone, based on a freshly computed plan.
     *
     * @param courseId restrict to one course; null for all
     * @return number of documents removed
     */
    public int pruneExtraInIndex(@Nullable final Long courseId) throws IOException {
        if (running.get()) {
            throw new IllegalStateException("A sync is running, prune refused");
        }
        final SyncPlan plan = plan(fetchInventory(effectiveCourseIds(null)), effectiveCourseIds(null));
        final List<IndexedEntry> extra = plan.extraInIndex().stream()
                .filter(e -> courseId == null || e.courseId() == courseId)
                .toList();
        final int removed = indexUploader.pruneExtra(extra);
        lastPlan = null;
        return removed;
    }

    /**
     * Rebuild a course's index manifest from the index service.
     */
    public int rebuildIndexManifest(final long courseId, @Nullable final String indexId) throws IOException {
        if (running.get()) {
            throw new IllegalStateException("A sync is running, manifest rebuild refused");
        }
        final int imported = indexUploader.importRemoteDocuments(courseId, indexId);
        lastPlan = null;
        return imported;
    }

    /**
     * Forget inaccessible records so the files are attempted again.
     */
    public int resetInaccessible(@Nullable final Long courseId) throws IOException {
        final int cleared = inaccessibilityTracker.reset(courseId);
        lastPlan = null;
        return cleared;
    }

    /**
     * Wait for the active pass to finish.
     *
     * @return true if no pass is running when this returns
     */
    public boolean awaitCompletion(final long timeoutMs) throws InterruptedException {
        final Thread coordinator = coordinatorThread;
        if (coordinator != null) {
            coordinator.join(timeoutMs);
        }
        return !running.get();
    }

    public void shutdown() {
        logger.info("Shutting down SyncOrchestrator");
        cancelRequested.set(true);
        final Thread coordinator = coordinatorThread;
        if (coordinator != null) {
            try {
                coordinator.join(10000);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for coordinator thread");
            }
        }
        executor.shutdown();
    }
}

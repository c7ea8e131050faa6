package de.mirkosertic.mcp.canvasindex.sync;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the current sync run. Thread-safe for use from the worker pool.
 */
public class SyncStatisticsTracker {

    private final AtomicLong filesPlanned = new AtomicLong(0);
    private final AtomicLong filesCompleted = new AtomicLong(0);
    private final AtomicLong filesDownloaded = new AtomicLong(0);
    private final AtomicLong filesUploaded = new AtomicLong(0);
    private final AtomicLong filesSkippedInaccessible = new AtomicLong(0);
    private final AtomicLong filesUnsupported = new AtomicLong(0);
    private final AtomicLong filesFailed = new AtomicLong(0);

    private final Set<Long> coursesTouched = ConcurrentHashMap.newKeySet();
    private final ConcurrentLinkedQueue<FileFailure> failures = new ConcurrentLinkedQueue<>();

    // path -> start timestamp in millis
    private final ConcurrentHashMap<String, Long> activeFiles = new ConcurrentHashMap<>();

    private volatile long startTime = 0;
    private volatile long endTime = 0;

    public void reset() {
        filesPlanned.set(0);
        filesCompleted.set(0);
        filesDownloaded.set(0);
        filesUploaded.set(0);
        filesSkippedInaccessible.set(0);
        filesUnsupported.set(0);
        filesFailed.set(0);
        coursesTouched.clear();
        failures.clear();
        activeFiles.clear();
        startTime = System.currentTimeMillis();
        endTime = 0;
    }

    public void setFilesPlanned(final long count) {
        filesPlanned.set(count);
    }

    public void recordDownloaded(final long courseId) {
        filesDownloaded.incrementAndGet();
        coursesTouched.add(courseId);
    }

    public void recordUploaded(final long courseId) {
        filesUploaded.incrementAndGet();
        coursesTouched.add(courseId);
    }

    public void recordFailure(final FileFailure failure) {
        failures.add(failure);
        switch (failure.kind()) {
            case PERMISSION_DENIED -> filesSkippedInaccessible.incrementAndGet();
            case UNSUPPORTED_FORMAT -> filesUnsupported.incrementAndGet();
            default -> filesFailed.incrementAndGet();
        }
    }

    public void recordCompleted() {
        filesCompleted.incrementAndGet();
    }

    public void registerActiveFile(final String path) {
        activeFiles.put(path, System.currentTimeMillis());
    }

    public void unregisterActiveFile(final String path) {
        activeFiles.remove(path);
    }

    public void markFinished() {
        endTime = System.currentTimeMillis();
    }

    public SyncProgress snapshot(final SyncState state, final boolean running) {
        final long now = System.currentTimeMillis();
        final List<SyncProgress.ActiveFile> active = new ArrayList<>();
        for (final Map.Entry<String, Long> entry : activeFiles.entrySet()) {
            active.add(new SyncProgress.ActiveFile(entry.getKey(), now - entry.getValue()));
        }
        active.sort(Comparator.comparingLong(SyncProgress.ActiveFile::processingDurationMs).reversed());

        final long end = endTime > 0 ? endTime : now;
        return new SyncProgress(
                running,
                state,
                filesPlanned.get(),
                filesCompleted.get(),
                filesDownloaded.get(),
                filesUploaded.get(),
                filesSkippedInaccessible.get(),
                filesUnsupported.get(),
                filesFailed.get(),
                coursesTouched.size(),
                startTime > 0 ? end - startTime : 0,
                active);
    }

    public SyncSummary summary(final SyncState state, final Map<Long, String> coursesFailed,
                               final boolean cancelled, @Nullable final String errorMessage) {
        return new SyncSummary(
                state,
                filesPlanned.get(),
                filesDownloaded.get(),
                filesUploaded.get(),
                filesSkippedInaccessible.get(),
                filesUnsupported.get(),
                filesFailed.get(),
                coursesTouched.size(),
                coursesFailed,
                new ArrayList<>(failures),
                cancelled,
                errorMessage,
                startTime,
                endTime > 0 ? endTime : System.currentTimeMillis());
    }
}

package de.mirkosertic.mcp.canvasindex.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.ToLongFunction;

/**
 * Bounded worker pool for the per-file tasks of a sync pass. When the queue is full the submitting
 * thread runs the task itself.
 */
public class SyncExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(SyncExecutorService.class);

    private static final int QUEUE_CAPACITY = 10000;

    private final ThreadPoolExecutor executor;

    public SyncExecutorService(final int threadPoolSize) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "sync-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("SyncExecutorService initialized with {} threads", threadPoolSize);
    }

    /**
     * Run one task per item and wait for all of them. Items are submitted course by course, courses in
     * the order they first appear, so one course's files are processed before the next course's.
     * Submission stops as soon as {@code cancelled} returns true; submitted tasks still finish.
     *
     * @return number of tasks submitted
     */
    public <T> int runGroupedByCourse(final List<T> items,
                                      final ToLongFunction<T> courseOf,
                                      final Consumer<T> task,
                                      final BooleanSupplier cancelled) throws InterruptedException {
        final Map<Long, List<T>> byCourse = new LinkedHashMap<>();
        for (final T item : items) {
            byCourse.computeIfAbsent(courseOf.applyAsLong(item), id -> new ArrayList<>()).add(item);
        }

        final List<T> ordered = new ArrayList<>(items.size());
        byCourse.values().forEach(ordered::addAll);
        logger.debug("Submitting {} tasks of {} courses", ordered.size(), byCourse.size());

        final List<Future<?>> futures = new ArrayList<>(ordered.size());
        for (final T item : ordered) {
            if (cancelled.getAsBoolean()) {
                logger.info("Cancelled, {} of {} tasks not submitted", ordered.size() - futures.size(), ordered.size());
                break;
            }
            futures.add(executor.submit(() -> task.accept(item)));
        }

        for (final Future<?> future : futures) {
            try {
                future.get();
            } catch (final ExecutionException e) {
                logger.error("Error in file sync task", e.getCause());
            }
        }
        return futures.size();
    }

    public void shutdown() {
        logger.info("Shutting down SyncExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("SyncExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for SyncExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

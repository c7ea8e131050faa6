package de.mirkosertic.mcp.canvasindex.sync;

import de.mirkosertic.mcp.canvasindex.config.ApplicationConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Bounded retry with exponential backoff, applied to every per-file transfer.
 * Only {@link FailureKind#TRANSIENT} failures are retried.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface IoOperation<T> {
        T call() throws IOException;
    }

    private final int maxAttempts;
    private final IntervalFunction intervalFunction;
    private final RetryConfig retryConfig;

    public RetryPolicy(final int maxAttempts, final long initialBackoffMs, final long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs);
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryOnException(RetryPolicy::isTransient)
                .build();
    }

    public static RetryPolicy fromConfig(final ApplicationConfig config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getInitialBackoffMs(), config.getMaxBackoffMs());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Run an operation, retrying transient failures.
     *
     * @throws IOException the last failure, or the first non-transient one
     */
    public <T> T execute(final String description, final IoOperation<T> operation) throws IOException {
        final Retry retry = newRetry(description);
        try {
            return retry.executeCheckedSupplier(operation::call);
        } catch (final IOException | RuntimeException | Error e) {
            throw e;
        } catch (final Throwable e) {
            throw new IOException(description + " failed", e);
        }
    }

    /**
     * A retry instance for one operation, logging every retry it makes.
     */
    Retry newRetry(final String description) {
        final Retry retry = Retry.of(description, retryConfig);
        retry.getEventPublisher().onRetry(event -> logger.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                description, event.getNumberOfRetryAttempts(), maxAttempts, event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        return retry;
    }

    /**
     * Delay before the retry following the given (1-based) attempt.
     */
    long backoffForAttempt(final int attempt) {
        return intervalFunction.apply(attempt);
    }

    private static boolean isTransient(final Throwable error) {
        return error instanceof IOException && FailureKind.classify((IOException) error) == FailureKind.TRANSIENT;
    }
}

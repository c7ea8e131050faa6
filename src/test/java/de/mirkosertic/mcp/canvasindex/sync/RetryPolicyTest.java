package de.mirkosertic.mcp.canvasindex.sync;

import de.mirkosertic.mcp.canvasindex.canvas.CanvasApiException;
import de.mirkosertic.mcp.canvasindex.index.UnsupportedFormatException;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, 1, 4);

    @Test
    @DisplayName("Should retry transient failures with doubling backoff")
    void shouldRetryTransientFailures() throws Throwable {
        final AtomicInteger calls = new AtomicInteger();
        final List<Long> waits = new ArrayList<>();
        final Retry retry = policy.newRetry("test");
        retry.getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval().toMillis()));

        final String result = retry.executeCheckedSupplier(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new CanvasApiException(CanvasApiException.Reason.UNAVAILABLE, 502, "Bad Gateway");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
        assertThat(waits).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("Should return the result of a recovered operation")
    void shouldRecover() throws IOException {
        final AtomicInteger calls = new AtomicInteger();

        final String result = policy.execute("test", () -> {
            if (calls.incrementAndGet() < 2) {
                throw new IOException("Connection reset");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("Should give up after the maximum number of attempts")
    void shouldGiveUp() {
        final AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute("test", () -> {
            calls.incrementAndGet();
            throw new CanvasApiException(CanvasApiException.Reason.RATE_LIMITED, 429, "Too Many Requests");
        })).isInstanceOf(CanvasApiException.class)
                .hasMessageContaining("Too Many Requests");

        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("Should never retry permission or format errors")
    void shouldNotRetryPermanentFailures() {
        final AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute("test", () -> {
            calls.incrementAndGet();
            throw new CanvasApiException(CanvasApiException.Reason.UNAUTHORIZED, 403, "Forbidden");
        })).isInstanceOf(CanvasApiException.class);
        assertThatThrownBy(() -> policy.execute("test", () -> {
            calls.incrementAndGet();
            throw new UnsupportedFormatException("binary");
        })).isInstanceOf(UnsupportedFormatException.class);

        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("Should cap the backoff")
    void shouldCapBackoff() {
        final RetryPolicy configured = new RetryPolicy(3, 500, 8000);

        assertThat(configured.backoffForAttempt(1)).isEqualTo(500);
        assertThat(configured.backoffForAttempt(2)).isEqualTo(1000);
        assertThat(configured.backoffForAttempt(4)).isEqualTo(4000);
        assertThat(configured.backoffForAttempt(5)).isEqualTo(8000);
        assertThat(configured.backoffForAttempt(12)).isEqualTo(8000);
    }

    @Test
    @DisplayName("Should reject fewer than one attempt")
    void shouldValidateAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(0, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

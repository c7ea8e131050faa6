package de.mirkosertic.mcp.canvasindex.mirror;

import de.mirkosertic.mcp.canvasindex.canvas.ContentKind;
import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InaccessibilityTracker Tests")
class InaccessibilityTrackerTest {

    @TempDir
    Path tempDir;

    private static RemoteFile file(final long courseId, final String id, final String path) {
        return new RemoteFile(id, courseId, "C_Course", path, 10, "v1", null, ContentKind.FILES);
    }

    @Test
    @DisplayName("Should survive a restart")
    void shouldPersistRecords() throws IOException {
        final Path path = tempDir.resolve("inaccessible-files.yaml");
        final InaccessibilityTracker tracker = new InaccessibilityTracker(path);
        tracker.markInaccessible(file(1, "file:1", "Files/locked.pdf"), "403 Forbidden");

        final InaccessibilityTracker reopened = new InaccessibilityTracker(path);

        assertThat(reopened.isInaccessible(1, "file:1")).isTrue();
        assertThat(reopened.keys()).containsExactly(new FileKey(1, "file:1"));
        assertThat(reopened.records(null)).singleElement()
                .satisfies(r -> {
                    assertThat(r.reason()).isEqualTo("403 Forbidden");
                    assertThat(r.path()).isEqualTo("Files/locked.pdf");
                });
    }

    @Test
    @DisplayName("Should keep the first-seen time on a repeated mark")
    void shouldKeepFirstSeen() throws IOException {
        final InaccessibilityTracker tracker = new InaccessibilityTracker(tempDir.resolve("i.yaml"));
        final InaccessibleRecord first = tracker.markInaccessible(file(1, "file:1", "a.pdf"), "403");

        final InaccessibleRecord second = tracker.markInaccessible(file(1, "file:1", "a.pdf"), "401");

        assertThat(second.firstSeenAt()).isEqualTo(first.firstSeenAt());
        assertThat(second.lastAttemptAt()).isAfterOrEqualTo(first.lastAttemptAt());
        assertThat(second.reason()).isEqualTo("401");
    }

    @Test
    @DisplayName("Should reset only the given course")
    void shouldResetPerCourse() throws IOException {
        final Path path = tempDir.resolve("i.yaml");
        final InaccessibilityTracker tracker = new InaccessibilityTracker(path);
        tracker.markInaccessible(file(1, "file:1", "a.pdf"), "403");
        tracker.markInaccessible(file(1, "file:2", "b.pdf"), "403");
        tracker.markInaccessible(file(2, "file:3", "c.pdf"), "403");

        final int cleared = tracker.reset(1L);

        assertThat(cleared).isEqualTo(2);
        assertThat(tracker.isInaccessible(1, "file:1")).isFalse();
        assertThat(tracker.isInaccessible(2, "file:3")).isTrue();
        assertThat(new InaccessibilityTracker(path).records(null)).hasSize(1);
    }

    @Test
    @DisplayName("Should reset everything without a course")
    void shouldResetAll() throws IOException {
        final InaccessibilityTracker tracker = new InaccessibilityTracker(tempDir.resolve("i.yaml"));
        tracker.markInaccessible(file(1, "file:1", "a.pdf"), "403");
        tracker.markInaccessible(file(2, "file:3", "c.pdf"), "403");

        assertThat(tracker.reset(null)).isEqualTo(2);
        assertThat(tracker.keys()).isEmpty();
    }

    @Test
    @DisplayName("Should skip a stored record without a path")
    void shouldSkipRecordWithoutPath() throws IOException {
        final Path path = tempDir.resolve("i.yaml");
        Files.writeString(path, """
                files:
                  - remoteId: "file:1"
                    courseId: 1
                    reason: "403"
                    firstSeenAt: "2024-01-01T00:00:00Z"
                    lastAttemptAt: "2024-01-02T00:00:00Z"
                  - remoteId: "file:2"
                    courseId: 1
                    path: "Files/b.pdf"
                    reason: "403"
                    firstSeenAt: "2024-01-01T00:00:00Z"
                    lastAttemptAt: "2024-01-02T00:00:00Z"
                """);

        final InaccessibilityTracker tracker = new InaccessibilityTracker(path);

        assertThat(tracker.records(null)).extracting(InaccessibleRecord::remoteId).containsExactly("file:2");
        assertThat(tracker.isInaccessible(1, "file:1")).isFalse();
    }
}

package de.mirkosertic.mcp.canvasindex.mirror;

import de.mirkosertic.mcp.canvasindex.canvas.ContentKind;
import de.mirkosertic.mcp.canvasindex.inventory.FileKey;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LocalMirrorStore Tests")
class LocalMirrorStoreTest {

    @TempDir
    Path tempDir;

    private Path mirrorDir;
    private Path manifest;

    @BeforeEach
    void setUp() {
        mirrorDir = tempDir.resolve("file_index");
        manifest = tempDir.resolve("local-manifest.yaml");
    }

    private static RemoteFile file(final String id, final String path, final String fingerprint) {
        return new RemoteFile(id, 7L, "BIO1_Biology", path, 5, fingerprint, null, ContentKind.FILES);
    }

    @Test
    @DisplayName("Should write bytes under the course folder and read them back")
    void shouldWriteAndRead() throws IOException {
        final LocalMirrorStore store = new LocalMirrorStore(mirrorDir, manifest);

        final LocalEntry entry = store.write(file("file:1", "Files/notes.txt", "v1"),
                "hello".getBytes(StandardCharsets.UTF_8));

        assertThat(entry.localPath()).isEqualTo("BIO1_Biology/Files/notes.txt");
        assertThat(entry.status()).isEqualTo(EntryStatus.OK);
        assertThat(Files.readString(mirrorDir.resolve("BIO1_Biology/Files/notes.txt"))).isEqualTo("hello");
        assertThat(store.has(7L, "file:1")).isTrue();
        assertThat(new String(store.read(7L, "file:1"), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    @DisplayName("Should keep the manifest across restarts")
    void shouldPersistManifest() throws IOException {
        final LocalMirrorStore store = new LocalMirrorStore(mirrorDir, manifest);
        store.write(file("file:1", "Files/notes.txt", "v1"), "hello".getBytes(StandardCharsets.UTF_8));

        final LocalMirrorStore reopened = new LocalMirrorStore(mirrorDir, manifest);

        assertThat(reopened.get(new FileKey(7L, "file:1")))
                .hasValueSatisfying(e -> {
                    assertThat(e.fingerprintAtDownload()).isEqualTo("v1");
                    assertThat(e.size()).isEqualTo(5);
                });
    }

    @Test
    @DisplayName("Should remove leftover .part files and never report them")
    void shouldCleanUpInterruptedDownloads() throws IOException {
        final Path partial = mirrorDir.resolve("BIO1_Biology/Files/big.pdf.part");
        Files.createDirectories(partial.getParent());
        Files.writeString(partial, "half");

        final LocalMirrorStore store = new LocalMirrorStore(mirrorDir, manifest);

        assertThat(partial).doesNotExist();
        assertThat(store.manifestSnapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should disambiguate two remote files with the same path")
    void shouldDisambiguateCollidingPaths() throws IOException {
        final LocalMirrorStore store = new LocalMirrorStore(mirrorDir, manifest);

        final LocalEntry first = store.write(file("file:1", "Files/slides.pdf", "v1"), new byte[]{1});
        final LocalEntry second = store.write(file("file:42", "Files/slides.pdf", "v1"), new byte[]{2});

        assertThat(first.localPath()).isEqualTo("BIO1_Biology/Files/slides.pdf");
        assertThat(second.localPath()).isEqualTo("BIO1_Biology/Files/slides-file-42.pdf");
        assertThat(store.read(7L, "file:1")).containsExactly(1);
        assertThat(store.read(7L, "file:42")).containsExactly(2);
    }

    @Test
    @DisplayName("Should replace content and fingerprint on rewrite")
    void shouldOverwriteChangedFile() throws IOException {
        final LocalMirrorStore store = new LocalMirrorStore(mirrorDir, manifest);
        store.write(file("file:1", "Files/notes.txt", "v1"), "old".getBytes(StandardCharsets.UTF_8));
        store.markStale(new FileKey(7L, "file:1"));

        final LocalEntry entry = store.write(file("file:1", "Files/notes.txt", "v2"),
                "new".getBytes(StandardCharsets.UTF_8));

        assertThat(entry.fingerprintAtDownload()).isEqualTo("v2");
        assertThat(entry.status()).isEqualTo(EntryStatus.OK);
        assertThat(new String(store.read(7L, "file:1"), StandardCharsets.UTF_8)).isEqualTo("new");
    }

    @Test
    @DisplayName("Should refuse to read an inaccessible or unknown entry")
    void shouldRejectUnusableEntries() throws IOException {
        final LocalMirrorStore store = new LocalMirrorStore(mirrorDir, manifest);
        store.write(file("file:1", "Files/notes.txt", "v1"), new byte[]{1});
        store.markInaccessible(new FileKey(7L, "file:1"));

        assertThat(store.has(7L, "file:1")).isFalse();
        assertThatThrownBy(() -> store.read(7L, "file:1")).isInstanceOf(MirrorEntryNotFoundException.class);
        assertThatThrownBy(() -> store.read(7L, "file:2")).isInstanceOf(MirrorEntryNotFoundException.class);
    }

    @Test
    @DisplayName("Should append the remote id before the extension")
    void shouldBuildSuffixedPath() {
        assertThat(LocalMirrorStore.withIdSuffix("C/Files/a.pdf", "file:42")).isEqualTo("C/Files/a-file-42.pdf");
        assertThat(LocalMirrorStore.withIdSuffix("README", "page:intro")).isEqualTo("README-page-intro");
    }

    @Test
    @DisplayName("Should serialize concurrent writes of the same file")
    void shouldSerializeConcurrentWrites() throws Exception {
        final LocalMirrorStore store = new LocalMirrorStore(mirrorDir, manifest);
        final int writers = 8;
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            final List<Future<LocalEntry>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                final int version = i;
                results.add(pool.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    final byte[] content = new byte[256 * 1024];
                    Arrays.fill(content, (byte) ('a' + version));
                    return store.write(file("file:1", "Files/big.bin", "v" + version), content);
                }));
            }
            start.countDown();
            for (final Future<LocalEntry> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS).localPath()).isEqualTo("BIO1_Biology/Files/big.bin");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.manifestSnapshot()).hasSize(1);
        final LocalEntry entry = store.get(new FileKey(7L, "file:1")).orElseThrow();
        final byte[] stored = store.read(7L, "file:1");
        final byte[] expected = new byte[256 * 1024];
        Arrays.fill(expected, (byte) ('a' + Integer.parseInt(entry.fingerprintAtDownload().substring(1))));
        assertThat(stored).isEqualTo(expected);
        try (Stream<Path> files = Files.list(mirrorDir.resolve("BIO1_Biology/Files"))) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("big.bin");
        }
        assertThat(new LocalMirrorStore(mirrorDir, manifest).get(new FileKey(7L, "file:1")))
                .hasValueSatisfying(reloaded ->
                        assertThat(reloaded.fingerprintAtDownload()).isEqualTo(entry.fingerprintAtDownload()));
    }
}

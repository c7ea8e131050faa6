package de.mirkosertic.mcp.canvasindex.index;

import de.mirkosertic.mcp.canvasindex.canvas.ContentKind;
import de.mirkosertic.mcp.canvasindex.inventory.RemoteFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("IndexUploader Tests")
class IndexUploaderTest {

    private static final List<String> EXTENSIONS = List.of(".pdf", ".txt", ".html");

    @TempDir
    Path tempDir;

    private SearchIndexClient indexClient;
    private Path manifest;
    private IndexUploader uploader;

    @BeforeEach
    void setUp() throws IOException {
        indexClient = mock(SearchIndexClient.class);
        when(indexClient.createIndex(anyLong(), anyString())).thenReturn("vs_1");
        when(indexClient.uploadDocument(eq("vs_1"), anyString(), any(byte[].class), anyMap()))
                .thenReturn("doc-a", "doc-b", "doc-c");
        manifest = tempDir.resolve("index-manifest.yaml");
        uploader = new IndexUploader(indexClient, manifest, EXTENSIONS, 1024);
    }

    private static RemoteFile file(final String id, final String name, final String fingerprint) {
        return new RemoteFile(id, 1L, "MATH_Algebra", "Files/" + name, 10, fingerprint, null, ContentKind.FILES);
    }

    @Test
    @DisplayName("Should create the course index once and upload with metadata")
    void shouldUploadWithMetadata() throws IOException {
        final IndexedEntry entry = uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1, 2});

        assertThat(entry.documentId()).isEqualTo("doc-a");
        assertThat(entry.indexId()).isEqualTo("vs_1");
        assertThat(entry.fingerprintAtUpload()).isEqualTo("v1");
        verify(indexClient, times(1)).createIndex(1L, "MATH_Algebra");
        verify(indexClient).uploadDocument(eq("vs_1"), eq("a.pdf"), any(byte[].class), eq(Map.of(
                IndexUploader.META_REMOTE_ID, "file:1",
                IndexUploader.META_COURSE_ID, "1",
                IndexUploader.META_FINGERPRINT, "v1",
                IndexUploader.META_FILE_NAME, "a.pdf",
                IndexUploader.META_PATH, "Files/a.pdf")));

        uploader.upload(file("file:2", "b.pdf", "v1"), new byte[]{3});
        verify(indexClient, times(1)).createIndex(anyLong(), anyString());
    }

    @Test
    @DisplayName("Should make no index service call for an identical re-upload")
    void shouldSkipIdenticalReupload() throws IOException {
        final RemoteFile file = file("file:1", "a.pdf", "v1");
        uploader.upload(file, new byte[]{1});
        clearInvocations(indexClient);

        final IndexedEntry again = uploader.upload(file, new byte[]{1});

        assertThat(again.documentId()).isEqualTo("doc-a");
        verifyNoInteractions(indexClient);
    }

    @Test
    @DisplayName("Should upload the new version before deleting the superseded document")
    void shouldReplaceChangedFile() throws IOException {
        uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1});

        final IndexedEntry updated = uploader.upload(file("file:1", "a.pdf", "v2"), new byte[]{2});

        assertThat(updated.documentId()).isEqualTo("doc-b");
        assertThat(uploader.listIndexed(1L)).singleElement()
                .extracting(IndexedEntry::fingerprintAtUpload).isEqualTo("v2");
        verify(indexClient).deleteDocument("vs_1", "doc-a");
    }

    @Test
    @DisplayName("Should keep the new entry when deleting the old document fails")
    void shouldTolerateFailedSupersededDelete() throws IOException {
        uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1});
        doThrow(new SearchIndexException(500, "boom")).when(indexClient).deleteDocument("vs_1", "doc-a");

        final IndexedEntry updated = uploader.upload(file("file:1", "a.pdf", "v2"), new byte[]{2});

        assertThat(updated.documentId()).isEqualTo("doc-b");
    }

    @Test
    @DisplayName("Should reject unsupported extensions and oversized files without calling the service")
    void shouldRejectUnsupported() {
        assertThatThrownBy(() -> uploader.upload(file("file:1", "movie.mp4", "v1"), new byte[]{1}))
                .isInstanceOf(UnsupportedFormatException.class);
        assertThatThrownBy(() -> uploader.upload(file("file:2", "huge.pdf", "v1"), new byte[2048]))
                .isInstanceOf(UnsupportedFormatException.class);
        verifyNoInteractions(indexClient);
    }

    @Test
    @DisplayName("Should remember a backend rejection until the fingerprint changes")
    void shouldRememberRejection() throws IOException {
        when(indexClient.uploadDocument(eq("vs_1"), eq("scan.pdf"), any(byte[].class), anyMap()))
                .thenThrow(new UnsupportedFormatException("no text"));
        final RemoteFile scan = file("file:9", "scan.pdf", "v1");

        assertThatThrownBy(() -> uploader.upload(scan, new byte[]{1}))
                .isInstanceOf(UnsupportedFormatException.class);

        assertThat(uploader.isIndexable(scan)).isFalse();
        assertThat(new IndexUploader(indexClient, manifest, EXTENSIONS, 1024).isIndexable(scan)).isFalse();
        assertThat(uploader.isIndexable(file("file:9", "scan.pdf", "v2"))).isTrue();
    }

    @Test
    @DisplayName("Should remove the outdated document when a changed file is rejected")
    void shouldDropOutdatedDocumentOnRejection() throws IOException {
        uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1});
        when(indexClient.uploadDocument(eq("vs_1"), eq("a.pdf"), any(byte[].class), anyMap()))
                .thenThrow(new UnsupportedFormatException("no text"));

        assertThatThrownBy(() -> uploader.upload(file("file:1", "a.pdf", "v2"), new byte[]{2}))
                .isInstanceOf(UnsupportedFormatException.class);

        verify(indexClient).deleteDocument("vs_1", "doc-a");
        assertThat(uploader.indexedEntry(file("file:1", "a.pdf", "v2").key())).isEmpty();
        assertThat(new IndexUploader(indexClient, manifest, EXTENSIONS, 1024).listIndexed(1L)).isEmpty();
    }

    @Test
    @DisplayName("Should remove the outdated document of a file that grew beyond the size limit")
    void shouldDropOutdatedDocumentOfOversizedFile() throws IOException {
        uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1});

        assertThatThrownBy(() -> uploader.upload(file("file:1", "a.pdf", "v2"), new byte[2048]))
                .isInstanceOf(UnsupportedFormatException.class);

        verify(indexClient).deleteDocument("vs_1", "doc-a");
        assertThat(uploader.listIndexed(1L)).isEmpty();
    }

    @Test
    @DisplayName("Should keep the document when the indexed version is current")
    void shouldNotDropCurrentDocument() throws IOException {
        uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1});

        assertThat(uploader.dropOutdated(file("file:1", "a.pdf", "v1"))).isFalse();
        assertThat(uploader.dropOutdated(file("file:2", "b.pdf", "v1"))).isFalse();
        assertThat(uploader.dropOutdated(file("file:1", "a.pdf", "v2"))).isTrue();

        verify(indexClient, times(1)).deleteDocument("vs_1", "doc-a");
        assertThat(uploader.listIndexed(null)).isEmpty();
    }

    @Test
    @DisplayName("Should persist index ids and entries across restarts")
    void shouldPersistManifest() throws IOException {
        uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1});

        final IndexUploader reopened = new IndexUploader(indexClient, manifest, EXTENSIONS, 1024);

        assertThat(reopened.indexId(1L)).contains("vs_1");
        assertThat(reopened.listIndexed(null)).singleElement()
                .satisfies(e -> assertThat(e.documentId()).isEqualTo("doc-a"));
    }

    @Test
    @DisplayName("Should prune extra entries and treat a missing document as removed")
    void shouldPruneExtra() throws IOException {
        final IndexedEntry first = uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1});
        final IndexedEntry second = uploader.upload(file("file:2", "b.pdf", "v1"), new byte[]{1});
        doThrow(new SearchIndexException(404, "gone")).when(indexClient).deleteDocument("vs_1", "doc-b");

        final int removed = uploader.pruneExtra(List.of(first, second));

        assertThat(removed).isEqualTo(2);
        assertThat(uploader.listIndexed(null)).isEmpty();
    }

    @Test
    @DisplayName("Should stop pruning on a real failure but keep earlier removals")
    void shouldKeepProgressWhenPruneFails() throws IOException {
        final IndexedEntry first = uploader.upload(file("file:1", "a.pdf", "v1"), new byte[]{1});
        final IndexedEntry second = uploader.upload(file("file:2", "b.pdf", "v1"), new byte[]{1});
        doThrow(new SearchIndexException(500, "boom")).when(indexClient).deleteDocument("vs_1", "doc-b");

        assertThatThrownBy(() -> uploader.pruneExtra(List.of(first, second)))
                .isInstanceOf(SearchIndexException.class);

        assertThat(new IndexUploader(indexClient, manifest, EXTENSIONS, 1024).listIndexed(null))
                .extracting(IndexedEntry::remoteId).containsExactly("file:2");
    }

    @Test
    @DisplayName("Should rebuild a course's entries from document metadata")
    void shouldImportRemoteDocuments() throws IOException {
        when(indexClient.listDocuments("vs_9")).thenReturn(List.of(
                new IndexedDocument("doc-x", "a.pdf", Map.of(
                        IndexUploader.META_REMOTE_ID, "file:1",
                        IndexUploader.META_COURSE_ID, "1",
                        IndexUploader.META_FINGERPRINT, "v1")),
                new IndexedDocument("doc-y", "foreign.pdf", Map.of())));

        final int imported = uploader.importRemoteDocuments(1L, "vs_9");

        assertThat(imported).isEqualTo(1);
        assertThat(uploader.indexId(1L)).contains("vs_9");
        assertThat(uploader.listIndexed(1L)).singleElement()
                .satisfies(e -> {
                    assertThat(e.documentId()).isEqualTo("doc-x");
                    assertThat(e.fingerprintAtUpload()).isEqualTo("v1");
                });
        verify(indexClient, never()).deleteDocument(anyString(), anyString());
    }

    @Test
    @DisplayName("Should require an index id when none is known")
    void shouldRequireIndexIdForImport() {
        assertThatThrownBy(() -> uploader.importRemoteDocuments(5L, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

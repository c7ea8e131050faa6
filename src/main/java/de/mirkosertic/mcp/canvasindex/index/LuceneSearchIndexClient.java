package de.mirkosertic.mcp.canvasindex.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Offline {@link SearchIndexClient} keeping one Lucene index per course under a base directory.
 * Text is extracted with Tika at upload time; documents without extractable text are rejected.
 */
public class LuceneSearchIndexClient implements SearchIndexClient, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(LuceneSearchIndexClient.class);

    static final String FIELD_DOCUMENT_ID = "document_id";
    static final String FIELD_FILE_NAME = "file_name";
    static final String FIELD_CONTENT = "content";
    static final String METADATA_PREFIX = "meta_";

    private static final int SNIPPET_LENGTH = 300;

    private final Path baseDirectory;
    private final ContentExtractor contentExtractor;
    private final Analyzer analyzer;
    private final Map<String, OpenIndex> openIndexes = new ConcurrentHashMap<>();

    public LuceneSearchIndexClient(final Path baseDirectory, final ContentExtractor contentExtractor) {
        this.baseDirectory = baseDirectory;
        this.contentExtractor = contentExtractor;
        this.analyzer = new StandardAnalyzer();
    }

    @Override
    public String createIndex(final long courseId, final String name) throws IOException {
        final String indexId = "course-" + courseId;
        open(indexId);
        logger.info("Lucene index {} ready for '{}'", indexId, name);
        return indexId;
    }

    @Override
    public String uploadDocument(final String indexId, final String fileName, final byte[] content,
                                 final Map<String, String> metadata) throws IOException {
        final String text = contentExtractor.extract(content, fileName, -1);
        if (text.isBlank()) {
            throw new UnsupportedFormatException("No text could be extracted from " + fileName);
        }

        final String documentId = UUID.randomUUID().toString();
        final Document document = new Document();
        document.add(new StringField(FIELD_DOCUMENT_ID, documentId, Field.Store.YES));
        document.add(new StoredField(FIELD_FILE_NAME, fileName));
        document.add(new TextField(FIELD_CONTENT, text, Field.Store.YES));
        for (final Map.Entry<String, String> entry : metadata.entrySet()) {
            document.add(new StringField(METADATA_PREFIX + entry.getKey(), entry.getValue(), Field.Store.YES));
        }

        final OpenIndex index = open(indexId);
        index.writer.addDocument(document);
        index.commit();
        logger.debug("Indexed {} as {} in {} ({} characters)", fileName, documentId, indexId, text.length());
        return documentId;
    }

    @Override
    public List<IndexedDocument> listDocuments(final String indexId) throws IOException {
        final OpenIndex index = open(indexId);
        final IndexSearcher searcher = index.searcherManager.acquire();
        try {
            final int total = Math.max(1, searcher.getIndexReader().numDocs());
            final TopDocs topDocs = searcher.search(new MatchAllDocsQuery(), total);
            final StoredFields storedFields = searcher.storedFields();
            final List<IndexedDocument> result = new ArrayList<>();
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Document document = storedFields.document(scoreDoc.doc);
                result.add(new IndexedDocument(document.get(FIELD_DOCUMENT_ID), document.get(FIELD_FILE_NAME),
                        metadataOf(document)));
            }
            return result;
        } finally {
            index.searcherManager.release(searcher);
        }
    }

    @Override
    public void deleteDocument(final String indexId, final String documentId) throws IOException {
        final OpenIndex index = open(indexId);
        index.writer.deleteDocuments(new Term(FIELD_DOCUMENT_ID, documentId));
        index.commit();
        logger.debug("Deleted document {} from {}", documentId, indexId);
    }

    @Override
    public List<SearchHit> search(final String indexId, final String queryString, final int maxResults)
            throws IOException {
        final OpenIndex index = open(indexId);
        final Query query = parse(queryString);
        final IndexSearcher searcher = index.searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(query, Math.max(1, maxResults));
            final StoredFields storedFields = searcher.storedFields();
            final List<SearchHit> hits = new ArrayList<>();
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Document document = storedFields.document(scoreDoc.doc);
                final String content = document.get(FIELD_CONTENT);
                hits.add(new SearchHit(document.get(FIELD_DOCUMENT_ID), document.get(FIELD_FILE_NAME),
                        scoreDoc.score, snippet(content), metadataOf(document)));
            }
            return hits;
        } finally {
            index.searcherManager.release(searcher);
        }
    }

    @Override
    public String backendName() {
        return "lucene";
    }

    @Override
    public void close() throws IOException {
        IOException first = null;
        for (final OpenIndex index : openIndexes.values()) {
            try {
                index.close();
            } catch (final IOException e) {
                logger.error("Failed to close Lucene index {}", index.path, e);
                if (first == null) {
                    first = e;
                }
            }
        }
        openIndexes.clear();
        if (first != null) {
            throw first;
        }
    }

    // ==================== Internals ====================

    private OpenIndex open(final String indexId) throws IOException {
        if (indexId.contains("/") || indexId.contains("\\") || indexId.contains("..")) {
            throw new SearchIndexException(400, "Invalid index id: " + indexId);
        }
        try {
            return openIndexes.computeIfAbsent(indexId, id -> {
                try {
                    return new OpenIndex(baseDirectory.resolve(id), analyzer);
                } catch (final IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (final UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private Query parse(final String queryString) {
        final QueryParser parser = new QueryParser(FIELD_CONTENT, analyzer);
        try {
            return parser.parse(queryString);
        } catch (final ParseException e) {
            logger.debug("Query '{}' is not valid Lucene syntax, searching it literally", queryString);
            try {
                return parser.parse(QueryParser.escape(queryString));
            } catch (final ParseException escaped) {
                throw new IllegalArgumentException("Cannot parse query: " + queryString, escaped);
            }
        }
    }

    private static Map<String, String> metadataOf(final Document document) {
        final Map<String, String> metadata = new LinkedHashMap<>();
        for (final IndexableField field : document.getFields()) {
            if (field.name().startsWith(METADATA_PREFIX) && field.stringValue() != null) {
                metadata.put(field.name().substring(METADATA_PREFIX.length()), field.stringValue());
            }
        }
        return metadata;
    }

    private static String snippet(final String content) {
        if (content == null) {
            return "";
        }
        return content.length() <= SNIPPET_LENGTH ? content : content.substring(0, SNIPPET_LENGTH) + "...";
    }

    private static final class OpenIndex implements Closeable {

        private final Path path;
        private final FSDirectory directory;
        private final IndexWriter writer;
        private final SearcherManager searcherManager;

        OpenIndex(final Path path, final Analyzer analyzer) throws IOException {
            this.path = path;
            Files.createDirectories(path);
            this.directory = FSDirectory.open(path);
            final IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            this.writer = new IndexWriter(directory, config);
            writer.commit();
            this.searcherManager = new SearcherManager(writer, null);
        }

        void commit() throws IOException {
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        }

        @Override
        public void close() throws IOException {
            searcherManager.close();
            writer.close();
            directory.close();
        }
    }
}

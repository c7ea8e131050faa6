package de.mirkosertic.mcp.canvasindex.index;

import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.text.Normalizer;

/**
 * Extracts plain text from documents using Apache Tika.
 * Supports PDF, Office documents, HTML and plain text.
 */
public class ContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ContentExtractor.class);

    private final Parser parser;

    public ContentExtractor() {
        this.parser = new AutoDetectParser();
    }

    /**
     * Extract the text of a document.
     *
     * @param content   raw bytes
     * @param fileName  name used as a type hint
     * @param maxLength maximum characters to extract; 0 or less for unlimited
     * @return normalized text, possibly empty
     * @throws UnsupportedFormatException if the document cannot be parsed
     */
    public String extract(final byte[] content, final String fileName, final int maxLength) throws IOException {
        final Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);

        final BodyContentHandler handler = new BodyContentHandler(maxLength > 0 ? maxLength : -1);
        final ParseContext context = new ParseContext();
        context.set(Parser.class, parser);

        try (final InputStream stream = new ByteArrayInputStream(content)) {
            parser.parse(stream, handler, metadata, context);
        } catch (final SAXException e) {
            if (!WriteLimitReachedException.isWriteLimitReached(e)) {
                logger.warn("Error parsing {}: {}", fileName, e.getMessage());
                throw new UnsupportedFormatException("Failed to parse " + fileName, e);
            }
            logger.debug("Extraction of {} truncated at {} characters", fileName, maxLength);
        } catch (final TikaException e) {
            if (WriteLimitReachedException.isWriteLimitReached(e)) {
                logger.debug("Extraction of {} truncated at {} characters", fileName, maxLength);
                return normalizeContent(handler.toString());
            }
            logger.warn("Error parsing {}: {}", fileName, e.getMessage());
            throw new UnsupportedFormatException("Failed to parse " + fileName, e);
        }

        final String text = normalizeContent(handler.toString());
        logger.debug("Extracted {} characters from {}", text.length(), fileName);
        return text;
    }

    /**
     * NFKC-normalize, drop control characters and collapse whitespace runs.
     */
    static String normalizeContent(final String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String result = Normalizer.normalize(content, Normalizer.Form.NFKC);
        result = result.replaceAll("[\\u0000-\\u0008\\u000B\\u000C\\u000E-\\u001F\\u007F-\\u009F]", "");
        result = result.replaceAll("[\\u00A0\\u1680\\u2000-\\u200B\\u202F\\u205F\\u3000\\uFEFF]", " ");
        result = result.replaceAll("[\\t ]+", " ");
        result = result.replaceAll(" *\\n *( *\\n *)*", "\n");
        return result.trim();
    }
}

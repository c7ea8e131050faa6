package de.mirkosertic.mcp.canvasindex.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContentExtractor Tests")
class ContentExtractorTest {

    private final ContentExtractor extractor = new ContentExtractor();

    @Test
    @DisplayName("Should extract the visible text of an HTML page")
    void shouldExtractHtml() throws Exception {
        final String html = "<html><head><title>T</title><script>var x = 1;</script></head>"
                + "<body><h1>Week 1</h1><p>Read chapter   two.</p></body></html>";

        final String text = extractor.extract(html.getBytes(StandardCharsets.UTF_8), "Intro.html", 0);

        assertThat(text).contains("Week 1").contains("Read chapter two.").doesNotContain("var x");
    }

    @Test
    @DisplayName("Should stop at the requested length")
    void shouldTruncate() throws Exception {
        final String content = "abcdefghij".repeat(100);

        final String text = extractor.extract(content.getBytes(StandardCharsets.UTF_8), "long.txt", 25);

        assertThat(text).hasSizeLessThanOrEqualTo(25).startsWith("abcdefghij");
    }

    @Test
    @DisplayName("Should normalize whitespace and drop control characters")
    void shouldNormalize() {
        assertThat(ContentExtractor.normalizeContent("a\u0001b\u00A0 c\t\td\n \n\ne"))
                .isEqualTo("ab c d\ne");
        assertThat(ContentExtractor.normalizeContent(null)).isEmpty();
    }
}

package com.stackprobe.core.scanner;

import com.stackprobe.core.model.PageMeta;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class PageMetaExtractorTest {

    private final PageMetaExtractor extractor = new PageMetaExtractor();

    @Test
    void extractsTitleDescriptionAndViewport() {
        String body = "<html><head>"
                + "<title> He said \"hi\" </title>"
                + "<meta name=\"description\" content=\"A &quot;quoted&quot; page\">"
                + "<meta name=\"viewport\" content=\"Width=Device-Width, initial-scale=1\">"
                + "</head><body></body></html>";

        PageMeta m = extractor.extract(body, "HTTP/2 200\n", URI.create("https://example.com/"));

        assertThat(m.title()).isEqualTo("He said \"hi\"");
        assertThat(m.description()).isEqualTo("A \"quoted\" page");
        assertThat(m.responsive()).isTrue();
        assertThat(m.httpVersion()).isEqualTo("HTTP/2");
        assertThat(m.sslEnabled()).isTrue();
    }

    @Test
    void viewportWithoutDeviceWidthIsNotResponsive() {
        String body = "<meta name=\"viewport\" content=\"width=1024\"><title>x</title>";

        PageMeta m = extractor.extract(body, "", URI.create("http://example.com"));

        assertThat(m.responsive()).isFalse();
        assertThat(m.sslEnabled()).isFalse();
        assertThat(m.httpVersion()).isEmpty();
    }

    @Test
    void missingElementsGiveEmptyStrings() {
        PageMeta m = extractor.extract("<html><body><p>nothing</p></body></html>", "HTTP/1.1 200 OK",
                URI.create("https://example.com"));

        assertThat(m.title()).isEmpty();
        assertThat(m.description()).isEmpty();
    }

    @Test
    void blankBodyKeepsTransportFields() {
        PageMeta m = extractor.extract("", "HTTP/1.1 404 Not Found\n", URI.create("https://example.com"));

        assertThat(m).isEqualTo(new PageMeta("", "", false, "HTTP/1.1", true));
    }

    @Test
    void httpVersionComesFromFirstLineOnly() {
        assertThat(PageMetaExtractor.httpVersion("HTTP/1.1 200 OK\nvia: HTTP/2 proxy")).isEqualTo("HTTP/1.1");
        assertThat(PageMetaExtractor.httpVersion("http/2 200")).isEqualTo("HTTP/2");
        assertThat(PageMetaExtractor.httpVersion("server: nginx\nHTTP/2 200")).isEmpty();
        assertThat(PageMetaExtractor.httpVersion(null)).isEmpty();
    }
}

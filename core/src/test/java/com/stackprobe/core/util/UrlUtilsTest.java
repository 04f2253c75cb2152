package com.stackprobe.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlUtilsTest {

    @Test
    void scheme_is_added_when_absent() {
        assertThat(UrlUtils.ensureScheme("example.com")).isEqualTo("https://example.com");
        assertThat(UrlUtils.ensureScheme("  http://example.com ")).isEqualTo("http://example.com");
        assertThat(UrlUtils.ensureScheme("HTTPS://Example.com")).isEqualTo("HTTPS://Example.com");
    }

    @Test
    void invalid_input_is_rejected() {
        assertThatThrownBy(() -> UrlUtils.toUri(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UrlUtils.toUri("   ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UrlUtils.toUri("https://")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UrlUtils.toUri("exa mple.com")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void origin_drops_path_query_and_default_port() {
        assertThat(UrlUtils.origin(URI.create("https://Example.com:443/a/b?x=1#f")))
                .isEqualTo(URI.create("https://example.com"));
        assertThat(UrlUtils.origin(URI.create("http://example.com:8080/a")))
                .isEqualTo(URI.create("http://example.com:8080"));
    }

    @Test
    void probe_paths_resolve_on_origin() {
        URI page = URI.create("https://example.com/blog/post?id=3");

        assertThat(UrlUtils.resolveOnOrigin(page, "/robots.txt"))
                .isEqualTo(URI.create("https://example.com/robots.txt"));
        assertThat(UrlUtils.resolveOnOrigin(page, ".well-known/security.txt"))
                .isEqualTo(URI.create("https://example.com/.well-known/security.txt"));
    }
}

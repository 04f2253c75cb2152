package com.stackprobe.core.scanner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MatchRuleTest {

    @Test
    void sourceLimitsWhichTextIsSearched() {
        assertThat(MatchRule.headers("nginx").test("server: nginx", "")).isTrue();
        assertThat(MatchRule.headers("nginx").test("", "nginx")).isFalse();
        assertThat(MatchRule.body("nginx").test("server: nginx", "")).isFalse();
        assertThat(MatchRule.any("nginx").test("", "nginx")).isTrue();
    }

    @Test
    void caseInsensitive() {
        assertThat(MatchRule.headers("server.*nginx").test("SERVER: NGINX/1.25", "")).isTrue();
    }

    @Test
    void dotDoesNotCrossLineBreak() {
        assertThat(MatchRule.headers("server.*nginx").test("server: apache\nx-upstream: nginx", "")).isFalse();
    }

    @Test
    void nullTextNeverMatches() {
        assertThat(MatchRule.any(".*").test(null, null)).isFalse();
    }

    @Test
    void headerPresentIsAnchoredToLineStart() {
        MatchRule csp = MatchRule.headerPresent("Content-Security-Policy");

        assertThat(csp.test("HTTP/2 200\ncontent-security-policy: default-src 'self'\n", "")).isTrue();
        assertThat(csp.test("HTTP/2 200\nx-note: see content-security-policy: docs\n", "")).isFalse();
        assertThat(csp.test("HTTP/2 200\ncontent-security-policy-report-only: x\n", "")).isFalse();
    }

    @Test
    void combinators() {
        MatchRule both = MatchRule.headers("cf-ray").and(MatchRule.body("pages\\.dev"));
        MatchRule either = MatchRule.headers("x-django").or(MatchRule.body("csrfmiddlewaretoken"));

        assertThat(both.test("cf-ray: 1", "a.pages.dev")).isTrue();
        assertThat(both.test("cf-ray: 1", "")).isFalse();
        assertThat(either.test("", "<input name=csrfmiddlewaretoken>")).isTrue();
        assertThat(either.test("", "")).isFalse();
    }
}

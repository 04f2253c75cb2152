package com.stackprobe.core.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    @Test
    void json_line_contains_context_and_pairs() {
        StructuredLog log = StructuredLog.get(StructuredLogTest.class).withContext("batchId", "20240305_140709");

        String line = log.toJson(Level.INFO, "site-analyzed", null,
                "url", "https://example.com", "status", 200, "ok", true);

        assertThat(line).startsWith("{").endsWith("}");
        assertThat(line)
                .contains("\"lvl\":\"INFO\"")
                .contains("\"comp\":\"StructuredLogTest\"")
                .contains("\"event\":\"site-analyzed\"")
                .contains("\"batchId\":\"20240305_140709\"")
                .contains("\"url\":\"https://example.com\"")
                .contains("\"status\":200")
                .contains("\"ok\":true");
    }

    @Test
    void values_are_escaped_and_errors_recorded() {
        StructuredLog log = StructuredLog.get(StructuredLogTest.class);

        String line = log.toJson(Level.SEVERE, "task-failed", new IllegalStateException("bad \"input\""),
                "note", "line1\nline2", "dangling");

        assertThat(line)
                .contains("\"note\":\"line1\\nline2\"")
                .contains("\"error\":\"IllegalStateException\"")
                .contains("\"message\":\"bad \\\"input\\\"\"")
                .contains("\"_kv_mismatch\":true");
    }

    @Test
    void context_copy_does_not_leak() {
        StructuredLog base = StructuredLog.get(StructuredLogTest.class);
        base.withContext("batchId", "x");

        assertThat(base.toJson(Level.INFO, "e", null)).doesNotContain("batchId");
    }
}

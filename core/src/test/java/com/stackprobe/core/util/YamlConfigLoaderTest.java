package com.stackprobe.core.util;

import com.stackprobe.core.model.AnalyzerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loads_bundled_sample() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/stackprobe-sample.yml")) {
            assertThat(in).isNotNull();
            AnalyzerConfig cfg = YamlConfigLoader.parse(in);

            assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(8000));
            assertThat(cfg.isFollowRedirects()).isFalse();
            assertThat(cfg.getUserAgent()).isEqualTo("StackProbe/0.1 (+https://example.org/bot)");
            assertThat(cfg.getParallelJobs()).isEqualTo(5);
            assertThat(cfg.getRps()).isEqualTo(4);
            assertThat(cfg.isProbeFiles()).isFalse();
            assertThat(cfg.getOutputDir()).isEqualTo(Path.of("reports"));
            assertThat(cfg.retry().getMaxAttempts()).isEqualTo(2);
            assertThat(cfg.retry().getBaseDelayMs()).isEqualTo(500);
        }
    }

    @Test
    void empty_document_keeps_defaults() {
        AnalyzerConfig cfg = YamlConfigLoader.parse(yaml(""));
        AnalyzerConfig def = AnalyzerConfig.defaults();

        assertThat(cfg.getParallelJobs()).isEqualTo(def.getParallelJobs());
        assertThat(cfg.getTimeout()).isEqualTo(def.getTimeout());
        assertThat(cfg.isProbeFiles()).isTrue();
    }

    @Test
    void numbers_given_as_strings_are_accepted() {
        AnalyzerConfig cfg = YamlConfigLoader.parse(yaml("parallelJobs: \"7\"\nprobeFiles: \"false\"\n"));

        assertThat(cfg.getParallelJobs()).isEqualTo(7);
        assertThat(cfg.isProbeFiles()).isFalse();
    }

    @Test
    void non_numeric_value_is_rejected() {
        assertThatThrownBy(() -> YamlConfigLoader.parse(yaml("rps: fast\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rps");
    }

    @Test
    void out_of_range_jobs_fail_validation() {
        assertThatThrownBy(() -> YamlConfigLoader.parse(yaml("parallelJobs: 11\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelJobs");
    }

    @Test
    void load_from_file_and_missing_file() throws Exception {
        Path f = tmp.resolve("stackprobe.yml");
        Files.writeString(f, "timeoutMs: 1500\nretry:\n  maxAttempts: 4\n");

        AnalyzerConfig cfg = YamlConfigLoader.load(f);
        assertThat(cfg.getTimeoutMs()).isEqualTo(1500);
        assertThat(cfg.retry().getMaxAttempts()).isEqualTo(4);

        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml"))).isInstanceOf(IOException.class);
        assertThat(YamlConfigLoader.loadOrDefaults(tmp.resolve("nope.yml")).getRps())
                .isEqualTo(AnalyzerConfig.defaults().getRps());
    }
}

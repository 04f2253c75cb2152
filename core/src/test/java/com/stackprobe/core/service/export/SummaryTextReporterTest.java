package com.stackprobe.core.service.export;

import com.stackprobe.core.model.BatchSummary;
import com.stackprobe.core.model.BatchSummary.RatioStat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryTextReporterTest {

    @TempDir
    Path tmp;

    private final SummaryTextReporter reporter = new SummaryTextReporter();

    @Test
    void render_lists_common_and_missing_sections() {
        String text = reporter.render(BatchSummaryJsonWriterTest.sample());

        assertThat(text)
                .contains("Batch Analysis Summary")
                .contains("Batch ID: 20240305_140709")
                .contains("Total sites analyzed: 10")
                .contains("Common Technologies (>50% of sites):")
                .contains("  + WordPress (cms) - 6/10 sites (60%)")
                .contains("Common Missing Security Headers:")
                .contains("  x Permissions-Policy - Missing on 10/10 sites (100%)")
                .contains("  x X-Frame-Options - Missing on 3/10 sites (30%)")
                .contains("  + No missing files detected")
                .contains("  x theme-color - Missing on 1/10 sites (10%)")
                .contains("Additional Statistics:")
                .contains("  Responsive design: 7/10 sites (70%)")
                .contains("  SSL enabled: 9/10 sites (90%)")
                .contains("  HTTP/2: 6/10 sites (60%)");
    }

    @Test
    void missing_entries_keep_summary_order() {
        String text = reporter.render(BatchSummaryJsonWriterTest.sample());
        assertThat(text.indexOf("Permissions-Policy")).isLessThan(text.indexOf("X-Frame-Options"));
    }

    @Test
    void no_common_technologies_prints_placeholder() {
        BatchSummary s = new BatchSummary("b", Instant.EPOCH, 1,
                new RatioStat(0, 0), new RatioStat(0, 0), new RatioStat(0, 0),
                Map.of(), List.of(), List.of(), List.of());

        String text = reporter.render(s);

        assertThat(text).contains("  (none)")
                .contains("  + No missing security headers detected")
                .contains("  + No missing meta tags detected");
    }

    @Test
    void export_writes_report_file() throws Exception {
        Path out = reporter.export(tmp, BatchSummaryJsonWriterTest.sample());

        assertThat(out).isEqualTo(tmp.resolve("summary_report.txt"));
        assertThat(Files.readString(out)).contains("Batch Analysis Summary");
    }
}

package com.stackprobe.core.service.export;

import com.stackprobe.core.model.BatchSummary;
import com.stackprobe.core.model.BatchSummary.RatioStat;
import com.stackprobe.core.model.BatchSummary.TechStat;
import com.stackprobe.core.model.Category;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/** 사람이 읽는 배치 요약(summary_report.txt). 색상 코드 없이 평문 */
public final class SummaryTextReporter implements ReportExporter {

    private static final String RULE = "=======================================";

    @Override
    public Path export(Path batchDir, BatchSummary summary) throws IOException {
        Files.createDirectories(batchDir);
        Path out = batchDir.resolve(ReportNaming.SUMMARY_REPORT);
        Files.writeString(out, render(summary), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }

    public String render(BatchSummary s) {
        final int total = s.getTotalSites();
        final String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder(2048);

        sb.append(RULE).append(nl)
          .append(" Batch Analysis Summary").append(nl)
          .append(RULE).append(nl).append(nl)
          .append("Batch ID: ").append(s.getBatchId()).append(nl)
          .append("Total sites analyzed: ").append(total).append(nl).append(nl);

        // 공통 기술(카테고리 통합, count 내림차순)
        sb.append("Common Technologies (>50% of sites):").append(nl).append(nl);
        List<Row> rows = new ArrayList<>();
        for (Map.Entry<Category, List<TechStat>> e : s.getCommonTechnologies().entrySet()) {
            for (TechStat t : e.getValue()) rows.add(new Row(e.getKey(), t));
        }
        rows.sort(Comparator.comparingInt((Row r) -> r.stat().count()).reversed()
                .thenComparing(r -> r.stat().name()));
        if (rows.isEmpty()) {
            sb.append("  (none)").append(nl);
        }
        for (Row r : rows) {
            TechStat t = r.stat();
            sb.append("  + ").append(t.name()).append(" (").append(r.category().key()).append(") - ")
              .append(t.count()).append('/').append(total).append(" sites (").append(t.percentage()).append("%)").append(nl);
        }
        sb.append(nl);

        missing(sb, "Common Missing Security Headers:", s.getMissingSecurityHeaders(), total,
                "No missing security headers detected", nl);
        missing(sb, "Common Missing Files:", s.getMissingFiles(), total,
                "No missing files detected", nl);
        missing(sb, "Common Missing Meta Tags:", s.getMissingMetaTags(), total,
                "No missing meta tags detected", nl);

        sb.append("Additional Statistics:").append(nl).append(nl);
        ratio(sb, "Responsive design", s.getResponsive(), total, nl);
        ratio(sb, "SSL enabled", s.getSsl(), total, nl);
        ratio(sb, "HTTP/2", s.getHttp2(), total, nl);
        sb.append(nl).append(RULE).append(nl);
        return sb.toString();
    }

    private record Row(Category category, TechStat stat) {}

    private static void missing(StringBuilder sb, String title, List<TechStat> items, int total, String none, String nl) {
        sb.append(title).append(nl).append(nl);
        if (items.isEmpty()) {
            sb.append("  + ").append(none).append(nl);
        }
        for (TechStat t : items) {
            sb.append("  x ").append(t.name()).append(" - Missing on ")
              .append(t.count()).append('/').append(total).append(" sites (").append(t.percentage()).append("%)").append(nl);
        }
        sb.append(nl);
    }

    private static void ratio(StringBuilder sb, String label, RatioStat r, int total, String nl) {
        sb.append("  ").append(label).append(": ")
          .append(r.count()).append('/').append(total).append(" sites (").append(r.percentage()).append("%)").append(nl);
    }
}

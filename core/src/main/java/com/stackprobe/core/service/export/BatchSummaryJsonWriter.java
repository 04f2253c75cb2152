package com.stackprobe.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stackprobe.core.model.BatchSummary;
import com.stackprobe.core.model.BatchSummary.RatioStat;
import com.stackprobe.core.model.BatchSummary.TechStat;
import com.stackprobe.core.model.Category;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/** 배치 요약 JSON(summary.json) */
public final class BatchSummaryJsonWriter implements ReportExporter {

    @Override
    public Path export(Path batchDir, BatchSummary summary) throws IOException {
        Files.createDirectories(batchDir);
        Path out = batchDir.resolve(ReportNaming.SUMMARY_JSON);
        Files.writeString(out, toJson(summary) + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }

    public ObjectNode toTree(BatchSummary s) {
        ObjectNode root = ReportJson.MAPPER.createObjectNode();
        root.put("batch_id", s.getBatchId());
        root.set("analyzed_at", ReportJson.MAPPER.valueToTree(s.getAnalyzedAt()));
        root.put("total_sites", s.getTotalSites());

        ObjectNode stats = root.putObject("statistics");
        ratio(stats.putObject("responsive_design"), s.getResponsive());
        ratio(stats.putObject("ssl_enabled"), s.getSsl());
        ratio(stats.putObject("http2"), s.getHttp2());

        ObjectNode common = root.putObject("common_technologies");
        for (Category c : Category.values()) {
            ArrayNode arr = common.putArray(c.key());
            for (TechStat t : s.getCommonTechnologies().get(c)) {
                arr.addObject()
                        .put("name", t.name())
                        .put("count", t.count())
                        .put("percentage", t.percentage());
            }
        }

        ObjectNode missing = root.putObject("common_missing_features");
        missingItems(missing.putArray("security_headers"), s.getMissingSecurityHeaders());
        missingItems(missing.putArray("files"), s.getMissingFiles());
        missingItems(missing.putArray("meta_tags"), s.getMissingMetaTags());
        return root;
    }

    public String toJson(BatchSummary s) {
        try {
            return ReportJson.MAPPER.writeValueAsString(toTree(s));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void ratio(ObjectNode node, RatioStat r) {
        node.put("count", r.count());
        node.put("percentage", r.percentage());
    }

    private static void missingItems(ArrayNode arr, List<TechStat> items) {
        for (TechStat t : items) {
            arr.addObject()
                    .put("name", t.name())
                    .put("missing_on", t.count())
                    .put("percentage", t.percentage());
        }
    }
}

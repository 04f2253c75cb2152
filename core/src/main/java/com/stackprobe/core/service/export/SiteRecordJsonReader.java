package com.stackprobe.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.stackprobe.core.model.Category;
import com.stackprobe.core.model.MissingReport;
import com.stackprobe.core.model.PageMeta;
import com.stackprobe.core.model.SiteRecord;
import com.stackprobe.core.model.TechProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 사이트 JSON → SiteRecord 역직렬화(summarize 재집계용).
 * 알 수 없는 카테고리 키는 무시, 누락된 배열은 빈 집합으로 본다.
 */
public final class SiteRecordJsonReader {

    private static final Logger LOG = LoggerFactory.getLogger(SiteRecordJsonReader.class);

    public SiteRecord read(Path file) throws IOException {
        JsonNode root = ReportJson.MAPPER.readTree(file.toFile());
        if (root == null || !root.isObject()) throw new IOException("not a JSON object: " + file);
        return fromTree(root);
    }

    public SiteRecord fromTree(JsonNode root) throws IOException {
        String url = root.path("url").asText("");
        if (url.isBlank()) throw new IOException("site record without url");

        TechProfile.Builder tech = TechProfile.builder();
        JsonNode techNode = root.path("technologies");
        Iterator<Map.Entry<String, JsonNode>> it = techNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            Category.fromKey(e.getKey()).ifPresent(c -> {
                for (String name : strings(e.getValue())) tech.add(c, name);
            });
        }

        JsonNode m = root.path("meta");
        PageMeta meta = new PageMeta(
                m.path("title").asText(""),
                m.path("description").asText(""),
                m.path("responsive").asBoolean(false),
                m.path("http_version").asText(""),
                m.path("ssl_enabled").asBoolean(false));

        JsonNode miss = root.path("missing");
        MissingReport missing = new MissingReport(
                strings(miss.path("security")),
                strings(miss.path("files")),
                strings(miss.path("meta_tags")));

        return SiteRecord.builder()
                .url(url)
                .analyzedAt(instant(root.path("analyzed_at")))
                .technologies(tech.build())
                .meta(meta)
                .missing(missing)
                .build();
    }

    /**
     * 배치 디렉터리의 사이트 JSON 전부(summary.json 제외, 파일명 순).
     * 읽을 수 없는 파일은 경고 로그 후 건너뛴다.
     */
    public List<SiteRecord> readBatchDir(Path batchDir) throws IOException {
        if (!Files.isDirectory(batchDir)) throw new IOException("not a directory: " + batchDir);
        List<Path> files;
        try (Stream<Path> s = Files.list(batchDir)) {
            files = s.filter(ReportNaming::isSiteRecordFile).sorted().collect(Collectors.toList());
        }
        List<SiteRecord> out = new ArrayList<>(files.size());
        for (Path f : files) {
            try {
                out.add(read(f));
            } catch (IOException e) {
                LOG.warn("Skipping unreadable site record {}: {}", f.getFileName(), e.getMessage());
            }
        }
        return out;
    }

    private static List<String> strings(JsonNode arr) {
        List<String> out = new ArrayList<>();
        if (arr == null || !arr.isArray()) return out;
        for (JsonNode n : arr) {
            String s = n.asText("").trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static Instant instant(JsonNode n) {
        if (n == null || !n.isTextual()) return null;
        try {
            return Instant.parse(n.asText());
        } catch (DateTimeParseException e) {
            LOG.debug("invalid analyzed_at '{}', using now", n.asText());
            return null;
        }
    }
}

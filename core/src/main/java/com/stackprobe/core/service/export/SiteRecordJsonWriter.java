package com.stackprobe.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stackprobe.core.model.Category;
import com.stackprobe.core.model.PageMeta;
import com.stackprobe.core.model.SiteRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;

/**
 * 사이트 1건 JSON(url / analyzed_at / technologies / meta / missing).
 * technologies는 18개 카테고리를 고정 순서로 모두 출력하고, 배열은 비어 있어도 생략하지 않는다.
 */
public final class SiteRecordJsonWriter {

    public ObjectNode toTree(SiteRecord rec) {
        ObjectNode root = ReportJson.MAPPER.createObjectNode();
        root.put("url", rec.getUrl());
        root.set("analyzed_at", ReportJson.MAPPER.valueToTree(rec.getAnalyzedAt()));

        ObjectNode tech = root.putObject("technologies");
        for (Category c : Category.values()) {
            strings(tech.putArray(c.key()), rec.getTechnologies().get(c));
        }

        PageMeta m = rec.getMeta();
        ObjectNode meta = root.putObject("meta");
        meta.put("title", m.title());
        meta.put("description", m.description());
        meta.put("responsive", m.responsive());
        meta.put("http_version", m.httpVersion());
        meta.put("ssl_enabled", m.sslEnabled());

        ObjectNode missing = root.putObject("missing");
        strings(missing.putArray("security"), rec.getMissing().getSecurity());
        strings(missing.putArray("files"), rec.getMissing().getFiles());
        strings(missing.putArray("meta_tags"), rec.getMissing().getMetaTags());
        return root;
    }

    public String toJson(SiteRecord rec) {
        try {
            return ReportJson.MAPPER.writeValueAsString(toTree(rec));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** dir 아래 URL 기반 파일명(충돌 시 _N)으로 저장 */
    public Path write(Path dir, SiteRecord rec) throws IOException {
        Files.createDirectories(dir);
        Path out = ReportNaming.siteJsonPath(dir, rec.getUrl());
        Files.writeString(out, toJson(rec) + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW);
        return out;
    }

    private static void strings(ArrayNode arr, Collection<String> values) {
        for (String v : values) arr.add(v);
    }
}

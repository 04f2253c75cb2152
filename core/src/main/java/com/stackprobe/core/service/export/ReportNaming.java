package com.stackprobe.core.service.export;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** 출력 파일/디렉터리 이름 규칙 */
public final class ReportNaming {

    public static final String BATCH_DIR_PREFIX = "tech_stack_batch_";
    public static final String SUMMARY_JSON = "summary.json";
    public static final String SUMMARY_REPORT = "summary_report.txt";
    public static final String JSON_EXT = ".json";

    private ReportNaming() {}

    /**
     * URL → 파일 이름 조각: 스킴 제거, 끝 슬래시 제거, [A-Za-z0-9.-] 이외는 '_'
     * 예) https://example.com/blog/ → example.com_blog
     */
    public static String urlSlug(String url) {
        if (url == null || url.isBlank()) return "no-url";
        String s = url.trim().replaceFirst("(?i)^https?://", "");
        if (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        s = s.replaceAll("[^a-zA-Z0-9.-]", "_");
        return s.isEmpty() ? "no-url" : s;
    }

    /** 충돌 시 _2, _3 ... 을 붙인 사이트 JSON 경로(파일은 만들지 않음) */
    public static Path siteJsonPath(Path dir, String url) {
        String slug = urlSlug(url);
        Path first = dir.resolve(slug + JSON_EXT);
        if (!Files.exists(first)) return first;
        int counter = 2;
        while (Files.exists(dir.resolve(slug + "_" + counter + JSON_EXT))) counter++;
        return dir.resolve(slug + "_" + counter + JSON_EXT);
    }

    public static String batchDirName(String batchId) {
        return BATCH_DIR_PREFIX + batchId;
    }

    public static Path batchDir(Path baseDir, String batchId) {
        return baseDir.resolve(batchDirName(batchId));
    }

    /** "tech_stack_batch_<id>" → id. 접두가 없으면 empty */
    public static Optional<String> batchIdOf(Path batchDir) {
        if (batchDir == null || batchDir.getFileName() == null) return Optional.empty();
        String name = batchDir.getFileName().toString();
        if (!name.startsWith(BATCH_DIR_PREFIX) || name.length() == BATCH_DIR_PREFIX.length()) return Optional.empty();
        return Optional.of(name.substring(BATCH_DIR_PREFIX.length()));
    }

    /** 배치 디렉터리 안의 사이트 레코드 파일인지(summary.json 제외) */
    public static boolean isSiteRecordFile(Path p) {
        if (p == null || p.getFileName() == null) return false;
        String name = p.getFileName().toString();
        return name.toLowerCase(Locale.ROOT).endsWith(JSON_EXT)
                && !name.equals(SUMMARY_JSON)
                && Files.isRegularFile(p);
    }
}

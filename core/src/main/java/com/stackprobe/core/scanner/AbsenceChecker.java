package com.stackprobe.core.scanner;

import com.stackprobe.core.model.MissingReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 모범 사례 누락 점검(보안 헤더 / 보조 파일 / 메타 태그).
 * 네트워크 I/O는 하지 않는다. 파일 존재 여부는 호출자가 probe 결과 맵으로 넘긴다.
 * 세 목록 모두 항상 반환한다(비어 있으면 "누락 없음").
 */
public final class AbsenceChecker {

    /** 보안 헤더 체크리스트(보고 순서 고정) */
    public static final List<String> SECURITY_HEADERS = List.of(
            "Strict-Transport-Security",
            "Content-Security-Policy",
            "X-Content-Type-Options",
            "X-Frame-Options",
            "Referrer-Policy",
            "Permissions-Policy");

    /** probe 이름 → origin 기준 경로 */
    public static final Map<String, String> FILE_PROBES;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("robots.txt", "/robots.txt");
        m.put("sitemap.xml", "/sitemap.xml");
        m.put("favicon.ico", "/favicon.ico");
        m.put("humans.txt", "/humans.txt");
        m.put("security.txt", "/.well-known/security.txt");
        FILE_PROBES = Collections.unmodifiableMap(m);
    }

    /** 메타 태그 체크리스트: 이름 → 본문 존재 규칙 */
    public static final Map<String, MatchRule> META_TAGS;
    static {
        Map<String, MatchRule> m = new LinkedHashMap<>();
        m.put("viewport", MatchRule.body("viewport"));
        m.put("description", MatchRule.body("<meta\\b[^>]*\\bname=[\"']description[\"']"));
        m.put("canonical", MatchRule.body("rel=[\"']canonical[\"']"));
        m.put("Open Graph tags", MatchRule.body("property=[\"']og:"));
        m.put("Twitter Card tags", MatchRule.body("name=[\"']twitter:"));
        m.put("theme-color", MatchRule.body("name=[\"']theme-color[\"']"));
        META_TAGS = Collections.unmodifiableMap(m);
    }

    /** 모든 probe가 실패한 맵(FILE_PROBES 순서) */
    public static Map<String, Boolean> allProbesAbsent() {
        Map<String, Boolean> m = new LinkedHashMap<>();
        for (String name : FILE_PROBES.keySet()) m.put(name, false);
        return Collections.unmodifiableMap(m);
    }

    private static final Map<String, MatchRule> HEADER_RULES;
    static {
        Map<String, MatchRule> m = new LinkedHashMap<>();
        for (String h : SECURITY_HEADERS) m.put(h, MatchRule.headerPresent(h));
        HEADER_RULES = Collections.unmodifiableMap(m);
    }

    /**
     * @param fileProbes probe 이름 → 존재 여부. false인 항목만 누락으로 보고한다.
     *                   맵에 없는 파일은 점검하지 않은 것이므로 보고하지 않는다.
     */
    public MissingReport checkMissing(String headers, String body, Map<String, Boolean> fileProbes) {
        final String h = headers == null ? "" : headers;
        final String b = body == null ? "" : body;
        final Map<String, Boolean> probes = fileProbes == null ? Map.of() : fileProbes;

        List<String> security = new ArrayList<>();
        HEADER_RULES.forEach((name, rule) -> {
            if (!rule.test(h, b)) security.add(name);
        });

        List<String> files = new ArrayList<>();
        probes.forEach((name, exists) -> {
            if (Boolean.FALSE.equals(exists)) files.add(name);
        });

        List<String> meta = new ArrayList<>();
        META_TAGS.forEach((name, rule) -> {
            if (!rule.test(h, b)) meta.add(name);
        });

        return new MissingReport(security, files, meta);
    }
}

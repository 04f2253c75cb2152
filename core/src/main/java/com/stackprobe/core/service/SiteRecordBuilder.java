package com.stackprobe.core.service;

import com.stackprobe.core.api.ITechDetector;
import com.stackprobe.core.model.MissingReport;
import com.stackprobe.core.model.PageMeta;
import com.stackprobe.core.model.SiteRecord;
import com.stackprobe.core.model.TechProfile;
import com.stackprobe.core.scanner.AbsenceChecker;
import com.stackprobe.core.scanner.PageMetaExtractor;
import com.stackprobe.core.scanner.TechDetector;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 탐지 결과 + 누락 보고 + 페이지 메타를 묶어 불변 SiteRecord를 만든다.
 * 네트워크 I/O 없음(이미 수집된 텍스트와 probe 결과만 사용).
 */
public final class SiteRecordBuilder {

    private final ITechDetector detector;
    private final AbsenceChecker absenceChecker;
    private final PageMetaExtractor metaExtractor;

    public SiteRecordBuilder() {
        this(new TechDetector(), new AbsenceChecker(), new PageMetaExtractor());
    }

    public SiteRecordBuilder(ITechDetector detector, AbsenceChecker absenceChecker, PageMetaExtractor metaExtractor) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.absenceChecker = Objects.requireNonNull(absenceChecker, "absenceChecker");
        this.metaExtractor = Objects.requireNonNull(metaExtractor, "metaExtractor");
    }

    public SiteRecord build(String url, String headers, String body, Map<String, Boolean> fileProbes, Instant analyzedAt) {
        Objects.requireNonNull(url, "url");
        TechProfile tech = detector.detect(headers, body);
        MissingReport missing = absenceChecker.checkMissing(headers, body, fileProbes);
        PageMeta meta = metaExtractor.extract(body, headers, parseQuietly(url));
        return SiteRecord.builder()
                .url(url)
                .analyzedAt(analyzedAt)
                .technologies(tech)
                .meta(meta)
                .missing(missing)
                .build();
    }

    /**
     * fetch 실패 시의 저하 레코드: 빈 입력 그대로 분석(기술 없음, 모든 체크리스트 항목 누락).
     */
    public SiteRecord degraded(String url, Instant analyzedAt) {
        Objects.requireNonNull(url, "url");
        MissingReport allMissing = absenceChecker.checkMissing("", "", AbsenceChecker.allProbesAbsent());
        return SiteRecord.builder()
                .url(url)
                .analyzedAt(analyzedAt)
                .technologies(TechProfile.empty())
                .meta(PageMeta.empty(isHttps(url)))
                .missing(allMissing)
                .degraded(true)
                .build();
    }

    private static URI parseQuietly(String url) {
        try {
            return URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isHttps(String url) {
        return url.trim().toLowerCase(Locale.ROOT).startsWith("https://");
    }
}

package com.stackprobe.core.service;

import com.stackprobe.core.api.IPageFetcher;
import com.stackprobe.core.http.HttpPageFetcher;
import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.model.FetchResult;
import com.stackprobe.core.model.SiteRecord;
import com.stackprobe.core.scanner.AbsenceChecker;
import com.stackprobe.core.util.StructuredLog;
import com.stackprobe.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 단일 사이트 분석 파이프라인:
 *  fetch → (옵션) 보조 파일 probe → 탐지/누락 점검/메타 추출 → SiteRecord
 *
 * fetch 실패는 예외로 올리지 않고 degraded 레코드로 바꾼다.
 */
public final class SiteAnalysisService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SiteAnalysisService.class);
    private static final StructuredLog SLOG = StructuredLog.get(SiteAnalysisService.class);

    private final AnalyzerConfig config;
    private final IPageFetcher fetcher;
    private final SiteRecordBuilder recordBuilder;
    private final Clock clock;
    private final boolean ownsFetcher;

    /** 기본 구현(HttpPageFetcher) */
    public SiteAnalysisService(AnalyzerConfig config) {
        this(config, new HttpPageFetcher(config), new SiteRecordBuilder(), Clock.systemUTC(), true);
    }

    /** DI/테스트용 */
    public SiteAnalysisService(AnalyzerConfig config, IPageFetcher fetcher, SiteRecordBuilder recordBuilder, Clock clock) {
        this(config, fetcher, recordBuilder, clock, false);
    }

    private SiteAnalysisService(AnalyzerConfig config, IPageFetcher fetcher, SiteRecordBuilder recordBuilder,
                                Clock clock, boolean ownsFetcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.recordBuilder = Objects.requireNonNull(recordBuilder, "recordBuilder");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownsFetcher = ownsFetcher;
    }

    /**
     * @param rawUrl 스킴이 없으면 https:// 를 붙인다
     * @throws IllegalArgumentException URL 형식 오류
     */
    public SiteRecord analyze(String rawUrl) {
        URI url = UrlUtils.toUri(rawUrl);
        String urlText = url.toString();
        Instant now = clock.instant();

        FetchResult page = fetcher.fetch(url);
        if (page.isFailure()) {
            String reason = page.getError().orElse("unknown");
            LOG.warn("Fetch failed for {}: {}", urlText, reason);
            SLOG.warn("fetch-failed", "url", urlText, "reason", reason, "ms", page.getResponseTimeMs());
            return recordBuilder.degraded(urlText, now);
        }

        Map<String, Boolean> probes = config.isProbeFiles() ? probeFiles(url) : Map.of();
        SiteRecord rec = recordBuilder.build(urlText, page.getHeaders(), page.getBody(), probes, now);

        int techCount = rec.getTechnologies().asMap().values().stream().mapToInt(Set::size).sum();
        LOG.info("Analyzed {} -> status={}, technologies={}", urlText, page.getStatusCode(), techCount);
        SLOG.info("site-analyzed",
                "url", urlText,
                "status", page.getStatusCode(),
                "ms", page.getResponseTimeMs(),
                "technologies", techCount,
                "missingSecurity", rec.getMissing().getSecurity().size());
        return rec;
    }

    /** 보조 파일 존재 여부(origin 기준). 키는 AbsenceChecker.FILE_PROBES의 이름 */
    Map<String, Boolean> probeFiles(URI page) {
        Map<String, Boolean> out = new LinkedHashMap<>();
        AbsenceChecker.FILE_PROBES.forEach((name, path) -> {
            URI target = UrlUtils.resolveOnOrigin(page, path);
            boolean exists = fetcher.probeExists(target);
            LOG.debug("probe {} -> {}", target, exists);
            out.put(name, exists);
        });
        return out;
    }

    /** fetch 실패 이외의 사유(URL 형식 오류, 작업 실패)로 레코드를 만들 수 없을 때 */
    public SiteRecord degraded(String rawUrl) {
        String urlText;
        try {
            urlText = UrlUtils.toUri(rawUrl).toString();
        } catch (IllegalArgumentException e) {
            urlText = rawUrl == null ? "" : rawUrl.trim();
        }
        return recordBuilder.degraded(urlText, clock.instant());
    }

    @Override
    public void close() throws Exception {
        if (ownsFetcher) fetcher.close();
    }
}

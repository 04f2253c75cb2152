package com.stackprobe.core.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/** 사이트 1건 분석 결과(출력 단위이자 집계 입력 단위). 생성 후 불변 */
public final class SiteRecord {
    private final String url;
    private final Instant analyzedAt;     // 초 단위로 절삭
    private final TechProfile technologies;
    private final PageMeta meta;
    private final MissingReport missing;
    private final boolean degraded;       // fetch 실패로 빈 입력을 분석한 경우

    private SiteRecord(Builder b) {
        this.url = b.url;
        this.analyzedAt = (b.analyzedAt == null ? Instant.now() : b.analyzedAt).truncatedTo(ChronoUnit.SECONDS);
        this.technologies = (b.technologies == null) ? TechProfile.empty() : b.technologies;
        this.meta = (b.meta == null) ? PageMeta.empty(false) : b.meta;
        this.missing = (b.missing == null) ? MissingReport.none() : b.missing;
        this.degraded = b.degraded;
    }

    public String getUrl() { return url; }
    public Instant getAnalyzedAt() { return analyzedAt; }
    public TechProfile getTechnologies() { return technologies; }
    public PageMeta getMeta() { return meta; }
    public MissingReport getMissing() { return missing; }
    public boolean isDegraded() { return degraded; }

    @Override public String toString() {
        return "SiteRecord{url=" + url + ", analyzedAt=" + analyzedAt + ", degraded=" + degraded + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private Instant analyzedAt;
        private TechProfile technologies;
        private PageMeta meta;
        private MissingReport missing;
        private boolean degraded;

        public Builder url(String url) { this.url = url; return this; }
        public Builder analyzedAt(Instant analyzedAt) { this.analyzedAt = analyzedAt; return this; }
        public Builder technologies(TechProfile technologies) { this.technologies = technologies; return this; }
        public Builder meta(PageMeta meta) { this.meta = meta; return this; }
        public Builder missing(MissingReport missing) { this.missing = missing; return this; }
        public Builder degraded(boolean degraded) { this.degraded = degraded; return this; }

        public SiteRecord build() {
            Objects.requireNonNull(url, "url");
            return new SiteRecord(this);
        }
    }
}

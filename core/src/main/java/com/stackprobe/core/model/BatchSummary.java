package com.stackprobe.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 여러 SiteRecord의 교차 통계. 매번 전체 레코드에서 새로 계산되는 순수 투영이며
 * 점진적으로 갱신하지 않는다.
 */
public final class BatchSummary {

    /** 이름 + 등장(또는 누락) 사이트 수 + 내림 백분율 */
    public record TechStat(String name, int count, int percentage) {
        public TechStat {
            Objects.requireNonNull(name, "name");
        }
    }

    /** 불리언 플래그 비율 */
    public record RatioStat(int count, int percentage) {}

    private final String batchId;
    private final Instant analyzedAt;
    private final int totalSites;
    private final RatioStat responsive;
    private final RatioStat ssl;
    private final RatioStat http2;
    private final Map<Category, List<TechStat>> commonTechnologies;
    private final List<TechStat> missingSecurityHeaders;
    private final List<TechStat> missingFiles;
    private final List<TechStat> missingMetaTags;

    public BatchSummary(String batchId,
                        Instant analyzedAt,
                        int totalSites,
                        RatioStat responsive,
                        RatioStat ssl,
                        RatioStat http2,
                        Map<Category, List<TechStat>> commonTechnologies,
                        List<TechStat> missingSecurityHeaders,
                        List<TechStat> missingFiles,
                        List<TechStat> missingMetaTags) {
        this.batchId = Objects.requireNonNull(batchId, "batchId");
        this.analyzedAt = Objects.requireNonNull(analyzedAt, "analyzedAt");
        if (totalSites <= 0) throw new IllegalArgumentException("totalSites must be > 0");
        this.totalSites = totalSites;
        this.responsive = Objects.requireNonNull(responsive, "responsive");
        this.ssl = Objects.requireNonNull(ssl, "ssl");
        this.http2 = Objects.requireNonNull(http2, "http2");

        EnumMap<Category, List<TechStat>> m = new EnumMap<>(Category.class);
        for (Category c : Category.values()) {
            List<TechStat> l = (commonTechnologies == null) ? null : commonTechnologies.get(c);
            m.put(c, l == null ? List.of() : List.copyOf(l));
        }
        this.commonTechnologies = Collections.unmodifiableMap(m);
        this.missingSecurityHeaders = List.copyOf(missingSecurityHeaders);
        this.missingFiles = List.copyOf(missingFiles);
        this.missingMetaTags = List.copyOf(missingMetaTags);
    }

    public String getBatchId() { return batchId; }
    public Instant getAnalyzedAt() { return analyzedAt; }
    public int getTotalSites() { return totalSites; }
    public RatioStat getResponsive() { return responsive; }
    public RatioStat getSsl() { return ssl; }
    public RatioStat getHttp2() { return http2; }

    /** 모든 카테고리 키가 존재(과반 미달이면 빈 리스트) */
    public Map<Category, List<TechStat>> getCommonTechnologies() { return commonTechnologies; }
    public List<TechStat> getMissingSecurityHeaders() { return missingSecurityHeaders; }
    public List<TechStat> getMissingFiles() { return missingFiles; }
    public List<TechStat> getMissingMetaTags() { return missingMetaTags; }
}

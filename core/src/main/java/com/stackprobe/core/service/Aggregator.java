package com.stackprobe.core.service;

import com.stackprobe.core.model.BatchSummary;
import com.stackprobe.core.model.BatchSummary.RatioStat;
import com.stackprobe.core.model.BatchSummary.TechStat;
import com.stackprobe.core.model.Category;
import com.stackprobe.core.model.EmptyBatchException;
import com.stackprobe.core.model.SiteRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * SiteRecord 집합 → BatchSummary.
 * <ul>
 *   <li>기술별 등장 사이트 수, 백분율 = floor(count * 100 / total)</li>
 *   <li>공통 기술 = count &gt; total / 2 (정수 나눗셈, 정확히 절반은 제외)</li>
 *   <li>누락 항목은 과반 필터 없이 count &gt; 0 전부</li>
 *   <li>정렬: count 내림차순, 동률이면 이름 오름차순</li>
 * </ul>
 * 상태가 없어 동시 호출에 안전하다.
 */
public final class Aggregator {

    public static final DateTimeFormatter BATCH_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    public static final String HTTP2 = "HTTP/2";

    private static final Comparator<TechStat> ORDER =
            Comparator.comparingInt(TechStat::count).reversed().thenComparing(TechStat::name);

    private final Clock clock;

    public Aggregator() {
        this(Clock.systemDefaultZone());
    }

    public Aggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 시계 기준 배치 ID(yyyyMMdd_HHmmss) */
    public String newBatchId() {
        return LocalDateTime.now(clock).format(BATCH_ID_FORMAT);
    }

    public BatchSummary summarize(Collection<SiteRecord> records) {
        return summarize(newBatchId(), records);
    }

    public BatchSummary summarize(String batchId, Collection<SiteRecord> records) {
        Objects.requireNonNull(batchId, "batchId");
        if (records == null || records.isEmpty()) throw new EmptyBatchException();

        final int total = records.size();
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        RatioStat responsive = ratio(records, r -> r.getMeta().responsive(), total);
        RatioStat ssl = ratio(records, r -> r.getMeta().sslEnabled(), total);
        RatioStat http2 = ratio(records, r -> HTTP2.equals(r.getMeta().httpVersion()), total);

        EnumMap<Category, List<TechStat>> common = new EnumMap<>(Category.class);
        for (Category c : Category.values()) {
            List<TechStat> stats = stats(records, r -> r.getTechnologies().get(c), total);
            stats.removeIf(s -> !isCommon(s.count(), total));
            common.put(c, stats);
        }

        List<TechStat> missingSecurity = stats(records, r -> r.getMissing().getSecurity(), total);
        List<TechStat> missingFiles = stats(records, r -> r.getMissing().getFiles(), total);
        List<TechStat> missingMeta = stats(records, r -> r.getMissing().getMetaTags(), total);

        return new BatchSummary(batchId, now, total, responsive, ssl, http2,
                common, missingSecurity, missingFiles, missingMeta);
    }

    /** 과반 판정: count > total / 2 (정수 나눗셈) */
    public static boolean isCommon(int count, int total) {
        return count > total / 2;
    }

    /** 내림 백분율 */
    public static int percentage(int count, int total) {
        if (total <= 0) throw new IllegalArgumentException("total must be > 0");
        return (int) ((long) count * 100 / total);
    }

    private static RatioStat ratio(Collection<SiteRecord> records, Predicate<SiteRecord> flag, int total) {
        int n = 0;
        for (SiteRecord r : records) if (flag.test(r)) n++;
        return new RatioStat(n, percentage(n, total));
    }

    /** 레코드별 집합(사이트당 1회) 등장 수 → 정렬된 통계 */
    private static List<TechStat> stats(Collection<SiteRecord> records,
                                        Function<SiteRecord, Set<String>> names,
                                        int total) {
        Map<String, Integer> counts = new HashMap<>();
        for (SiteRecord r : records) {
            for (String name : names.apply(r)) counts.merge(name, 1, Integer::sum);
        }
        List<TechStat> out = new ArrayList<>(counts.size());
        counts.forEach((name, n) -> out.add(new TechStat(name, n, percentage(n, total))));
        out.sort(ORDER);
        return out;
    }
}

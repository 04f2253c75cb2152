package com.stackprobe.core.service;

import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.model.SiteRecord;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BatchAnalysisServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    private static AnalyzerConfig config(int jobs) {
        return AnalyzerConfig.defaults()
                .setParallelJobs(jobs)
                .setRps(10_000)          // 레이트리미터 영향 제거
                .setProbeFiles(false);
    }

    @Test
    void results_follow_input_order_regardless_of_completion() {
        FakePageFetcher fetcher = new FakePageFetcher();
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String u = "https://site" + i + ".example";
            fetcher.page(u, "HTTP/2 200\n", "<title>" + i + "</title>");
            urls.add(u);
        }
        fetcher.delayMs = 20;

        AnalyzerConfig cfg = config(4);
        BatchAnalysisService batch = new BatchAnalysisService(cfg,
                new SiteAnalysisService(cfg, fetcher, new SiteRecordBuilder(), CLOCK));

        List<SiteRecord> out = batch.analyzeAll("20240305_140709", urls);

        assertThat(out).extracting(SiteRecord::getUrl).containsExactlyElementsOf(urls);
        for (int i = 0; i < out.size(); i++) {
            assertThat(out.get(i).getMeta().title()).isEqualTo(String.valueOf(i));
        }
    }

    @Test
    void failures_become_degraded_records_and_batch_continues() {
        FakePageFetcher fetcher = new FakePageFetcher()
                .page("https://ok.example", "HTTP/2 200\nserver: nginx\n", "<title>ok</title>")
                .throwing("https://crash.example");

        AnalyzerConfig cfg = config(2);
        BatchAnalysisService batch = new BatchAnalysisService(cfg,
                new SiteAnalysisService(cfg, fetcher, new SiteRecordBuilder(), CLOCK));

        List<String> urls = List.of("ok.example", "https://crash.example", "https://down.example", "https://");
        List<String> progress = new CopyOnWriteArrayList<>();
        AtomicInteger degradedSeen = new AtomicInteger();

        List<SiteRecord> out = batch.analyzeAll("b1", urls, (done, total, url, degraded) -> {
            progress.add(done + "/" + total);
            if (degraded) degradedSeen.incrementAndGet();
        });

        assertThat(out).hasSize(4);
        assertThat(out.get(0).isDegraded()).isFalse();
        assertThat(out.get(1).isDegraded()).isTrue();   // 작업 예외
        assertThat(out.get(2).isDegraded()).isTrue();   // fetch 실패
        assertThat(out.get(3).isDegraded()).isTrue();   // URL 형식 오류
        assertThat(out.get(1).getUrl()).isEqualTo("https://crash.example");
        assertThat(out.get(3).getUrl()).isEqualTo("https://");

        assertThat(progress).hasSize(4).contains("4/4");
        assertThat(degradedSeen.get()).isEqualTo(3);
    }

    @Test
    void empty_input_returns_empty_list() {
        AnalyzerConfig cfg = config(3);
        BatchAnalysisService batch = new BatchAnalysisService(cfg,
                new SiteAnalysisService(cfg, new FakePageFetcher(), new SiteRecordBuilder(), CLOCK));

        assertThat(batch.analyzeAll("empty", List.of())).isEmpty();
    }

    @Test
    void worker_threads_are_named_daemons() {
        Thread t = new BatchAnalysisService.NamedThreadFactory("site-worker").newThread(() -> {});
        assertThat(t.getName()).isEqualTo("site-worker-1");
        assertThat(t.isDaemon()).isTrue();
    }
}

package com.stackprobe.core.service;

import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.model.SiteRecord;
import com.stackprobe.core.util.ProgressListener;
import com.stackprobe.core.util.RateLimiter;
import com.stackprobe.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 오케스트레이터:
 *  - 고정 스레드풀(parallelJobs, 1~10) + 유계 큐 역압
 *  - 전역 RateLimiter(rps)로 fetch 속도 제한
 *  - 결과는 입력 순서대로 수집, 작업 실패는 degraded 레코드로 대체(배치는 중단하지 않음)
 */
public final class BatchAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(BatchAnalysisService.class);
    private static final StructuredLog SLOG = StructuredLog.get(BatchAnalysisService.class);

    private final AnalyzerConfig config;
    private final SiteAnalysisService site;
    private final RateLimiter rateLimiter;

    public BatchAnalysisService(AnalyzerConfig config, SiteAnalysisService site) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.site = Objects.requireNonNull(site, "site");
        this.rateLimiter = RateLimiter.perSecond(config.getRps());
    }

    public List<SiteRecord> analyzeAll(String batchId, List<String> urls) {
        return analyzeAll(batchId, urls, ProgressListener.NONE);
    }

    public List<SiteRecord> analyzeAll(String batchId, List<String> urls, ProgressListener listener) {
        Objects.requireNonNull(urls, "urls");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final StructuredLog slog = SLOG.withContext("batchId", batchId);
        final int total = urls.size();
        final int jobs = Math.min(config.getParallelJobs(), Math.max(1, total));

        LOG.info("Batch start: batchId={}, sites={}, jobs={}, rps={}", batchId, total, jobs, config.getRps());
        slog.info("batch-start", "sites", total, "jobs", jobs, "rps", config.getRps());
        if (total == 0) {
            slog.info("batch-done", "sites", 0, "degraded", 0);
            return List.of();
        }

        ExecutorService exec = new ThreadPoolExecutor(
                jobs, jobs,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(jobs * 2),
                new NamedThreadFactory("site-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        final AtomicInteger done = new AtomicInteger(0);
        final List<Future<SiteRecord>> futures = new ArrayList<>(total);

        for (String url : urls) {
            futures.add(exec.submit(() -> {
                try {
                    rateLimiter.acquire();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while rate-limiting");
                }
                SiteRecord rec = site.analyze(url);
                notify(pl, done.incrementAndGet(), total, rec);
                return rec;
            }));
        }

        List<SiteRecord> out = new ArrayList<>(total);
        int degraded = 0;
        try {
            for (int i = 0; i < futures.size(); i++) {
                String url = urls.get(i);
                SiteRecord rec;
                try {
                    rec = futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Site task failed for {}: {}", url, cause.toString());
                    slog.error("task-failed", cause, "url", String.valueOf(url));
                    rec = site.degraded(url);
                    notify(pl, done.incrementAndGet(), total, rec);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }
                if (rec.isDegraded()) degraded++;
                out.add(rec);
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        LOG.info("Batch done: batchId={}, sites={}, degraded={}", batchId, out.size(), degraded);
        slog.info("batch-done", "sites", out.size(), "degraded", degraded);
        return out;
    }

    private static void notify(ProgressListener pl, int done, int total, SiteRecord rec) {
        try {
            pl.onSiteDone(done, total, rec.getUrl(), rec.isDegraded());
        } catch (RuntimeException e) {
            LOG.debug("progress listener failed: {}", e.toString());
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}

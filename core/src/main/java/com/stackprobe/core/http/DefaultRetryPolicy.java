package com.stackprobe.core.http;

import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.model.FetchResult;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** 429/5xx/전송 실패에서만 재시도. base → 2×base → 4×base (±10% Jitter) */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final DoubleSupplier random;   // [0,1)

    public DefaultRetryPolicy() { this(3, 250); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this(maxAttempts, baseMillis, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** 테스트용: 난수원 주입 */
    DefaultRetryPolicy(int maxAttempts, long baseMillis, DoubleSupplier random) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.random = random;
    }

    public static DefaultRetryPolicy from(AnalyzerConfig.RetryCfg cfg) {
        return new DefaultRetryPolicy(cfg.getMaxAttempts(), cfg.getBaseDelayMs());
    }

    @Override public boolean shouldRetry(FetchResult result, int attempt) {
        if (attempt >= maxAttempts) return false;
        if (result.isFailure()) return true;
        int status = result.getStatusCode();
        return status == 429 || status >= 500;
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1));   // 1,2,4...
        long raw = baseMillis * pow;
        double jitter = 0.9 + random.getAsDouble() * 0.2;           // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}

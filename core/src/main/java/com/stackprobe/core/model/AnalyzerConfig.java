package com.stackprobe.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 분석 설정 (stackprobe.yml 매핑 대상). 순수 설정 보관용.
 * 배치 병렬도는 1~10 범위로 제한한다.
 */
public final class AnalyzerConfig {

    public static final int MIN_PARALLEL_JOBS = 1;
    public static final int MAX_PARALLEL_JOBS = 10;
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

    /** 재시도 관련 하위 설정: YAML의 `retry:` 섹션과 매핑 */
    public static final class RetryCfg {
        private int maxAttempts = 3;
        private long baseDelayMs = 250;

        public int getMaxAttempts() { return maxAttempts; }
        public RetryCfg setMaxAttempts(int v) { this.maxAttempts = Math.max(1, v); return this; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public RetryCfg setBaseDelayMs(long v) { this.baseDelayMs = Math.max(1, v); return this; }
    }

    // ---------- 기본 필드 ----------
    private Duration timeout = Duration.ofSeconds(10); // 요청 타임아웃
    private boolean followRedirects = true;
    private String userAgent = DEFAULT_USER_AGENT;
    private int parallelJobs = 3;        // 배치 동시 분석 수
    private int rps = 10;
    private boolean probeFiles = true;   // robots.txt 등 존재 확인 여부
    private Path outputDir = Path.of(".");

    private final RetryCfg retry = new RetryCfg();

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public int getParallelJobs() { return parallelJobs; }
    public int getRps() { return rps; }
    public boolean isProbeFiles() { return probeFiles; }
    public Path getOutputDir() { return outputDir; }
    public RetryCfg retry() { return retry; }

    // ---------- fluent setters ----------
    public AnalyzerConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public AnalyzerConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public AnalyzerConfig setUserAgent(String userAgent) {
        if (userAgent != null && !userAgent.isBlank()) this.userAgent = userAgent.trim();
        return this;
    }
    public AnalyzerConfig setParallelJobs(int parallelJobs) { this.parallelJobs = parallelJobs; return this; }
    public AnalyzerConfig setRps(int rps) { this.rps = rps; return this; }
    public AnalyzerConfig setProbeFiles(boolean v) { this.probeFiles = v; return this; }
    public AnalyzerConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (parallelJobs < MIN_PARALLEL_JOBS || parallelJobs > MAX_PARALLEL_JOBS)
            throw new IllegalArgumentException("parallelJobs must be between "
                    + MIN_PARALLEL_JOBS + " and " + MAX_PARALLEL_JOBS);
        if (rps <= 0) throw new IllegalArgumentException("rps must be > 0");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(userAgent, "userAgent");
    }

    // ---------- helpers ----------
    public static AnalyzerConfig defaults() { return new AnalyzerConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public AnalyzerConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}

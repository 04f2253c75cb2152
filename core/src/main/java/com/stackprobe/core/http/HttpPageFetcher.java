package com.stackprobe.core.http;

import com.stackprobe.core.api.IPageFetcher;
import com.stackprobe.core.model.AnalyzerConfig;
import com.stackprobe.core.model.FetchResult;
import com.stackprobe.core.util.DefaultSleeper;
import com.stackprobe.core.util.Sleeper;
import com.stackprobe.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * java.net.http 기반 페이지 수집기.
 * <ul>
 *   <li>fetch: GET(리다이렉트 추종은 설정값) → "HTTP/2 200" + "name: value" 라인 텍스트로 헤더 직렬화</li>
 *   <li>probeExists: 리다이렉트 없이 GET, 200일 때만 true</li>
 *   <li>예외는 던지지 않고 FetchResult.failure / false로 변환</li>
 * </ul>
 */
public class HttpPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(HttpPageFetcher.class);

    private static final Pattern RETRY_AFTER = Pattern.compile("(?im)^retry-after:\\s*(\\d{1,9})\\s*$");
    private static final long MAX_RETRY_AFTER_SEC = 30;

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final AnalyzerConfig config;
    private final HttpClient pageClient;    // 리다이렉트 추종(설정)
    private final HttpClient probeClient;   // 리다이렉트 미추종
    private final HttpSender sender;        // 있으면 이걸 사용
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public HttpPageFetcher(AnalyzerConfig config) {
        this(config, DefaultRetryPolicy.from(config.retry()), DefaultSleeper.INSTANCE);
    }

    public HttpPageFetcher(AnalyzerConfig config, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.pageClient = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.probeClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(AnalyzerConfig config, HttpSender testSender, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.pageClient = null;
        this.probeClient = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** 재시도 포함 fetch: 정책이 허용하는 동안 반복, 마지막 결과 반환 */
    @Override
    public FetchResult fetch(URI url) {
        Objects.requireNonNull(url, "url");
        int attempt = 1;
        while (true) {
            FetchResult r = fetchOnce(url);
            if (!retryPolicy.shouldRetry(r, attempt) || attempt >= retryPolicy.maxAttempts()) {
                if (attempt > 1) LOG.debug("fetch {} finished after {} attempts (status={})", url, attempt, r.getStatusCode());
                return r;
            }
            Duration delay = retryAfterOr(retryPolicy.nextDelay(attempt), r);
            SLOG.debug("fetch-retry", "url", String.valueOf(url), "attempt", attempt,
                    "status", r.getStatusCode(), "delayMs", delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return r;
            }
            attempt++;
        }
    }

    /** 단일 GET. 예외 시 failure 결과 */
    FetchResult fetchOnce(URI url) {
        long start = System.nanoTime();
        try {
            HttpRequest req = request(url);
            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : pageClient.send(req, HttpResponse.BodyHandlers.ofString());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return FetchResult.ok(url, resp.statusCode(),
                    headerText(resp.version(), resp.statusCode(), resp.headers()),
                    resp.body() == null ? "" : resp.body(),
                    elapsedMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return FetchResult.failure(url, "interrupted", elapsedMs);
        } catch (Exception e) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            LOG.debug("fetch failed: {} -> {}", url, e.toString());
            return FetchResult.failure(url, e.getClass().getSimpleName() + ": " + e.getMessage(), elapsedMs);
        }
    }

    @Override
    public boolean probeExists(URI url) {
        Objects.requireNonNull(url, "url");
        try {
            HttpRequest req = request(url);
            int status = (sender != null)
                    ? sender.send(req).statusCode()
                    : probeClient.send(req, HttpResponse.BodyHandlers.discarding()).statusCode();
            return status == 200;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            LOG.debug("probe failed: {} -> {}", url, e.toString());
            return false;
        }
    }

    /** Retry-After(초) 헤더를 우선하되 30초로 상한. HTTP-date 형태는 fallback */
    static Duration retryAfterOr(Duration fallback, FetchResult r) {
        Matcher m = RETRY_AFTER.matcher(r.getHeaders());
        if (!m.find()) return fallback;
        try {
            long sec = Long.parseLong(m.group(1));
            return Duration.ofSeconds(Math.min(sec, MAX_RETRY_AFTER_SEC));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private HttpRequest request(URI url) {
        return HttpRequest.newBuilder(url)
                .timeout(config.getTimeout())
                .header("User-Agent", config.getUserAgent())
                .GET()
                .build();
    }

    /** 상태 라인 + 헤더 라인(이름 정렬) 텍스트. 탐지 규칙은 이 텍스트를 대상으로 한다 */
    static String headerText(HttpClient.Version version, int status, HttpHeaders headers) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(statusLineVersion(version)).append(' ').append(status).append('\n');
        Map<String, List<String>> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) sorted.putAll(headers.map());
        sorted.forEach((name, values) -> {
            if (name.startsWith(":")) return;   // HTTP/2 pseudo header
            for (String v : values) {
                sb.append(name.toLowerCase(Locale.ROOT)).append(": ").append(v).append('\n');
            }
        });
        return sb.toString();
    }

    static String statusLineVersion(HttpClient.Version v) {
        if (v == HttpClient.Version.HTTP_2) return "HTTP/2";
        return "HTTP/1.1";
    }
}

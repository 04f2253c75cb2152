package com.stackprobe.core.http;

import com.stackprobe.core.model.FetchResult;

import java.time.Duration;

/** fetch 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터 시작(방금 끝난 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(FetchResult result, int attempt);
    /** attempt에 해당하는 다음 지연 시간. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). */
    int maxAttempts();

    /** 재시도 없음 */
    RetryPolicy NONE = new RetryPolicy() {
        @Override public boolean shouldRetry(FetchResult result, int attempt) { return false; }
        @Override public Duration nextDelay(int attempt) { return Duration.ZERO; }
        @Override public int maxAttempts() { return 1; }
    };
}

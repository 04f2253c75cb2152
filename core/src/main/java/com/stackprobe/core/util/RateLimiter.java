package com.stackprobe.core.util;

import java.util.function.LongSupplier;

/** 토큰 버킷: 초당 rps개 보충, 최대 burst개 보관. 배치 fetch 속도 제한용 */
public final class RateLimiter {
    private final long capacity;
    private final long refillPerSecond;
    private final LongSupplier nanoClock;
    private double tokens;
    private long lastNs;

    public RateLimiter(long capacity, long refillPerSecond) {
        this(capacity, refillPerSecond, System::nanoTime);
    }

    RateLimiter(long capacity, long refillPerSecond, LongSupplier nanoClock) {
        if (capacity <= 0 || refillPerSecond <= 0)
            throw new IllegalArgumentException("capacity/refillPerSecond must be > 0");
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastNs = nanoClock.getAsLong();
    }

    /** rps 기준(버스트 = rps) */
    public static RateLimiter perSecond(int rps) {
        return new RateLimiter(rps, rps);
    }

    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            this.wait(5);
        }
    }

    /** 대기 없이 토큰 1개 시도 */
    synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) { tokens -= 1.0; return true; }
        return false;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}

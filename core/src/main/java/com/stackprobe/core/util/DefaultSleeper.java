package com.stackprobe.core.util;

import java.time.Duration;

/** Thread.sleep 기반 기본 구현. 음수/0 지연은 건너뜀 */
public final class DefaultSleeper implements Sleeper {
    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    @Override public void sleep(Duration d) throws InterruptedException {
        if (d == null) return;
        long ms = Math.max(0, d.toMillis());
        if (ms > 0) Thread.sleep(ms);
    }
}

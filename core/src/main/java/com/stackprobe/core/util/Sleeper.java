package com.stackprobe.core.util;

import java.time.Duration;

/** 재시도 대기 추상화(테스트에서는 즉시 반환하는 구현 주입) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper NONE = d -> {};
}

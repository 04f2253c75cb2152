package com.stackprobe.app;

/** CLI 종료 코드 */
public final class ExitCodes {
    private ExitCodes() {}

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int USAGE = 2;        // picocli 파라미터 오류와 동일
    public static final int EMPTY_BATCH = 3;
}

package com.stackprobe.core.util;

/** 배치 진행률 콜백(사이트 1건 완료마다 호출, 워커 스레드에서 호출될 수 있음) */
@FunctionalInterface
public interface ProgressListener {
    /**
     * @param done  완료 수
     * @param total 전체 수
     * @param url   방금 끝난 URL
     * @param degraded fetch 실패로 빈 입력을 분석했는지
     */
    void onSiteDone(int done, int total, String url, boolean degraded);

    ProgressListener NONE = (d, t, u, g) -> {};
}

package com.stackprobe.core.service.export;

import com.stackprobe.core.model.BatchSummary;

import java.io.IOException;
import java.nio.file.Path;

/** 배치 요약을 파일로 내보내는 책임 (JSON / 텍스트) */
public interface ReportExporter {
    /**
     * @param batchDir 배치 출력 디렉터리(없으면 생성)
     * @param summary  집계 결과
     * @return 생성된 파일 경로
     */
    Path export(Path batchDir, BatchSummary summary) throws IOException;
}

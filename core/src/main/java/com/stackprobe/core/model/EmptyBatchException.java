package com.stackprobe.core.model;

/** 레코드 0건에 대한 집계 요청. 백분율이 정의되지 않으므로 호출자가 처리해야 한다 */
public class EmptyBatchException extends IllegalStateException {
    public EmptyBatchException() {
        super("Cannot summarize an empty batch: at least one site record is required");
    }
}

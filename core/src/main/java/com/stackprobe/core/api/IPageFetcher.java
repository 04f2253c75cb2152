// IPageFetcher.java
package com.stackprobe.core.api;

import com.stackprobe.core.model.FetchResult;
import java.net.URI;

/** 페이지 수집 최소 계약: 본문/헤더 fetch + 보조 파일 존재 확인. 실패는 예외 대신 FetchResult로 돌려준다. */
public interface IPageFetcher extends AutoCloseable {
    FetchResult fetch(URI url);
    boolean probeExists(URI url);
    @Override default void close() throws Exception {}
}

package com.stackprobe.core.service;

import com.stackprobe.core.api.IPageFetcher;
import com.stackprobe.core.model.FetchResult;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** 테스트용 고정 응답 fetcher. 등록되지 않은 URL은 실패로 응답한다 */
final class FakePageFetcher implements IPageFetcher {

    private final Map<String, FetchResult> pages = new ConcurrentHashMap<>();
    private final Set<String> existing = ConcurrentHashMap.newKeySet();
    private final Set<String> throwing = ConcurrentHashMap.newKeySet();
    final List<URI> fetched = new CopyOnWriteArrayList<>();
    final List<URI> probed = new CopyOnWriteArrayList<>();
    volatile long delayMs;
    volatile boolean closed;

    FakePageFetcher page(String url, String headers, String body) {
        URI u = URI.create(url);
        pages.put(url, FetchResult.ok(u, 200, headers, body, 5));
        return this;
    }

    FakePageFetcher existing(String... urls) {
        existing.addAll(List.of(urls));
        return this;
    }

    /** fetch 시 RuntimeException (작업 실패 경로) */
    FakePageFetcher throwing(String url) {
        throwing.add(url);
        return this;
    }

    @Override
    public FetchResult fetch(URI url) {
        fetched.add(url);
        if (delayMs > 0) {
            try { Thread.sleep(delayMs); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
        }
        String key = url.toString();
        if (throwing.contains(key)) throw new IllegalStateException("boom: " + key);
        FetchResult r = pages.get(key);
        return r != null ? r : FetchResult.failure(url, "connection refused", 1);
    }

    @Override
    public boolean probeExists(URI url) {
        probed.add(url);
        return existing.contains(url.toString());
    }

    @Override
    public void close() {
        closed = true;
    }
}

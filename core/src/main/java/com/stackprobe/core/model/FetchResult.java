package com.stackprobe.core.model;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * fetch 협력자의 결과: 원문 헤더 텍스트 + 본문 텍스트, 또는 실패 사유.
 * 실패해도 headers/body는 빈 문자열로 채워 분석을 그대로 진행할 수 있게 한다.
 */
public final class FetchResult {
    private final URI url;
    private final int statusCode;          // 실패 시 -1
    private final String headers;          // "HTTP/2 200\nserver: nginx\n..." 형태
    private final String body;
    private final long responseTimeMs;
    private final String error;            // null이면 성공

    private FetchResult(URI url, int statusCode, String headers, String body, long responseTimeMs, String error) {
        this.url = Objects.requireNonNull(url, "url");
        this.statusCode = statusCode;
        this.headers = (headers == null) ? "" : headers;
        this.body = (body == null) ? "" : body;
        this.responseTimeMs = responseTimeMs;
        this.error = error;
    }

    public static FetchResult ok(URI url, int statusCode, String headers, String body, long responseTimeMs) {
        return new FetchResult(url, statusCode, headers, body, responseTimeMs, null);
    }

    public static FetchResult failure(URI url, String error, long responseTimeMs) {
        return new FetchResult(url, -1, "", "", responseTimeMs, error == null ? "unknown error" : error);
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getHeaders() { return headers; }
    public String getBody() { return body; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public Optional<String> getError() { return Optional.ofNullable(error); }
    public boolean isFailure() { return error != null; }
}

package com.stackprobe.core.model;

/**
 * 페이지 메타 정보. title/description은 원문 그대로 보관하고
 * 따옴표 이스케이프는 JSON 직렬화 단계에서 한 번만 수행한다.
 */
public record PageMeta(String title,
                       String description,
                       boolean responsive,
                       String httpVersion,
                       boolean sslEnabled) {

    public PageMeta {
        title = (title == null) ? "" : title;
        description = (description == null) ? "" : description;
        httpVersion = (httpVersion == null) ? "" : httpVersion;
    }

    public static PageMeta empty(boolean sslEnabled) {
        return new PageMeta("", "", false, "", sslEnabled);
    }
}

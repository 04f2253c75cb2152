package com.stackprobe.core.model;

import java.util.Locale;
import java.util.Optional;

/** 기술 분류 체계(고정 집합). 선언 순서 = 출력 순서 */
public enum Category {
    CMS,
    JAVASCRIPT_FRAMEWORKS,
    JAVASCRIPT_LIBRARIES,
    UI_FRAMEWORKS,
    WEB_FRAMEWORKS,
    PROGRAMMING_LANGUAGES,
    ANALYTICS,
    TAG_MANAGERS,
    CDN,
    CACHING,
    REVERSE_PROXIES,
    FONT_SCRIPTS,
    SECURITY,
    COOKIE_COMPLIANCE,
    RUM,
    PERFORMANCE,
    HOSTING,
    MISCELLANEOUS;

    /** JSON 키(snake_case). 예: JAVASCRIPT_FRAMEWORKS → "javascript_frameworks" */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** JSON 키 → enum. 모르는 키면 empty */
    public static Optional<Category> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toUpperCase(Locale.ROOT);
        for (Category c : values()) {
            if (c.name().equals(k)) return Optional.of(c);
        }
        return Optional.empty();
    }
}

package com.stackprobe.core.scanner;

import com.stackprobe.core.model.Category;

import java.util.Objects;

/** (카테고리, 기술명, 판정 규칙) 튜플. 프로세스 시작 시 정의되며 불변 */
public record Signature(Category category, String technology, MatchRule rule) {

    public Signature {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(technology, "technology");
        Objects.requireNonNull(rule, "rule");
        if (technology.isBlank()) throw new IllegalArgumentException("technology must not be blank");
    }

    public boolean matches(String headers, String body) {
        return rule.test(headers, body);
    }
}

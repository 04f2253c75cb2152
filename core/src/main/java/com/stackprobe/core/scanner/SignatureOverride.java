package com.stackprobe.core.scanner;

import com.stackprobe.core.model.Category;

import java.util.Objects;
import java.util.Optional;

/**
 * 카테고리 간 예외 규칙: 기본 패스에서 (category, technology)가 탐지되었고
 * suppressWhen이 참이면 해당 항목을 제거하고, redirect가 있으면 다른 카테고리로 옮긴다.
 */
public record SignatureOverride(Category category,
                                String technology,
                                MatchRule suppressWhen,
                                Category redirectCategory,
                                String redirectTechnology) {

    public SignatureOverride {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(technology, "technology");
        Objects.requireNonNull(suppressWhen, "suppressWhen");
        if ((redirectCategory == null) != (redirectTechnology == null))
            throw new IllegalArgumentException("redirectCategory and redirectTechnology must be set together");
    }

    /** 제거만 하는 규칙 */
    public static SignatureOverride suppress(Category category, String technology, MatchRule when) {
        return new SignatureOverride(category, technology, when, null, null);
    }

    /** 제거 후 다른 카테고리로 재분류하는 규칙 */
    public static SignatureOverride redirect(Category category, String technology, MatchRule when,
                                             Category to, String toTechnology) {
        return new SignatureOverride(category, technology, when, to, toTechnology);
    }

    public Optional<Category> redirect() { return Optional.ofNullable(redirectCategory); }
}

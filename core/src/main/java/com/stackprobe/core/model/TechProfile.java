package com.stackprobe.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 페이지 1건의 카테고리 → 탐지 기술 집합.
 * 모든 카테고리가 항상 존재(없으면 빈 집합)하며 생성 후 불변.
 */
public final class TechProfile {
    private final Map<Category, Set<String>> byCategory;

    private TechProfile(Map<Category, Set<String>> src) {
        EnumMap<Category, Set<String>> m = new EnumMap<>(Category.class);
        for (Category c : Category.values()) {
            Set<String> s = src.get(c);
            m.put(c, Collections.unmodifiableSet(s == null ? new LinkedHashSet<>() : new LinkedHashSet<>(s)));
        }
        this.byCategory = Collections.unmodifiableMap(m);
    }

    public static TechProfile empty() { return new TechProfile(Map.of()); }

    /** 해당 카테고리의 기술 집합(삽입 순서 유지). null 아님 */
    public Set<String> get(Category c) { return byCategory.get(c); }

    public boolean contains(Category c, String technology) {
        return byCategory.get(c).contains(technology);
    }

    public Map<Category, Set<String>> asMap() { return byCategory; }

    /** 모든 카테고리가 비어 있으면 true */
    public boolean isEmpty() {
        for (Set<String> s : byCategory.values()) if (!s.isEmpty()) return false;
        return true;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TechProfile other)) return false;
        return byCategory.equals(other.byCategory);
    }

    @Override public int hashCode() { return Objects.hash(byCategory); }

    @Override public String toString() { return "TechProfile" + byCategory; }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final EnumMap<Category, Set<String>> m = new EnumMap<>(Category.class);

        /** 같은 카테고리에 같은 이름이 다시 들어와도 한 번만 남는다 */
        public Builder add(Category c, String technology) {
            Objects.requireNonNull(c, "category");
            Objects.requireNonNull(technology, "technology");
            m.computeIfAbsent(c, k -> new LinkedHashSet<>()).add(technology);
            return this;
        }

        public Builder remove(Category c, String technology) {
            Set<String> s = m.get(c);
            if (s != null) s.remove(technology);
            return this;
        }

        public boolean contains(Category c, String technology) {
            Set<String> s = m.get(c);
            return s != null && s.contains(technology);
        }

        public TechProfile build() { return new TechProfile(m); }
    }
}

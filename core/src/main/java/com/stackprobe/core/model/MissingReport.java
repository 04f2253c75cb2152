package com.stackprobe.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 누락된 모범 사례 항목 3종(보안 헤더 / 파일 / 메타 태그).
 * 세 집합은 항상 존재한다. 빈 집합 = "누락 없음".
 */
public final class MissingReport {
    private final Set<String> security;
    private final Set<String> files;
    private final Set<String> metaTags;

    public MissingReport(Collection<String> security, Collection<String> files, Collection<String> metaTags) {
        this.security = freeze(security);
        this.files = freeze(files);
        this.metaTags = freeze(metaTags);
    }

    public static MissingReport none() {
        return new MissingReport(Set.of(), Set.of(), Set.of());
    }

    public Set<String> getSecurity() { return security; }
    public Set<String> getFiles() { return files; }
    public Set<String> getMetaTags() { return metaTags; }

    private static Set<String> freeze(Collection<String> c) {
        return Collections.unmodifiableSet(c == null ? new LinkedHashSet<>() : new LinkedHashSet<>(c));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MissingReport r)) return false;
        return security.equals(r.security) && files.equals(r.files) && metaTags.equals(r.metaTags);
    }

    @Override public int hashCode() { return Objects.hash(security, files, metaTags); }

    @Override public String toString() {
        return "MissingReport{security=" + security + ", files=" + files + ", metaTags=" + metaTags + "}";
    }
}

package com.stackprobe.core.scanner;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 헤더/본문 텍스트에 대한 순수 판정 함수.
 * 정규식은 대소문자 무시 + 줄 단위(`.`은 줄바꿈을 넘지 않음)로 평가한다.
 */
@FunctionalInterface
public interface MatchRule {

    /** 판정 대상 텍스트 범위 */
    enum Source { HEADERS, BODY, ANY }

    boolean test(String headers, String body);

    default MatchRule and(MatchRule other) {
        Objects.requireNonNull(other, "other");
        return (h, b) -> test(h, b) && other.test(h, b);
    }

    default MatchRule or(MatchRule other) {
        Objects.requireNonNull(other, "other");
        return (h, b) -> test(h, b) || other.test(h, b);
    }

    // ----------------- 팩토리 -----------------

    static MatchRule of(Source source, String regex) {
        Objects.requireNonNull(source, "source");
        return new PatternRule(source, compile(regex));
    }

    static MatchRule headers(String regex) { return of(Source.HEADERS, regex); }
    static MatchRule body(String regex)    { return of(Source.BODY, regex); }
    static MatchRule any(String regex)     { return of(Source.ANY, regex); }

    /** 헤더 라인이 해당 이름으로 시작하면 true (예: "X-Frame-Options: DENY") */
    static MatchRule headerPresent(String headerName) {
        Objects.requireNonNull(headerName, "headerName");
        Pattern p = Pattern.compile("^[ \\t]*" + Pattern.quote(headerName.toLowerCase(Locale.ROOT)) + "[ \\t]*:",
                Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
        return new PatternRule(Source.HEADERS, p);
    }

    static Pattern compile(String regex) {
        Objects.requireNonNull(regex, "regex");
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    }

    /** Source + Pattern 기반 기본 구현 */
    final class PatternRule implements MatchRule {
        private final Source source;
        private final Pattern pattern;

        PatternRule(Source source, Pattern pattern) {
            this.source = source;
            this.pattern = pattern;
        }

        public Pattern pattern() { return pattern; }

        @Override public boolean test(String headers, String body) {
            return switch (source) {
                case HEADERS -> find(headers);
                case BODY    -> find(body);
                case ANY     -> find(headers) || find(body);
            };
        }

        private boolean find(String text) {
            return text != null && !text.isEmpty() && pattern.matcher(text).find();
        }

        @Override public String toString() {
            return source + ":/" + pattern.pattern() + "/i";
        }
    }
}

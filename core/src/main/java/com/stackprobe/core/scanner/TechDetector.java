package com.stackprobe.core.scanner;

import com.stackprobe.core.api.ITechDetector;
import com.stackprobe.core.model.Category;
import com.stackprobe.core.model.TechProfile;

import java.util.Objects;

/**
 * 시그니처 테이블 기반 기술 스택 탐지기.
 * <p>
 * 1) 카테고리 순서대로 모든 시그니처를 평가해 결과 집합에 추가(중복 제거)<br>
 * 2) 기본 패스가 끝난 뒤 예외 규칙(SignatureOverride)을 선언 순서대로 적용
 * <p>
 * 상태를 갖지 않으므로 여러 스레드에서 동시에 호출해도 안전하다.
 */
public final class TechDetector implements ITechDetector {

    private final SignatureRuleSet rules;

    public TechDetector() {
        this(SignatureRuleSet.defaults());
    }

    public TechDetector(SignatureRuleSet rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    @Override
    public TechProfile detect(String headers, String body) {
        final String h = headers == null ? "" : headers;
        final String b = body == null ? "" : body;

        TechProfile.Builder out = TechProfile.builder();
        if (h.isEmpty() && b.isEmpty()) return out.build();

        // 기본 패스
        for (Category c : Category.values()) {
            for (Signature s : rules.forCategory(c)) {
                if (s.matches(h, b)) out.add(c, s.technology());
            }
        }

        // 예외 패스
        for (SignatureOverride o : rules.overrides()) {
            if (!out.contains(o.category(), o.technology())) continue;
            if (!o.suppressWhen().test(h, b)) continue;
            out.remove(o.category(), o.technology());
            o.redirect().ifPresent(to -> out.add(to, o.redirectTechnology()));
        }
        return out.build();
    }
}

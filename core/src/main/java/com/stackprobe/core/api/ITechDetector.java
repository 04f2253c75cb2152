// ITechDetector.java
package com.stackprobe.core.api;

import com.stackprobe.core.model.TechProfile;

/** 탐지 최소 계약: 헤더/본문 텍스트를 받아 카테고리별 기술 집합을 돌려준다. */
public interface ITechDetector {
    TechProfile detect(String headers, String body);
}

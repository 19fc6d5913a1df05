package com.cspsmith.core.heuristics;

/**
 * 중복 억제용 키: (추론 대상, 그룹)
 * 그룹이 같은 규칙끼리는 같은 대상에 대해 한 번만 발화한다 (예: 분석/결제/CDN 의 "connect").
 */
public record InferenceKey(String target, String group) {
    public static InferenceKey of(String target, String group) {
        return new InferenceKey(target == null ? "" : target, group == null ? "" : group);
    }
}

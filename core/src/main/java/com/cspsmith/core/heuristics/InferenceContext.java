package com.cspsmith.core.heuristics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * apply() 한 번 동안만 쓰는 상태: 이미 발화한 키 집합 + (origin, 규칙) 발화 기록 + 결과 목록.
 * 호출마다 새로 만든다(전역 공유 금지).
 */
public final class InferenceContext {
    private final Set<InferenceKey> seen = new HashSet<>();
    private final Set<InferenceKey> firedOn = new HashSet<>();  // (origin, 규칙 이름)
    private final List<HeuristicResource> inferred = new ArrayList<>();

    /** 처음 보는 키면 true 를 돌려주고 기록 */
    public boolean claim(InferenceKey key) {
        return seen.add(key);
    }

    /** 규칙이 이 origin 의 리소스에서 발화했음을 기록 */
    void markFired(String origin, String rule) { firedOn.add(InferenceKey.of(origin, rule)); }

    boolean hasFired(String origin, String rule) { return firedOn.contains(InferenceKey.of(origin, rule)); }

    void emit(HeuristicResource r) { inferred.add(r); }

    public List<HeuristicResource> results() { return Collections.unmodifiableList(inferred); }
}

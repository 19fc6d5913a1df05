package com.cspsmith.core.heuristics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 추론 결과 집계: 분류별 + 신뢰도별 건수 */
public record HeuristicSummary(Map<InferredType, Integer> byType,
                               Map<Confidence, Integer> byConfidence,
                               int total) {

    public HeuristicSummary {
        byType = Collections.unmodifiableMap(new EnumMap<>(byType));
        byConfidence = Collections.unmodifiableMap(new EnumMap<>(byConfidence));
    }

    public static HeuristicSummary of(List<HeuristicResource> inferred) {
        Map<InferredType, Integer> types = new EnumMap<>(InferredType.class);
        Map<Confidence, Integer> levels = new EnumMap<>(Confidence.class);
        int n = 0;
        if (inferred != null) {
            for (HeuristicResource h : inferred) {
                types.merge(h.getType(), 1, Integer::sum);
                levels.merge(h.getConfidence(), 1, Integer::sum);
                n++;
            }
        }
        return new HeuristicSummary(types, levels, n);
    }

    public int count(InferredType type) { return byType.getOrDefault(type, 0); }

    public int count(Confidence confidence) { return byConfidence.getOrDefault(confidence, 0); }

    /** 평면 키 맵: "font" → 2, "confidence_high" → 3 ... (리포트용) */
    public Map<String, Integer> asFlatMap() {
        Map<String, Integer> out = new LinkedHashMap<>();
        byType.forEach((t, c) -> out.put(t.label(), c));
        byConfidence.forEach((c, n) -> out.put("confidence_" + c.label(), n));
        return out;
    }
}

package com.cspsmith.core.heuristics;

import com.cspsmith.core.model.ExternalResource;
import com.cspsmith.core.model.ResourceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 규칙 테이블 평가기.
 *  - 입력 순서대로 리소스를 돌며 해당 분류 규칙 + 전체 분류 규칙 적용
 *  - 중복 억제는 호출마다 새로 만드는 {@link InferenceContext} 로
 *  - 결과는 최선의 추정일 뿐, 보안 경계가 아님
 */
public final class HeuristicEngine {

    private static final Logger LOG = LoggerFactory.getLogger(HeuristicEngine.class);

    private final List<HeuristicRule> rules;

    /** 기본 테이블 사용 */
    public HeuristicEngine() {
        this(HeuristicRules.DEFAULT);
    }

    /** 테스트/확장용 테이블 주입 */
    public HeuristicEngine(List<HeuristicRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public List<HeuristicResource> apply(List<ExternalResource> resources) {
        InferenceContext ctx = new InferenceContext();
        if (resources == null) return ctx.results();

        for (ExternalResource r : resources) {
            String lowerUrl = r.url().toLowerCase(Locale.ROOT);
            String origin = r.domain();
            for (HeuristicRule rule : rules) {
                if (rule.appliesTo(r.type())) rule.evaluate(r, lowerUrl, origin, ctx);
            }
        }

        List<HeuristicResource> out = ctx.results();
        LOG.debug("Heuristics: {} resource(s) in, {} inference(s) out", resources.size(), out.size());
        return List.copyOf(out);
    }

    /** 카탈로그 전체(분류 순서)로 추론 */
    public List<HeuristicResource> apply(ResourceCatalog catalog) {
        return apply(catalog == null ? List.of() : catalog.all());
    }

    /** 추론 결과를 카탈로그에 되돌려 넣는다 (connect → other) */
    public static void mergeInto(ResourceCatalog catalog, List<HeuristicResource> inferred) {
        Objects.requireNonNull(catalog, "catalog");
        if (inferred == null) return;
        for (HeuristicResource h : inferred) {
            catalog.add(h.toExternalResource());
        }
    }

    public static HeuristicSummary summarize(List<HeuristicResource> inferred) {
        return HeuristicSummary.of(inferred);
    }
}

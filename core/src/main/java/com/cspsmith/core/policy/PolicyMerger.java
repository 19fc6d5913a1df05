package com.cspsmith.core.policy;

import com.cspsmith.core.model.CspModification;
import com.cspsmith.core.model.ResourceCatalog;
import com.cspsmith.core.model.ResourceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 정책 병합 패스 모음. 모두 헤더 문자열을 받아 새 헤더 문자열을 돌려준다(입력 불변).
 *  1) 해시 주입: {@link #updateCsp}
 *  2) strict 생성 + 해시 병합: {@link #generateStrict}, {@link #mergeStrictWithHashes}
 *  3) 도메인 주입: {@link #addExternalResources}
 *  4) 명시적 add/remove: {@link #applyModifications}
 */
public final class PolicyMerger {
    private PolicyMerger() {}

    public static final String UNSAFE_HASHES = "'unsafe-hashes'";
    public static final String DATA_SCHEME = "data:";

    // ---------- 1) 기존 정책에 해시 주입 ----------

    /**
     * 스크립트 해시 → script-src, &lt;style&gt; 해시 → style-src,
     * style 속성 해시 → style-src-attr(이미 있으면) 아니면 style-src.
     * 디렉티브가 없으면 해시만으로 새로 만든다.
     * 'unsafe-hashes': 이벤트 핸들러가 있으면 script-src 에, style 속성 해시가 있으면 그 디렉티브에.
     */
    public static String updateCsp(String header,
                                   List<String> scriptHashes,
                                   List<String> styleTagHashes,
                                   List<String> styleAttrHashes,
                                   boolean hasEventHandlers) {
        DirectiveMap dm = DirectiveMap.parse(header);
        List<String> scripts = nonNull(scriptHashes);
        List<String> styleTags = nonNull(styleTagHashes);
        List<String> styleAttrs = nonNull(styleAttrHashes);

        if (!scripts.isEmpty()) {
            dm.appendTokens("script-src", scripts);
            if (hasEventHandlers) dm.appendTokens("script-src", List.of(UNSAFE_HASHES));
        }

        if (!styleTags.isEmpty()) {
            dm.appendTokens("style-src", styleTags);
        }

        if (!styleAttrs.isEmpty()) {
            String target = dm.has("style-src-attr") ? "style-src-attr" : "style-src";
            dm.appendTokens(target, styleAttrs);
            dm.appendTokens(target, List.of(UNSAFE_HASHES));
        }

        return dm.toHeader();
    }

    // ---------- 2) strict 생성 ----------

    public static String generateStrict(StrictTemplate template) {
        return Objects.requireNonNull(template, "template").toHeader();
    }

    /**
     * strict 정책에 해시 병합. 추가할 것이 있을 때만 디렉티브를 건드린다.
     * style 태그/속성 해시는 모두 style-src 로 간다.
     */
    public static String mergeStrictWithHashes(String strictHeader,
                                               List<String> scriptHashes,
                                               List<String> styleTagHashes,
                                               List<String> styleAttrHashes,
                                               boolean hasEventHandlers) {
        DirectiveMap dm = DirectiveMap.parse(strictHeader);
        List<String> scripts = nonNull(scriptHashes);
        List<String> styleTags = nonNull(styleTagHashes);
        List<String> styleAttrs = nonNull(styleAttrHashes);

        if (!scripts.isEmpty() || hasEventHandlers) {
            List<String> add = new ArrayList<>(scripts);
            if (hasEventHandlers) add.add(UNSAFE_HASHES);
            dm.appendTokens("script-src", add);
        }

        if (!styleTags.isEmpty() || !styleAttrs.isEmpty()) {
            List<String> add = new ArrayList<>(styleTags);
            add.addAll(styleAttrs);
            if (!styleAttrs.isEmpty()) add.add(UNSAFE_HASHES);
            dm.appendTokens("style-src", add);
        }

        return dm.toHeader();
    }

    // ---------- 3) 외부 리소스 도메인 주입 ----------

    /**
     * 분류별 고유 origin 을 대응 디렉티브에 합친다.
     * 대상 디렉티브가 없으면 default-src 값을 씨앗으로, 그것도 없으면 origin 만으로 생성.
     * data: 사용이 기록된 image/font 는 img-src/font-src 에 "data:" 보장.
     */
    public static String addExternalResources(String header, ResourceCatalog catalog) {
        DirectiveMap dm = DirectiveMap.parse(header);
        if (catalog == null) return dm.toHeader();

        if (catalog.usesDataUri(ResourceType.IMAGE)) {
            mergeSources(dm, ResourceType.IMAGE.directive(), List.of(DATA_SCHEME));
        }
        if (catalog.usesDataUri(ResourceType.FONT)) {
            mergeSources(dm, ResourceType.FONT.directive(), List.of(DATA_SCHEME));
        }

        for (ResourceType type : ResourceType.values()) {
            List<String> domains = catalog.domainsByType(type);
            if (!domains.isEmpty()) mergeSources(dm, type.directive(), domains);
        }
        return dm.toHeader();
    }

    private static void mergeSources(DirectiveMap dm, String directive, List<String> values) {
        if (dm.has(directive)) {
            dm.appendTokens(directive, values);
        } else if (dm.has("default-src")) {
            dm.put(directive, DirectiveMap.joinUnique(dm.get("default-src"), values));
        } else {
            dm.put(directive, DirectiveMap.joinUnique(null, values));
        }
    }

    // ---------- 4) 명시적 수정 ----------

    /**
     * add/remove 를 주어진 순서대로 적용.
     * - add: 이미 있는 토큰이면 no-op, 디렉티브가 없으면 값만으로 생성(값이 비면 아무것도 안 함)
     * - remove: 있는 토큰만 제거, 마지막 토큰이 빠지면 디렉티브 자체를 삭제
     */
    public static String applyModifications(String header, List<CspModification> modifications) {
        DirectiveMap dm = DirectiveMap.parse(header);
        if (modifications == null) return dm.toHeader();

        for (CspModification m : modifications) {
            String d = m.directive().trim();
            List<String> values = DirectiveMap.splitTokens(m.value());
            switch (m.action()) {
                case ADD -> {
                    if (values.isEmpty()) break;
                    dm.appendTokens(d, values);
                }
                case REMOVE -> {
                    if (!dm.has(d) || values.isEmpty()) break;
                    List<String> remaining = new ArrayList<>(dm.tokens(d));
                    if (!remaining.removeAll(values)) break;
                    if (remaining.isEmpty()) dm.remove(d);
                    else dm.put(d, String.join(" ", remaining));
                }
            }
        }
        return dm.toHeader();
    }

    private static List<String> nonNull(List<String> in) {
        return in == null ? List.of() : in;
    }
}

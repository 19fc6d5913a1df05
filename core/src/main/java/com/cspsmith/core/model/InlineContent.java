package com.cspsmith.core.model;

import java.util.List;

/**
 * 문서 하나에서 추출한 인라인 콘텐츠(원문 그대로, 공백 정규화 없음).
 * 이벤트 핸들러 소스는 scripts 와 별도로 보관하지만 해시는 script-src 로 간다.
 */
public record InlineContent(List<String> scripts,
                            List<String> eventHandlers,
                            List<String> styleTags,
                            List<String> styleAttributes) {

    public InlineContent {
        scripts = copy(scripts);
        eventHandlers = copy(eventHandlers);
        styleTags = copy(styleTags);
        styleAttributes = copy(styleAttributes);
    }

    public static InlineContent empty() {
        return new InlineContent(List.of(), List.of(), List.of(), List.of());
    }

    public boolean hasEventHandlers() { return !eventHandlers.isEmpty(); }

    public boolean isEmpty() {
        return scripts.isEmpty() && eventHandlers.isEmpty() && styleTags.isEmpty() && styleAttributes.isEmpty();
    }

    private static List<String> copy(List<String> in) {
        return in == null ? List.of() : List.copyOf(in);
    }
}

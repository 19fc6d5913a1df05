package com.cspsmith.core.model;

import java.util.Objects;

/** 문서 1개의 추출 결과: 인라인 콘텐츠 + 외부 리소스 카탈로그 */
public record DocumentContent(String source, InlineContent inline, ResourceCatalog resources) {

    public DocumentContent {
        source = (source == null ? "" : source);
        Objects.requireNonNull(inline, "inline");
        Objects.requireNonNull(resources, "resources");
    }
}

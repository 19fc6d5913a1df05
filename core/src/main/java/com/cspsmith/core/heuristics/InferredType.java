package com.cspsmith.core.heuristics;

import com.cspsmith.core.model.ResourceType;

import java.util.Locale;

/**
 * 추론 결과의 분류. CONNECT 는 카탈로그의 OTHER(connect-src) 에 대응한다.
 */
public enum InferredType {
    SCRIPT(ResourceType.SCRIPT),
    STYLESHEET(ResourceType.STYLESHEET),
    IMAGE(ResourceType.IMAGE),
    FONT(ResourceType.FONT),
    FRAME(ResourceType.FRAME),
    CONNECT(ResourceType.OTHER);

    private final ResourceType resourceType;

    InferredType(ResourceType resourceType) { this.resourceType = resourceType; }

    /** 카탈로그에 다시 넣을 때의 분류 */
    public ResourceType resourceType() { return resourceType; }

    public String label() { return name().toLowerCase(Locale.ROOT); }
}

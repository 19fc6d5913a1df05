package com.cspsmith.core.model;

import java.util.Locale;

/** 외부 리소스 분류 + 각 분류가 기록되는 CSP 디렉티브 */
public enum ResourceType {
    SCRIPT("script", "script-src"),
    STYLESHEET("stylesheet", "style-src"),
    IMAGE("image", "img-src"),
    FONT("font", "font-src"),
    FRAME("frame", "frame-src"),
    OTHER("other", "connect-src");

    private final String key;
    private final String directive;

    ResourceType(String key, String directive) {
        this.key = key;
        this.directive = directive;
    }

    /** 소문자 키 ("script", "stylesheet", ...) */
    public String key() { return key; }

    /** 이 분류의 도메인이 병합되는 디렉티브 이름 */
    public String directive() { return directive; }

    /** 키 → enum. 모르는 값이면 IllegalArgumentException */
    public static ResourceType fromKey(String key) {
        if (key != null) {
            String k = key.trim().toLowerCase(Locale.ROOT);
            for (ResourceType t : values()) {
                if (t.key.equals(k)) return t;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + key);
    }

    @Override
    public String toString() { return key; }
}

package com.cspsmith.core.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * strict 정책 템플릿: 디렉티브별 허용 목록 + 플래그 2개.
 * 생성 순서는 {@link #DIRECTIVES} 순서 → upgrade-insecure-requests → require-trusted-types-for.
 * 허용 목록이 빈 디렉티브는 출력하지 않는다.
 */
public final class StrictTemplate {

    /** 템플릿이 다루는 디렉티브(= 생성 순서) */
    public static final List<String> DIRECTIVES = List.of(
            "default-src",
            "script-src",
            "style-src",
            "img-src",
            "font-src",
            "connect-src",
            "manifest-src",
            "worker-src",
            "frame-src",
            "object-src",
            "media-src",
            "base-uri",
            "form-action",
            "frame-ancestors");

    public static final String UPGRADE_INSECURE_REQUESTS = "upgrade-insecure-requests";
    public static final String REQUIRE_TRUSTED_TYPES = "require-trusted-types-for 'script'";

    private final Map<String, List<String>> sources = new LinkedHashMap<>();
    private boolean upgradeInsecureRequests;
    private boolean requireTrustedTypes;

    private StrictTemplate() {
        for (String d : DIRECTIVES) sources.put(d, List.of());
    }

    /** 빈 템플릿(아무 것도 출력하지 않음) */
    public static StrictTemplate empty() { return new StrictTemplate(); }

    /**
     * 권장 기본값: default-src 'none', frame/object/frame-ancestors 'none',
     * 나머지 'self', upgrade-insecure-requests on, trusted types off
     */
    public static StrictTemplate defaults() {
        StrictTemplate t = new StrictTemplate();
        for (String d : DIRECTIVES) t.sources.put(d, List.of("'self'"));
        t.sources.put("default-src", List.of("'none'"));
        t.sources.put("frame-src", List.of("'none'"));
        t.sources.put("object-src", List.of("'none'"));
        t.sources.put("frame-ancestors", List.of("'none'"));
        t.upgradeInsecureRequests = true;
        return t;
    }

    public StrictTemplate copy() {
        StrictTemplate t = new StrictTemplate();
        t.sources.putAll(this.sources);
        t.upgradeInsecureRequests = this.upgradeInsecureRequests;
        t.requireTrustedTypes = this.requireTrustedTypes;
        return t;
    }

    // ---------- getters ----------
    public List<String> get(String directive) {
        checkDirective(directive);
        return sources.get(directive);
    }

    public boolean isUpgradeInsecureRequests() { return upgradeInsecureRequests; }
    public boolean isRequireTrustedTypes() { return requireTrustedTypes; }

    // ---------- fluent setters ----------
    public StrictTemplate set(String directive, List<String> values) {
        checkDirective(directive);
        List<String> clean = new ArrayList<>();
        if (values != null) {
            for (String v : values) if (v != null && !v.isBlank()) clean.add(v.trim());
        }
        sources.put(directive, List.copyOf(clean));
        return this;
    }

    public StrictTemplate setUpgradeInsecureRequests(boolean v) { this.upgradeInsecureRequests = v; return this; }
    public StrictTemplate setRequireTrustedTypes(boolean v) { this.requireTrustedTypes = v; return this; }

    public Map<String, List<String>> asMap() { return Collections.unmodifiableMap(sources); }

    /** 템플릿 → 헤더 문자열 */
    public String toHeader() {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : sources.entrySet()) {
            if (!e.getValue().isEmpty()) parts.add(e.getKey() + " " + String.join(" ", e.getValue()));
        }
        if (upgradeInsecureRequests) parts.add(UPGRADE_INSECURE_REQUESTS);
        if (requireTrustedTypes) parts.add(REQUIRE_TRUSTED_TYPES);
        return String.join("; ", parts);
    }

    public static boolean isTemplateDirective(String directive) {
        return DIRECTIVES.contains(directive);
    }

    private static void checkDirective(String directive) {
        Objects.requireNonNull(directive, "directive");
        if (!DIRECTIVES.contains(directive)) {
            throw new IllegalArgumentException("Not a strict template directive: " + directive);
        }
    }
}

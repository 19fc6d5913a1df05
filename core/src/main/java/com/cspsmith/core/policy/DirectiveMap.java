package com.cspsmith.core.policy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CSP 헤더의 디렉티브 맵(name → value).
 * - 이름은 적힌 그대로(대소문자 구분), 중복 정의는 나중 것이 덮어씀
 * - 값이 ""인 디렉티브는 이름만 출력 (예: upgrade-insecure-requests)
 * - 출력은 {@link #CANONICAL_ORDER} 먼저, 나머지는 삽입 순서
 */
public final class DirectiveMap {

    /** 출력 시 우선 배치되는 디렉티브 순서 */
    public static final List<String> CANONICAL_ORDER = List.of(
            "default-src",
            "script-src",
            "style-src",
            "img-src",
            "font-src",
            "connect-src",
            "frame-src",
            "frame-ancestors",
            "object-src",
            "base-uri",
            "form-action");

    private final Map<String, String> directives = new LinkedHashMap<>();

    public DirectiveMap() {}

    public DirectiveMap(DirectiveMap other) {
        this.directives.putAll(other.directives);
    }

    /** ";" 분리 → trim → 첫 공백/탭 기준 name/value. 빈 조각은 무시 */
    public static DirectiveMap parse(String header) {
        DirectiveMap map = new DirectiveMap();
        if (header == null) return map;

        for (String raw : header.split(";")) {
            String part = raw.trim();
            if (part.isEmpty()) continue;

            int idx = firstWhitespace(part);
            if (idx < 0) {
                map.directives.put(part, "");
            } else {
                map.directives.put(part.substring(0, idx), part.substring(idx + 1).trim());
            }
        }
        return map;
    }

    // ---------- 조회 ----------
    public boolean has(String name) { return directives.containsKey(name); }

    /** 값(없으면 null) */
    public String get(String name) { return directives.get(name); }

    /** 값을 공백 기준 토큰 목록으로 (없으면 빈 목록) */
    public List<String> tokens(String name) {
        return splitTokens(directives.get(name));
    }

    public boolean hasToken(String name, String token) {
        return tokens(name).contains(token);
    }

    public Set<String> names() { return Collections.unmodifiableSet(directives.keySet()); }

    public int size() { return directives.size(); }

    public boolean isEmpty() { return directives.isEmpty(); }

    public Map<String, String> asMap() { return Collections.unmodifiableMap(directives); }

    // ---------- 변경 ----------
    public DirectiveMap put(String name, String value) {
        Objects.requireNonNull(name, "name");
        directives.put(name, value == null ? "" : value.trim());
        return this;
    }

    public DirectiveMap remove(String name) {
        directives.remove(name);
        return this;
    }

    /**
     * 기존 값 뒤에 토큰들을 이어붙인다(순서 유지, 중복 제거).
     * 디렉티브가 없으면 새로 만든다.
     */
    public DirectiveMap appendTokens(String name, Collection<String> tokens) {
        put(name, joinUnique(directives.get(name), tokens));
        return this;
    }

    // ---------- 출력 ----------
    /** 헤더 문자열 재구성: 정규 순서 → 나머지, "; " 로 연결 */
    public String toHeader() {
        List<String> parts = new ArrayList<>();
        for (String name : CANONICAL_ORDER) {
            if (directives.containsKey(name)) parts.add(render(name, directives.get(name)));
        }
        for (Map.Entry<String, String> e : directives.entrySet()) {
            if (!CANONICAL_ORDER.contains(e.getKey())) parts.add(render(e.getKey(), e.getValue()));
        }
        return String.join("; ", parts);
    }

    @Override
    public String toString() { return toHeader(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectiveMap other)) return false;
        return directives.equals(other.directives);
    }

    @Override
    public int hashCode() { return directives.hashCode(); }

    // ---------- helpers ----------

    /** existing 토큰 + extra 를 순서 유지/중복 없이 공백으로 연결 */
    public static String joinUnique(String existing, Collection<String> extra) {
        Set<String> out = new LinkedHashSet<>(splitTokens(existing));
        if (extra != null) {
            for (String v : extra) {
                if (v != null && !v.isBlank()) out.add(v.trim());
            }
        }
        return String.join(" ", out);
    }

    static List<String> splitTokens(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.asList(value.trim().split("\\s+"));
    }

    private static String render(String name, String value) {
        return (value == null || value.isEmpty()) ? name : name + " " + value;
    }

    private static int firstWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == ' ' || c == '\t') return i;
        }
        return -1;
    }
}

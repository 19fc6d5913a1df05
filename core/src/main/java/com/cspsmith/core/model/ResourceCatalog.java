package com.cspsmith.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 분류별 외부 리소스 목록 + data: URI 사용 플래그.
 * - 목록은 삽입 순서 유지(중복 허용)
 * - 도메인 조회는 항상 정렬 + 중복 제거
 */
public final class ResourceCatalog {

    private final Map<ResourceType, List<ExternalResource>> byType = new EnumMap<>(ResourceType.class);
    private final Set<ResourceType> dataUriTypes = EnumSet.noneOf(ResourceType.class);

    public ResourceCatalog() {
        for (ResourceType t : ResourceType.values()) {
            byType.put(t, new ArrayList<>());
        }
    }

    // ---------- 추가 ----------
    public ResourceCatalog add(ExternalResource resource) {
        Objects.requireNonNull(resource, "resource");
        byType.get(resource.type()).add(resource);
        return this;
    }

    public ResourceCatalog add(ResourceType type, String url) {
        return add(ExternalResource.of(type, url));
    }

    public ResourceCatalog addAll(Collection<ExternalResource> resources) {
        if (resources != null) resources.forEach(this::add);
        return this;
    }

    /** 해당 분류에서 data: URI가 쓰였음을 기록 */
    public ResourceCatalog markDataUri(ResourceType type) {
        dataUriTypes.add(Objects.requireNonNull(type, "type"));
        return this;
    }

    /**
     * 다른 카탈로그를 뒤에 이어붙인다(목록 연결 + 플래그 합집합).
     * 여러 문서의 결과를 합칠 때 사용.
     */
    public ResourceCatalog mergeFrom(ResourceCatalog other) {
        if (other == null) return this;
        for (ResourceType t : ResourceType.values()) {
            byType.get(t).addAll(other.byType.get(t));
        }
        dataUriTypes.addAll(other.dataUriTypes);
        return this;
    }

    // ---------- 조회 ----------
    public List<ExternalResource> get(ResourceType type) {
        return Collections.unmodifiableList(byType.get(Objects.requireNonNull(type, "type")));
    }

    /** 분류 순서(script → ... → other)대로 모든 리소스 */
    public List<ExternalResource> all() {
        List<ExternalResource> out = new ArrayList<>();
        for (ResourceType t : ResourceType.values()) out.addAll(byType.get(t));
        return out;
    }

    public boolean usesDataUri(ResourceType type) { return dataUriTypes.contains(type); }

    public int size() {
        int n = 0;
        for (List<ExternalResource> l : byType.values()) n += l.size();
        return n;
    }

    public boolean isEmpty() { return size() == 0; }

    /** 전체 분류의 고유 origin (정렬, 빈 값 제외) */
    public List<String> uniqueDomains() {
        Set<String> set = new TreeSet<>();
        for (List<ExternalResource> l : byType.values()) collectDomains(l, set);
        return List.copyOf(set);
    }

    /** 한 분류의 고유 origin (정렬, 빈 값 제외) */
    public List<String> domainsByType(ResourceType type) {
        Set<String> set = new TreeSet<>();
        collectDomains(byType.get(Objects.requireNonNull(type, "type")), set);
        return List.copyOf(set);
    }

    private static void collectDomains(List<ExternalResource> list, Set<String> into) {
        for (ExternalResource r : list) {
            if (r.isAddressable()) into.add(r.domain());
        }
    }
}

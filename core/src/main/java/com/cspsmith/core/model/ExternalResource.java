package com.cspsmith.core.model;

import com.cspsmith.core.resource.DomainExtractor;

import java.util.Objects;

/**
 * 문서에서 발견된 외부 참조 1건.
 * domain은 url에서 파생된 origin("scheme://host[:port]"), 상대경로/data: 이면 "".
 */
public record ExternalResource(ResourceType type, String url, String domain) {

    public ExternalResource {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(url, "url");
        domain = (domain == null ? "" : domain);
    }

    /** url에서 origin을 계산해 생성 */
    public static ExternalResource of(ResourceType type, String url) {
        Objects.requireNonNull(url, "url");
        return new ExternalResource(type, url, DomainExtractor.extract(url));
    }

    public boolean isAddressable() { return !domain.isEmpty(); }
}

package com.cspsmith.core.heuristics;

import com.cspsmith.core.model.ExternalResource;
import com.cspsmith.core.model.ResourceType;

import java.util.Objects;

/** 휴리스틱으로 추론된 리소스 1건 (생성 후 불변) */
public final class HeuristicResource {
    private final String url;             // 보통 origin, 스킴이 없을 수도 있음 (예: "stripe.com")
    private final InferredType type;
    private final Confidence confidence;
    private final String reason;          // 사람이 읽는 근거
    private final String sourceUrl;       // 추론을 일으킨 리소스
    private final ResourceType sourceType;

    private HeuristicResource(Builder b) {
        this.url = b.url;
        this.type = b.type;
        this.confidence = b.confidence;
        this.reason = b.reason;
        this.sourceUrl = b.sourceUrl;
        this.sourceType = b.sourceType;
    }

    public String getUrl() { return url; }
    public InferredType getType() { return type; }
    public Confidence getConfidence() { return confidence; }
    public String getReason() { return reason; }
    public String getSourceUrl() { return sourceUrl; }
    public ResourceType getSourceType() { return sourceType; }

    /** 카탈로그 병합용 변환. 스킴이 없으면 https:// 를 붙인다 */
    public ExternalResource toExternalResource() {
        String u = url;
        if (!u.startsWith("http://") && !u.startsWith("https://")) {
            u = "https://" + u;
        }
        return ExternalResource.of(type.resourceType(), u);
    }

    @Override
    public String toString() {
        return "[" + confidence.label() + "] " + type.label() + " " + url + " (" + reason + ")";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private InferredType type;
        private Confidence confidence = Confidence.MEDIUM;
        private String reason = "";
        private String sourceUrl = "";
        private ResourceType sourceType;

        public Builder url(String url) { this.url = url; return this; }
        public Builder type(InferredType type) { this.type = type; return this; }
        public Builder confidence(Confidence confidence) { this.confidence = confidence; return this; }
        public Builder reason(String reason) { this.reason = reason; return this; }
        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder sourceType(ResourceType sourceType) { this.sourceType = sourceType; return this; }

        public HeuristicResource build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(confidence, "confidence");
            Objects.requireNonNull(sourceType, "sourceType");
            return new HeuristicResource(this);
        }
    }
}

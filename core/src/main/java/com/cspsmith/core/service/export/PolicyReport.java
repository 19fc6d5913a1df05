package com.cspsmith.core.service.export;

import com.cspsmith.core.heuristics.HeuristicResource;
import com.cspsmith.core.model.ExternalResource;
import com.cspsmith.core.model.ResourceCatalog;
import com.cspsmith.core.model.ResourceType;
import com.cspsmith.core.model.ValidationResult;
import com.cspsmith.core.model.ValidationWarning;
import com.cspsmith.core.service.HashedContent;
import com.cspsmith.core.service.PolicyRun;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 실행 리포트 파일 포맷 (v=1) */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PolicyReport {
    public String v = "1";                     // 스키마 버전
    public Instant generatedAt;
    public String header;                      // 최종 CSP
    public String baseHeader;                  // 시작 CSP
    public boolean strict;
    public Boolean valid;                      // 출력 검증 안했으면 null
    public List<Finding> findings;             // 출력 검증 결과
    public List<HashEntry> hashes;
    public Map<String, List<String>> resources; // 분류 키 → URL 목록
    public List<String> dataUri;               // data: 사용 분류 키
    public List<String> domains;               // 고유 origin (정렬)
    public List<Inference> inferred;
    public Map<String, Integer> summary;       // "font" → n, "confidence_high" → n

    public static final class Finding {
        public String severity;
        public String message;
        public String fix;
    }

    public static final class HashEntry {
        public String hash;
        public String kind;
        public String file;
    }

    public static final class Inference {
        public String url;
        public String type;
        public String confidence;
        public String reason;
        public String sourceUrl;
        public String sourceType;
    }

    /** 실행 결과 → 리포트 */
    public static PolicyReport from(PolicyRun run) {
        PolicyReport r = new PolicyReport();
        r.generatedAt = run.getFinishedAt();
        r.header = run.getHeader();
        r.baseHeader = run.getBaseHeader();
        r.strict = run.isStrict();

        ValidationResult out = run.getOutputValidation();
        if (out != null) {
            r.valid = out.valid();
            r.findings = new ArrayList<>();
            for (ValidationWarning w : out.warnings()) {
                Finding f = new Finding();
                f.severity = w.severity().label();
                f.message = w.message();
                f.fix = w.fix();
                r.findings.add(f);
            }
        }

        r.hashes = new ArrayList<>();
        for (HashedContent h : run.getHashes()) {
            HashEntry e = new HashEntry();
            e.hash = h.hash();
            e.kind = h.kind().key();
            e.file = h.sourceFile();
            r.hashes.add(e);
        }

        ResourceCatalog c = run.getResources();
        r.resources = new LinkedHashMap<>();
        r.dataUri = new ArrayList<>();
        for (ResourceType t : ResourceType.values()) {
            List<String> urls = new ArrayList<>();
            for (ExternalResource res : c.get(t)) urls.add(res.url());
            if (!urls.isEmpty()) r.resources.put(t.key(), urls);
            if (c.usesDataUri(t)) r.dataUri.add(t.key());
        }
        r.domains = c.uniqueDomains();

        r.inferred = new ArrayList<>();
        for (HeuristicResource h : run.getInferred()) {
            Inference i = new Inference();
            i.url = h.getUrl();
            i.type = h.getType().label();
            i.confidence = h.getConfidence().label();
            i.reason = h.getReason();
            i.sourceUrl = h.getSourceUrl();
            i.sourceType = h.getSourceType().key();
            r.inferred.add(i);
        }
        r.summary = run.getHeuristicSummary().asFlatMap();
        return r;
    }
}

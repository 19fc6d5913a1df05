package com.cspsmith.core.service;

import com.cspsmith.core.heuristics.HeuristicResource;
import com.cspsmith.core.heuristics.HeuristicSummary;
import com.cspsmith.core.model.ResourceCatalog;
import com.cspsmith.core.model.ValidationResult;

import java.time.Instant;
import java.util.List;

/** 파이프라인 1회 실행 결과 (최종 헤더 + 중간 산출물) */
public final class PolicyRun {

    /** 파일별 인라인 콘텐츠 건수 */
    public record FileSummary(String source, int scripts, int styleTags, int styleAttributes, int eventHandlers) {
        public boolean isEmpty() { return scripts + styleTags + styleAttributes + eventHandlers == 0; }
    }

    private final String header;
    private final String baseHeader;
    private final boolean strict;
    private final ValidationResult inputValidation;   // nullable (검증 off 또는 strict)
    private final ValidationResult outputValidation;  // nullable (검증 off)
    private final List<FileSummary> files;
    private final List<HashedContent> hashes;         // 계산 순서, 중복 포함
    private final List<String> scriptHashes;          // 고유, 순서 유지
    private final List<String> styleTagHashes;
    private final List<String> styleAttrHashes;
    private final boolean eventHandlers;
    private final ResourceCatalog resources;          // includeExternal 아니면 빈 카탈로그
    private final List<HeuristicResource> inferred;
    private final Instant finishedAt;

    PolicyRun(String header, String baseHeader, boolean strict,
              ValidationResult inputValidation, ValidationResult outputValidation,
              List<FileSummary> files, List<HashedContent> hashes,
              List<String> scriptHashes, List<String> styleTagHashes, List<String> styleAttrHashes,
              boolean eventHandlers, ResourceCatalog resources, List<HeuristicResource> inferred) {
        this.header = header;
        this.baseHeader = baseHeader;
        this.strict = strict;
        this.inputValidation = inputValidation;
        this.outputValidation = outputValidation;
        this.files = List.copyOf(files);
        this.hashes = List.copyOf(hashes);
        this.scriptHashes = List.copyOf(scriptHashes);
        this.styleTagHashes = List.copyOf(styleTagHashes);
        this.styleAttrHashes = List.copyOf(styleAttrHashes);
        this.eventHandlers = eventHandlers;
        this.resources = resources;
        this.inferred = List.copyOf(inferred);
        this.finishedAt = Instant.now();
    }

    public String getHeader() { return header; }
    public String getBaseHeader() { return baseHeader; }
    public boolean isStrict() { return strict; }
    public ValidationResult getInputValidation() { return inputValidation; }
    public ValidationResult getOutputValidation() { return outputValidation; }
    public List<FileSummary> getFiles() { return files; }
    public List<HashedContent> getHashes() { return hashes; }
    public List<String> getScriptHashes() { return scriptHashes; }
    public List<String> getStyleTagHashes() { return styleTagHashes; }
    public List<String> getStyleAttrHashes() { return styleAttrHashes; }
    public boolean hasEventHandlers() { return eventHandlers; }
    public ResourceCatalog getResources() { return resources; }
    public List<HeuristicResource> getInferred() { return inferred; }
    public HeuristicSummary getHeuristicSummary() { return HeuristicSummary.of(inferred); }
    public Instant getFinishedAt() { return finishedAt; }

    /** 종류별 계산 건수 (중복 포함) */
    public long count(HashedContent.Kind kind) {
        return hashes.stream().filter(h -> h.kind() == kind).count();
    }
}

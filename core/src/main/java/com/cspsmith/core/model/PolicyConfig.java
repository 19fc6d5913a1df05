package com.cspsmith.core.model;

import com.cspsmith.core.hash.HashAlgorithm;
import com.cspsmith.core.policy.StrictTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 실행 설정 (csp.yml 매핑 대상 + CLI 플래그 덮어쓰기). 순수 설정 보관용.
 * CSP 를 주지 않으면 strict 템플릿에서 시작한다(안전한 기본값).
 */
public final class PolicyConfig {

    // ---------- 기본 필드 ----------
    private String csp;                          // 기존 헤더 (없으면 strict)
    private boolean generateStrict = false;
    private HashAlgorithm hashAlgorithm = HashAlgorithm.SHA256;
    private boolean requireTrustedTypes = false;

    // ---------- 검증 ----------
    private boolean validate = true;             // 입력/출력 정책 점검
    private boolean validateOnly = false;        // 파일 처리 없이 --csp 만 점검

    // ---------- 수집 ----------
    private ExtractOptions extract = ExtractOptions.all();
    private boolean includeExternal = false;
    private boolean heuristics = false;          // includeExternal 일 때만 의미 있음

    private boolean verbose = false;

    /** YAML `strict:` 섹션 매핑 */
    private StrictTemplate strictTemplate = StrictTemplate.defaults();

    /** 적용 순서 그대로 */
    private final List<CspModification> modifications = new ArrayList<>();

    // ---------- getters ----------
    public String getCsp() { return csp; }
    public boolean isGenerateStrict() { return generateStrict; }
    public HashAlgorithm getHashAlgorithm() { return hashAlgorithm; }
    public boolean isRequireTrustedTypes() { return requireTrustedTypes; }
    public boolean isValidate() { return validate; }
    public boolean isValidateOnly() { return validateOnly; }
    public ExtractOptions getExtract() { return extract; }
    public boolean isIncludeExternal() { return includeExternal; }
    public boolean isHeuristics() { return heuristics; }
    public boolean isVerbose() { return verbose; }
    public StrictTemplate getStrictTemplate() { return strictTemplate; }
    public List<CspModification> getModifications() { return List.copyOf(modifications); }

    /** strict 로 시작하는지: 명시했거나 CSP 가 없을 때 */
    public boolean useStrict() { return generateStrict || !hasCsp(); }

    public boolean hasCsp() { return csp != null && !csp.isBlank(); }

    /** 휴리스틱 실제 적용 여부 */
    public boolean useHeuristics() { return includeExternal && heuristics; }

    /** 설정된 템플릿 사본 + trusted types 플래그 반영 */
    public StrictTemplate effectiveStrictTemplate() {
        return strictTemplate.copy()
                .setRequireTrustedTypes(requireTrustedTypes || strictTemplate.isRequireTrustedTypes());
    }

    // ---------- fluent setters ----------
    public PolicyConfig setCsp(String csp) { this.csp = csp; return this; }
    public PolicyConfig setGenerateStrict(boolean v) { this.generateStrict = v; return this; }
    public PolicyConfig setHashAlgorithm(HashAlgorithm a) { this.hashAlgorithm = a; return this; }
    public PolicyConfig setRequireTrustedTypes(boolean v) { this.requireTrustedTypes = v; return this; }
    public PolicyConfig setValidate(boolean v) { this.validate = v; return this; }
    public PolicyConfig setValidateOnly(boolean v) { this.validateOnly = v; return this; }
    public PolicyConfig setExtract(ExtractOptions e) { this.extract = (e != null ? e : ExtractOptions.all()); return this; }
    public PolicyConfig setIncludeExternal(boolean v) { this.includeExternal = v; return this; }
    public PolicyConfig setHeuristics(boolean v) { this.heuristics = v; return this; }
    public PolicyConfig setVerbose(boolean v) { this.verbose = v; return this; }
    public PolicyConfig setStrictTemplate(StrictTemplate t) { this.strictTemplate = t; return this; }

    public PolicyConfig addModification(CspModification m) {
        modifications.add(Objects.requireNonNull(m, "modification"));
        return this;
    }

    public PolicyConfig clearModifications() { modifications.clear(); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(hashAlgorithm, "hashAlgorithm");
        Objects.requireNonNull(extract, "extract");
        Objects.requireNonNull(strictTemplate, "strictTemplate");
        if (validateOnly && !hasCsp()) {
            throw new IllegalArgumentException("csp is required for validateOnly");
        }
    }

    // ---------- helpers ----------
    public static PolicyConfig defaults() { return new PolicyConfig(); }
}

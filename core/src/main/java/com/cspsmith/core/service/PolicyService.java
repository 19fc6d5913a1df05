package com.cspsmith.core.service;

import com.cspsmith.core.api.IDocumentExtractor;
import com.cspsmith.core.api.IHasher;
import com.cspsmith.core.extract.JsoupDocumentExtractor;
import com.cspsmith.core.hash.CspHasher;
import com.cspsmith.core.heuristics.HeuristicEngine;
import com.cspsmith.core.heuristics.HeuristicResource;
import com.cspsmith.core.model.DocumentContent;
import com.cspsmith.core.model.ExternalResource;
import com.cspsmith.core.model.ExtractOptions;
import com.cspsmith.core.model.InlineContent;
import com.cspsmith.core.model.PolicyConfig;
import com.cspsmith.core.model.ResourceCatalog;
import com.cspsmith.core.model.ResourceType;
import com.cspsmith.core.model.ValidationResult;
import com.cspsmith.core.policy.PolicyMerger;
import com.cspsmith.core.policy.PolicyValidator;
import com.cspsmith.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * 정책 생성 오케스트레이터:
 *  - extract → hash → (heuristics) → merge → modify → validate
 *  - 기본 구현체(JsoupDocumentExtractor/CspHasher/HeuristicEngine)
 *  - DI 생성자는 테스트 주입용
 * 여러 문서의 결과는 단순 연결 후 마지막 병합 단계에서 중복 제거한다.
 */
public final class PolicyService {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyService.class);

    private final PolicyConfig config;
    private final IDocumentExtractor extractor;
    private final IHasher hasher;
    private final HeuristicEngine heuristics;

    /** 기본 구현 */
    public PolicyService(PolicyConfig config) {
        this(config,
                new JsoupDocumentExtractor(Objects.requireNonNull(config, "config").getExtract()),
                new CspHasher(config.getHashAlgorithm()),
                new HeuristicEngine());
    }

    /** DI/테스트용 */
    public PolicyService(PolicyConfig config, IDocumentExtractor extractor, IHasher hasher, HeuristicEngine heuristics) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.heuristics = Objects.requireNonNull(heuristics, "heuristics");
    }

    public PolicyConfig config() { return config; }

    /** --validate-only: 파일 처리 없이 주어진 CSP 만 점검 */
    public ValidationResult validateOnly() {
        return PolicyValidator.validate(config.getCsp());
    }

    /* =========================
       실행 API
       ========================= */

    public PolicyRun run(List<Path> files) throws IOException {
        return run(files, ProgressListener.NONE);
    }

    /** 파일을 읽어 처리. 하나라도 읽기/파싱 실패하면 IOException 으로 중단 */
    public PolicyRun run(List<Path> files, ProgressListener listener) throws IOException {
        Objects.requireNonNull(files, "files");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        List<DocumentContent> docs = new ArrayList<>(files.size());
        int i = 0;
        for (Path f : files) {
            pl.onProgress("extract", ++i, files.size(), f.toString());
            try {
                docs.add(extractor.extract(f));
            } catch (IOException e) {
                LOG.warn("Extraction failed: file={}, err={}", f, e.toString());
                throw new IOException("Error parsing " + f + ": " + e.getMessage(), e);
            }
        }
        return process(docs, pl);
    }

    /** 이미 추출된 문서들로 처리 (메모리 입력/테스트용) */
    public PolicyRun process(List<DocumentContent> docs, ProgressListener listener) {
        Objects.requireNonNull(docs, "docs");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final boolean strict = config.useStrict();

        // ---- 1) 시작 정책 ----
        String base = strict
                ? PolicyMerger.generateStrict(config.effectiveStrictTemplate())
                : config.getCsp().trim();
        LOG.info("Policy run start: files={}, strict={}, hashAlgo={}, external={}, heuristics={}",
                docs.size(), strict, config.getHashAlgorithm().token(),
                config.isIncludeExternal(), config.useHeuristics());

        // ---- 2) 입력 정책 검증 (주어진 CSP 일 때만) ----
        ValidationResult inputValidation = null;
        if (!strict && config.isValidate()) {
            inputValidation = PolicyValidator.validate(base);
            if (!inputValidation.valid()) {
                LOG.warn("Input CSP validation failed, continuing anyway");
            } else if (inputValidation.hasWarnings()) {
                LOG.info("Input CSP has {} warning(s)", inputValidation.warnings().size());
            }
        }

        // ---- 3) 문서별 해시 + 리소스 수집 ----
        ExtractOptions opt = config.getExtract();
        List<HashedContent> hashes = new ArrayList<>();
        List<PolicyRun.FileSummary> summaries = new ArrayList<>();
        ResourceCatalog catalog = new ResourceCatalog();
        boolean eventHandlers = false;

        for (DocumentContent doc : docs) {
            InlineContent in = doc.inline();
            String src = doc.source();

            if (opt.isScripts()) hashAll(in.scripts(), HashedContent.Kind.SCRIPT, src, hashes);
            if (opt.isEventHandlers()) {
                hashAll(in.eventHandlers(), HashedContent.Kind.EVENT_HANDLER, src, hashes);
                eventHandlers |= in.hasEventHandlers();
            }
            if (opt.isStyles()) hashAll(in.styleTags(), HashedContent.Kind.STYLE_TAG, src, hashes);
            if (opt.isInlineStyles()) hashAll(in.styleAttributes(), HashedContent.Kind.STYLE_ATTR, src, hashes);

            summaries.add(new PolicyRun.FileSummary(src,
                    opt.isScripts() ? in.scripts().size() : 0,
                    opt.isStyles() ? in.styleTags().size() : 0,
                    opt.isInlineStyles() ? in.styleAttributes().size() : 0,
                    opt.isEventHandlers() ? in.eventHandlers().size() : 0));

            if (config.isIncludeExternal()) catalog.mergeFrom(doc.resources());
        }

        // ---- 4) 휴리스틱 (other 분류는 입력에서 제외) ----
        List<HeuristicResource> inferred = List.of();
        if (config.useHeuristics()) {
            pl.onProgress("heuristics", -1, -1, "");
            List<ExternalResource> input = new ArrayList<>();
            for (ResourceType t : List.of(ResourceType.SCRIPT, ResourceType.STYLESHEET,
                    ResourceType.IMAGE, ResourceType.FONT, ResourceType.FRAME)) {
                input.addAll(catalog.get(t));
            }
            inferred = heuristics.apply(input);
            HeuristicEngine.mergeInto(catalog, inferred);
            LOG.info("Heuristics inferred {} resource(s)", inferred.size());
        }

        // ---- 5) 해시 중복 제거 (순서 유지) ----
        List<String> scriptHashes = unique(hashes, HashedContent.Kind.SCRIPT, HashedContent.Kind.EVENT_HANDLER);
        List<String> styleTagHashes = unique(hashes, HashedContent.Kind.STYLE_TAG);
        List<String> styleAttrHashes = unique(hashes, HashedContent.Kind.STYLE_ATTR);

        // ---- 6~8) 병합 ----
        pl.onProgress("merge", -1, -1, "");
        String header = strict
                ? PolicyMerger.mergeStrictWithHashes(base, scriptHashes, styleTagHashes, styleAttrHashes, eventHandlers)
                : PolicyMerger.updateCsp(base, scriptHashes, styleTagHashes, styleAttrHashes, eventHandlers);

        if (config.isIncludeExternal()) {
            header = PolicyMerger.addExternalResources(header, catalog);
        }
        if (!config.getModifications().isEmpty()) {
            header = PolicyMerger.applyModifications(header, config.getModifications());
        }

        // ---- 9) 출력 정책 검증 ----
        ValidationResult outputValidation = null;
        if (config.isValidate()) {
            pl.onProgress("validate", -1, -1, "");
            outputValidation = PolicyValidator.validate(header);
            if (outputValidation.hasWarnings()) {
                LOG.info("Output CSP has {} warning(s)", outputValidation.warnings().size());
            }
        }

        LOG.info("Policy run done: scriptHashes={}, styleTagHashes={}, styleAttrHashes={}, domains={}",
                scriptHashes.size(), styleTagHashes.size(), styleAttrHashes.size(), catalog.uniqueDomains().size());

        return new PolicyRun(header, base, strict, inputValidation, outputValidation,
                summaries, hashes, scriptHashes, styleTagHashes, styleAttrHashes,
                eventHandlers, catalog, inferred);
    }

    // ---------- helpers ----------
    private void hashAll(List<String> contents, HashedContent.Kind kind, String src, List<HashedContent> into) {
        for (String c : contents) {
            into.add(new HashedContent(hasher.hash(c), kind, src, c));
        }
    }

    private static List<String> unique(List<HashedContent> hashes, HashedContent.Kind... kinds) {
        List<HashedContent.Kind> wanted = List.of(kinds);
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (HashedContent h : hashes) {
            if (wanted.contains(h.kind())) out.add(h.hash());
        }
        return new ArrayList<>(out);
    }
}

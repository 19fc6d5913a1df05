package com.cspsmith.cli;

import com.cspsmith.core.heuristics.Confidence;
import com.cspsmith.core.heuristics.HeuristicResource;
import com.cspsmith.core.heuristics.HeuristicSummary;
import com.cspsmith.core.model.ExternalResource;
import com.cspsmith.core.model.ResourceCatalog;
import com.cspsmith.core.model.ResourceType;
import com.cspsmith.core.model.ValidationResult;
import com.cspsmith.core.model.ValidationWarning;
import com.cspsmith.core.service.HashedContent;
import com.cspsmith.core.service.PolicyRun;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 콘솔 출력 담당 (진단/상세 정보는 stderr, 헤더는 호출 측이 stdout 으로).
 * 출력 순서: 파일별 진행 → 해시 상세 → 외부 리소스 → 추론 리소스 → 요약
 */
public final class VerbosePrinter {

    private static final String DASH_RULE = "-".repeat(80);
    private static final String EQUALS_RULE = "=".repeat(80);
    private static final int SNIPPET_LEN = 60;

    private final PrintStream err;

    public VerbosePrinter(PrintStream err) {
        this.err = Objects.requireNonNull(err, "err");
    }

    /** verbose 전체 출력 */
    public void printDetails(PolicyRun run) {
        printFiles(run.getFiles());
        printHashDetails(run.getHashes());
        printExternalResources(run.getResources());
        printInferred(run.getInferred(), run.getHeuristicSummary());
        printSummary(run);
    }

    // ---------- 파일별 ----------
    public void printFiles(List<PolicyRun.FileSummary> files) {
        int n = files.size();
        for (int i = 0; i < n; i++) {
            PolicyRun.FileSummary f = files.get(i);
            err.printf(Locale.ROOT, "[%d/%d] Processing %s%n", i + 1, n, f.source());
            err.println("  Found: " + describe(f));
        }
    }

    static String describe(PolicyRun.FileSummary f) {
        List<String> items = new ArrayList<>();
        if (f.scripts() > 0) items.add(f.scripts() + " inline script(s)");
        if (f.styleTags() > 0) items.add(f.styleTags() + " <style> tag(s)");
        if (f.styleAttributes() > 0) items.add(f.styleAttributes() + " style attribute(s)");
        if (f.eventHandlers() > 0) items.add(f.eventHandlers() + " event handler(s)");
        return items.isEmpty() ? "no inline content" : String.join(", ", items);
    }

    // ---------- 해시 ----------
    public void printHashDetails(List<HashedContent> hashes) {
        if (hashes.isEmpty()) return;

        err.println();
        err.println("Hash Details:");
        err.println(DASH_RULE);
        for (HashedContent.Kind kind : HashedContent.Kind.values()) {
            List<HashedContent> group = new ArrayList<>();
            for (HashedContent h : hashes) if (h.kind() == kind) group.add(h);
            if (group.isEmpty()) continue;

            err.println();
            err.println(kind.title() + ":");
            int i = 0;
            for (HashedContent h : group) {
                err.printf(Locale.ROOT, "  [%d] %s%n", ++i, h.hash());
                err.println("      File: " + h.sourceFile());
                err.println("      Content: " + h.snippet(SNIPPET_LEN));
            }
        }
        err.println(DASH_RULE);
    }

    // ---------- 외부 리소스 ----------
    public void printExternalResources(ResourceCatalog catalog) {
        if (catalog == null || catalog.isEmpty()) return;

        err.println();
        err.println("External Resources:");
        err.println(DASH_RULE);
        for (ResourceType t : ResourceType.values()) {
            List<ExternalResource> list = catalog.get(t);
            if (list.isEmpty()) continue;

            err.println();
            err.println(sectionTitle(t) + ":");
            int i = 0;
            for (ExternalResource r : list) {
                err.printf(Locale.ROOT, "  [%d] %s%n", ++i, r.url());
                if (!r.domain().isEmpty()) err.println("      Domain: " + r.domain());
            }
        }

        List<String> domains = catalog.uniqueDomains();
        if (!domains.isEmpty()) {
            err.println();
            err.printf(Locale.ROOT, "Unique Domains (%d):%n", domains.size());
            for (String d : domains) err.println("  - " + d);
        }
        err.println(DASH_RULE);
    }

    static String sectionTitle(ResourceType t) {
        return switch (t) {
            case SCRIPT -> "External Scripts";
            case STYLESHEET -> "External Stylesheets";
            case IMAGE -> "External Images";
            case FONT -> "External Fonts";
            case FRAME -> "External Frames";
            case OTHER -> "Other External Resources";
        };
    }

    // ---------- 추론 ----------
    public void printInferred(List<HeuristicResource> inferred, HeuristicSummary summary) {
        if (inferred.isEmpty()) return;

        err.println();
        err.println("Inferred Resources (from heuristics):");
        err.println(EQUALS_RULE);
        for (HeuristicResource h : inferred) {
            err.printf(Locale.ROOT, "  [%s] %s%n", h.getConfidence().name(), h.getUrl());
            err.println("      Type: " + h.getType().label());
            err.println("      Reason: " + h.getReason());
            err.printf(Locale.ROOT, "      Source: %s (%s)%n", h.getSourceUrl(), h.getSourceType().key());
            err.println();
        }

        err.printf(Locale.ROOT, "Total inferred: %d resources%n", summary.total());
        summary.byType().forEach((type, count) -> err.printf(Locale.ROOT, "  - %s: %d%n", type.label(), count));
        err.printf(Locale.ROOT, "Confidence levels: High=%d, Medium=%d, Low=%d%n%n",
                summary.count(Confidence.HIGH), summary.count(Confidence.MEDIUM), summary.count(Confidence.LOW));
    }

    // ---------- 요약 ----------
    public void printSummary(PolicyRun run) {
        long scripts = run.count(HashedContent.Kind.SCRIPT) + run.count(HashedContent.Kind.EVENT_HANDLER);
        err.println();
        err.println("Summary:");
        err.printf(Locale.ROOT, "  Total inline scripts: %d (unique: %d)%n", scripts, run.getScriptHashes().size());
        err.printf(Locale.ROOT, "  Total <style> tags: %d (unique: %d)%n",
                run.count(HashedContent.Kind.STYLE_TAG), run.getStyleTagHashes().size());
        err.printf(Locale.ROOT, "  Total style attributes: %d (unique: %d)%n",
                run.count(HashedContent.Kind.STYLE_ATTR), run.getStyleAttrHashes().size());
        err.println();
    }

    // ---------- 검증 ----------
    /** 입력 정책 점검 결과: 실패면 상세, 경고만 있으면 건수 한 줄 */
    public void printInputValidation(ValidationResult result) {
        if (result == null) return;
        if (!result.valid()) {
            err.println("Input CSP validation failed:");
            printValidation(result, false, err);
            err.println();
            err.println("Continuing anyway...");
        } else if (result.hasWarnings()) {
            err.printf(Locale.ROOT, "Input CSP has %d warning(s). Use --validate-only for details.%n%n",
                    result.warnings().size());
        }
    }

    public void printOutputValidation(ValidationResult result) {
        if (result == null || !result.hasWarnings()) return;
        err.printf(Locale.ROOT, "Output CSP has %d warning(s). Use --validate-only to check.%n%n",
                result.warnings().size());
    }

    /** 검증 결과 전체. verbose 면 권장 수정안까지 */
    public static void printValidation(ValidationResult result, boolean verbose, PrintStream to) {
        if (result.valid() && !result.hasWarnings()) {
            to.println("✓ CSP validation passed with no warnings");
            return;
        }
        if (!result.valid()) {
            to.println("✗ CSP validation failed");
        } else {
            to.printf(Locale.ROOT, "⚠ CSP validation passed with %d warning(s)%n", result.warnings().size());
        }
        to.println();

        List<ValidationWarning> ws = result.warnings();
        for (int i = 0; i < ws.size(); i++) {
            ValidationWarning w = ws.get(i);
            to.println((w.isError() ? "✗ " : "⚠ ") + w.message());
            if (verbose && !w.fix().isEmpty()) to.println("  Fix: " + w.fix());
            if (i < ws.size() - 1) to.println();
        }
    }
}

package com.cspsmith.cli;

import com.cspsmith.core.hash.HashAlgorithm;
import com.cspsmith.core.model.CspModification;
import com.cspsmith.core.model.ExtractOptions;
import com.cspsmith.core.model.PolicyConfig;
import com.cspsmith.core.policy.StrictTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * 명령행 인자 파싱 결과.
 * - "--flag value", "--flag=value", 단일 대시("-csp") 모두 허용
 * - 불리언 플래그는 값 생략 시 true ("--verbose=false" 가능)
 * - "--" 이후는 모두 파일
 * 플래그는 지정된 것만 설정 파일 값을 덮어쓴다 (null = 미지정).
 */
public final class CliArgs {

    /** 잘못된 사용법 (알 수 없는 플래그, 값 누락 등) */
    public static final class UsageException extends IllegalArgumentException {
        public UsageException(String message) { super(message); }
    }

    private static final Set<String> VALUE_FLAGS = Set.of("csp", "hash-algo", "config", "report");

    /** 불리언 플래그 → setter */
    private static final Map<String, BiConsumer<CliArgs, Boolean>> BOOLEAN_FLAGS = new LinkedHashMap<>();
    static {
        BOOLEAN_FLAGS.put("validate-only", (a, v) -> a.validateOnly = v);
        BOOLEAN_FLAGS.put("no-validate", (a, v) -> a.validate = !v);
        BOOLEAN_FLAGS.put("no-scripts", (a, v) -> a.scripts = !v);
        BOOLEAN_FLAGS.put("no-styles", (a, v) -> a.styles = !v);
        BOOLEAN_FLAGS.put("no-inline-styles", (a, v) -> a.inlineStyles = !v);
        BOOLEAN_FLAGS.put("no-event-handlers", (a, v) -> a.eventHandlers = !v);
        BOOLEAN_FLAGS.put("include-external", (a, v) -> a.includeExternal = v);
        BOOLEAN_FLAGS.put("heuristics", (a, v) -> a.heuristics = v);
        BOOLEAN_FLAGS.put("generate-strict", (a, v) -> a.generateStrict = v);
        BOOLEAN_FLAGS.put("require-trusted-types", (a, v) -> a.requireTrustedTypes = v);
        BOOLEAN_FLAGS.put("verbose", (a, v) -> a.verbose = v);
        BOOLEAN_FLAGS.put("v", (a, v) -> a.verbose = v);
    }

    // ---------- 값 플래그 ----------
    private String csp;
    private String hashAlgo;
    private String configPath;
    private String reportPath;

    // ---------- 불리언 덮어쓰기 (null = 미지정) ----------
    private Boolean validateOnly;
    private Boolean validate;
    private Boolean scripts;
    private Boolean styles;
    private Boolean inlineStyles;
    private Boolean eventHandlers;
    private Boolean includeExternal;
    private Boolean heuristics;
    private Boolean generateStrict;
    private Boolean requireTrustedTypes;
    private Boolean verbose;

    private boolean help;
    private final List<CspModification> modifications = new ArrayList<>();
    private final List<String> files = new ArrayList<>();

    private CliArgs() {}

    public static CliArgs parse(String... args) {
        CliArgs out = new CliArgs();
        if (args == null) return out;

        boolean onlyFiles = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (onlyFiles || !arg.startsWith("-") || arg.equals("-")) {
                out.files.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                onlyFiles = true;
                continue;
            }

            String body = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
            String name = body;
            String inline = null;
            int eq = body.indexOf('=');
            if (eq >= 0) {
                name = body.substring(0, eq);
                inline = body.substring(eq + 1);
            }

            if (name.equals("h") || name.equals("help")) {
                out.help = true;
                continue;
            }

            BiConsumer<CliArgs, Boolean> bool = BOOLEAN_FLAGS.get(name);
            if (bool != null) {
                bool.accept(out, inline == null || parseBool(name, inline));
                continue;
            }

            CspModification.Action action = modificationAction(name);
            if (!VALUE_FLAGS.contains(name) && action == null) {
                throw new UsageException("unknown flag: " + arg);
            }

            String value = inline;
            if (value == null) {
                if (i + 1 >= args.length) throw new UsageException("flag needs an argument: --" + name);
                value = args[++i];
            }

            switch (name) {
                case "csp" -> out.csp = value;
                case "hash-algo" -> out.hashAlgo = value;
                case "config" -> out.configPath = value;
                case "report" -> out.reportPath = value;
                default -> out.modifications.add(new CspModification(action, directiveOf(name), value.trim()));
            }
        }
        return out;
    }

    /**
     * 설정에 지정된 플래그만 덮어쓰기. 수정 목록은 설정 파일의 것 뒤에 붙는다.
     * @throws IllegalArgumentException 해시 알고리즘 이름이 잘못된 경우
     */
    public PolicyConfig applyTo(PolicyConfig cfg) {
        if (csp != null) cfg.setCsp(csp);
        if (hashAlgo != null) cfg.setHashAlgorithm(HashAlgorithm.fromName(hashAlgo));
        if (validateOnly != null) cfg.setValidateOnly(validateOnly);
        if (validate != null) cfg.setValidate(validate);
        if (includeExternal != null) cfg.setIncludeExternal(includeExternal);
        if (heuristics != null) cfg.setHeuristics(heuristics);
        if (generateStrict != null) cfg.setGenerateStrict(generateStrict);
        if (requireTrustedTypes != null) cfg.setRequireTrustedTypes(requireTrustedTypes);
        if (verbose != null) cfg.setVerbose(verbose);

        ExtractOptions e = cfg.getExtract();
        if (scripts != null) e.setScripts(scripts);
        if (styles != null) e.setStyles(styles);
        if (inlineStyles != null) e.setInlineStyles(inlineStyles);
        if (eventHandlers != null) e.setEventHandlers(eventHandlers);

        modifications.forEach(cfg::addModification);
        return cfg;
    }

    // ---------- getters ----------
    public boolean isHelp() { return help; }
    public boolean isVerbose() { return Boolean.TRUE.equals(verbose); }
    public String getCsp() { return csp; }
    public String getHashAlgo() { return hashAlgo; }
    public String getConfigPath() { return configPath; }
    public String getReportPath() { return reportPath; }
    public List<CspModification> getModifications() { return List.copyOf(modifications); }
    public List<String> getFiles() { return List.copyOf(files); }

    public static String usage() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("Usage: csp [options] file1.html [file2.html ...]\n\n");
        sb.append("Generate CSP hashes for inline content in HTML files.\n");
        sb.append("If no CSP is provided, a strict CSP will be generated by default.\n\n");
        sb.append("Options:\n");
        opt(sb, "--csp VALUE", "Existing CSP header to update with hashes (optional, defaults to --generate-strict)");
        opt(sb, "--hash-algo NAME", "Hash algorithm to use: sha256, sha384, or sha512 (default sha256)");
        opt(sb, "--validate-only", "Only validate the CSP without processing HTML files");
        opt(sb, "--no-validate", "Skip CSP validation checks");
        opt(sb, "--no-scripts", "Skip processing inline <script> elements");
        opt(sb, "--no-styles", "Skip processing inline <style> tags");
        opt(sb, "--no-inline-styles", "Skip processing inline style attributes");
        opt(sb, "--no-event-handlers", "Skip processing inline event handlers (onclick, etc.)");
        opt(sb, "--include-external", "Scan for external resources and add domains to CSP directives");
        opt(sb, "--heuristics", "Use heuristics to infer additional external resources (requires --include-external)");
        opt(sb, "--generate-strict", "Generate a complete strict CSP from scratch");
        opt(sb, "--require-trusted-types", "Add require-trusted-types-for 'script' directive");
        opt(sb, "-v, --verbose", "Show detailed information about hash generation");
        opt(sb, "--config FILE", "Load settings from a csp.yml file (flags override it)");
        opt(sb, "--report FILE", "Write a JSON report of the run");
        for (String d : StrictTemplate.DIRECTIVES) {
            opt(sb, "--add-" + d + " VALUE", "Add value to " + d + " (repeatable, applied in order)");
            opt(sb, "--remove-" + d + " VALUE", "Remove value from " + d + " (repeatable, applied in order)");
        }
        sb.append("\nExamples:\n");
        sb.append("  csp index.html\n");
        sb.append("  csp --csp \"default-src 'self'\" index.html\n");
        sb.append("  csp --csp \"default-src 'self'\" --no-scripts *.html\n");
        sb.append("  csp --csp \"default-src 'self'\" --hash-algo sha384 index.html\n");
        sb.append("  csp --csp \"default-src 'self'\" --validate-only\n");
        sb.append("  csp --csp \"default-src 'self'\" --no-event-handlers index.html about.html\n");
        sb.append("  csp --generate-strict index.html\n");
        sb.append("  csp --csp \"default-src 'self'\" --include-external index.html\n");
        sb.append("  csp --include-external --heuristics index.html\n");
        sb.append("  csp --csp \"default-src 'self'\" -v index.html\n");
        return sb.toString();
    }

    // ---------- helpers ----------
    private static void opt(StringBuilder sb, String flag, String desc) {
        sb.append(String.format(Locale.ROOT, "  %-34s %s\n", flag, desc));
    }

    private static boolean parseBool(String name, String v) {
        switch (v.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "t" -> { return true; }
            case "false", "0", "f" -> { return false; }
            default -> throw new UsageException("invalid boolean value \"" + v + "\" for flag --" + name);
        }
    }

    /** "add-script-src" → ADD, 템플릿 디렉티브가 아니면 null */
    private static CspModification.Action modificationAction(String name) {
        CspModification.Action action;
        if (name.startsWith("add-")) action = CspModification.Action.ADD;
        else if (name.startsWith("remove-")) action = CspModification.Action.REMOVE;
        else return null;
        return StrictTemplate.isTemplateDirective(directiveOf(name)) ? action : null;
    }

    private static String directiveOf(String name) {
        return name.substring(name.indexOf('-') + 1);
    }
}

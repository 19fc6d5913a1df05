package com.cspsmith.core.policy;

import com.cspsmith.core.model.ValidationResult;
import com.cspsmith.core.model.ValidationWarning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 읽기 전용 CSP 점검. 빈 헤더만 valid=false, 나머지는 권고 경고 누적.
 * 각 검사는 독립적이며 앞선 결과와 무관하게 모두 실행된다.
 */
public final class PolicyValidator {
    private PolicyValidator() {}

    private static final List<String> HASH_PREFIXES = List.of("'sha256-", "'sha384-", "'sha512-");

    /** 와일드카드 검사 대상 */
    private static final List<String> WILDCARD_CHECKED = List.of(
            "default-src", "script-src", "style-src", "img-src", "connect-src");

    /** 폐기된 디렉티브 → 대안 */
    private static final Map<String, String> DEPRECATED = new LinkedHashMap<>();
    static {
        DEPRECATED.put("block-all-mixed-content", "Use 'upgrade-insecure-requests' instead, or handle via HTTPS");
        DEPRECATED.put("plugin-types", "Deprecated - plugins are no longer supported in modern browsers");
        DEPRECATED.put("referrer", "Use the Referrer-Policy header instead");
    }

    public static ValidationResult validate(String header) {
        if (header == null || header.isBlank()) {
            return new ValidationResult(false, List.of(ValidationWarning.error(
                    "CSP header is empty",
                    "Provide a valid CSP header string")));
        }

        DirectiveMap dm = DirectiveMap.parse(header);
        List<ValidationWarning> out = new ArrayList<>();

        checkUnsafeInlineWithHashes(dm, out);
        checkUnsafeEval(dm, out);
        checkMissingDefaultSrc(dm, out);
        checkOverlyPermissive(dm, out);
        checkDeprecated(dm, out);
        checkOrphanedAttrDirectives(dm, out);

        return new ValidationResult(true, out);
    }

    /* ----------------- 검사 ----------------- */

    // 'unsafe-inline' 이 있으면 브라우저가 해시를 무시한다
    private static void checkUnsafeInlineWithHashes(DirectiveMap dm, List<ValidationWarning> out) {
        for (String d : List.of("script-src", "style-src")) {
            String v = dm.get(d);
            if (v == null) continue;
            if (v.contains("'unsafe-inline'") && containsHash(v)) {
                out.add(ValidationWarning.warning(
                        d + " contains both 'unsafe-inline' and hash values",
                        "Remove 'unsafe-inline' from " + d + " - hashes are ignored when 'unsafe-inline' is present"));
            }
        }
    }

    private static void checkUnsafeEval(DirectiveMap dm, List<ValidationWarning> out) {
        String v = dm.get("script-src");
        if (v != null && v.contains("'unsafe-eval'")) {
            out.add(ValidationWarning.warning(
                    "script-src contains 'unsafe-eval' which allows dangerous eval() usage",
                    "Remove 'unsafe-eval' if possible and refactor code to avoid eval(), Function(), setTimeout(string), etc."));
        }
    }

    private static void checkMissingDefaultSrc(DirectiveMap dm, List<ValidationWarning> out) {
        if (!dm.has("default-src")) {
            out.add(ValidationWarning.warning(
                    "Missing 'default-src' directive",
                    "Add 'default-src' as a fallback for other directives (recommended: 'default-src 'self'')"));
        }
    }

    // "https://*" 만 예외. http://* 등 다른 스킴 와일드카드는 경고 대상
    private static void checkOverlyPermissive(DirectiveMap dm, List<ValidationWarning> out) {
        for (String d : WILDCARD_CHECKED) {
            String v = dm.get(d);
            if (v == null) continue;

            if (v.contains("*") && !v.contains("https://*")) {
                out.add(ValidationWarning.warning(
                        d + " contains wildcard '*' which allows resources from any origin",
                        "Restrict " + d + " to specific domains or use 'self'"));
            }
            if (d.equals("script-src") && v.contains("data:")) {
                out.add(ValidationWarning.warning(
                        "script-src allows 'data:' URIs which can be exploited",
                        "Remove 'data:' from script-src if not absolutely necessary"));
            }
        }
    }

    private static void checkDeprecated(DirectiveMap dm, List<ValidationWarning> out) {
        for (Map.Entry<String, String> e : DEPRECATED.entrySet()) {
            if (dm.has(e.getKey())) {
                out.add(ValidationWarning.warning("'" + e.getKey() + "' is deprecated", e.getValue()));
            }
        }
    }

    private static void checkOrphanedAttrDirectives(DirectiveMap dm, List<ValidationWarning> out) {
        for (String base : List.of("style-src", "script-src")) {
            String attr = base + "-attr";
            if (dm.has(attr) && !dm.has(base)) {
                out.add(ValidationWarning.warning(
                        "'" + attr + "' is defined but '" + base + "' is not",
                        "Consider adding '" + base + "' as it acts as fallback for '" + attr + "'"));
            }
        }
    }

    private static boolean containsHash(String value) {
        for (String p : HASH_PREFIXES) {
            if (value.contains(p)) return true;
        }
        return false;
    }
}

package com.cspsmith.core.util;

import com.cspsmith.core.hash.HashAlgorithm;
import com.cspsmith.core.model.CspModification;
import com.cspsmith.core.model.PolicyConfig;
import com.cspsmith.core.policy.StrictTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * csp.yml 을 읽어 PolicyConfig 로 변환.
 *
 * 예상 YAML 키:
 * csp: "default-src 'self'"
 * generateStrict: false
 * hashAlgo: sha256 | sha384 | sha512
 * requireTrustedTypes: false
 * validate: true
 * include:
 *   scripts: true
 *   styles: true
 *   inlineStyles: true
 *   eventHandlers: true
 * external:
 *   enabled: true
 *   heuristics: true
 *
 * # strict 템플릿 덮어쓰기(옵션)
 * strict:
 *   script-src: ["'self'"]
 *   upgrade-insecure-requests: true
 *
 * # 순서대로 적용
 * modifications:
 *   - { action: add, directive: script-src, value: "https://cdn.example.com" }
 */
public final class YamlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(YamlConfigLoader.class);

    private YamlConfigLoader() {}

    public static PolicyConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("csp.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            LoaderOptions opts = new LoaderOptions();
            Yaml yaml = new Yaml(new SafeConstructor(opts));
            Object root = yaml.load(in);

            PolicyConfig cfg = PolicyConfig.defaults();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                cfg.validate();
                return cfg;
            }

            // 1) 평면 키
            setString(map, "csp", cfg::setCsp);
            setBoolean(map, "generateStrict", cfg::setGenerateStrict);
            setHashAlgorithm(map, "hashAlgo", cfg::setHashAlgorithm);
            setBoolean(map, "requireTrustedTypes", cfg::setRequireTrustedTypes);
            setBoolean(map, "validate", cfg::setValidate);
            setBoolean(map, "verbose", cfg::setVerbose);

            // 2) include.*
            Map<String, Object> include = getMap(map, "include");
            if (include != null) {
                var e = cfg.getExtract();
                setBoolean(include, "scripts", e::setScripts);
                setBoolean(include, "styles", e::setStyles);
                setBoolean(include, "inlineStyles", e::setInlineStyles);
                setBoolean(include, "eventHandlers", e::setEventHandlers);
            }

            // 3) external.*
            Map<String, Object> external = getMap(map, "external");
            if (external != null) {
                setBoolean(external, "enabled", cfg::setIncludeExternal);
                setBoolean(external, "heuristics", cfg::setHeuristics);
            }

            // 4) strict.* (템플릿 디렉티브별 덮어쓰기)
            Map<String, Object> strict = getMap(map, "strict");
            if (strict != null) {
                applyStrict(strict, cfg.getStrictTemplate());
            }

            // 5) modifications[]
            Object mods = map.get("modifications");
            if (mods != null) {
                for (CspModification m : parseModifications(mods)) cfg.addModification(m);
            }

            // 기본값/필수값 확인
            cfg.validate();
            return cfg;
        }
    }

    // ------------ sections ------------
    private static void applyStrict(Map<String, Object> strict, StrictTemplate t) {
        for (Map.Entry<String, Object> e : strict.entrySet()) {
            String key = e.getKey();
            switch (key) {
                case "upgrade-insecure-requests" -> setBoolean(strict, key, t::setUpgradeInsecureRequests);
                case "require-trusted-types-for" -> setBoolean(strict, key, t::setRequireTrustedTypes);
                default -> {
                    if (StrictTemplate.isTemplateDirective(key)) {
                        t.set(key, toStringList(e.getValue()));
                    } else {
                        LOG.warn("Ignoring unknown strict template key: {}", key);
                    }
                }
            }
        }
    }

    private static List<CspModification> parseModifications(Object v) {
        if (!(v instanceof List<?> list)) {
            throw new IllegalArgumentException("modifications must be a list");
        }
        List<CspModification> out = new ArrayList<>();
        int i = 0;
        for (Object o : list) {
            if (!(o instanceof Map<?, ?> m)) {
                throw new IllegalArgumentException("modifications[" + i + "] must be a mapping");
            }
            Object action = m.get("action");
            Object directive = m.get("directive");
            Object value = m.get("value");
            if (action == null || directive == null || value == null) {
                throw new IllegalArgumentException("modifications[" + i + "] requires action, directive and value");
            }
            out.add(new CspModification(CspModification.Action.parse(String.valueOf(action)),
                    String.valueOf(directive).trim(), String.valueOf(value).trim()));
            i++;
        }
        return out;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setHashAlgorithm(Map<?, ?> map, String key, Consumer<HashAlgorithm> setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(HashAlgorithm.fromName(String.valueOf(v)));
        } catch (IllegalArgumentException e) {
            // 사용자 오타 시 기본값 유지
            LOG.warn("Unknown {} '{}', keeping default", key, v);
        }
    }

    /** 리스트 또는 "a b c" 문자열 */
    private static List<String> toStringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else if (v != null) {
            for (String p : String.valueOf(v).trim().split("\\s+")) if (!p.isEmpty()) out.add(p);
        }
        return out;
    }
}

package com.cspsmith.cli;

import com.cspsmith.core.hash.HashAlgorithm;
import com.cspsmith.core.model.CspModification;
import com.cspsmith.core.model.PolicyConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CliArgsTest {

    @Test
    void valueFlagsInAllForms() {
        CliArgs a = CliArgs.parse("--csp", "default-src 'self'", "-hash-algo=sha384", "--report=out/r.json", "index.html");

        assertEquals("default-src 'self'", a.getCsp());
        assertEquals("sha384", a.getHashAlgo());
        assertEquals("out/r.json", a.getReportPath());
        assertThat(a.getFiles()).containsExactly("index.html");
    }

    @Test
    void flagsMayFollowFiles() {
        CliArgs a = CliArgs.parse("a.html", "-v", "b.html", "--no-scripts");

        assertTrue(a.isVerbose());
        assertThat(a.getFiles()).containsExactly("a.html", "b.html");
    }

    @Test
    void doubleDashEndsOptions() {
        CliArgs a = CliArgs.parse("--verbose", "--", "--weird.html", "-");
        assertThat(a.getFiles()).containsExactly("--weird.html", "-");
    }

    @Test
    void booleanValues() {
        PolicyConfig cfg = CliArgs.parse("--include-external=true", "--heuristics=0", "--verbose=f")
                .applyTo(PolicyConfig.defaults());

        assertTrue(cfg.isIncludeExternal());
        assertFalse(cfg.isHeuristics());
        assertFalse(cfg.isVerbose());
    }

    @Test
    void badBooleanIsUsageError() {
        assertThatThrownBy(() -> CliArgs.parse("--heuristics=maybe"))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessage("invalid boolean value \"maybe\" for flag --heuristics");
    }

    @Test
    void unknownFlag() {
        assertThatThrownBy(() -> CliArgs.parse("--frobnicate"))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessage("unknown flag: --frobnicate");
        // 템플릿에 없는 디렉티브는 add/remove 불가
        assertThatThrownBy(() -> CliArgs.parse("--add-report-uri", "/csp"))
                .hasMessage("unknown flag: --add-report-uri");
    }

    @Test
    void missingValue() {
        assertThatThrownBy(() -> CliArgs.parse("--csp"))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessage("flag needs an argument: --csp");
    }

    @Test
    void help() {
        assertTrue(CliArgs.parse("-h").isHelp());
        assertTrue(CliArgs.parse("--help", "x.html").isHelp());
    }

    @Test
    void modificationsKeepOrder() {
        CliArgs a = CliArgs.parse(
                "--add-script-src", " https://cdn.example.com ",
                "--remove-object-src='none'",
                "--add-img-src", "data:");

        assertThat(a.getModifications()).containsExactly(
                CspModification.add("script-src", "https://cdn.example.com"),
                CspModification.remove("object-src", "'none'"),
                CspModification.add("img-src", "data:"));
    }

    @Test
    void applyTo_overridesOnlyGivenFlags() {
        PolicyConfig cfg = PolicyConfig.defaults()
                .setCsp("default-src 'none'")
                .setHashAlgorithm(HashAlgorithm.SHA512)
                .setIncludeExternal(true)
                .addModification(CspModification.add("font-src", "data:"));
        cfg.getExtract().setStyles(false);

        CliArgs.parse("--no-event-handlers", "--add-script-src", "'self'").applyTo(cfg);

        assertEquals("default-src 'none'", cfg.getCsp());
        assertEquals(HashAlgorithm.SHA512, cfg.getHashAlgorithm());
        assertTrue(cfg.isIncludeExternal());
        assertFalse(cfg.getExtract().isStyles());
        assertFalse(cfg.getExtract().isEventHandlers());
        assertTrue(cfg.getExtract().isScripts());
        assertThat(cfg.getModifications()).containsExactly(
                CspModification.add("font-src", "data:"),
                CspModification.add("script-src", "'self'"));
    }

    @Test
    void applyTo_noValidateAndNegations() {
        PolicyConfig cfg = CliArgs.parse("--no-validate", "--no-inline-styles", "--generate-strict",
                "--require-trusted-types", "--validate-only").applyTo(PolicyConfig.defaults());

        assertFalse(cfg.isValidate());
        assertFalse(cfg.getExtract().isInlineStyles());
        assertTrue(cfg.isGenerateStrict());
        assertTrue(cfg.isRequireTrustedTypes());
        assertTrue(cfg.isValidateOnly());
    }

    @Test
    void applyTo_badHashAlgo() {
        CliArgs a = CliArgs.parse("--hash-algo", "md5");
        assertThatThrownBy(() -> a.applyTo(PolicyConfig.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("md5");
    }

    @Test
    void emptyArgs() {
        CliArgs a = CliArgs.parse();
        assertNull(a.getCsp());
        assertFalse(a.isVerbose());
        assertThat(a.getFiles()).isEmpty();
    }

    @Test
    void usageListsDirectiveFlags() {
        String u = CliArgs.usage();
        assertThat(u).startsWith("Usage: csp [options] file1.html [file2.html ...]");
        assertThat(u).contains("--add-frame-ancestors VALUE", "--remove-worker-src VALUE", "--hash-algo NAME");
        assertThat(u).doesNotContain("--add-report-uri");
    }
}

package com.cspsmith.core.model;

import com.cspsmith.core.hash.HashAlgorithm;
import com.cspsmith.core.policy.StrictTemplate;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PolicyConfigTest {

    @Test
    void defaultsAreValid() {
        PolicyConfig cfg = PolicyConfig.defaults();
        cfg.validate();

        assertThat(cfg.hasCsp()).isFalse();
        assertThat(cfg.useStrict()).isTrue();      // CSP 없으면 strict
        assertThat(cfg.getHashAlgorithm()).isEqualTo(HashAlgorithm.SHA256);
        assertThat(cfg.isValidate()).isTrue();
        assertThat(cfg.isIncludeExternal()).isFalse();
        assertThat(cfg.getExtract().isScripts()).isTrue();
        assertThat(cfg.getModifications()).isEmpty();
    }

    @Test
    void givenCspDisablesStrictUnlessForced() {
        PolicyConfig cfg = PolicyConfig.defaults().setCsp("default-src 'self'");
        assertThat(cfg.useStrict()).isFalse();

        cfg.setGenerateStrict(true);
        assertThat(cfg.useStrict()).isTrue();

        assertThat(PolicyConfig.defaults().setCsp("   ").useStrict()).isTrue();
    }

    @Test
    void heuristicsNeedExternal() {
        PolicyConfig cfg = PolicyConfig.defaults().setHeuristics(true);
        assertThat(cfg.useHeuristics()).isFalse();
        assertThat(cfg.setIncludeExternal(true).useHeuristics()).isTrue();
    }

    @Test
    void trustedTypesFlagIsMergedIntoTemplateCopy() {
        PolicyConfig cfg = PolicyConfig.defaults().setRequireTrustedTypes(true);

        StrictTemplate t = cfg.effectiveStrictTemplate();
        assertThat(t.isRequireTrustedTypes()).isTrue();
        assertThat(cfg.getStrictTemplate().isRequireTrustedTypes()).isFalse();

        PolicyConfig fromTemplate = PolicyConfig.defaults()
                .setStrictTemplate(StrictTemplate.defaults().setRequireTrustedTypes(true));
        assertThat(fromTemplate.effectiveStrictTemplate().isRequireTrustedTypes()).isTrue();
    }

    @Test
    void validateOnlyRequiresCsp() {
        PolicyConfig cfg = PolicyConfig.defaults().setValidateOnly(true);
        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("csp is required");

        cfg.setCsp("default-src 'self'");
        cfg.validate();
    }

    @Test
    void validateRejectsNullParts() {
        assertThrows(NullPointerException.class, () -> PolicyConfig.defaults().setHashAlgorithm(null).validate());
        assertThrows(NullPointerException.class, () -> PolicyConfig.defaults().setStrictTemplate(null).validate());
    }

    @Test
    void modificationsKeepOrder() {
        PolicyConfig cfg = PolicyConfig.defaults()
                .addModification(CspModification.add("img-src", "data:"))
                .addModification(CspModification.remove("img-src", "data:"));

        assertThat(cfg.getModifications()).extracting(CspModification::action)
                .containsExactly(CspModification.Action.ADD, CspModification.Action.REMOVE);
        assertThat(CspModification.Action.parse(" remove ")).isEqualTo(CspModification.Action.REMOVE);
        assertThatThrownBy(() -> CspModification.Action.parse("replace"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

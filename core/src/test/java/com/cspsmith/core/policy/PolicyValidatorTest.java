package com.cspsmith.core.policy;

import com.cspsmith.core.model.Severity;
import com.cspsmith.core.model.ValidationResult;
import com.cspsmith.core.model.ValidationWarning;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyValidatorTest {

    @Test
    void emptyHeaderIsInvalidWithOneError() {
        ValidationResult r = PolicyValidator.validate("   ");

        assertThat(r.valid()).isFalse();
        assertThat(r.warnings()).hasSize(1);
        assertThat(r.warnings().get(0).severity()).isEqualTo(Severity.ERROR);
        assertThat(r.warnings().get(0).message()).isEqualTo("CSP header is empty");
        assertThat(PolicyValidator.validate(null).valid()).isFalse();
    }

    @Test
    void cleanPolicyHasNoWarnings() {
        ValidationResult r = PolicyValidator.validate("default-src 'self'; script-src 'self' 'sha256-abc'");
        assertThat(r.valid()).isTrue();
        assertThat(r.hasWarnings()).isFalse();
    }

    @Test
    void unsafeInlineWithHashPlusMissingDefault() {
        ValidationResult r = PolicyValidator.validate("script-src 'self' 'unsafe-inline' 'sha256-abc'");

        assertThat(r.valid()).isTrue();
        assertThat(r.warnings()).extracting(ValidationWarning::message).containsExactly(
                "script-src contains both 'unsafe-inline' and hash values",
                "Missing 'default-src' directive");
    }

    @Test
    void unsafeEvalIsReported() {
        ValidationResult r = PolicyValidator.validate("default-src 'self'; script-src 'self' 'unsafe-eval'");
        assertThat(r.warnings()).singleElement()
                .extracting(ValidationWarning::message)
                .isEqualTo("script-src contains 'unsafe-eval' which allows dangerous eval() usage");
    }

    @Test
    void wildcardAndDataInScriptSrc() {
        ValidationResult r = PolicyValidator.validate("default-src *; script-src 'self' data:; img-src https://*");

        assertThat(r.warnings()).extracting(ValidationWarning::message).containsExactly(
                "default-src contains wildcard '*' which allows resources from any origin",
                "script-src allows 'data:' URIs which can be exploited");
    }

    @Test
    void httpWildcardIsNotExempt() {
        ValidationResult r = PolicyValidator.validate("default-src 'self'; connect-src http://*");
        assertThat(r.warnings()).extracting(ValidationWarning::message)
                .containsExactly("connect-src contains wildcard '*' which allows resources from any origin");
    }

    @Test
    void deprecatedDirectives() {
        ValidationResult r = PolicyValidator.validate(
                "default-src 'self'; referrer no-referrer; block-all-mixed-content; plugin-types application/pdf");

        assertThat(r.warnings()).extracting(ValidationWarning::message).containsExactly(
                "'block-all-mixed-content' is deprecated",
                "'plugin-types' is deprecated",
                "'referrer' is deprecated");
        assertThat(r.warnings().get(2).fix()).isEqualTo("Use the Referrer-Policy header instead");
    }

    @Test
    void orphanedAttrDirectives() {
        ValidationResult r = PolicyValidator.validate(
                "default-src 'self'; script-src-attr 'none'; style-src-attr 'unsafe-hashes'");

        assertThat(r.warnings()).extracting(ValidationWarning::message).containsExactly(
                "'style-src-attr' is defined but 'style-src' is not",
                "'script-src-attr' is defined but 'script-src' is not");
    }

    @Test
    void checksAccumulate() {
        ValidationResult r = PolicyValidator.validate(
                "script-src * 'unsafe-inline' 'unsafe-eval' 'sha384-x'; referrer origin");
        assertThat(r.warnings()).hasSize(5);
        assertThat(r.errorCount()).isZero();
    }
}

package com.cspsmith.core.util;

import com.cspsmith.core.hash.HashAlgorithm;
import com.cspsmith.core.model.CspModification;
import com.cspsmith.core.model.PolicyConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @Test
    void loadsEverySection() throws IOException, URISyntaxException {
        Path yml = Path.of(getClass().getResource("/csp-sample.yml").toURI());

        PolicyConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.getCsp()).isEqualTo("default-src 'self'; script-src 'self'");
        assertThat(cfg.getHashAlgorithm()).isEqualTo(HashAlgorithm.SHA384);
        assertThat(cfg.isRequireTrustedTypes()).isTrue();
        assertThat(cfg.isValidate()).isFalse();
        assertThat(cfg.isVerbose()).isTrue();
        assertThat(cfg.getExtract().isScripts()).isTrue();
        assertThat(cfg.getExtract().isStyles()).isFalse();
        assertThat(cfg.getExtract().isEventHandlers()).isFalse();
        assertThat(cfg.useHeuristics()).isTrue();

        // strict: 목록/문자열 둘 다, 모르는 키(report-uri)는 무시
        assertThat(cfg.getStrictTemplate().get("img-src")).containsExactly("'self'", "data:");
        assertThat(cfg.getStrictTemplate().get("default-src")).containsExactly("'self'");
        assertThat(cfg.getStrictTemplate().isUpgradeInsecureRequests()).isFalse();

        assertThat(cfg.getModifications()).containsExactly(
                CspModification.add("script-src", "https://cdn.example.com"),
                CspModification.remove("object-src", "'none'"));
    }

    @Test
    void emptyFileGivesDefaults(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("csp.yml");
        Files.writeString(yml, "");

        PolicyConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.hasCsp()).isFalse();
        assertThat(cfg.useStrict()).isTrue();
        assertThat(cfg.getHashAlgorithm()).isEqualTo(HashAlgorithm.SHA256);
        assertThat(cfg.isValidate()).isTrue();
    }

    @Test
    void unknownHashAlgoKeepsDefault(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("csp.yml");
        Files.writeString(yml, "hashAlgo: md5\n");

        assertThat(YamlConfigLoader.load(yml).getHashAlgorithm()).isEqualTo(HashAlgorithm.SHA256);
    }

    @Test
    void malformedModificationsAreRejected(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("csp.yml");
        Files.writeString(yml, """
            modifications:
              - { action: add, directive: script-src }
            """);

        assertThatThrownBy(() -> YamlConfigLoader.load(yml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("modifications[0]");

        Files.writeString(yml, "modifications: nope\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(yml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("modifications must be a list");
    }

    @Test
    void missingFileIsAnIOException(@TempDir Path dir) {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("absent.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("csp.yml not found at:");
    }
}

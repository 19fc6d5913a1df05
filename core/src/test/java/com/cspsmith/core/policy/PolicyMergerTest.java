package com.cspsmith.core.policy;

import com.cspsmith.core.model.CspModification;
import com.cspsmith.core.model.ResourceCatalog;
import com.cspsmith.core.model.ResourceType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyMergerTest {

    static final String H1 = "'sha256-AAA='";
    static final String H2 = "'sha256-BBB='";
    static final String S1 = "'sha256-SSS='";

    @Nested
    class UpdateCsp {

        @Test
        void scriptHashIsAppendedAndDefaultSrcUntouched() {
            String out = PolicyMerger.updateCsp("default-src 'self'", List.of("'sha256-X'"), null, null, false);

            DirectiveMap dm = DirectiveMap.parse(out);
            assertThat(dm.get("default-src")).isEqualTo("'self'");
            assertThat(dm.get("script-src")).isEqualTo("'sha256-X'");
            assertThat(out).isEqualTo("default-src 'self'; script-src 'sha256-X'");
        }

        @Test
        void appendsToExistingDirectiveWithoutDuplicates() {
            String out = PolicyMerger.updateCsp("default-src 'self'; script-src 'self' " + H1,
                    List.of(H1, H2, H2), List.of(), List.of(), false);

            assertThat(DirectiveMap.parse(out).get("script-src")).isEqualTo("'self' " + H1 + " " + H2);
        }

        @Test
        void eventHandlersAddUnsafeHashesOnce() {
            String once = PolicyMerger.updateCsp("script-src 'self'", List.of(H1), List.of(), List.of(), true);
            String twice = PolicyMerger.updateCsp(once, List.of(H1), List.of(), List.of(), true);

            assertThat(DirectiveMap.parse(once).get("script-src")).isEqualTo("'self' " + H1 + " 'unsafe-hashes'");
            assertThat(twice).isEqualTo(once);
        }

        @Test
        void styleAttributesPreferStyleSrcAttr() {
            String out = PolicyMerger.updateCsp("default-src 'self'; style-src-attr 'self'",
                    List.of(), List.of(H2), List.of(S1), false);

            DirectiveMap dm = DirectiveMap.parse(out);
            assertThat(dm.get("style-src")).isEqualTo(H2);
            assertThat(dm.get("style-src-attr")).isEqualTo("'self' " + S1 + " 'unsafe-hashes'");
        }

        @Test
        void styleAttributesFallBackToStyleSrc() {
            String out = PolicyMerger.updateCsp("default-src 'self'", List.of(), List.of(H2), List.of(S1), false);

            assertThat(out).isEqualTo("default-src 'self'; style-src " + H2 + " " + S1 + " 'unsafe-hashes'");
        }

        @Test
        void nothingToAddKeepsDirectives() {
            String out = PolicyMerger.updateCsp("default-src 'self'; report-uri /r", List.of(), List.of(), List.of(), false);
            assertThat(out).isEqualTo("default-src 'self'; report-uri /r");
        }
    }

    @Nested
    class Strict {

        @Test
        void emptyMergeDoesNotFabricateDirectives() {
            String base = PolicyMerger.generateStrict(StrictTemplate.defaults());
            String out = PolicyMerger.mergeStrictWithHashes(base, List.of(), List.of(), List.of(), false);

            assertThat(DirectiveMap.parse(out)).isEqualTo(DirectiveMap.parse(base));
            assertThat(PolicyMerger.mergeStrictWithHashes("", List.of(), List.of(), List.of(), false)).isEmpty();
        }

        @Test
        void hashesGoToScriptAndStyleSrc() {
            String base = PolicyMerger.generateStrict(StrictTemplate.defaults());
            String out = PolicyMerger.mergeStrictWithHashes(base, List.of(H1), List.of(H2), List.of(S1), true);

            DirectiveMap dm = DirectiveMap.parse(out);
            assertThat(dm.get("script-src")).isEqualTo("'self' " + H1 + " 'unsafe-hashes'");
            assertThat(dm.get("style-src")).isEqualTo("'self' " + H2 + " " + S1 + " 'unsafe-hashes'");
            assertThat(dm.has("style-src-attr")).isFalse();
            assertThat(dm.get("default-src")).isEqualTo("'none'");
            assertThat(dm.has("upgrade-insecure-requests")).isTrue();
        }

        @Test
        void styleTagsOnlyDoNotAddUnsafeHashes() {
            String out = PolicyMerger.mergeStrictWithHashes("default-src 'none'", List.of(), List.of(H2), List.of(), false);
            assertThat(out).isEqualTo("default-src 'none'; style-src " + H2);
        }

        @Test
        void emptyTemplateGetsOnlyWhatIsAdded() {
            String base = PolicyMerger.generateStrict(StrictTemplate.empty());
            String out = PolicyMerger.mergeStrictWithHashes(base, List.of(H1), List.of(), List.of(), false);
            assertThat(out).isEqualTo("script-src " + H1);
        }
    }

    @Nested
    class ExternalResources {

        @Test
        void domainsAreUnionedIntoExistingDirective() {
            ResourceCatalog c = new ResourceCatalog()
                    .add(ResourceType.SCRIPT, "https://cdn.example.com/a.js")
                    .add(ResourceType.SCRIPT, "https://cdn.example.com/b.js")
                    .add(ResourceType.SCRIPT, "/local.js");

            String out = PolicyMerger.addExternalResources("default-src 'self'; script-src 'self'", c);
            assertThat(out).isEqualTo("default-src 'self'; script-src 'self' https://cdn.example.com");
        }

        @Test
        void missingDirectiveIsSeededFromDefaultSrc() {
            ResourceCatalog c = new ResourceCatalog().add(ResourceType.IMAGE, "https://img.example.com/x.png");

            String out = PolicyMerger.addExternalResources("default-src 'self'", c);
            assertThat(out).isEqualTo("default-src 'self'; img-src 'self' https://img.example.com");
        }

        @Test
        void withoutDefaultSrcDirectiveIsCreatedBare() {
            ResourceCatalog c = new ResourceCatalog()
                    .add(ResourceType.FONT, "https://fonts.gstatic.com/s/a.woff2")
                    .add(ResourceType.OTHER, "https://api.example.com/");

            String out = PolicyMerger.addExternalResources("", c);
            assertThat(out).isEqualTo("font-src https://fonts.gstatic.com; connect-src https://api.example.com");
        }

        @Test
        void dataUriFlagsEnsureDataToken() {
            ResourceCatalog c = new ResourceCatalog()
                    .markDataUri(ResourceType.IMAGE)
                    .markDataUri(ResourceType.FONT)
                    .add(ResourceType.FONT, "https://fonts.example.com/a.woff2");

            DirectiveMap dm = DirectiveMap.parse(
                    PolicyMerger.addExternalResources("default-src 'self'; img-src 'self' data:", c));

            assertThat(dm.get("img-src")).isEqualTo("'self' data:");
            assertThat(dm.get("font-src")).isEqualTo("'self' data: https://fonts.example.com");
        }

        @Test
        void repeatedMergeIsStable() {
            ResourceCatalog c = new ResourceCatalog()
                    .add(ResourceType.FRAME, "https://player.example.com/embed/1")
                    .add(ResourceType.STYLESHEET, "https://css.example.com/a.css");

            String once = PolicyMerger.addExternalResources("default-src 'self'", c);
            assertThat(PolicyMerger.addExternalResources(once, c)).isEqualTo(once);
        }
    }

    @Nested
    class Modifications {

        @Test
        void removingLastTokenDropsDirective() {
            String out = PolicyMerger.applyModifications("script-src 'self'",
                    List.of(CspModification.remove("script-src", "'self'")));
            assertThat(DirectiveMap.parse(out).has("script-src")).isFalse();
            assertThat(out).isEmpty();
        }

        @Test
        void addIsNoOpWhenPresentAndCreatesWhenAbsent() {
            String out = PolicyMerger.applyModifications("default-src 'self'; script-src 'self'", List.of(
                    CspModification.add("script-src", "'self'"),
                    CspModification.add("script-src", "https://a.example.com"),
                    CspModification.add("img-src", "data:")));

            assertThat(out).isEqualTo("default-src 'self'; script-src 'self' https://a.example.com; img-src data:");
        }

        @Test
        void addWithBlankValueCreatesNothing() {
            String out = PolicyMerger.applyModifications("default-src 'self'", List.of(
                    CspModification.add("script-src", "  "),
                    CspModification.add("default-src", "")));
            assertThat(out).isEqualTo("default-src 'self'");
        }

        @Test
        void removeOfMissingTokenOrDirectiveIsNoOp() {
            String h = "default-src 'self'; script-src 'self'";
            String out = PolicyMerger.applyModifications(h, List.of(
                    CspModification.remove("script-src", "https://nope.example.com"),
                    CspModification.remove("img-src", "'self'")));
            assertThat(out).isEqualTo(h);
        }

        @Test
        void appliedInOrder() {
            String out = PolicyMerger.applyModifications("default-src 'self'", List.of(
                    CspModification.add("object-src", "'none'"),
                    CspModification.remove("object-src", "'none'"),
                    CspModification.add("base-uri", "'self'")));
            assertThat(out).isEqualTo("default-src 'self'; base-uri 'self'");
        }
    }
}

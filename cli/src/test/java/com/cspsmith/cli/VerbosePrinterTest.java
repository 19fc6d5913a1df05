package com.cspsmith.cli;

import com.cspsmith.core.model.ResourceType;
import com.cspsmith.core.model.ValidationResult;
import com.cspsmith.core.model.ValidationWarning;
import com.cspsmith.core.service.PolicyRun;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class VerbosePrinterTest {

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private final PrintStream ps = new PrintStream(buf, true, StandardCharsets.UTF_8);

    private String text() {
        return buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void describe_listsOnlyNonZeroCounts() {
        assertEquals("2 inline script(s), 1 style attribute(s)",
                VerbosePrinter.describe(new PolicyRun.FileSummary("a.html", 2, 0, 1, 0)));
        assertEquals("no inline content",
                VerbosePrinter.describe(new PolicyRun.FileSummary("b.html", 0, 0, 0, 0)));
    }

    @Test
    void sectionTitles() {
        assertEquals("External Stylesheets", VerbosePrinter.sectionTitle(ResourceType.STYLESHEET));
        assertEquals("Other External Resources", VerbosePrinter.sectionTitle(ResourceType.OTHER));
    }

    @Test
    void printValidation_clean() {
        VerbosePrinter.printValidation(new ValidationResult(true, List.of()), true, ps);
        assertEquals("✓ CSP validation passed with no warnings\n", text());
    }

    @Test
    void printValidation_verboseShowsFixes() {
        ValidationResult r = new ValidationResult(true, List.of(
                ValidationWarning.warning("first", "fix one"),
                ValidationWarning.warning("second", "fix two")));

        VerbosePrinter.printValidation(r, true, ps);

        assertEquals("""
                ⚠ CSP validation passed with 2 warning(s)

                ⚠ first
                  Fix: fix one

                ⚠ second
                  Fix: fix two
                """, text());
    }

    @Test
    void printValidation_failedWithoutFixes() {
        ValidationResult r = new ValidationResult(false, List.of(ValidationWarning.error("CSP header is empty", "x")));

        VerbosePrinter.printValidation(r, false, ps);

        assertEquals("✗ CSP validation failed\n\n✗ CSP header is empty\n", text());
    }

    @Test
    void inputValidation_failedContinues() {
        ValidationResult r = new ValidationResult(false, List.of(ValidationWarning.error("CSP header is empty", "x")));

        new VerbosePrinter(ps).printInputValidation(r);

        assertThat(text()).startsWith("Input CSP validation failed:\n").endsWith("\nContinuing anyway...\n");
    }

    @Test
    void nullValidationPrintsNothing() {
        VerbosePrinter p = new VerbosePrinter(ps);
        p.printInputValidation(null);
        p.printOutputValidation(null);
        p.printOutputValidation(new ValidationResult(true, List.of()));
        assertThat(text()).isEmpty();
    }
}

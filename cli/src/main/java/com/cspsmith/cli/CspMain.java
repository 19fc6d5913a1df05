package com.cspsmith.cli;

import com.cspsmith.cli.logging.LogSetup;
import com.cspsmith.core.model.PolicyConfig;
import com.cspsmith.core.model.ValidationResult;
import com.cspsmith.core.service.PolicyRun;
import com.cspsmith.core.service.PolicyService;
import com.cspsmith.core.service.export.JsonReportExporter;
import com.cspsmith.core.util.ProgressListener;
import com.cspsmith.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * csp [options] file.html ...
 * stdout: 최종 CSP 헤더 (validate-only 면 검증 결과) / stderr: 그 외 전부
 * 종료 코드: 0 성공, 1 사용법·읽기 오류·validate-only 실패
 */
public final class CspMain {

    private static final Logger LOG = LoggerFactory.getLogger(CspMain.class);

    private CspMain() {}

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err));
    }

    /** 종료 코드 반환 (테스트용으로 System.exit 분리) */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        // ---- 인자 ----
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (CliArgs.UsageException e) {
            err.println("Error: " + e.getMessage());
            err.print(CliArgs.usage());
            return 1;
        }
        if (cli.isHelp()) {
            err.print(CliArgs.usage());
            return 0;
        }
        LogSetup.init(cli.isVerbose());

        // ---- 설정: csp.yml → 플래그 덮어쓰기 ----
        PolicyConfig cfg;
        try {
            cfg = (cli.getConfigPath() != null)
                    ? YamlConfigLoader.load(Path.of(cli.getConfigPath()))
                    : PolicyConfig.defaults();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: failed to load config: " + e.getMessage());
            return 1;
        }
        try {
            cli.applyTo(cfg);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        // ---- validate-only ----
        if (cfg.isValidateOnly()) {
            if (!cfg.hasCsp()) {
                err.println("Error: --csp flag is required for validation");
                return 1;
            }
            ValidationResult result = new PolicyService(cfg).validateOnly();
            VerbosePrinter.printValidation(result, true, out);
            return result.valid() ? 0 : 1;
        }

        List<String> files = cli.getFiles();
        if (files.isEmpty()) {
            err.println("Error: at least one HTML file is required");
            err.println("Usage: csp --csp \"CSP_HEADER\" [options] file1.html file2.html ...");
            return 1;
        }

        boolean verbose = cfg.isVerbose();
        if (verbose && !cfg.hasCsp() && !cfg.isGenerateStrict()) {
            err.println("No CSP provided, using --generate-strict as safe default");
        }

        // ---- 실행 ----
        List<Path> paths = new ArrayList<>(files.size());
        for (String f : files) paths.add(Path.of(f));

        PolicyRun run;
        try {
            run = new PolicyService(cfg).run(paths, progressLogger());
        } catch (IOException e) {
            err.println(e.getMessage());
            return 1;
        }

        // ---- 출력 ----
        VerbosePrinter printer = new VerbosePrinter(err);
        printer.printInputValidation(run.getInputValidation());
        if (verbose) printer.printDetails(run);
        printer.printOutputValidation(run.getOutputValidation());

        out.println(run.getHeader());

        if (cli.getReportPath() != null) {
            try {
                new JsonReportExporter().export(run, Path.of(cli.getReportPath()));
            } catch (IOException e) {
                err.println("Error: failed to write report: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private static ProgressListener progressLogger() {
        return (phase, done, total, item) -> {
            if (done > 0) LOG.debug("{} {}/{} {}", phase, done, total, item);
            else LOG.debug("{}", phase);
        };
    }
}

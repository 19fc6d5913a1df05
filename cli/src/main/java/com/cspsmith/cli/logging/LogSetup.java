package com.cspsmith.cli.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (콘솔 전용, stderr)
 * - init(verbose): 최초 1회만 적용. 레벨은 -Dcsp.log.level → (verbose ? FINE : WARNING)
 * - setLevel(Level): 루트/핸들러 레벨 즉시 변경
 * stdout 은 최종 CSP 헤더 전용이므로 로그는 항상 stderr 로만 나간다.
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static final String LEVEL_PROPERTY = "csp.log.level";

    public static synchronized void init(boolean verbose) {
        if (initialized) return;
        initialized = true;

        Level level = resolveLevel(System.getProperty(LEVEL_PROPERTY), verbose);

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);
        root.setLevel(level);

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. level=" + level.getName());
    }

    /** 런타임 레벨 변경 */
    public static void setLevel(Level level) {
        if (level == null) level = Level.WARNING;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    /** 시스템 프로퍼티 우선, 없으면 verbose 여부로 결정 */
    public static Level resolveLevel(String property, boolean verbose) {
        Level fallback = verbose ? Level.FINE : Level.WARNING;
        if (property == null || property.isBlank()) return fallback;
        return toLevel(property, fallback);
    }

    /* ----------------- 내부 유틸 ----------------- */

    private static Level toLevel(String s, Level def) {
        try { return Level.parse(s.trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return def; }
    }

    /** 한 줄 포맷 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] %3$s - %4$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}

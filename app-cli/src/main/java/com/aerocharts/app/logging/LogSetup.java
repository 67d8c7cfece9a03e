package com.aerocharts.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * CLI용 java.util.logging 전역 설정.
 * 콘솔 핸들러는 stderr로만 쓴다(stdout은 결과 출력 전용).
 *
 * System props:
 *  -Dac.log.level=FINE|INFO|WARNING|SEVERE (기본 WARNING, -v면 FINE)
 *  -Dac.log.dir=logs     지정하면 사이즈 롤링 파일 추가(aerocharts-%g.log)
 *  -Dac.log.sizeMb=2
 *  -Dac.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init(boolean verbose) {
        if (initialized) return;
        initialized = true;

        Level level = verbose ? Level.FINE : toLevel(System.getProperty("ac.log.level", "WARNING"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        String dir = System.getProperty("ac.log.dir");
        if (dir != null && !dir.isBlank()) {
            addFileHandler(root, Path.of(dir.trim()), level);
        }
        root.setLevel(level);
    }

    private static void addFileHandler(Logger root, Path logDir, Level level) {
        int sizeMb = parseInt(System.getProperty("ac.log.sizeMb"), 2);
        int files = parseInt(System.getProperty("ac.log.files"), 5);
        try {
            Files.createDirectories(logDir);
            FileHandler file = new FileHandler(logDir.resolve("aerocharts-%g.log").toString(),
                    sizeMb * 1024 * 1024, files, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 없이 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING,
                    "File logging disabled: " + e.getMessage(), e);
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    static Level toLevel(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.WARNING; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));
            Throwable t = r.getThrown();
            if (t == null) return base;
            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}

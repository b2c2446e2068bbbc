/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.utils;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Supplier;

/**
 * Process-wide logger.
 *
 * <p>Lines are written as {@code [timestamp][LEVEL] message}. Output goes to
 * stderr by default so that rendered previews on stdout stay clean; every line
 * is also kept in a bounded history for diagnostics and tests.
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;
    private static volatile PrintStream out = System.err;

    private static volatile CircularBuffer<String> logHistory = new CircularBuffer<>(200);

    public static void log(String level, String msg) {
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "] " + msg;
        logHistory.add(line);
        if (!silent) {
            out.println(line);
        }
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }
    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled) {
            log("DEBUG", msgSupplier.get());
        }
    }
    public static boolean isDebugEnabled() { return debugEnabled; }
    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    /**
     * Suppresses console output. Lines are still recorded in the history.
     */
    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    public static void setOutput(PrintStream stream) {
        out = stream != null ? stream : System.err;
    }

    /**
     * Retrieves the last N log lines, oldest first.
     *
     * @param count maximum number of lines to return
     * @return recorded lines (may be fewer than requested)
     */
    public static List<String> getRecentLogs(int count) {
        return logHistory.getLast(count);
    }

    public static List<String> getAllLogs() {
        return logHistory.getAll();
    }

    /**
     * Replaces the history buffer. Existing history is discarded.
     *
     * @param capacity new capacity (must be at least 1)
     */
    public static void setLogHistoryCapacity(int capacity) {
        logHistory = new CircularBuffer<>(capacity);
    }

    public static void clearLogHistory() {
        logHistory.clear();
    }

    private LoggerUtil() {}
}

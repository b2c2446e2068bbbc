/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.terminal;

import java.util.regex.Pattern;

/**
 * Removes terminal control sequences from text before it is shown in a preview pane.
 *
 * <p>Handles:
 * <ul>
 *   <li>CSI sequences: {@code ESC[31m}, {@code ESC[1;32;40m}, {@code ESC[2J}</li>
 *   <li>OSC sequences: {@code ESC]0;title BEL} or terminated by {@code ESC\}</li>
 *   <li>remaining C0 control characters other than tab, line feed and carriage return</li>
 * </ul>
 * Line structure is preserved: none of the patterns can match a newline.
 */
public final class AnsiColorStripper {

    private static final Pattern CSI = Pattern.compile("\u001B\\[[0-9;?]*[a-zA-Z]");
    private static final Pattern OSC = Pattern.compile("\u001B\\][^\u0007\u001B\n\r]*?(?:\u0007|\u001B\\\\)");
    private static final Pattern STRAY_CONTROL = Pattern.compile("[\u0000-\u0008\u000B\u000C\u000E-\u001F\u007F]");

    /**
     * Share of non-text characters above which content is considered binary.
     */
    private static final double BINARY_THRESHOLD = 0.10;

    private AnsiColorStripper() {
        // Utility class - prevent instantiation
    }

    /**
     * @param text input that may contain escape sequences
     * @return plain text, or null if input is null
     */
    public static String stripAnsiCodes(String text) {
        if (text == null) {
            return null;
        }
        String result = CSI.matcher(text).replaceAll("");
        result = OSC.matcher(result).replaceAll("");
        return STRAY_CONTROL.matcher(result).replaceAll("");
    }

    /**
     * Heuristic binary check: NUL bytes, replacement characters from invalid UTF-8,
     * or a high share of control characters mark content as not displayable text.
     *
     * @param text content decoded as UTF-8
     * @return true if the content should not be shown as text
     */
    public static boolean looksBinary(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        int suspicious = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\u0000') {
                return true;
            }
            if (c == '\uFFFD' || (c < 0x20 && c != '\n' && c != '\r' && c != '\t' && c != '\u001B')) {
                suspicious++;
            }
        }
        return (double) suspicious / text.length() > BINARY_THRESHOLD;
    }
}

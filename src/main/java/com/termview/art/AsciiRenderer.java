/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import java.util.List;

/**
 * Assembles the final text block: a four-line diagnostic header followed by the glyph grid.
 *
 * <pre>
 * ┌─ Image: 640x480 (png) ─┐
 * ├─ ASCII: 45x17 (term: 80x25, max: 74x17) ─┤
 * ├─ Sampling: X[0,312,625] Y[0,225,451] of 640x480 ─┤
 * └───────────────────────────────────────────────┘
 * </pre>
 *
 * Every grid line is exactly {@code targetWidth} glyphs followed by a single {@code '\n'}.
 */
public class AsciiRenderer {

    public String render(String format, ViewportBounds viewport, OutputGeometry geometry, List<String> rows) {
        validateRows(geometry, rows);

        int sw = geometry.sourceWidth();
        int sh = geometry.sourceHeight();
        int tw = geometry.targetWidth();
        int th = geometry.targetHeight();

        StringBuilder result = new StringBuilder((tw + 1) * (th + 4) + 256);
        result.append(String.format("┌─ Image: %dx%d (%s) ─┐\n", sw, sh, format));
        result.append(String.format("├─ ASCII: %dx%d (term: %dx%d, max: %dx%d) ─┤\n",
            tw, th, viewport.terminalWidth(), viewport.terminalHeight(),
            viewport.maxWidth(), viewport.maxHeight()));

        // First, middle and last source coordinates the grid samples on each axis
        result.append(String.format("├─ Sampling: X[0,%d,%d] Y[0,%d,%d] of %dx%d ─┤\n",
            geometry.sourceX(tw / 2), geometry.sourceX(tw - 1),
            geometry.sourceY(th / 2), geometry.sourceY(th - 1),
            sw, sh));
        result.append('└').append("─".repeat(tw + 2)).append("┘\n");

        for (String row : rows) {
            result.append(row).append('\n');
        }
        return result.toString();
    }

    private static void validateRows(OutputGeometry geometry, List<String> rows) {
        if (rows.size() != geometry.targetHeight()) {
            throw new IllegalArgumentException(String.format(
                "Expected %d rows, got %d", geometry.targetHeight(), rows.size()));
        }
        for (String row : rows) {
            int glyphs = row.codePointCount(0, row.length());
            if (glyphs != geometry.targetWidth()) {
                throw new IllegalArgumentException(String.format(
                    "Expected rows of %d glyphs, got %d", geometry.targetWidth(), glyphs));
            }
        }
    }
}

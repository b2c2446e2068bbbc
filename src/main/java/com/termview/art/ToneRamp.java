/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import java.util.Arrays;

/**
 * Ordered glyphs, densest first. Index 0 stands for the darkest tone and the
 * last index (normally a space) for the lightest. Glyphs are code points, so
 * block characters such as {@code █} occupy a single slot.
 */
public final class ToneRamp {

    private final int[] glyphs;

    private ToneRamp(int[] glyphs) {
        this.glyphs = glyphs;
    }

    /**
     * @throws IllegalArgumentException if the ramp has fewer than two glyphs
     */
    public static ToneRamp of(String glyphs) {
        if (glyphs == null) {
            throw new IllegalArgumentException("Ramp must not be null");
        }
        int[] codePoints = glyphs.codePoints().toArray();
        if (codePoints.length < 2) {
            throw new IllegalArgumentException("Ramp needs at least 2 glyphs, got " + codePoints.length);
        }
        return new ToneRamp(codePoints);
    }

    public static ToneRamp defaultRamp() {
        return of(RenderProfile.DEFAULT_RAMP);
    }

    public int size() {
        return glyphs.length;
    }

    public int glyphAt(int index) {
        return glyphs[index];
    }

    public int densest() {
        return glyphs[0];
    }

    public int lightest() {
        return glyphs[glyphs.length - 1];
    }

    /**
     * @return position of the glyph in the ramp, or -1
     */
    public int indexOf(int codePoint) {
        for (int i = 0; i < glyphs.length; i++) {
            if (glyphs[i] == codePoint) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToneRamp)) return false;
        return Arrays.equals(glyphs, ((ToneRamp) o).glyphs);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(glyphs);
    }

    @Override
    public String toString() {
        return new String(glyphs, 0, glyphs.length);
    }
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * One pixel sample with 16-bit channels (0..65535), straight (non-premultiplied) alpha.
 */
public record Rgba(int red, int green, int blue, int alpha) {

    public static final int MAX = 65535;

    /**
     * Widens an 8-bit-per-channel {@code 0xAARRGGBB} value, as returned by
     * {@link java.awt.image.BufferedImage#getRGB(int, int)}.
     */
    public static Rgba fromArgb(int argb) {
        return new Rgba(
            widen((argb >> 16) & 0xFF),
            widen((argb >> 8) & 0xFF),
            widen(argb & 0xFF),
            widen((argb >>> 24) & 0xFF));
    }

    // 0xAB -> 0xABAB, so 0xFF maps to exactly MAX
    private static int widen(int channel) {
        return channel * 257;
    }
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * Perceptual brightness of a sample, with transparency composited over white.
 */
public final class Luminance {

    // ITU-R BT.601
    static final double RED_WEIGHT = 0.299;
    static final double GREEN_WEIGHT = 0.587;
    static final double BLUE_WEIGHT = 0.114;

    private Luminance() {
    }

    /**
     * @return 0.0 for opaque black up to 1.0 for white or fully transparent
     */
    public static double of(Rgba sample) {
        double alpha = (double) sample.alpha() / Rgba.MAX;
        double r = overWhite(sample.red(), alpha);
        double g = overWhite(sample.green(), alpha);
        double b = overWhite(sample.blue(), alpha);

        double gray = RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b;
        return clamp(gray / Rgba.MAX);
    }

    private static double overWhite(int channel, double alpha) {
        return channel * alpha + Rgba.MAX * (1.0 - alpha);
    }

    static double clamp(double value) {
        if (value < 0.0) return 0.0;
        if (value > 1.0) return 1.0;
        return value;
    }
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import java.util.Objects;

/**
 * Maps cell intensities onto a {@link ToneRamp}.
 *
 * <p>A logistic curve {@code 1 / (1 + e^(-k (x - 0.5)))} is applied first to push
 * mid-tones apart, then the result is quantized with
 * {@code floor(contrasted * (N - 1))}. The curve is rescaled so that 0 and 1 map
 * onto themselves: black reaches the densest glyph and white the blank one.
 */
public class ToneMapper {

    private static final double MIDPOINT = 0.5;

    /**
     * Absorbs floating-point error just below a ramp step (e.g. white computing to 0.99999999).
     */
    private static final double QUANTIZE_EPSILON = 1e-9;

    private final ToneRamp ramp;
    private final double steepness;
    private final double curveLow;
    private final double curveHigh;

    public ToneMapper() {
        this(ToneRamp.defaultRamp(), RenderProfile.DEFAULT_CONTRAST_STEEPNESS);
    }

    public ToneMapper(ToneRamp ramp, double steepness) {
        this.ramp = Objects.requireNonNull(ramp, "ramp");
        if (!(steepness > 0)) {
            throw new IllegalArgumentException("Contrast steepness must be positive: " + steepness);
        }
        this.steepness = steepness;
        this.curveLow = logistic(0.0);
        this.curveHigh = logistic(1.0);
    }

    public static ToneMapper fromProfile(RenderProfile profile) {
        return new ToneMapper(ToneRamp.of(profile.getRamp()), profile.getContrastSteepness());
    }

    /**
     * Contrast curve, monotone on [0, 1] with {@code contrast(0) == 0} and {@code contrast(1) == 1}.
     */
    public double contrast(double intensity) {
        double x = Double.isNaN(intensity) ? 0.0 : Luminance.clamp(intensity);
        return Luminance.clamp((logistic(x) - curveLow) / (curveHigh - curveLow));
    }

    /**
     * @return ramp index in {@code [0, ramp.size() - 1]}
     */
    public int indexFor(double intensity) {
        int last = ramp.size() - 1;
        int index = (int) Math.floor(contrast(intensity) * last + QUANTIZE_EPSILON);
        if (index < 0) return 0;
        if (index > last) return last;
        return index;
    }

    /**
     * @return glyph code point for the intensity
     */
    public int glyphFor(double intensity) {
        return ramp.glyphAt(indexFor(intensity));
    }

    /**
     * Renders one grid row of intensities as glyphs.
     */
    public String mapRow(double[] intensities) {
        StringBuilder row = new StringBuilder(intensities.length);
        for (double intensity : intensities) {
            row.appendCodePoint(glyphFor(intensity));
        }
        return row.toString();
    }

    public ToneRamp getRamp() {
        return ramp;
    }

    private double logistic(double x) {
        return 1.0 / (1.0 + Math.exp(-steepness * (x - MIDPOINT)));
    }
}

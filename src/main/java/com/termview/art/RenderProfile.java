/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tuning knobs for text rendering, loaded from JSON files under {@code /profiles/}.
 * Every field is optional; unset fields fall back to the reference constants.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RenderProfile {

    public static final String DEFAULT_RAMP = "█▓@#%*+=~-:;,. ";
    public static final double DEFAULT_CHAR_ASPECT = 0.5;
    public static final double DEFAULT_EDGE_WEIGHT = 0.3;
    public static final double DEFAULT_CONTRAST_STEEPNESS = 6.0;
    public static final int DEFAULT_MAX_SAMPLE_WINDOW = 4;
    public static final int DEFAULT_MIN_SAMPLE_WINDOW = 2;

    @JsonProperty("name")
    private String name;

    /**
     * Glyphs from densest (darkest source tone) to sparsest (lightest, usually a space).
     */
    @JsonProperty("ramp")
    private String ramp;

    /**
     * Width/height ratio of one terminal character cell.
     */
    @JsonProperty("charAspect")
    private Double charAspect;

    /**
     * Weight of the Sobel edge magnitude added to the area luminance.
     */
    @JsonProperty("edgeWeight")
    private Double edgeWeight;

    /**
     * Steepness of the logistic contrast curve. Higher values push mid-tones
     * further toward the ends of the ramp.
     */
    @JsonProperty("contrastSteepness")
    private Double contrastSteepness;

    /**
     * Upper bound on the area-sampling window edge, in source pixels, at most 4.
     * The per-cell cost is at most the square of this plus the 3x3 edge pass.
     */
    @JsonProperty("maxSampleWindow")
    private Integer maxSampleWindow;

    @JsonProperty("minSampleWindow")
    private Integer minSampleWindow;

    public RenderProfile() {
        // Default constructor for Jackson
    }

    public static RenderProfile defaults() {
        RenderProfile profile = new RenderProfile();
        profile.setName("default");
        return profile;
    }

    public String getName() {
        return name != null ? name : "custom";
    }

    public void setName(String name) {
        this.name = name;
    }

    void setNameIfAbsent(String fallback) {
        if (name == null) {
            name = fallback;
        }
    }

    public String getRamp() {
        return ramp != null ? ramp : DEFAULT_RAMP;
    }

    public void setRamp(String ramp) {
        this.ramp = ramp;
    }

    public double getCharAspect() {
        return charAspect != null ? charAspect : DEFAULT_CHAR_ASPECT;
    }

    public void setCharAspect(Double charAspect) {
        this.charAspect = charAspect;
    }

    public double getEdgeWeight() {
        return edgeWeight != null ? edgeWeight : DEFAULT_EDGE_WEIGHT;
    }

    public void setEdgeWeight(Double edgeWeight) {
        this.edgeWeight = edgeWeight;
    }

    public double getContrastSteepness() {
        return contrastSteepness != null ? contrastSteepness : DEFAULT_CONTRAST_STEEPNESS;
    }

    public void setContrastSteepness(Double contrastSteepness) {
        this.contrastSteepness = contrastSteepness;
    }

    public int getMaxSampleWindow() {
        return maxSampleWindow != null ? maxSampleWindow : DEFAULT_MAX_SAMPLE_WINDOW;
    }

    public void setMaxSampleWindow(Integer maxSampleWindow) {
        this.maxSampleWindow = maxSampleWindow;
    }

    public int getMinSampleWindow() {
        return minSampleWindow != null ? minSampleWindow : DEFAULT_MIN_SAMPLE_WINDOW;
    }

    public void setMinSampleWindow(Integer minSampleWindow) {
        this.minSampleWindow = minSampleWindow;
    }

    /**
     * @throws IllegalArgumentException if any effective value is out of range
     */
    public void validate() {
        if (getRamp().codePointCount(0, getRamp().length()) < 2) {
            throw new IllegalArgumentException("Profile " + getName() + ": ramp needs at least 2 glyphs");
        }
        if (!(getCharAspect() > 0)) {
            throw new IllegalArgumentException("Profile " + getName() + ": charAspect must be positive");
        }
        if (!(getContrastSteepness() > 0)) {
            throw new IllegalArgumentException("Profile " + getName() + ": contrastSteepness must be positive");
        }
        if (!(getEdgeWeight() >= 0)) {
            throw new IllegalArgumentException("Profile " + getName() + ": edgeWeight must not be negative");
        }
        if (getMinSampleWindow() < 1 || getMaxSampleWindow() < getMinSampleWindow()) {
            throw new IllegalArgumentException(
                "Profile " + getName() + ": sample window bounds must satisfy 1 <= min <= max");
        }
        if (getMaxSampleWindow() > DEFAULT_MAX_SAMPLE_WINDOW) {
            throw new IllegalArgumentException(String.format(
                "Profile %s: maxSampleWindow %d exceeds %d", getName(), getMaxSampleWindow(), DEFAULT_MAX_SAMPLE_WINDOW));
        }
    }

    @Override
    public String toString() {
        return String.format(
            "RenderProfile{name=%s, ramp='%s', charAspect=%.2f, edgeWeight=%.2f, steepness=%.2f, window=%d..%d}",
            getName(), getRamp(), getCharAspect(), getEdgeWeight(), getContrastSteepness(),
            getMinSampleWindow(), getMaxSampleWindow());
    }
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import com.termview.utils.LoggerUtil;

/**
 * Chooses the character grid for an image.
 *
 * <p>A terminal cell is roughly twice as tall as it is wide, so the image's
 * aspect ratio is divided by the cell aspect before fitting. Examples with the
 * default cell aspect of 0.5:
 * <pre>
 *   100x100 into 80x24 -> 48x24  (height limited)
 *   400x100 into 80x24 -> 80x10  (width limited)
 * </pre>
 */
public class GeometryPlanner {

    private final double charAspect;

    public GeometryPlanner() {
        this(RenderProfile.DEFAULT_CHAR_ASPECT);
    }

    /**
     * @param charAspect width/height ratio of one character cell
     */
    public GeometryPlanner(double charAspect) {
        if (!(charAspect > 0)) {
            throw new IllegalArgumentException("Character aspect must be positive: " + charAspect);
        }
        this.charAspect = charAspect;
    }

    /**
     * Fits the source into at most {@code maxWidth x maxHeight} characters.
     * Non-positive inputs are treated as 1.
     *
     * @return geometry with {@code 1 <= targetWidth <= maxWidth} and {@code 1 <= targetHeight <= maxHeight}
     */
    public OutputGeometry plan(int sourceWidth, int sourceHeight, int maxWidth, int maxHeight) {
        int sw = Math.max(1, sourceWidth);
        int sh = Math.max(1, sourceHeight);
        int mw = Math.max(1, maxWidth);
        int mh = Math.max(1, maxHeight);

        double imageRatio = (double) sw / sh;
        double adjustedRatio = imageRatio / charAspect;

        long targetWidth;
        long targetHeight;
        if (adjustedRatio > (double) mw / mh) {
            // Width-constrained
            targetWidth = mw;
            targetHeight = Math.round(mw / adjustedRatio);
        } else {
            // Height-constrained
            targetHeight = mh;
            targetWidth = Math.round(mh * adjustedRatio);
        }

        int tw = (int) Math.max(1, Math.min(mw, targetWidth));
        int th = (int) Math.max(1, Math.min(mh, targetHeight));

        LoggerUtil.debug(() -> String.format(
            "Planned grid %dx%d for %dx%d image (bounds %dx%d, adjusted ratio %.3f)",
            tw, th, sw, sh, mw, mh, adjustedRatio));

        return new OutputGeometry(sw, sh, tw, th);
    }

    public double getCharAspect() {
        return charAspect;
    }
}

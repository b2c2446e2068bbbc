/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * Source image size and the character grid it is rendered into. All dimensions are at least 1.
 *
 * @param sourceWidth  source width in pixels
 * @param sourceHeight source height in pixels
 * @param targetWidth  grid width in characters
 * @param targetHeight grid height in characters (lines)
 */
public record OutputGeometry(int sourceWidth, int sourceHeight, int targetWidth, int targetHeight) {

    public OutputGeometry {
        if (sourceWidth < 1 || sourceHeight < 1 || targetWidth < 1 || targetHeight < 1) {
            throw new IllegalArgumentException(String.format(
                "Geometry dimensions must be positive: source %dx%d, target %dx%d",
                sourceWidth, sourceHeight, targetWidth, targetHeight));
        }
    }

    /**
     * Source pixels per output column.
     */
    public double xScale() {
        return (double) sourceWidth / targetWidth;
    }

    /**
     * Source pixels per output line.
     */
    public double yScale() {
        return (double) sourceHeight / targetHeight;
    }

    /**
     * Source column that output column {@code cellX} is centered on.
     */
    public int sourceX(int cellX) {
        return (int) (cellX * xScale());
    }

    /**
     * Source row that output line {@code cellY} is centered on.
     */
    public int sourceY(int cellY) {
        return (int) (cellY * yScale());
    }
}

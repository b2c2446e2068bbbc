/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * Computes one intensity per output cell from the source pixels.
 *
 * <p>Each cell combines two measurements taken around the source point the cell maps to:
 * <ul>
 *   <li>the mean luminance of a small window (anti-aliased downscale), where the
 *       window edge follows the horizontal downscale ratio within the profile's bounds;</li>
 *   <li>a 3x3 Sobel gradient magnitude, {@code min(1, gx^2 + gy^2)}, which lifts outlines.</li>
 * </ul>
 * The result is {@code clamp(area + edgeWeight * edge, 0, 1)}, 0 for black and 1 for white.
 *
 * <p>Every cell is an independent function of the source, so rows may be computed in any order.
 */
public class CellSampler {

    private static final int[][] SOBEL_X = {
        {-1, 0, 1},
        {-2, 0, 2},
        {-1, 0, 1}
    };
    private static final int[][] SOBEL_Y = {
        {-1, -2, -1},
        { 0,  0,  0},
        { 1,  2,  1}
    };

    private final double edgeWeight;
    private final int minWindow;
    private final int maxWindow;

    public CellSampler() {
        this(RenderProfile.DEFAULT_EDGE_WEIGHT,
            RenderProfile.DEFAULT_MIN_SAMPLE_WINDOW, RenderProfile.DEFAULT_MAX_SAMPLE_WINDOW);
    }

    public CellSampler(double edgeWeight, int minWindow, int maxWindow) {
        if (edgeWeight < 0 || minWindow < 1 || maxWindow < minWindow) {
            throw new IllegalArgumentException(String.format(
                "Invalid sampler settings: edgeWeight=%s, window=%d..%d", edgeWeight, minWindow, maxWindow));
        }
        this.edgeWeight = edgeWeight;
        this.minWindow = minWindow;
        this.maxWindow = maxWindow;
    }

    public static CellSampler fromProfile(RenderProfile profile) {
        return new CellSampler(profile.getEdgeWeight(), profile.getMinSampleWindow(), profile.getMaxSampleWindow());
    }

    /**
     * Intensities for the whole grid, indexed {@code [cellY][cellX]}.
     */
    public double[][] sampleGrid(PixelSource source, OutputGeometry geometry) {
        double[][] grid = new double[geometry.targetHeight()][geometry.targetWidth()];
        for (int y = 0; y < geometry.targetHeight(); y++) {
            for (int x = 0; x < geometry.targetWidth(); x++) {
                grid[y][x] = intensityAt(source, x, y, geometry);
            }
        }
        return grid;
    }

    /**
     * @return combined intensity for one cell, in [0, 1]
     */
    public double intensityAt(PixelSource source, int cellX, int cellY, OutputGeometry geometry) {
        int centerX = clamp(geometry.sourceX(cellX), source.width());
        int centerY = clamp(geometry.sourceY(cellY), source.height());

        double area = areaLuminance(source, centerX, centerY, windowSize(geometry));
        double edge = edgeMagnitude(source, centerX, centerY);

        return Luminance.clamp(area + edgeWeight * edge);
    }

    /**
     * Window edge length in source pixels; the cell samples at most {@code size * size} pixels.
     */
    public int windowSize(OutputGeometry geometry) {
        int size = (int) geometry.xScale();
        if (size < minWindow) {
            size = minWindow;
        }
        if (size > maxWindow) {
            size = maxWindow;
        }
        return size;
    }

    /**
     * Mean luminance over a {@code size x size} window starting {@code size / 2} pixels
     * up and left of the center. Pixels outside the image are skipped; the center
     * itself is always inside, so the mean is never empty.
     */
    double areaLuminance(PixelSource source, int centerX, int centerY, int size) {
        int start = -(size / 2);
        double total = 0.0;
        int count = 0;

        for (int dy = start; dy < start + size; dy++) {
            int y = centerY + dy;
            if (y < 0 || y >= source.height()) {
                continue;
            }
            for (int dx = start; dx < start + size; dx++) {
                int x = centerX + dx;
                if (x < 0 || x >= source.width()) {
                    continue;
                }
                total += Luminance.of(source.sample(x, y));
                count++;
            }
        }

        return total / count;
    }

    /**
     * Sobel gradient magnitude at the center; neighbors past the border repeat the edge pixel.
     */
    double edgeMagnitude(PixelSource source, int centerX, int centerY) {
        double gx = 0.0;
        double gy = 0.0;

        for (int dy = -1; dy <= 1; dy++) {
            int y = clamp(centerY + dy, source.height());
            for (int dx = -1; dx <= 1; dx++) {
                int x = clamp(centerX + dx, source.width());
                double lum = Luminance.of(source.sample(x, y));
                gx += lum * SOBEL_X[dy + 1][dx + 1];
                gy += lum * SOBEL_Y[dy + 1][dx + 1];
            }
        }

        return Math.min(1.0, gx * gx + gy * gy);
    }

    private static int clamp(int value, int size) {
        if (value < 0) return 0;
        if (value >= size) return size - 1;
        return value;
    }
}

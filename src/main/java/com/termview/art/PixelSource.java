/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * Read-only view over a decoded image.
 *
 * <p>Callers must keep {@code 0 <= x < width()} and {@code 0 <= y < height()};
 * implementations are not required to range-check.
 */
public interface PixelSource {

    int width();

    int height();

    /**
     * @return lower-case container format the pixels were decoded from (e.g. {@code png})
     */
    String format();

    Rgba sample(int x, int y);
}

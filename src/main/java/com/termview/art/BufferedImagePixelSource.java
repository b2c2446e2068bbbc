/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import java.awt.image.BufferedImage;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link PixelSource} backed by an AWT image. Samples go through
 * {@link BufferedImage#getRGB(int, int)}, so every color model is normalized to sRGB ARGB.
 */
public final class BufferedImagePixelSource implements PixelSource {

    private final BufferedImage image;
    private final String format;

    public BufferedImagePixelSource(BufferedImage image, String format) {
        this.image = Objects.requireNonNull(image, "image");
        this.format = format == null ? "unknown" : format.toLowerCase(Locale.ROOT);
    }

    @Override
    public int width() {
        return image.getWidth();
    }

    @Override
    public int height() {
        return image.getHeight();
    }

    @Override
    public String format() {
        return format;
    }

    @Override
    public Rgba sample(int x, int y) {
        return Rgba.fromArgb(image.getRGB(x, y));
    }
}

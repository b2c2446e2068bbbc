/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * Turns encoded image bytes into pixels. Which container format was involved is
 * an implementation detail; callers only see the resulting {@link PixelSource}.
 */
public interface ImageDecoder {

    /**
     * @param data encoded image bytes
     * @return decoded pixels, never null, at least 1x1
     * @throws DecodeException if the bytes are not a readable, non-empty image
     */
    PixelSource decode(byte[] data) throws DecodeException;
}

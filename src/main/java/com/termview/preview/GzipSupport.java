/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.preview;

import com.termview.utils.LoggerUtil;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Transparent gunzip for previewed objects.
 */
public final class GzipSupport {

    private static final String[] GZIP_SUFFIXES = {".gz", ".gzip"};

    /**
     * Upper bound on inflated size. Larger payloads are left compressed.
     */
    static final int MAX_INFLATED_BYTES = 64 * 1024 * 1024;

    private GzipSupport() {
    }

    public static boolean hasGzipMagic(byte[] data) {
        return data != null && data.length >= 2 && (data[0] & 0xFF) == 0x1F && (data[1] & 0xFF) == 0x8B;
    }

    public static boolean hasGzipSuffix(String name) {
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String suffix : GZIP_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops a trailing {@code .gz}/{@code .gzip} so the inner extension can serve as a format hint.
     */
    public static String stripGzipSuffix(String name) {
        if (!hasGzipSuffix(name)) {
            return name;
        }
        return name.substring(0, name.lastIndexOf('.'));
    }

    /**
     * Inflates the data when the name or the magic bytes indicate gzip.
     * Data that fails to inflate is returned unchanged.
     */
    public static byte[] decompressIfGzipped(byte[] data, String name) {
        if (data == null || (!hasGzipSuffix(name) && !hasGzipMagic(data))) {
            return data;
        }

        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            byte[] inflated = in.readNBytes(MAX_INFLATED_BYTES + 1);
            if (inflated.length > MAX_INFLATED_BYTES) {
                LoggerUtil.warn(String.format(
                    "Gzip payload of %s exceeds %d bytes when inflated, previewing raw bytes", name, MAX_INFLATED_BYTES));
                return data;
            }
            LoggerUtil.debug(String.format("Inflated %s: %d -> %d bytes", name, data.length, inflated.length));
            return inflated;
        } catch (IOException e) {
            LoggerUtil.debug(String.format("Not inflating %s: %s", name, e.getMessage()));
            return data;
        }
    }
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import java.util.Locale;

/**
 * Cheap image classification from a filename hint and magic bytes.
 * Never decodes and never throws; unrecognized input is simply not an image.
 */
public final class FormatSniffer {

    /**
     * Extensions treated as image hints (matched case-insensitively after the last dot).
     */
    private static final String[] IMAGE_EXTENSIONS = {".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp"};

    private static final byte[] PNG_SIGNATURE = {
        (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };
    private static final byte[] GIF87A = {'G', 'I', 'F', '8', '7', 'a'};
    private static final byte[] GIF89A = {'G', 'I', 'F', '8', '9', 'a'};
    private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP = {'W', 'E', 'B', 'P'};

    private FormatSniffer() {
    }

    /**
     * @return true if either the filename or the content looks like a supported image
     */
    public static boolean isImage(byte[] data, String filename) {
        return isImageFile(filename) || isImageData(data);
    }

    /**
     * Checks the filename suffix only. {@code photo.png.txt} is not an image name.
     */
    public static boolean isImageFile(String filename) {
        if (filename == null || filename.isEmpty()) {
            return false;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String ext : IMAGE_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks the leading bytes against the JPEG, PNG, GIF, BMP and WebP signatures.
     */
    public static boolean isImageData(byte[] data) {
        return detectFormat(data) != null;
    }

    /**
     * Names the container whose signature matches, or returns null.
     *
     * @param data raw bytes (null is treated as empty)
     * @return one of {@code jpeg}, {@code png}, {@code gif}, {@code bmp}, {@code webp}, or null
     */
    public static String detectFormat(byte[] data) {
        if (data == null || data.length < 2) {
            return null;
        }
        if ((data[0] & 0xFF) == 0xFF && (data[1] & 0xFF) == 0xD8) {
            return "jpeg";
        }
        if (startsWith(data, 0, PNG_SIGNATURE)) {
            return "png";
        }
        if (startsWith(data, 0, GIF87A) || startsWith(data, 0, GIF89A)) {
            return "gif";
        }
        if (data[0] == 0x42 && data[1] == 0x4D) {
            return "bmp";
        }
        // RIFF <4-byte size> WEBP
        if (startsWith(data, 0, RIFF) && startsWith(data, 8, WEBP)) {
            return "webp";
        }
        return null;
    }

    private static boolean startsWith(byte[] data, int offset, byte[] signature) {
        if (data.length < offset + signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (data[offset + i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}

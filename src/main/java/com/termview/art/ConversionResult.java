/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * Outcome of a conversion.
 *
 * @param text  rendered art, a short diagnostic when decoding failed, or empty when
 *              the input was not recognized as an image
 * @param image true only when {@code text} holds rendered art
 */
public record ConversionResult(String text, boolean image) {

    private static final ConversionResult NOT_AN_IMAGE = new ConversionResult("", false);

    public static ConversionResult notAnImage() {
        return NOT_AN_IMAGE;
    }

    public static ConversionResult failed(String message) {
        return new ConversionResult(message, false);
    }

    public static ConversionResult rendered(String art) {
        return new ConversionResult(art, true);
    }
}

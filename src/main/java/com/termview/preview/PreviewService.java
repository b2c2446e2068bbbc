/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.preview;

import com.termview.art.AsciiArtConverter;
import com.termview.art.ConversionResult;
import com.termview.art.FormatSniffer;
import com.termview.terminal.AnsiColorStripper;
import com.termview.utils.LoggerUtil;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Decides how an object's content is shown in a text viewport.
 *
 * <p>Compressed objects are inflated first. Images are rendered as text art;
 * anything else is shown as sanitized text, or as a short notice when it is
 * empty or binary.
 */
public class PreviewService {

    public static final String IMAGE_LOADING_MESSAGE = "Loading image and converting to ASCII art...";
    public static final String LOADING_MESSAGE = "Loading file content...";
    public static final String EMPTY_MESSAGE = "File is empty or contains binary data";

    private final AsciiArtConverter converter;

    /**
     * How a preview should be presented.
     */
    public enum Kind {
        /** Rendered image art. */
        IMAGE,
        /** Plain text content. */
        TEXT,
        /** Content looked like an image but could not be decoded. */
        ERROR,
        /** Nothing displayable. */
        EMPTY
    }

    /**
     * @param kind presentation kind
     * @param text content to place in the viewport
     */
    public record Preview(Kind kind, String text) {}

    public PreviewService(AsciiArtConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
    }

    /**
     * Message to show while an object is being fetched.
     */
    public static String loadingMessage(String objectKey) {
        String hint = GzipSupport.stripGzipSuffix(objectKey);
        return FormatSniffer.isImageFile(hint) ? IMAGE_LOADING_MESSAGE : LOADING_MESSAGE;
    }

    /**
     * Builds the preview for an object's content.
     *
     * @param data           raw object bytes, possibly gzip-compressed
     * @param objectKey      object name, used as a format hint
     * @param terminalWidth  columns of the viewport
     * @param terminalHeight rows of the viewport
     */
    public Preview preview(byte[] data, String objectKey, int terminalWidth, int terminalHeight) {
        byte[] content = GzipSupport.decompressIfGzipped(data == null ? new byte[0] : data, objectKey);
        String hint = GzipSupport.stripGzipSuffix(objectKey);

        ConversionResult result = converter.convertForTerminal(content, hint, terminalWidth, terminalHeight);
        if (result.image()) {
            return new Preview(Kind.IMAGE, result.text());
        }
        if (!result.text().isEmpty()) {
            return new Preview(Kind.ERROR, result.text());
        }

        String text = new String(content, StandardCharsets.UTF_8);
        if (text.isEmpty() || AnsiColorStripper.looksBinary(text)) {
            LoggerUtil.debug(() -> "No displayable content for " + objectKey);
            return new Preview(Kind.EMPTY, EMPTY_MESSAGE);
        }
        return new Preview(Kind.TEXT, AnsiColorStripper.stripAnsiCodes(text));
    }
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import com.termview.utils.LoggerUtil;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * {@link ImageDecoder} backed by the ImageIO plugin registry.
 *
 * <p>The JDK ships readers for JPEG, PNG, GIF and BMP; WebP comes from the
 * TwelveMonkeys {@code imageio-webp} plugin, which registers itself through
 * {@code META-INF/services}. Only the first frame of multi-frame images is read.
 *
 * <p>Readers recover from truncated streams by emitting a warning and returning a
 * partially filled image. Any such warning is treated as a decode failure.
 */
public class ImageIoDecoder implements ImageDecoder {

    @Override
    public PixelSource decode(byte[] data) throws DecodeException {
        if (data == null || data.length == 0) {
            throw new DecodeException("empty image data");
        }

        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (input == null) {
                throw new DecodeException("no image input stream available");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new DecodeException("unsupported image format");
            }

            ImageReader reader = readers.next();
            try {
                return readFirstFrame(reader, input, data.length);
            } finally {
                reader.dispose();
            }
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException(describe(e), e);
        }
    }

    private PixelSource readFirstFrame(ImageReader reader, ImageInputStream input, int byteCount)
            throws DecodeException {
        List<String> warnings = new ArrayList<>();
        reader.setInput(input, true, true);
        reader.addIIOReadWarningListener((source, warning) -> warnings.add(warning));

        String format;
        BufferedImage image;
        try {
            format = reader.getFormatName();
            image = reader.read(0);
        } catch (IOException e) {
            throw new DecodeException(describe(e), e);
        } catch (RuntimeException e) {
            // Third-party readers signal some corrupt streams with unchecked exceptions
            throw new DecodeException("corrupt image data: " + describe(e), e);
        }

        if (!warnings.isEmpty()) {
            throw new DecodeException("truncated or corrupt image data: " + warnings.get(0));
        }
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new DecodeException("image has no pixels");
        }

        LoggerUtil.debug(String.format(
            "Decoded %s image: %dx%d from %d bytes",
            format, image.getWidth(), image.getHeight(), byteCount));

        return new BufferedImagePixelSource(image, format);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}

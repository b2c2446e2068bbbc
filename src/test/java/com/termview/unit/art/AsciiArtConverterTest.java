/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.unit.art;

import com.termview.art.AsciiArtConverter;
import com.termview.art.ConversionResult;
import com.termview.art.DecodeException;
import com.termview.art.GeometryPlanner;
import com.termview.art.ImageDecoder;
import com.termview.art.ImageIoDecoder;
import com.termview.art.OutputGeometry;
import com.termview.art.PixelSource;
import com.termview.art.RenderProfile;
import com.termview.art.Rgba;
import com.termview.art.ToneRamp;
import com.termview.art.ViewportPolicy;
import com.termview.test.TestImages;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests for AsciiArtConverter.
 */
@DisplayName("AsciiArtConverter")
class AsciiArtConverterTest {

    private static final int HEADER_LINES = 4;
    private static final byte[] TEXT = "Hello, world!\nSecond line\n".getBytes(StandardCharsets.UTF_8);

    private final AsciiArtConverter converter = new AsciiArtConverter();

    private static String[] body(String text) {
        String[] lines = text.split("\n");
        return Arrays.copyOfRange(lines, HEADER_LINES, lines.length);
    }

    @Nested
    @DisplayName("images")
    class Images {

        @Test
        void whiteImageShouldRenderAsBlankGlyphs() throws Exception {
            byte[] png = TestImages.png(TestImages.solid(2, 2, 0xFFFFFF));

            ConversionResult result = converter.convert(png, "white.png", 10, 10);

            assertTrue(result.image());
            assertTrue(result.text().startsWith("┌─ Image: 2x2 (png) ─┐\n"));
            int blank = converter.getRamp().lightest();
            for (String line : body(result.text())) {
                assertFalse(line.isEmpty());
                line.codePoints().forEach(cp -> assertEquals(blank, cp));
            }
        }

        @Test
        void gradientShouldFollowPlannedGeometry() throws Exception {
            byte[] png = TestImages.png(TestImages.diagonalGradient(20, 10));

            ConversionResult result = converter.convert(png, "gradient.png", 40, 20);

            OutputGeometry planned = new GeometryPlanner().plan(20, 10, 40, 20);
            String[] body = body(result.text());
            assertTrue(result.image());
            assertEquals(planned.targetHeight(), body.length);
            assertEquals(10, body.length);
            for (String line : body) {
                assertEquals(40, line.codePointCount(0, line.length()));
            }
            assertTrue(result.text().endsWith("\n"));
        }

        @Test
        void horizontalGradientShouldDarkenToLightLeftToRight() throws Exception {
            byte[] png = TestImages.png(TestImages.horizontalGradient(256, 32));
            ToneRamp ramp = converter.getRamp();

            ConversionResult result = converter.convert(png, "ramp.png", 64, 16);

            String[] body = body(result.text());
            assertEquals(4, body.length);
            for (String line : body) {
                int[] glyphs = line.codePoints().toArray();
                assertEquals(64, glyphs.length);
                for (int x = 1; x < glyphs.length; x++) {
                    assertTrue(ramp.indexOf(glyphs[x - 1]) <= ramp.indexOf(glyphs[x]),
                        "glyph index decreased at column " + x + " in '" + line + "'");
                }
                assertEquals(ramp.densest(), glyphs[0]);
                assertTrue(ramp.indexOf(glyphs[glyphs.length - 1]) >= ramp.size() - 2);
            }
        }

        @Test
        void webpShouldRenderEndToEnd() {
            ConversionResult lossless = converter.convert(TestImages.WEBP_LOSSLESS, "pixel.webp", 40, 20);
            ConversionResult lossy = converter.convert(TestImages.WEBP_LOSSY, "unnamed", 40, 20);

            assertTrue(lossless.image());
            assertTrue(lossless.text().startsWith("┌─ Image: 1x1 (webp) ─┐\n"));
            assertTrue(lossy.image());
            assertTrue(lossy.text().startsWith("┌─ Image: 1x1 (webp) ─┐\n"));
        }

        @Test
        void signatureShouldWinOverMisleadingName() throws Exception {
            byte[] png = TestImages.png(TestImages.solid(4, 4, 0x000000));

            ConversionResult result = converter.convert(png, "notes.txt", 40, 20);

            assertTrue(result.image());
            assertTrue(result.text().contains("█"));
        }

        @Test
        void conversionShouldBeIdempotent() throws Exception {
            byte[] png = TestImages.png(TestImages.diagonalGradient(33, 17));

            ConversionResult first = converter.convert(png, "a.png", 50, 20);
            ConversionResult second = converter.convert(png, "a.png", 50, 20);

            assertEquals(first, second);
        }

        @Test
        void terminalConversionShouldReserveMargins() throws Exception {
            byte[] png = TestImages.png(TestImages.diagonalGradient(640, 480));

            ConversionResult result = converter.convertForTerminal(png, "photo.png", 80, 25);

            assertTrue(result.text().contains("├─ ASCII: 45x17 (term: 80x25, max: 74x17) ─┤"));
            assertTrue(result.text().contains("├─ Sampling: X[0,312,625] Y[0,225,451] of 640x480 ─┤"));
        }
    }

    @Property(tries = 200)
    void uniformImageShouldUseASingleGlyph(
            @ForAll @IntRange(min = 1, max = 40) int width,
            @ForAll @IntRange(min = 1, max = 30) int height,
            @ForAll @IntRange(min = 0, max = 0xFFFFFF) int rgb) throws Exception {
        byte[] png = TestImages.png(TestImages.solid(width, height, rgb));

        ConversionResult result = converter.convert(png, "solid.png", 40, 20);

        assertTrue(result.image());
        String[] body = body(result.text());
        int first = body[0].codePointAt(0);
        for (String line : body) {
            line.codePoints().forEach(cp -> assertEquals(first, cp));
        }
    }

    @Nested
    @DisplayName("non-images")
    class NonImages {

        @ParameterizedTest
        @ValueSource(strings = {"notes.txt", "README", "archive.tar"})
        void textShouldBeReportedAsNotAnImage(String name) {
            ConversionResult result = converter.convert(TEXT, name, 40, 20);

            assertEquals(ConversionResult.notAnImage(), result);
            assertEquals("", result.text());
            assertFalse(result.image());
        }

        @ParameterizedTest
        @NullAndEmptySource
        void missingNameShouldBeReportedAsNotAnImage(String name) {
            assertEquals(ConversionResult.notAnImage(), converter.convert(TEXT, name, 40, 20));
        }

        @Test
        void emptyDataShouldBeReportedAsNotAnImage() {
            assertEquals(ConversionResult.notAnImage(), converter.convert(new byte[0], "empty.log", 40, 20));
        }

        @Test
        void textWithImageNameShouldYieldErrorMessage() {
            ConversionResult result = converter.convert(TEXT, "fake.jpg", 40, 20);

            assertFalse(result.image());
            assertTrue(result.text().startsWith("Error converting image to ASCII"));
        }

        @Test
        void truncatedJpegShouldYieldErrorMessage() throws Exception {
            byte[] full = TestImages.encode(TestImages.diagonalGradient(64, 64), "jpeg");

            ConversionResult result = converter.convert(TestImages.truncated(full, full.length / 2), "cut.jpg", 40, 20);

            assertFalse(result.image());
            assertFalse(result.text().isEmpty());
        }

        @Test
        void headerOnlyJpegShouldYieldErrorMessage() {
            byte[] header = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0x00, 0x10, 'J', 'F', 'I', 'F'};

            ConversionResult result = converter.convert(header, "photo", 40, 20);

            assertFalse(result.image());
            assertTrue(result.text().startsWith("Error converting image to ASCII"));
        }
    }

    @Nested
    @DisplayName("collaborators")
    class Collaborators {

        @Test
        void decoderShouldNotBeCalledForText() {
            ImageDecoder decoder = mock(ImageDecoder.class);
            AsciiArtConverter mocked = new AsciiArtConverter(decoder, RenderProfile.defaults(), ViewportPolicy.defaults());

            mocked.convert(TEXT, "notes.txt", 40, 20);

            verifyNoInteractions(decoder);
        }

        @Test
        void decodeFailureShouldBecomeMessage() throws Exception {
            ImageDecoder decoder = mock(ImageDecoder.class);
            when(decoder.decode(any())).thenThrow(new DecodeException("boom"));
            AsciiArtConverter mocked = new AsciiArtConverter(decoder, RenderProfile.defaults(), ViewportPolicy.defaults());

            ConversionResult result = mocked.convert(TEXT, "fake.png", 40, 20);

            assertEquals(ConversionResult.failed("Error converting image to ASCII: boom"), result);
        }

        @Test
        void customProfileShouldDriveGlyphChoice() throws Exception {
            PixelSource black = mock(PixelSource.class);
            when(black.width()).thenReturn(8);
            when(black.height()).thenReturn(8);
            when(black.format()).thenReturn("mock");
            when(black.sample(anyInt(), anyInt())).thenReturn(new Rgba(0, 0, 0, Rgba.MAX));
            ImageDecoder decoder = mock(ImageDecoder.class);
            when(decoder.decode(any())).thenReturn(black);

            RenderProfile profile = RenderProfile.defaults();
            profile.setRamp("X.");
            AsciiArtConverter custom = new AsciiArtConverter(decoder, profile, ViewportPolicy.defaults());

            ConversionResult result = custom.convert(TestImages.png(TestImages.solid(1, 1, 0)), "x.png", 20, 10);

            assertTrue(result.image());
            assertTrue(result.text().startsWith("┌─ Image: 8x8 (mock) ─┐"));
            for (String line : body(result.text())) {
                assertTrue(line.matches("X+"), line);
            }
        }

        @Test
        void invalidProfileShouldBeRejectedUpFront() {
            RenderProfile profile = RenderProfile.defaults();
            profile.setRamp("#");

            assertThrows(IllegalArgumentException.class,
                () -> new AsciiArtConverter(new ImageIoDecoder(), profile, ViewportPolicy.defaults()));
        }
    }
}

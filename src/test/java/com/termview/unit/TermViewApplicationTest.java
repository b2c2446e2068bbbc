/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.unit;

import com.termview.TermViewApplication;
import com.termview.test.TestImages;
import com.termview.utils.LoggerUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TermViewApplication")
class TermViewApplicationTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(captured, true, StandardCharsets.UTF_8);

    @BeforeEach
    void setUp() {
        LoggerUtil.setSilent(true);
    }

    @AfterEach
    void tearDown() {
        LoggerUtil.setSilent(false);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("run()")
    class Run {

        @Test
        void imageShouldPrintArtAndExitZero() throws Exception {
            Path image = tempDir.resolve("photo.png");
            Files.write(image, TestImages.png(TestImages.diagonalGradient(640, 480)));

            int code = TermViewApplication.run(new String[] {image.toString(), "80", "25"}, out, Map.of());

            assertEquals(TermViewApplication.EXIT_OK, code);
            assertTrue(output().startsWith("┌─ Image: 640x480 (png) ─┐\n"));
            assertTrue(output().contains("(term: 80x25, max: 74x17)"));
        }

        @Test
        void textShouldPrintContentAndExitTwo() throws Exception {
            Path text = tempDir.resolve("notes.txt");
            Files.writeString(text, "first line\nsecond line");

            int code = TermViewApplication.run(new String[] {text.toString()}, out, Map.of());

            assertEquals(TermViewApplication.EXIT_NOT_IMAGE, code);
            assertEquals("first line\nsecond line\n", output());
        }

        @Test
        void undecodableImageShouldPrintErrorAndExitTwo() throws Exception {
            Path fake = tempDir.resolve("fake.jpg");
            Files.writeString(fake, "not really a jpeg");

            int code = TermViewApplication.run(new String[] {fake.toString()}, out, Map.of());

            assertEquals(TermViewApplication.EXIT_NOT_IMAGE, code);
            assertTrue(output().startsWith("Error converting image to ASCII"));
        }

        @Test
        void missingFileShouldExitOne() {
            int code = TermViewApplication.run(
                new String[] {tempDir.resolve("nope.png").toString()}, out, Map.of());

            assertEquals(TermViewApplication.EXIT_ERROR, code);
        }

        @Test
        void wrongArgumentCountShouldPrintUsage() {
            assertEquals(TermViewApplication.EXIT_ERROR, TermViewApplication.run(new String[0], out, Map.of()));
            assertEquals(TermViewApplication.EXIT_ERROR,
                TermViewApplication.run(new String[] {"a", "80"}, out, Map.of()));
            assertTrue(output().startsWith("Usage: termview"));
        }

        @Test
        void invalidSizeShouldPrintUsage() throws Exception {
            Path text = tempDir.resolve("notes.txt");
            Files.writeString(text, "hello");

            int code = TermViewApplication.run(new String[] {text.toString(), "wide", "25"}, out, Map.of());

            assertEquals(TermViewApplication.EXIT_ERROR, code);
            assertTrue(output().contains("Usage: termview"));
        }
    }

    @Nested
    @DisplayName("terminalSize()")
    class TerminalSize {

        @Test
        void explicitArgumentsShouldWin() {
            int[] size = TermViewApplication.terminalSize(
                new String[] {"f", "120", "40"}, Map.of("COLUMNS", "200", "LINES", "60"));

            assertArrayEquals(new int[] {120, 40}, size);
        }

        @Test
        void environmentShouldBeUsedWhenPresent() {
            int[] size = TermViewApplication.terminalSize(new String[] {"f"}, Map.of("COLUMNS", "132", "LINES", "43"));

            assertArrayEquals(new int[] {132, 43}, size);
        }

        @Test
        void badEnvironmentShouldFallBackToDefaults() {
            int[] size = TermViewApplication.terminalSize(new String[] {"f"}, Map.of("COLUMNS", "abc", "LINES", "-3"));

            assertArrayEquals(new int[] {80, 25}, size);
        }

        @Test
        void nonPositiveArgumentsShouldBeRejected() {
            assertThrows(IllegalArgumentException.class,
                () -> TermViewApplication.terminalSize(new String[] {"f", "0", "25"}, Map.of()));
            assertThrows(IllegalArgumentException.class,
                () -> TermViewApplication.terminalSize(new String[] {"f", "80", "x"}, Map.of()));
        }
    }
}

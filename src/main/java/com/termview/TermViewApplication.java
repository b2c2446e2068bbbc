/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview;

import com.termview.art.AsciiArtConverter;
import com.termview.art.ImageIoDecoder;
import com.termview.art.RenderProfile;
import com.termview.art.RenderProfileLoader;
import com.termview.preview.PreviewService;
import com.termview.utils.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Command-line previewer: {@code termview <file> [columns rows]}.
 *
 * <p>Prints the same preview a terminal object browser would show for the file.
 * Exit codes: 0 rendered art, 2 content shown but not as an image, 1 usage or I/O error.
 */
public class TermViewApplication {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_NOT_IMAGE = 2;

    public static final int DEFAULT_COLUMNS = 80;
    public static final int DEFAULT_ROWS = 25;

    private static final String USAGE = "Usage: termview <file> [columns rows]";

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, System.getenv()));
    }

    public static int run(String[] args, PrintStream out, Map<String, String> env) {
        if (args.length != 1 && args.length != 3) {
            out.println(USAGE);
            return EXIT_ERROR;
        }

        try {
            TermViewConfig config = TermViewConfig.load();
            LoggerUtil.setDebugEnabled(config.isDebugLogging());

            int[] size = terminalSize(args, env);
            Path file = Paths.get(args[0]);
            byte[] data = Files.readAllBytes(file);
            LoggerUtil.debug(String.format("Previewing %s (%d bytes) for %dx%d terminal",
                file, data.length, size[0], size[1]));

            RenderProfile profile = new RenderProfileLoader().load(config.getRenderProfile());
            AsciiArtConverter converter = new AsciiArtConverter(
                new ImageIoDecoder(), profile, config.getViewportPolicy());
            PreviewService.Preview preview = new PreviewService(converter)
                .preview(data, file.getFileName().toString(), size[0], size[1]);

            out.print(preview.text());
            if (!preview.text().endsWith("\n")) {
                out.println();
            }
            return preview.kind() == PreviewService.Kind.IMAGE ? EXIT_OK : EXIT_NOT_IMAGE;
        } catch (IOException e) {
            LoggerUtil.error("Preview failed: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            LoggerUtil.error("Invalid configuration or arguments: " + e.getMessage());
            out.println(USAGE);
            return EXIT_ERROR;
        }
    }

    /**
     * Explicit arguments win, then {@code COLUMNS}/{@code LINES}, then 80x25.
     */
    public static int[] terminalSize(String[] args, Map<String, String> env) {
        if (args.length == 3) {
            int columns = parsePositive(args[1], "columns");
            int rows = parsePositive(args[2], "rows");
            return new int[] {columns, rows};
        }
        return new int[] {
            fromEnv(env, "COLUMNS", DEFAULT_COLUMNS),
            fromEnv(env, "LINES", DEFAULT_ROWS)
        };
    }

    private static int parsePositive(String value, String name) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a positive integer, got: " + value, e);
        }
        throw new IllegalArgumentException(name + " must be a positive integer, got: " + value);
    }

    private static int fromEnv(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            LoggerUtil.debug(() -> "Ignoring non-numeric " + key + ": " + value);
            return fallback;
        }
    }
}

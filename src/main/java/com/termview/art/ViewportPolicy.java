/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * Turns a requested viewport into grid bounds that keep per-call cost in check.
 *
 * <p>Small viewports are raised to a floor so that a preview stays legible. The
 * ceiling only applies to exceptionally large terminals; anything up to the
 * {@code large*} thresholds is used as requested.
 *
 * @param marginWidth  columns reserved for borders and the scrollbar
 * @param marginHeight rows reserved for headers and other UI chrome
 * @param minWidth     smallest grid width
 * @param minHeight    smallest grid height
 * @param largeWidth   terminal width above which {@code capWidth} applies
 * @param largeHeight  terminal height above which {@code capHeight} applies
 * @param capWidth     grid width ceiling for large terminals
 * @param capHeight    grid height ceiling for large terminals
 */
public record ViewportPolicy(
    int marginWidth,
    int marginHeight,
    int minWidth,
    int minHeight,
    int largeWidth,
    int largeHeight,
    int capWidth,
    int capHeight
) {

    public ViewportPolicy {
        if (marginWidth < 0 || marginHeight < 0) {
            throw new IllegalArgumentException("Viewport margins must not be negative");
        }
        if (minWidth < 1 || minHeight < 1) {
            throw new IllegalArgumentException("Viewport floors must be at least 1");
        }
        if (capWidth < minWidth || capHeight < minHeight) {
            throw new IllegalArgumentException("Viewport ceilings must not be below the floors");
        }
    }

    public static ViewportPolicy defaults() {
        return new ViewportPolicy(6, 8, 20, 10, 200, 100, 180, 80);
    }

    /**
     * Bounds for a caller that already subtracted its own chrome.
     */
    public ViewportBounds forMaxSize(int maxWidth, int maxHeight) {
        return bound(maxWidth, maxHeight, maxWidth, maxHeight);
    }

    /**
     * Bounds for a full terminal; the configured margins are subtracted first.
     */
    public ViewportBounds forTerminal(int terminalWidth, int terminalHeight) {
        return bound(terminalWidth, terminalHeight, terminalWidth - marginWidth, terminalHeight - marginHeight);
    }

    private ViewportBounds bound(int terminalWidth, int terminalHeight, int maxWidth, int maxHeight) {
        int width = Math.max(minWidth, maxWidth);
        int height = Math.max(minHeight, maxHeight);

        if (terminalWidth > largeWidth && width > capWidth) {
            width = capWidth;
        }
        if (terminalHeight > largeHeight && height > capHeight) {
            height = capHeight;
        }

        return new ViewportBounds(terminalWidth, terminalHeight, width, height);
    }
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

/**
 * Terminal size a preview was requested for, and the grid bounds actually used for it.
 *
 * @param terminalWidth  columns of the host viewport
 * @param terminalHeight rows of the host viewport
 * @param maxWidth       maximum grid width after floors and ceilings
 * @param maxHeight      maximum grid height after floors and ceilings
 */
public record ViewportBounds(int terminalWidth, int terminalHeight, int maxWidth, int maxHeight) {
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import java.io.IOException;

/**
 * Raised when bytes cannot be turned into a usable pixel grid: no reader
 * recognizes them, the stream is corrupt or truncated, or the image is empty.
 */
public class DecodeException extends IOException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import com.termview.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for turning raw file bytes into a text preview.
 *
 * <p>Pipeline: sniff, decode, plan the grid, sample each cell, map tones, render.
 * Instances are immutable and hold no per-call state, so one converter can serve
 * any number of threads. Callers own moving the result onto their UI thread.
 *
 * <p>Failures never escape as exceptions:
 * <ul>
 *   <li>input that does not look like an image yields {@code ("", false)} without a decode attempt;</li>
 *   <li>input that looks like an image but cannot be decoded yields a short message and {@code false}.</li>
 * </ul>
 */
public class AsciiArtConverter {

    static final String ERROR_PREFIX = "Error converting image to ASCII: ";

    private final ImageDecoder decoder;
    private final ViewportPolicy viewportPolicy;
    private final GeometryPlanner planner;
    private final CellSampler sampler;
    private final ToneMapper toneMapper;
    private final AsciiRenderer renderer;

    public AsciiArtConverter() {
        this(new ImageIoDecoder(), RenderProfile.defaults(), ViewportPolicy.defaults());
    }

    public AsciiArtConverter(ImageDecoder decoder, RenderProfile profile, ViewportPolicy viewportPolicy) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.viewportPolicy = Objects.requireNonNull(viewportPolicy, "viewportPolicy");
        Objects.requireNonNull(profile, "profile").validate();
        this.planner = new GeometryPlanner(profile.getCharAspect());
        this.sampler = CellSampler.fromProfile(profile);
        this.toneMapper = ToneMapper.fromProfile(profile);
        this.renderer = new AsciiRenderer();
    }

    /**
     * Converts bytes for a viewport of at most {@code maxWidth x maxHeight} characters.
     *
     * @param data     raw file content
     * @param filename name hint; only the extension is consulted
     * @return rendered art with {@code image == true}, or a non-image result
     */
    public ConversionResult convert(byte[] data, String filename, int maxWidth, int maxHeight) {
        return convert(data, filename, viewportPolicy.forMaxSize(maxWidth, maxHeight));
    }

    /**
     * Converts bytes for a whole terminal, reserving the policy's margins for UI chrome.
     */
    public ConversionResult convertForTerminal(byte[] data, String filename, int terminalWidth, int terminalHeight) {
        return convert(data, filename, viewportPolicy.forTerminal(terminalWidth, terminalHeight));
    }

    private ConversionResult convert(byte[] data, String filename, ViewportBounds bounds) {
        if (!FormatSniffer.isImage(data, filename)) {
            return ConversionResult.notAnImage();
        }

        PixelSource source;
        try {
            source = decoder.decode(data);
        } catch (DecodeException e) {
            LoggerUtil.warn(String.format("Could not decode %s as an image: %s", filename, e.getMessage()));
            return ConversionResult.failed(ERROR_PREFIX + e.getMessage());
        }

        return ConversionResult.rendered(render(source, bounds));
    }

    /**
     * Runs planning, sampling, tone mapping and rendering over already decoded pixels.
     */
    public String render(PixelSource source, ViewportBounds bounds) {
        OutputGeometry geometry = planner.plan(
            source.width(), source.height(), bounds.maxWidth(), bounds.maxHeight());

        double[][] intensities = sampler.sampleGrid(source, geometry);
        List<String> rows = new ArrayList<>(intensities.length);
        for (double[] row : intensities) {
            rows.add(toneMapper.mapRow(row));
        }

        LoggerUtil.debug(() -> String.format(
            "Rendered %dx%d %s image as %dx%d grid",
            source.width(), source.height(), source.format(),
            geometry.targetWidth(), geometry.targetHeight()));

        return renderer.render(source.format(), bounds, geometry, rows);
    }

    public ViewportPolicy getViewportPolicy() {
        return viewportPolicy;
    }

    public ToneRamp getRamp() {
        return toneMapper.getRamp();
    }
}

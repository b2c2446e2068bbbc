/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.art;

import com.termview.utils.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads {@link RenderProfile}s from {@code /profiles/<name>.json} on the classpath.
 */
public class RenderProfileLoader {

    private static final String PROFILE_BASE_PATH = "/profiles/";

    private final ObjectMapper objectMapper;

    public RenderProfileLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @param name profile name, without the {@code .json} extension
     * @return the validated profile
     * @throws IOException if the profile does not exist or is not valid JSON
     * @throws IllegalArgumentException if the profile holds out-of-range values
     */
    public RenderProfile load(String name) throws IOException {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("..")) {
            throw new IOException("Invalid render profile name: " + name);
        }

        String path = PROFILE_BASE_PATH + name + ".json";
        try (InputStream inputStream = getClass().getResourceAsStream(path)) {
            if (inputStream == null) {
                throw new IOException("Render profile not found: " + path);
            }

            RenderProfile profile = objectMapper.readValue(inputStream, RenderProfile.class);
            profile.setNameIfAbsent(name);
            profile.validate();

            LoggerUtil.debug(() -> "Render profile loaded: " + profile);
            return profile;
        }
    }
}

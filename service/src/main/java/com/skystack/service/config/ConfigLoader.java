package com.skystack.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.skystack.core.util.JsonUtils;
import com.skystack.pipeline.config.AcquisitionConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    public static final String ACQUISITION_FILE = "acquisition.json";

    private ConfigLoader() {
    }

    public static AcquisitionConfig loadAcquisition(Path configDir) {
        return read(configDir.resolve(ACQUISITION_FILE), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
